package com.autonomous.gateway.service;

import com.autonomous.gateway.model.EndpointConfig;
import com.autonomous.gateway.model.LimiterSnapshot;
import com.autonomous.gateway.model.ProviderRequest;
import com.autonomous.gateway.shape.Shape;
import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Entry point for callers: budget scopes, plain and typed invocations, usage queries.
 */
@Service
public class ModelGatewayService {

    public static final String DEFAULT_TRUE_KEYWORD = "YES";
    public static final String DEFAULT_FALSE_KEYWORD = "NO";

    private final EndpointConfigLoaderService configLoader;
    private final BudgetLedgerService ledger;
    private final AdmissionLimiterRegistry limiters;
    private final CallEnvelopeService envelope;
    private final TypedInvocationService typedInvocation;
    private final ExecutorService executor;

    public ModelGatewayService(EndpointConfigLoaderService configLoader, BudgetLedgerService ledger,
                               AdmissionLimiterRegistry limiters, CallEnvelopeService envelope,
                               TypedInvocationService typedInvocation,
                               @Value("${gateway.executor.threads:8}") int threads) {
        this.configLoader = configLoader;
        this.ledger = ledger;
        this.limiters = limiters;
        this.envelope = envelope;
        this.typedInvocation = typedInvocation;
        this.executor = Executors.newFixedThreadPool(threads);
    }

    public SpendingScope openScope() {
        return ledger.openScope();
    }

    public SpendingScope openScope(Double cap) {
        return ledger.openScope(cap);
    }

    public double currentUsage(SpendingScope scope) {
        return ledger.currentUsage(scope);
    }

    public String invoke(String endpointId, String prompt) {
        return invoke(endpointId, prompt, null, null, null);
    }

    public String invoke(String endpointId, String prompt, Duration timeout, Integer maxAttempts, SpendingScope scope) {
        EndpointConfig config = configLoader.require(endpointId);
        ProviderRequest request = ProviderRequest.builder()
            .model(config.getModel())
            .prompt(prompt)
            .build();
        int attempts = maxAttempts != null ? maxAttempts : config.getDefaultMaxAttempts();
        return envelope.execute(config, request, timeout, attempts, scope).getText();
    }

    /**
     * Runs {@link #invoke} on the gateway's worker pool. Cancelling the returned future with
     * interruption abandons the call: its limiter slot is freed and nothing is charged.
     * The call is charged to {@code scope}, or to the submitting thread's current scope.
     */
    public Future<String> invokeAsync(String endpointId, String prompt, Duration timeout, Integer maxAttempts,
                                      SpendingScope scope) {
        SpendingScope chargeScope = scope != null ? scope : ledger.currentScope();
        return executor.submit(() -> invoke(endpointId, prompt, timeout, maxAttempts, chargeScope));
    }

    public <T> T invokeTyped(String endpointId, String prompt, Shape<T> shape) {
        return invokeTyped(endpointId, prompt, shape, null, null);
    }

    public <T> T invokeTyped(String endpointId, String prompt, Shape<T> shape, Integer maxAttempts, SpendingScope scope) {
        EndpointConfig config = configLoader.require(endpointId);
        int attempts = maxAttempts != null ? maxAttempts : config.getTypedMaxAttempts();
        return typedInvocation.invokeTyped(config, prompt, shape, attempts, scope);
    }

    public boolean invokeForBoolean(String endpointId, String prompt) {
        return invokeForBoolean(endpointId, prompt, DEFAULT_TRUE_KEYWORD, DEFAULT_FALSE_KEYWORD, null, null);
    }

    public boolean invokeForBoolean(String endpointId, String prompt, String trueKeyword, String falseKeyword,
                                    Integer maxAttempts, SpendingScope scope) {
        EndpointConfig config = configLoader.require(endpointId);
        int attempts = maxAttempts != null ? maxAttempts : config.getTypedMaxAttempts();
        return typedInvocation.invokeForBoolean(config, prompt, trueKeyword, falseKeyword, attempts, scope);
    }

    public LimiterSnapshot limiterSnapshot(String endpointId) {
        return limiters.forEndpoint(configLoader.require(endpointId)).snapshot();
    }

    public String formatBudgetStatus() {
        SpendingScope root = ledger.rootScope();
        double usage = ledger.currentUsage(root);
        if (!root.hasCap()) {
            return String.format("$%.2f spent (no global cap)", usage);
        }
        return String.format("$%.2f / $%.2f (%.0f%%)", usage, root.getCap(), usage / root.getCap() * 100.0);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
