package com.autonomous.gateway.service;

import com.autonomous.gateway.exception.AdmissionTimeoutException;
import com.autonomous.gateway.exception.BudgetExceededException;
import com.autonomous.gateway.exception.CallCancelledException;
import com.autonomous.gateway.exception.CallExhaustedException;
import com.autonomous.gateway.exception.CallTimeoutException;
import com.autonomous.gateway.exception.ProviderFatalException;
import com.autonomous.gateway.exception.ScopeClosedException;
import com.autonomous.gateway.model.CallOutcome;
import com.autonomous.gateway.model.CallRecord;
import com.autonomous.gateway.model.CallResult;
import com.autonomous.gateway.model.EndpointConfig;
import com.autonomous.gateway.model.ProviderRequest;
import com.autonomous.gateway.model.ProviderResponse;
import com.autonomous.gateway.provider.ProviderAdapter;
import com.autonomous.gateway.provider.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one logical remote call: admission, a budget check, the provider call with a per-attempt
 * timeout, and bounded retry with exponential backoff. Only a successful attempt is charged.
 */
@Slf4j
@Service
public class CallEnvelopeService {

    private final BudgetLedgerService ledger;
    private final AdmissionLimiterRegistry limiters;
    private final ProviderAdapter provider;
    private final PricingService pricing;
    private final CallJournalService journal;

    public CallEnvelopeService(BudgetLedgerService ledger, AdmissionLimiterRegistry limiters, ProviderAdapter provider,
                               PricingService pricing, CallJournalService journal) {
        this.ledger = ledger;
        this.limiters = limiters;
        this.provider = provider;
        this.pricing = pricing;
        this.journal = journal;
    }

    public CallResult execute(EndpointConfig config, ProviderRequest request) {
        return execute(config, request, null, config.getDefaultMaxAttempts(), null);
    }

    /**
     * @param timeout     per-attempt wait for the provider, endpoint default when {@code null}
     * @param maxAttempts attempts allowed before {@link CallExhaustedException}
     * @param scope       scope to charge, the calling thread's current scope when {@code null}
     */
    public CallResult execute(EndpointConfig config, ProviderRequest request, Duration timeout, int maxAttempts,
                              SpendingScope scope) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        String endpointId = config.getEndpointId();
        Duration attemptTimeout = timeout != null ? timeout : config.defaultTimeout();
        SpendingScope chargeScope = scope != null ? scope : ledger.currentScope();
        if (request.getEstimatedTokens() <= 0) {
            request.setEstimatedTokens(TokenEstimator.estimate(request.getSystemPrompt(), request.getPrompt()));
        }
        if (request.getModel() == null) {
            request.setModel(config.getModel());
        }
        long estimatedTokens = request.getEstimatedTokens();
        double estimatedCost = pricing.estimateCost(config, estimatedTokens);

        // fail fast before queueing; checked again once admitted
        ledger.ensureWithinBudget(chargeScope, estimatedCost);
        AdmissionLimiter limiter = limiters.forEndpoint(config);

        List<CallRecord> attempts = new ArrayList<>();
        Throwable lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                backoff(config, attempt - 1);
            }

            CallRecord record = CallRecord.builder()
                .endpointId(endpointId)
                .scopeId(chargeScope.getId())
                .attempt(attempt)
                .estimatedTokens(estimatedTokens)
                .build();
            attempts.add(record);

            AdmissionLease lease;
            try {
                lease = limiter.admit(estimatedTokens, config.admissionDeadline());
            } catch (AdmissionTimeoutException e) {
                finishFailed(record, CallOutcome.RATE_LIMITED, e.getMessage());
                throw e;
            } catch (InterruptedException e) {
                finishFailed(record, CallOutcome.CANCELLED, "interrupted while waiting for admission");
                Thread.currentThread().interrupt();
                throw new CallCancelledException("Call to " + endpointId + " cancelled while waiting for admission", e);
            }

            checkBudgetAfterAdmission(record, lease, chargeScope, estimatedCost);

            CompletableFuture<ProviderResponse> future = null;
            ProviderResponse response;
            try {
                future = provider.send(endpointId, request);
                response = future.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                lease.release();
                CallTimeoutException timedOut = new CallTimeoutException(endpointId, attempt, attemptTimeout);
                finishFailed(record, CallOutcome.TIMEOUT, timedOut.getMessage());
                log.warn("Attempt {}/{} on {} timed out after {} ms", attempt, maxAttempts, endpointId, attemptTimeout.toMillis());
                lastFailure = timedOut;
                continue;
            } catch (InterruptedException e) {
                if (future != null) {
                    future.cancel(true);
                }
                lease.revoke();
                finishFailed(record, CallOutcome.CANCELLED, "interrupted while waiting for provider");
                Thread.currentThread().interrupt();
                throw new CallCancelledException("Call to " + endpointId + " cancelled while waiting for provider", e);
            } catch (ExecutionException e) {
                lease.release();
                lastFailure = classifyFailure(record, e.getCause(), attempts, chargeScope, maxAttempts);
                continue;
            } catch (RuntimeException e) {
                lease.release();
                lastFailure = classifyFailure(record, e, attempts, chargeScope, maxAttempts);
                continue;
            }

            lease.reconcile(response.totalTokens() > 0 ? response.totalTokens() : estimatedTokens);
            lease.release();
            record.succeed(response.totalTokens(), response.getCostUsd());
            journal.record(record);
            log.debug("Attempt {} on {} succeeded: {}", attempt, endpointId,
                pricing.formatCost(response.getCostUsd(), response.totalTokens()));

            try {
                ledger.charge(chargeScope, response.getCostUsd());
            } catch (BudgetExceededException e) {
                throw e.withCallRecord(record);
            }
            return new CallResult(response, List.copyOf(attempts));
        }

        log.warn("All {} attempts on {} failed", maxAttempts, endpointId);
        throw new CallExhaustedException(endpointId, attempts, ledger.scopeChain(chargeScope), lastFailure);
    }

    /**
     * Other calls may have spent the scope's budget while this one waited for admission or
     * backed off, so the room check is repeated before anything is sent.
     */
    private void checkBudgetAfterAdmission(CallRecord record, AdmissionLease lease, SpendingScope scope,
                                           double estimatedCost) {
        try {
            ledger.ensureWithinBudget(scope, estimatedCost);
        } catch (BudgetExceededException e) {
            lease.revoke();
            finishFailed(record, CallOutcome.BUDGET_BLOCKED, e.getMessage());
            log.warn("Attempt {} on {} blocked after admission: {}", record.getAttempt(), record.getEndpointId(),
                e.getMessage());
            throw e.withCallRecord(record);
        } catch (ScopeClosedException e) {
            lease.revoke();
            finishFailed(record, CallOutcome.CANCELLED, e.getMessage());
            throw e;
        }
    }

    /**
     * Records a failed attempt and returns it for retry, or throws if it is fatal.
     */
    private Throwable classifyFailure(CallRecord record, Throwable cause, List<CallRecord> attempts,
                                      SpendingScope scope, int maxAttempts) {
        String endpointId = record.getEndpointId();
        if (cause instanceof ProviderException && ((ProviderException) cause).isFatal()) {
            finishFailed(record, CallOutcome.FATAL_ERROR, cause.getMessage());
            log.error("Fatal provider error on {} at attempt {}: {}", endpointId, record.getAttempt(), cause.getMessage());
            throw new ProviderFatalException(endpointId, attempts, ledger.scopeChain(scope), cause);
        }

        CallOutcome outcome = cause instanceof ProviderException
            && ((ProviderException) cause).getKind() == ProviderException.Kind.RATE_LIMITED
            ? CallOutcome.RATE_LIMITED
            : CallOutcome.RETRYABLE_ERROR;
        finishFailed(record, outcome, String.valueOf(cause.getMessage()));
        log.warn("Attempt {}/{} on {} failed ({}): {}", record.getAttempt(), maxAttempts, endpointId, outcome, cause.getMessage());
        return cause;
    }

    private void finishFailed(CallRecord record, CallOutcome outcome, String error) {
        record.fail(outcome, error);
        journal.record(record);
    }

    private void backoff(EndpointConfig config, int failedAttempts) {
        long delayMs = config.backoffForAttempt(failedAttempts);
        if (delayMs <= 0) {
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CallCancelledException("Call to " + config.getEndpointId() + " cancelled during backoff", e);
        }
    }
}
