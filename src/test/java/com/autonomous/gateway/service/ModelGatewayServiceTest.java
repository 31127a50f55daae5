package com.autonomous.gateway.service;

import com.autonomous.gateway.exception.UnknownEndpointException;
import com.autonomous.gateway.model.EndpointConfig;
import com.autonomous.gateway.model.LimiterSnapshot;
import com.autonomous.gateway.model.ProviderResponse;
import com.autonomous.gateway.provider.ProviderAdapter;
import com.autonomous.gateway.shape.Shapes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ModelGatewayServiceTest {

    @Mock
    private ProviderAdapter provider;

    private BudgetLedgerService ledger;
    private ModelGatewayService gateway;

    @BeforeEach
    void setUp() {
        EndpointConfigLoaderService configLoader = new EndpointConfigLoaderService();
        EndpointConfig config = new EndpointConfig();
        config.setEndpointId("sonnet");
        config.setModel("claude-sonnet");
        config.setRequestsPerPeriod(5);
        config.setBackoffBaseMs(1);
        configLoader.register(config);

        ledger = new BudgetLedgerService();
        AdmissionLimiterRegistry limiters = new AdmissionLimiterRegistry();
        CallEnvelopeService envelope = new CallEnvelopeService(ledger, limiters, provider, new PricingService(),
            new CallJournalService());
        gateway = new ModelGatewayService(configLoader, ledger, limiters, envelope,
            new TypedInvocationService(envelope), 2);
    }

    @AfterEach
    void tearDown() {
        gateway.shutdown();
    }

    private static CompletableFuture<ProviderResponse> reply(String text, double cost) {
        return CompletableFuture.completedFuture(ProviderResponse.builder()
            .text(text)
            .promptTokens(10)
            .completionTokens(10)
            .costUsd(cost)
            .build());
    }

    @Test
    void shouldInvokeAndChargeScope() {
        when(provider.send(eq("sonnet"), any())).thenReturn(reply("hello back", 0.2));

        try (SpendingScope scope = gateway.openScope(1.0)) {
            assertEquals("hello back", gateway.invoke("sonnet", "hello"));
            assertEquals(0.2, gateway.currentUsage(scope), 1e-9);
        }
    }

    @Test
    void shouldRejectUnknownEndpoint() {
        assertThrows(UnknownEndpointException.class, () -> gateway.invoke("missing", "hello"));
        verifyNoInteractions(provider);
    }

    @Test
    void cancellingAsyncCallFreesSlotAndChargesNothing() throws Exception {
        CompletableFuture<ProviderResponse> hanging = new CompletableFuture<>();
        when(provider.send(eq("sonnet"), any())).thenReturn(hanging);

        try (SpendingScope scope = gateway.openScope()) {
            Future<String> call = gateway.invokeAsync("sonnet", "slow question", null, 1, null);
            verify(provider, timeout(2_000)).send(eq("sonnet"), any());

            assertTrue(call.cancel(true));

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            LimiterSnapshot snapshot = gateway.limiterSnapshot("sonnet");
            while (snapshot.getRequestsInWindow() > 0 && System.nanoTime() < deadline) {
                Thread.sleep(10);
                snapshot = gateway.limiterSnapshot("sonnet");
            }
            assertEquals(0, snapshot.getInFlight());
            assertEquals(0, snapshot.getRequestsInWindow());
            assertTrue(hanging.isCancelled());
            assertEquals(0, scope.currentUsage(), 1e-9);
        }
    }

    @Test
    void asyncCallChargesSubmittingThreadsScope() throws Exception {
        when(provider.send(eq("sonnet"), any())).thenReturn(reply("done", 0.3));

        try (SpendingScope scope = gateway.openScope()) {
            Future<String> call = gateway.invokeAsync("sonnet", "question", null, null, null);

            assertEquals("done", call.get(5, TimeUnit.SECONDS));
            assertEquals(0.3, scope.currentUsage(), 1e-9);
        }
    }

    @Test
    void shouldUseDefaultKeywordsForBoolean() {
        when(provider.send(eq("sonnet"), any())).thenReturn(reply("Looks right to me. YES", 0.01));

        assertTrue(gateway.invokeForBoolean("sonnet", "Is the sky blue?"));
    }

    @Test
    void shouldInvokeTypedList() {
        when(provider.send(eq("sonnet"), any())).thenReturn(reply("[\"a\", \"b\"]", 0.01));

        List<String> values = gateway.invokeTyped("sonnet", "Two letters", Shapes.listOf(Shapes.string(), 2, 2));

        assertEquals(List.of("a", "b"), values);
    }

    @Test
    void shouldFormatBudgetStatus() {
        assertEquals("$0.00 spent (no global cap)", gateway.formatBudgetStatus());
    }
}
