package com.autonomous.gateway.integration;

import com.autonomous.gateway.exception.BudgetExceededException;
import com.autonomous.gateway.exception.UnknownEndpointException;
import com.autonomous.gateway.model.CallOutcome;
import com.autonomous.gateway.model.ProviderResponse;
import com.autonomous.gateway.provider.ProviderAdapter;
import com.autonomous.gateway.service.CallJournalService;
import com.autonomous.gateway.service.ModelGatewayService;
import com.autonomous.gateway.service.SpendingScope;
import com.autonomous.gateway.shape.Shapes;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@SpringBootTest(properties = "gateway.config.path=config/endpoints")
class EndToEndFlowTest {

    @Autowired
    private ModelGatewayService gateway;

    @Autowired
    private CallJournalService journal;

    @MockBean
    private ProviderAdapter provider;

    private static CompletableFuture<ProviderResponse> reply(String text, double cost) {
        return CompletableFuture.completedFuture(ProviderResponse.builder()
            .text(text)
            .promptTokens(50)
            .completionTokens(5)
            .costUsd(cost)
            .build());
    }

    @Test
    void shouldRejectUnconfiguredEndpoint() {
        assertThrows(UnknownEndpointException.class, () -> gateway.invoke("UNKNOWN", "Do something"));
    }

    @Test
    void shouldInvokeConfiguredEndpointAndJournalCall() {
        when(provider.send(eq("haiku"), any())).thenReturn(reply("Paris", 0.001));

        try (SpendingScope scope = gateway.openScope(1.0)) {
            assertEquals("Paris", gateway.invoke("haiku", "Capital of France?"));
            assertEquals(0.001, gateway.currentUsage(scope), 1e-9);
        }

        assertTrue(journal.getRecords("haiku").stream().anyMatch(r -> r.getOutcome() == CallOutcome.SUCCESS));
        assertTrue(gateway.limiterSnapshot("haiku").getRequestsInWindow() >= 1);
    }

    @Test
    void shouldBlockCallsOnceScopeIsSpent() {
        when(provider.send(eq("haiku"), any())).thenReturn(reply("{\"score\": 0.9}", 0.6));

        try (SpendingScope scope = gateway.openScope(1.0)) {
            gateway.invokeTyped("haiku", "Score it", Shapes.object().field("score", Shapes.probability()).build());
            gateway.invokeTyped("haiku", "Score it again", Shapes.object().field("score", Shapes.probability()).build());
            fail("second charge should cross the cap");
        } catch (BudgetExceededException e) {
            assertTrue(e.isSpendOccurred());
        }

        try (SpendingScope scope = gateway.openScope(0.5)) {
            BudgetExceededException crossed = assertThrows(BudgetExceededException.class,
                () -> gateway.invoke("haiku", "one call"));
            BudgetExceededException blocked = assertThrows(BudgetExceededException.class,
                () -> gateway.invoke("haiku", "one more"));

            assertTrue(crossed.isSpendOccurred());
            assertFalse(blocked.isSpendOccurred());
            assertEquals(0.6, scope.currentUsage(), 1e-9);
        }
        verify(provider, times(3)).send(eq("haiku"), any());
    }
}
