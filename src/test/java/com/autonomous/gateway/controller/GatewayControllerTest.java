package com.autonomous.gateway.controller;

import com.autonomous.gateway.exception.AdmissionTimeoutException;
import com.autonomous.gateway.exception.BudgetExceededException;
import com.autonomous.gateway.exception.UnknownEndpointException;
import com.autonomous.gateway.model.LimiterSnapshot;
import com.autonomous.gateway.service.ModelGatewayService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(GatewayController.class)
class GatewayControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ModelGatewayService gateway;

    @Test
    void shouldInvokeEndpoint() throws Exception {
        when(gateway.invoke(eq("sonnet"), eq("Say hi"), eq(Duration.ofMillis(5000)), eq(2), any()))
            .thenReturn("hi");

        mockMvc.perform(post("/gateway/invoke")
                .param("endpoint", "sonnet")
                .param("prompt", "Say hi")
                .param("budget", "0.5")
                .param("timeout_ms", "5000")
                .param("max_attempts", "2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.text").value("hi"));

        verify(gateway).openScope(0.5);
    }

    @Test
    void shouldAnswerBooleanQuestion() throws Exception {
        when(gateway.invokeForBoolean("sonnet", "Is it done?", "YES", "NO", null, null)).thenReturn(true);

        mockMvc.perform(post("/gateway/invoke-boolean")
                .param("endpoint", "sonnet")
                .param("prompt", "Is it done?"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.answer").value(true));
    }

    @Test
    void shouldReportBudget() throws Exception {
        when(gateway.formatBudgetStatus()).thenReturn("$1.00 / $10.00 (10%)");

        mockMvc.perform(get("/gateway/budget"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.text").value("Global budget: $1.00 / $10.00 (10%)"));
    }

    @Test
    void shouldReportLimiterState() throws Exception {
        when(gateway.limiterSnapshot("sonnet")).thenReturn(LimiterSnapshot.builder()
            .endpointId("sonnet")
            .requestsInWindow(3)
            .requestCeiling(50)
            .periodMs(60000)
            .build());

        mockMvc.perform(get("/gateway/endpoints/sonnet/limiter"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.requestsInWindow").value(3))
            .andExpect(jsonPath("$.requestCeiling").value(50));
    }

    @Test
    void shouldMapBudgetExceededToPaymentRequired() throws Exception {
        when(gateway.invoke(anyString(), anyString(), any(), any(), any()))
            .thenThrow(new BudgetExceededException(2, 0.5, 0.5, false, List.of(2L, 1L)));

        mockMvc.perform(post("/gateway/invoke")
                .param("endpoint", "sonnet")
                .param("prompt", "Say hi"))
            .andExpect(status().isPaymentRequired())
            .andExpect(jsonPath("$.error").value("budget_exceeded"));
    }

    @Test
    void shouldMapAdmissionTimeoutToTooManyRequests() throws Exception {
        when(gateway.invoke(anyString(), anyString(), any(), any(), any()))
            .thenThrow(new AdmissionTimeoutException("sonnet", Duration.ofMillis(100)));

        mockMvc.perform(post("/gateway/invoke")
                .param("endpoint", "sonnet")
                .param("prompt", "Say hi"))
            .andExpect(status().isTooManyRequests())
            .andExpect(jsonPath("$.error").value("admission_timeout"));
    }

    @Test
    void shouldMapUnknownEndpointToNotFound() throws Exception {
        when(gateway.limiterSnapshot("missing")).thenThrow(new UnknownEndpointException("missing"));

        mockMvc.perform(get("/gateway/endpoints/missing/limiter"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("unknown_endpoint"));
    }

    @Test
    void shouldRejectInvocationWithoutEndpoint() throws Exception {
        mockMvc.perform(post("/gateway/invoke")
                .param("prompt", "Say hi"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"))
            .andExpect(jsonPath("$.message").value("Missing required parameter: endpoint"));

        mockMvc.perform(post("/gateway/invoke-boolean")
                .param("endpoint", " ")
                .param("prompt", "Is the sky blue?"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));

        verifyNoInteractions(gateway);
    }

    @Test
    void shouldReportHealth() throws Exception {
        mockMvc.perform(get("/gateway/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"));
    }
}
