package com.autonomous.gateway.provider;

import com.autonomous.gateway.model.EndpointConfig;
import com.autonomous.gateway.model.ProviderRequest;
import com.autonomous.gateway.model.ProviderResponse;
import com.autonomous.gateway.service.EndpointConfigLoaderService;
import com.autonomous.gateway.service.PricingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CliProviderAdapterTest {

    private CliProviderAdapter adapter;

    @BeforeEach
    void setUp() {
        EndpointConfigLoaderService configLoader = new EndpointConfigLoaderService();
        EndpointConfig config = new EndpointConfig();
        config.setEndpointId("local");
        config.setModel("test-model");
        config.setInputPricePerMillion(1_000_000);
        configLoader.register(config);

        adapter = new CliProviderAdapter(configLoader, new PricingService());
        adapter.setProcessTimeoutMinutes(1);
    }

    @AfterEach
    void tearDown() {
        adapter.shutdown();
    }

    private static ProviderRequest request(String prompt) {
        return ProviderRequest.builder().prompt(prompt).build();
    }

    @Test
    void shouldReturnCliOutputWithEstimatedUsage() throws Exception {
        adapter.setCliPath("echo");

        ProviderResponse response = adapter.send("local", request("hello")).get(10, TimeUnit.SECONDS);

        assertEquals("--print --model test-model hello", response.getText());
        assertEquals(2, response.getPromptTokens());
        // $1 per input token
        assertEquals(2.0, response.getCostUsd(), 1e-9);
    }

    @Test
    void shouldTreatNonZeroExitAsRetryable() {
        adapter.setCliPath("false");

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> adapter.send("local", request("hello")).get(10, TimeUnit.SECONDS));

        ProviderException cause = assertInstanceOf(ProviderException.class, e.getCause());
        assertEquals(ProviderException.Kind.RETRYABLE, cause.getKind());
    }

    @Test
    void shouldTreatMissingBinaryAsFatal() {
        adapter.setCliPath("/nonexistent/model-cli");

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> adapter.send("local", request("hello")).get(10, TimeUnit.SECONDS));

        assertTrue(assertInstanceOf(ProviderException.class, e.getCause()).isFatal());
    }

    @Test
    void shouldClassifyFailureOutput() {
        assertEquals(ProviderException.Kind.FATAL, adapter.classify(1, "Error: Invalid API key").getKind());
        assertEquals(ProviderException.Kind.RATE_LIMITED, adapter.classify(1, "429 Too Many Requests").getKind());
        assertEquals(ProviderException.Kind.RATE_LIMITED, adapter.classify(1, "API is overloaded").getKind());
        assertEquals(ProviderException.Kind.RETRYABLE, adapter.classify(1, "connection reset").getKind());
    }
}
