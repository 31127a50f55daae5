package com.autonomous.gateway.service;

import com.autonomous.gateway.exception.UnknownEndpointException;
import com.autonomous.gateway.model.EndpointConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileWriter;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EndpointConfigLoaderServiceTest {

    private EndpointConfigLoaderService configLoader;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        configLoader = new EndpointConfigLoaderService();
        configLoader.setConfigPath(tempDir.toString());
    }

    @Test
    void shouldLoadConfigFromYaml() throws Exception {
        File configFile = tempDir.resolve("sonnet.yaml").toFile();
        try (FileWriter writer = new FileWriter(configFile)) {
            writer.write("endpoint_id: sonnet\n");
            writer.write("model: claude-sonnet-4\n");
            writer.write("requests_per_period: 50\n");
            writer.write("tokens_per_period: 40000\n");
            writer.write("period_ms: 60000\n");
            writer.write("input_price_per_million: 3.0\n");
            writer.write("output_price_per_million: 15.0\n");
            writer.write("some_future_setting: ignored\n");
        }

        configLoader.loadConfigs();
        Optional<EndpointConfig> config = configLoader.getConfigForEndpoint("sonnet");

        assertTrue(config.isPresent());
        assertEquals("claude-sonnet-4", config.get().getModel());
        assertEquals(50, config.get().getRequestsPerPeriod());
        assertEquals(40000, config.get().getTokensPerPeriod());
        assertEquals(15.0, config.get().getOutputPricePerMillion());
        // unset keys keep their defaults
        assertEquals(3, config.get().getDefaultMaxAttempts());
    }

    @Test
    void shouldSkipInvalidConfig() throws Exception {
        try (FileWriter writer = new FileWriter(tempDir.resolve("broken.yaml").toFile())) {
            writer.write("endpoint_id: broken\n");
            writer.write("requests_per_period: 0\n");
        }
        try (FileWriter writer = new FileWriter(tempDir.resolve("haiku.yml").toFile())) {
            writer.write("endpoint_id: haiku\n");
        }

        configLoader.loadConfigs();

        assertFalse(configLoader.getConfigForEndpoint("broken").isPresent());
        assertTrue(configLoader.getConfigForEndpoint("haiku").isPresent());
        assertEquals(1, configLoader.getAllConfigs().size());
    }

    @Test
    void shouldReturnEmptyForUnknownEndpoint() {
        configLoader.loadConfigs();

        assertFalse(configLoader.getConfigForEndpoint("UNKNOWN").isPresent());
        assertThrows(UnknownEndpointException.class, () -> configLoader.require("UNKNOWN"));
    }

    @Test
    void shouldRejectMissingEndpointId() {
        configLoader.loadConfigs();

        assertFalse(configLoader.getConfigForEndpoint(null).isPresent());
        assertThrows(IllegalArgumentException.class, () -> configLoader.require(null));
        assertThrows(IllegalArgumentException.class, () -> configLoader.require(" "));
    }

    @Test
    void shouldPreferLaterFileForDuplicateEndpoint() throws Exception {
        try (FileWriter writer = new FileWriter(tempDir.resolve("a-sonnet.yaml").toFile())) {
            writer.write("endpoint_id: sonnet\n");
            writer.write("model: claude-sonnet-old\n");
        }
        try (FileWriter writer = new FileWriter(tempDir.resolve("b-sonnet.yaml").toFile())) {
            writer.write("endpoint_id: sonnet\n");
            writer.write("model: claude-sonnet-new\n");
        }

        configLoader.loadConfigs();

        assertEquals(1, configLoader.getAllConfigs().size());
        assertEquals("claude-sonnet-new", configLoader.require("sonnet").getModel());
    }

    @Test
    void shouldTolerateMissingDirectory() {
        configLoader.setConfigPath(tempDir.resolve("missing").toString());

        configLoader.loadConfigs();

        assertTrue(configLoader.getAllConfigs().isEmpty());
    }

    @Test
    void shouldRegisterProgrammaticConfig() {
        EndpointConfig config = new EndpointConfig();
        config.setEndpointId("local");

        configLoader.register(config);

        assertSame(config, configLoader.require("local"));
    }
}
