package com.autonomous.gateway.service;

import com.autonomous.gateway.exception.UnknownEndpointException;
import com.autonomous.gateway.model.EndpointConfig;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of endpoint configurations.
 * <p>
 * At startup every {@code *.yaml} / {@code *.yml} file under {@code gateway.config.path} is read
 * as one {@link EndpointConfig}, in file-name order. A file that cannot be read or fails
 * validation is skipped and logged; when two files name the same endpoint the later one wins.
 * Endpoints can also be registered programmatically. Nothing is reloaded at runtime: limiters
 * keep the ceilings they were created with.
 */
@Slf4j
@Service
public class EndpointConfigLoaderService {

    @Value("${gateway.config.path:config/endpoints}")
    private String configPath;

    private final Map<String, EndpointConfig> endpoints = new ConcurrentHashMap<>();
    private final ObjectMapper yamlMapper;

    public EndpointConfigLoaderService() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void setConfigPath(String path) {
        this.configPath = path;
    }

    @PostConstruct
    public void loadConfigs() {
        Path dir = Paths.get(configPath);
        if (!Files.isDirectory(dir)) {
            log.info("No endpoint config directory at {}, endpoints must be registered in code", dir.toAbsolutePath());
            return;
        }

        int loaded = 0;
        for (Path file : endpointFiles(dir)) {
            Optional<EndpointConfig> config = readEndpoint(file);
            if (config.isPresent()) {
                register(config.get());
                loaded++;
            }
        }
        log.info("Loaded {} endpoint config(s) from {}", loaded, dir);
    }

    private List<Path> endpointFiles(Path dir) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.{yaml,yml}")) {
            stream.forEach(files::add);
        } catch (IOException e) {
            log.error("Cannot list endpoint configs in {}: {}", dir, e.getMessage());
            return List.of();
        }
        Collections.sort(files);
        return files;
    }

    private Optional<EndpointConfig> readEndpoint(Path file) {
        try {
            EndpointConfig config = yamlMapper.readValue(file.toFile(), EndpointConfig.class);
            if (config == null || config.getEndpointId() == null) {
                log.warn("Skipping {}: no endpoint_id", file.getFileName());
                return Optional.empty();
            }
            config.validate();
            return Optional.of(config);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Skipping endpoint config {}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    public void register(EndpointConfig config) {
        config.validate();
        EndpointConfig previous = endpoints.put(config.getEndpointId(), config);
        if (previous != null) {
            log.warn("Endpoint {} was configured twice, keeping the later definition", config.getEndpointId());
        } else {
            log.info("Registered endpoint {} (model {})", config.getEndpointId(), config.getModel());
        }
    }

    public Optional<EndpointConfig> getConfigForEndpoint(String endpointId) {
        if (endpointId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(endpoints.get(endpointId));
    }

    /**
     * @throws IllegalArgumentException if {@code endpointId} is null or blank
     * @throws UnknownEndpointException if no endpoint has that id
     */
    public EndpointConfig require(String endpointId) {
        if (endpointId == null || endpointId.isBlank()) {
            throw new IllegalArgumentException("An endpoint id is required");
        }
        return getConfigForEndpoint(endpointId).orElseThrow(() -> new UnknownEndpointException(endpointId));
    }

    public Map<String, EndpointConfig> getAllConfigs() {
        return Map.copyOf(endpoints);
    }
}
