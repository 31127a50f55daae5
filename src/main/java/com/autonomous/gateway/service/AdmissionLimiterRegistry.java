package com.autonomous.gateway.service;

import com.autonomous.gateway.model.EndpointConfig;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One independent {@link AdmissionLimiter} per endpoint, created on first use from the
 * endpoint's configuration at that moment.
 */
@Service
public class AdmissionLimiterRegistry {

    private final Map<String, AdmissionLimiter> limiters = new ConcurrentHashMap<>();

    public AdmissionLimiter forEndpoint(EndpointConfig config) {
        return limiters.computeIfAbsent(config.getEndpointId(), id -> new AdmissionLimiter(config));
    }

    public Optional<AdmissionLimiter> find(String endpointId) {
        return Optional.ofNullable(limiters.get(endpointId));
    }
}
