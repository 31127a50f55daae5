package com.autonomous.gateway.model;

import lombok.Data;

import java.time.Duration;

@Data
public class EndpointConfig {
    private String endpointId;
    private String model;

    // Rate ceilings
    private int requestsPerPeriod = 60;
    private long tokensPerPeriod = 0;      // 0 = unlimited
    private long periodMs = 60_000;
    private int maxConcurrent = 0;         // 0 = unbounded
    private long admissionDeadlineMs = 0;  // 0 = wait indefinitely

    // Call envelope
    private long defaultTimeoutMs = 120_000;
    private int defaultMaxAttempts = 3;
    private int typedMaxAttempts = 3;
    private long backoffBaseMs = 1_000;
    private double backoffMultiplier = 2.0;
    private long backoffMaxMs = 60_000;

    // Pricing, USD
    private double inputPricePerMillion;
    private double outputPricePerMillion;
    private double pricePerRequest;

    public Duration period() {
        return Duration.ofMillis(periodMs);
    }

    public Duration defaultTimeout() {
        return Duration.ofMillis(defaultTimeoutMs);
    }

    public Duration admissionDeadline() {
        return admissionDeadlineMs > 0 ? Duration.ofMillis(admissionDeadlineMs) : null;
    }

    public long backoffForAttempt(int attempt) {
        double delay = backoffBaseMs * Math.pow(backoffMultiplier, Math.max(0, attempt - 1));
        return (long) Math.min(delay, backoffMaxMs);
    }

    public void validate() {
        if (endpointId == null || endpointId.isBlank()) {
            throw new IllegalArgumentException("endpoint_id is required");
        }
        if (requestsPerPeriod <= 0) {
            throw new IllegalArgumentException("requests_per_period must be positive for " + endpointId);
        }
        if (tokensPerPeriod < 0 || maxConcurrent < 0) {
            throw new IllegalArgumentException("tokens_per_period and max_concurrent must not be negative for " + endpointId);
        }
        if (periodMs <= 0) {
            throw new IllegalArgumentException("period_ms must be positive for " + endpointId);
        }
        if (defaultTimeoutMs <= 0) {
            throw new IllegalArgumentException("default_timeout_ms must be positive for " + endpointId);
        }
        if (admissionDeadlineMs < 0) {
            throw new IllegalArgumentException("admission_deadline_ms must not be negative for " + endpointId);
        }
        if (defaultMaxAttempts < 1 || typedMaxAttempts < 1) {
            throw new IllegalArgumentException("max attempts must be at least 1 for " + endpointId);
        }
        if (backoffMultiplier < 1.0 || backoffBaseMs < 0) {
            throw new IllegalArgumentException("backoff must be non-decreasing for " + endpointId);
        }
    }
}
