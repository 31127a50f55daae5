package com.autonomous.gateway.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * The caller's admission deadline elapsed while waiting for a rate-limiter slot.
 */
@Getter
public class AdmissionTimeoutException extends GatewayException {

    private final String endpointId;
    private final Duration deadline;

    public AdmissionTimeoutException(String endpointId, Duration deadline) {
        super(String.format("No admission to %s within %d ms", endpointId, deadline.toMillis()));
        this.endpointId = endpointId;
        this.deadline = deadline;
    }
}
