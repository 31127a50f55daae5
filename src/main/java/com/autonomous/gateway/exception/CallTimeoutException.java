package com.autonomous.gateway.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class CallTimeoutException extends GatewayException {

    private final String endpointId;
    private final int attempt;
    private final Duration timeout;

    public CallTimeoutException(String endpointId, int attempt, Duration timeout) {
        super(String.format("Attempt %d on %s did not settle within %d ms", attempt, endpointId, timeout.toMillis()));
        this.endpointId = endpointId;
        this.attempt = attempt;
        this.timeout = timeout;
    }
}
