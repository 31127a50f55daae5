package com.autonomous.gateway.exception;

import com.autonomous.gateway.model.TypedAttempt;
import lombok.Getter;

import java.util.List;

@Getter
public class TypeValidationExhaustedException extends GatewayException {

    private final String endpointId;
    private final List<TypedAttempt> attempts;

    public TypeValidationExhaustedException(String endpointId, String expected, List<TypedAttempt> attempts) {
        super(String.format("No valid %s from %s after %d attempts; last problems: %s",
            expected, endpointId, attempts.size(),
            attempts.isEmpty() ? "none" : attempts.get(attempts.size() - 1).getProblems()));
        this.endpointId = endpointId;
        this.attempts = List.copyOf(attempts);
    }
}
