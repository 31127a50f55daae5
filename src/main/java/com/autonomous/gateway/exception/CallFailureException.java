package com.autonomous.gateway.exception;

import com.autonomous.gateway.model.CallRecord;
import lombok.Getter;

import java.util.List;

/**
 * Terminal failure of a logical call, carrying every attempt made for it.
 */
@Getter
public abstract class CallFailureException extends GatewayException {

    private final String endpointId;
    private final List<CallRecord> attempts;
    private final List<Long> scopeChain;

    protected CallFailureException(String message, String endpointId, List<CallRecord> attempts,
                                   List<Long> scopeChain, Throwable cause) {
        super(message, cause);
        this.endpointId = endpointId;
        this.attempts = List.copyOf(attempts);
        this.scopeChain = List.copyOf(scopeChain);
    }

    public int getAttemptCount() {
        return attempts.size();
    }
}
