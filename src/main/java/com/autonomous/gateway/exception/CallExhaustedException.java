package com.autonomous.gateway.exception;

import com.autonomous.gateway.model.CallRecord;

import java.util.List;

public class CallExhaustedException extends CallFailureException {

    public CallExhaustedException(String endpointId, List<CallRecord> attempts, List<Long> scopeChain, Throwable lastFailure) {
        super(String.format("All %d attempts on %s failed (scopes %s)", attempts.size(), endpointId, scopeChain),
            endpointId, attempts, scopeChain, lastFailure);
    }
}
