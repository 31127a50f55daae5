package com.autonomous.gateway.exception;

import com.autonomous.gateway.model.CallRecord;

import java.util.List;

public class ProviderFatalException extends CallFailureException {

    public ProviderFatalException(String endpointId, List<CallRecord> attempts, List<Long> scopeChain, Throwable cause) {
        super(String.format("Fatal provider error on %s at attempt %d (scopes %s): %s",
                endpointId, attempts.size(), scopeChain, cause.getMessage()),
            endpointId, attempts, scopeChain, cause);
    }
}
