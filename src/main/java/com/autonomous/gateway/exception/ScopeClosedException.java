package com.autonomous.gateway.exception;

public class ScopeClosedException extends GatewayException {

    public ScopeClosedException(long scopeId) {
        super("Spending scope " + scopeId + " is closed");
    }
}
