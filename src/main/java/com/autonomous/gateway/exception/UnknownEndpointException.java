package com.autonomous.gateway.exception;

public class UnknownEndpointException extends GatewayException {

    public UnknownEndpointException(String endpointId) {
        super("No configuration for endpoint: " + endpointId);
    }
}
