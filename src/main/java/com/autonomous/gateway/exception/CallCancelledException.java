package com.autonomous.gateway.exception;

public class CallCancelledException extends GatewayException {

    public CallCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
