package com.autonomous.gateway.shape;

public class UnparseableResponseException extends Exception {

    public UnparseableResponseException(String message) {
        super(message);
    }
}
