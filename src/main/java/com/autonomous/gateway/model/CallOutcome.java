package com.autonomous.gateway.model;

public enum CallOutcome {
    PENDING,
    SUCCESS,
    TIMEOUT,
    RATE_LIMITED,
    RETRYABLE_ERROR,
    FATAL_ERROR,
    BUDGET_BLOCKED,
    CANCELLED;

    public boolean isRetryable() {
        return this == TIMEOUT || this == RATE_LIMITED || this == RETRYABLE_ERROR;
    }
}
