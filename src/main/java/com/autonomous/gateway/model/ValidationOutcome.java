package com.autonomous.gateway.model;

public enum ValidationOutcome {
    VALID,
    PARSE_FAILED,
    SHAPE_MISMATCH
}
