package com.autonomous.gateway.model;

import lombok.Value;

import java.util.List;

@Value
public class TypedAttempt {
    int index;
    String prompt;
    String rawResponse;
    ValidationOutcome outcome;
    List<String> problems;
}
