package com.autonomous.gateway.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LimiterSnapshot {
    String endpointId;
    int requestsInWindow;
    long tokensInWindow;
    int inFlight;
    int waiting;
    int requestCeiling;
    long tokenCeiling;
    long periodMs;
}
