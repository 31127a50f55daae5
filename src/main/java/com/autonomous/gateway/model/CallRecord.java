package com.autonomous.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * One attempt at a remote call. Created when the attempt starts and finalized exactly once,
 * when the provider settles or the attempt is abandoned.
 */
@Getter
@ToString
public class CallRecord {
    private final String endpointId;
    private final long scopeId;
    private final int attempt;
    private final long estimatedTokens;
    private final Instant startedAt;

    private Long actualTokens;
    private Double costUsd;
    private CallOutcome outcome = CallOutcome.PENDING;
    private String error;
    private Instant finishedAt;

    @Builder
    public CallRecord(String endpointId, long scopeId, int attempt, long estimatedTokens) {
        this.endpointId = endpointId;
        this.scopeId = scopeId;
        this.attempt = attempt;
        this.estimatedTokens = estimatedTokens;
        this.startedAt = Instant.now();
    }

    public synchronized void succeed(long actualTokens, double costUsd) {
        finish(CallOutcome.SUCCESS, null);
        this.actualTokens = actualTokens;
        this.costUsd = costUsd;
    }

    public synchronized void fail(CallOutcome outcome, String error) {
        if (outcome == CallOutcome.SUCCESS || outcome == CallOutcome.PENDING) {
            throw new IllegalArgumentException("Not a failure outcome: " + outcome);
        }
        finish(outcome, error);
    }

    @JsonIgnore
    public synchronized boolean isFinalized() {
        return outcome != CallOutcome.PENDING;
    }

    private void finish(CallOutcome outcome, String error) {
        if (isFinalized()) {
            throw new IllegalStateException("Call record already finalized as " + this.outcome);
        }
        this.outcome = outcome;
        this.error = error;
        this.finishedAt = Instant.now();
    }
}
