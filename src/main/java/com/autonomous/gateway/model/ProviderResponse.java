package com.autonomous.gateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderResponse {
    private String text;
    private long promptTokens;
    private long completionTokens;
    private double costUsd;

    public long totalTokens() {
        return promptTokens + completionTokens;
    }
}
