package com.autonomous.gateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderRequest {
    private String model;
    private String systemPrompt;
    private String prompt;
    private long estimatedTokens;
}
