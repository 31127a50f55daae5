package com.autonomous.gateway.service;

import com.autonomous.gateway.model.EndpointConfig;
import org.springframework.stereotype.Service;

@Service
public class PricingService {

    public double calculateCost(EndpointConfig config, long inputTokens, long outputTokens) {
        double inputCost = (inputTokens * config.getInputPricePerMillion()) / 1_000_000.0;
        double outputCost = (outputTokens * config.getOutputPricePerMillion()) / 1_000_000.0;
        return inputCost + outputCost + config.getPricePerRequest();
    }

    /**
     * Lower bound on what a call will cost, from its prompt alone.
     */
    public double estimateCost(EndpointConfig config, long inputTokens) {
        return calculateCost(config, inputTokens, 0);
    }

    public String formatCost(double costUsd, long tokens) {
        return String.format("$%.4f (%dK tokens)", costUsd, tokens / 1000);
    }
}
