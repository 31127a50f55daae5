package com.autonomous.gateway.model;

import lombok.Value;

import java.util.List;

@Value
public class CallResult {
    ProviderResponse response;
    List<CallRecord> attempts;

    public String getText() {
        return response.getText();
    }

    public double getCostUsd() {
        return response.getCostUsd();
    }
}
