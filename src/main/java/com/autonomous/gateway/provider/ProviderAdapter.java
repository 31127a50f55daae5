package com.autonomous.gateway.provider;

import com.autonomous.gateway.model.ProviderRequest;
import com.autonomous.gateway.model.ProviderResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Performs the actual remote call for an endpoint and reports token usage and dollar cost.
 * Implementations must be safe to call concurrently. Failures complete the future with a
 * {@link ProviderException}; cancelling the future abandons the call.
 */
public interface ProviderAdapter {

    CompletableFuture<ProviderResponse> send(String endpointId, ProviderRequest request);
}
