package com.vcc.router.model;

import java.time.Duration;

/**
 * Successful reply from a provider or sanitizing adapter.
 */
public record ProviderResponse(
        String text,
        TokenUsage usage,
        Duration latency
) {

    public ProviderResponse {
        usage = usage != null ? usage : TokenUsage.none();
        latency = latency != null ? latency : Duration.ZERO;
    }
}
