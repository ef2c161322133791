package com.vcc.router.service.health;

/**
 * Point-in-time view of one model's health record.
 */
public record HealthSnapshot(
        String modelId,
        CircuitState state,
        double score,
        int successes,
        int failures,
        long p95LatencyMs,
        boolean probeInFlight
) {
}
