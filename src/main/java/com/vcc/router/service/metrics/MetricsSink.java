package com.vcc.router.service.metrics;

import java.time.Duration;

/**
 * Counters and latency histograms keyed by {app, model, provider, reason}.
 */
public interface MetricsSink {

    void increment(String event, String app, String model, String provider, String reason);

    void recordLatency(String app, String model, String provider, String outcome, Duration latency);

    default void increment(String event, String app) {
        increment(event, app, null, null, null);
    }
}
