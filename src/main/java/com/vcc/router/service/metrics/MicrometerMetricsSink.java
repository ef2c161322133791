package com.vcc.router.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Micrometer-backed metrics. Tag values are kept low-cardinality and sanitized.
 */
@Component
public class MicrometerMetricsSink implements MetricsSink {

    static final String EVENTS = "router.events";
    static final String LATENCY = "router.invocation.latency";

    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();

    public MicrometerMetricsSink(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void increment(String event, String app, String model, String provider, String reason) {
        String e = safeTag(event);
        String a = safeTag(app);
        String m = safeTag(model);
        String p = safeTag(provider);
        String r = safeTag(reason);
        String cacheKey = e + "|" + a + "|" + m + "|" + p + "|" + r;
        counters.computeIfAbsent(cacheKey, k -> Counter.builder(EVENTS)
                        .tag("event", e)
                        .tag("app", a)
                        .tag("model", m)
                        .tag("provider", p)
                        .tag("reason", r)
                        .register(registry))
                .increment();
    }

    @Override
    public void recordLatency(String app, String model, String provider, String outcome, Duration latency) {
        String a = safeTag(app);
        String m = safeTag(model);
        String p = safeTag(provider);
        String o = safeTag(outcome);
        String cacheKey = a + "|" + m + "|" + p + "|" + o;
        timers.computeIfAbsent(cacheKey, k -> Timer.builder(LATENCY)
                        .tag("app", a)
                        .tag("model", m)
                        .tag("provider", p)
                        .tag("outcome", o)
                        .publishPercentiles(0.5, 0.95)
                        .register(registry))
                .record(latency);
    }

    static String safeTag(String raw) {
        if (raw == null) {
            return "none";
        }
        String s = raw.trim();
        if (s.isEmpty()) {
            return "none";
        }
        if (s.length() > 64) {
            s = s.substring(0, 64);
        }
        return s.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
