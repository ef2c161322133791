package com.vcc.router.service.health;

import com.vcc.router.config.RouterProperties;
import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.ProviderErrorClass;
import com.vcc.router.service.metrics.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-model health statistics and circuit breakers, shared by all in-flight requests.
 * State is keyed by model id; there is no global lock.
 */
@Service
public class HealthTracker {
    private static final Logger log = LoggerFactory.getLogger(HealthTracker.class);

    private final Map<String, HealthRecord> records = new ConcurrentHashMap<>();
    private final Map<String, String> providers = new ConcurrentHashMap<>();
    private final HealthRecord.Thresholds thresholds;
    private final Clock clock;
    private final MetricsSink metrics;

    public HealthTracker(RouterProperties properties, Clock clock, MetricsSink metrics) {
        RouterProperties.HealthConfig health = properties.getHealth();
        this.thresholds = new HealthRecord.Thresholds(
                health.getWindow(),
                health.getFailureThreshold(),
                health.getLatencyP95Threshold(),
                health.getLatencySustain(),
                health.getMinLatencySamples(),
                health.getCooldown()
        );
        this.clock = clock;
        this.metrics = metrics;
        log.info("HealthTracker initialized: window={}, failureThreshold={}, p95Threshold={}, cooldown={}",
                health.getWindow(), health.getFailureThreshold(), health.getLatencyP95Threshold(),
                health.getCooldown());
    }

    public CircuitState state(String modelId) {
        HealthRecord record = records.get(modelId);
        return record != null ? record.state(now()) : CircuitState.CLOSED;
    }

    public boolean isOpen(String modelId) {
        return state(modelId) == CircuitState.OPEN;
    }

    /**
     * Claim the single trial slot of a half-open circuit.
     *
     * @return true if the caller now owns the probe and must report its outcome or release it
     */
    public boolean tryAcquireProbe(String modelId) {
        return record(modelId).tryAcquireProbe(now());
    }

    public void releaseProbe(String modelId) {
        HealthRecord record = records.get(modelId);
        if (record != null) {
            record.releaseProbe();
        }
    }

    public void recordSuccess(ModelDescriptor model, Duration latency, boolean probe) {
        providers.putIfAbsent(model.id(), model.provider());
        record(model.id()).recordSuccess(now(), latency.toMillis(), probe);
    }

    public void recordFailure(ModelDescriptor model, Duration latency, ProviderErrorClass errorClass, boolean probe) {
        providers.putIfAbsent(model.id(), model.provider());
        HealthRecord record = record(model.id());
        if (errorClass != null && !errorClass.countsAgainstProvider()) {
            if (probe) {
                record.releaseProbe();
            }
            return;
        }
        record.recordFailure(now(), latency.toMillis(), probe);
    }

    /**
     * Derived health score in [0, 1]. Used only to break ties between equally weighted candidates.
     */
    public double score(String modelId) {
        HealthRecord record = records.get(modelId);
        return record != null ? record.score(now()) : 1.0d;
    }

    public List<HealthSnapshot> snapshots() {
        long now = now();
        return records.values().stream()
                .map(r -> r.snapshot(now))
                .sorted(Comparator.comparing(HealthSnapshot::modelId))
                .toList();
    }

    private HealthRecord record(String modelId) {
        return records.computeIfAbsent(modelId, id -> new HealthRecord(id, thresholds, this::onTransition));
    }

    private void onTransition(String modelId, CircuitState from, CircuitState to, String reason) {
        log.info("Circuit transition model={} {} -> {} reason={}", modelId, from, to, reason);
        String event = switch (to) {
            case OPEN -> "circuit_opened";
            case HALF_OPEN -> "circuit_half_open";
            case CLOSED -> "circuit_closed";
        };
        metrics.increment(event, null, modelId, providers.get(modelId), reason);
    }

    private long now() {
        return clock.millis();
    }
}
