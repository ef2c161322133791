package com.vcc.router.service.health;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Rolling outcome window and circuit state for one model.
 * Each record is its own lock; the half-open trial slot is claimed by compare-and-set.
 */
final class HealthRecord {

    interface TransitionListener {
        void onTransition(String modelId, CircuitState from, CircuitState to, String reason);
    }

    private record Sample(long atMillis, boolean success, long latencyMs) {
    }

    private final String modelId;
    private final Thresholds thresholds;
    private final TransitionListener listener;

    private final Deque<Sample> samples = new ArrayDeque<>();
    private final AtomicBoolean probeInFlight = new AtomicBoolean(false);
    private volatile CircuitState state = CircuitState.CLOSED;
    private long openedAtMillis;
    private long latencyBreachSinceMillis = -1L;

    HealthRecord(String modelId, Thresholds thresholds, TransitionListener listener) {
        this.modelId = modelId;
        this.thresholds = thresholds;
        this.listener = listener;
    }

    /**
     * Current state, moving OPEN to HALF_OPEN once the cool-down has elapsed.
     */
    synchronized CircuitState state(long nowMillis) {
        if (state == CircuitState.OPEN && nowMillis - openedAtMillis >= thresholds.cooldown().toMillis()) {
            transition(CircuitState.HALF_OPEN, "cooldown_elapsed");
        }
        return state;
    }

    boolean tryAcquireProbe(long nowMillis) {
        if (state(nowMillis) != CircuitState.HALF_OPEN) {
            return false;
        }
        return probeInFlight.compareAndSet(false, true);
    }

    void releaseProbe() {
        probeInFlight.set(false);
    }

    synchronized void recordSuccess(long nowMillis, long latencyMs, boolean probe) {
        evict(nowMillis);
        samples.addLast(new Sample(nowMillis, true, latencyMs));
        if (probe && state == CircuitState.HALF_OPEN) {
            samples.clear();
            latencyBreachSinceMillis = -1L;
            transition(CircuitState.CLOSED, "probe_succeeded");
            probeInFlight.set(false);
            return;
        }
        if (state == CircuitState.CLOSED) {
            checkLatency(nowMillis);
        }
    }

    synchronized void recordFailure(long nowMillis, long latencyMs, boolean probe) {
        evict(nowMillis);
        samples.addLast(new Sample(nowMillis, false, latencyMs));
        if (probe && state == CircuitState.HALF_OPEN) {
            open(nowMillis, "probe_failed");
            probeInFlight.set(false);
            return;
        }
        if (state != CircuitState.CLOSED) {
            return;
        }
        if (failures() > thresholds.failureThreshold()) {
            open(nowMillis, "failure_threshold");
            return;
        }
        checkLatency(nowMillis);
    }

    /**
     * Success rate scaled down by how far p95 latency exceeds the threshold. 1.0 with no data.
     */
    synchronized double score(long nowMillis) {
        evict(nowMillis);
        if (samples.isEmpty()) {
            return 1.0d;
        }
        double successRate = (double) (samples.size() - failures()) / samples.size();
        long p95 = p95();
        double latencyFactor = p95 <= 0
                ? 1.0d
                : Math.min(1.0d, (double) thresholds.latencyP95Threshold().toMillis() / p95);
        return successRate * latencyFactor;
    }

    synchronized HealthSnapshot snapshot(long nowMillis) {
        CircuitState current = state(nowMillis);
        double score = score(nowMillis);
        int failures = failures();
        return new HealthSnapshot(modelId, current, score, samples.size() - failures, failures, p95(),
                probeInFlight.get());
    }

    private void checkLatency(long nowMillis) {
        if (samples.size() < thresholds.minLatencySamples()
                || p95() <= thresholds.latencyP95Threshold().toMillis()) {
            latencyBreachSinceMillis = -1L;
            return;
        }
        if (latencyBreachSinceMillis < 0) {
            latencyBreachSinceMillis = nowMillis;
        } else if (nowMillis - latencyBreachSinceMillis >= thresholds.latencySustain().toMillis()) {
            open(nowMillis, "latency_p95");
        }
    }

    private void open(long nowMillis, String reason) {
        openedAtMillis = nowMillis;
        latencyBreachSinceMillis = -1L;
        transition(CircuitState.OPEN, reason);
    }

    private void transition(CircuitState to, String reason) {
        CircuitState from = state;
        state = to;
        if (from != to) {
            listener.onTransition(modelId, from, to, reason);
        }
    }

    private void evict(long nowMillis) {
        long cutoff = nowMillis - thresholds.window().toMillis();
        while (!samples.isEmpty() && samples.peekFirst().atMillis() < cutoff) {
            samples.removeFirst();
        }
    }

    private int failures() {
        int count = 0;
        for (Sample s : samples) {
            if (!s.success()) {
                count++;
            }
        }
        return count;
    }

    private long p95() {
        if (samples.isEmpty()) {
            return 0L;
        }
        long[] latencies = samples.stream().mapToLong(Sample::latencyMs).toArray();
        Arrays.sort(latencies);
        int index = (int) Math.ceil(0.95d * latencies.length) - 1;
        return latencies[Math.max(0, index)];
    }

    record Thresholds(
            Duration window,
            int failureThreshold,
            Duration latencyP95Threshold,
            Duration latencySustain,
            int minLatencySamples,
            Duration cooldown
    ) {
    }
}
