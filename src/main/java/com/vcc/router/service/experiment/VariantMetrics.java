package com.vcc.router.service.experiment;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Bounded rolling window of outcomes for one experiment arm.
 */
final class VariantMetrics {

    private final int capacity;
    private final Deque<Outcome> window = new ArrayDeque<>();

    VariantMetrics(int capacity) {
        this.capacity = capacity;
    }

    synchronized void record(long latencyMs, BigDecimal cost, boolean success) {
        if (window.size() == capacity) {
            window.removeFirst();
        }
        window.addLast(new Outcome(latencyMs, cost != null ? cost : BigDecimal.ZERO, success));
    }

    synchronized int samples() {
        return window.size();
    }

    synchronized double successRate() {
        if (window.isEmpty()) {
            return 1.0d;
        }
        long ok = window.stream().filter(Outcome::success).count();
        return (double) ok / window.size();
    }

    synchronized long p95LatencyMs() {
        if (window.isEmpty()) {
            return 0L;
        }
        long[] sorted = window.stream().mapToLong(Outcome::latencyMs).toArray();
        Arrays.sort(sorted);
        int index = (int) Math.ceil(0.95d * sorted.length) - 1;
        return sorted[Math.max(0, index)];
    }

    synchronized BigDecimal meanCost() {
        if (window.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal total = window.stream().map(Outcome::cost).reduce(BigDecimal.ZERO, BigDecimal::add);
        return total.divide(BigDecimal.valueOf(window.size()), 6, RoundingMode.HALF_UP);
    }

    synchronized void reset() {
        window.clear();
    }

    synchronized ArmStats stats() {
        return new ArmStats(samples(), successRate(), p95LatencyMs(), meanCost());
    }

    private record Outcome(long latencyMs, BigDecimal cost, boolean success) {
    }
}
