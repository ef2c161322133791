package com.vcc.router.service.experiment;

import java.math.BigDecimal;

public record ArmStats(int samples, double successRate, long p95LatencyMs, BigDecimal meanCost) {
}
