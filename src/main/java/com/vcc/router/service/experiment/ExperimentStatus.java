package com.vcc.router.service.experiment;

import java.time.Instant;
import java.util.Map;

public record ExperimentStatus(
        String id,
        String tenantId,
        String appId,
        String mode,
        ExperimentState state,
        double trafficPercent,
        Map<String, Double> variant,
        Instant rolledBackAt,
        String rollbackReason,
        ArmStats control,
        ArmStats treatment
) {
}
