package com.vcc.router.service.experiment;

import com.vcc.router.config.RouterProperties;
import com.vcc.router.model.RequestContext;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runtime state of one configured experiment. A rolled-back experiment takes no traffic until its
 * cool-down has elapsed, then re-activates with empty outcome windows.
 */
public class Experiment {

    private final String id;
    private final String tenantId;
    private final String appId;
    private final double trafficPercent;
    private final RouterProperties.VariantMode mode;
    private final Map<String, Double> variant;
    private final RouterProperties.GuardrailConfig guardrail;
    private final Duration cooldown;

    private final VariantMetrics control;
    private final VariantMetrics treatment;

    private ExperimentState state = ExperimentState.ACTIVE;
    private Instant rolledBackAt;
    private String rollbackReason;

    public Experiment(RouterProperties.ExperimentConfig config) {
        this.id = config.getId();
        this.tenantId = config.getTenantId();
        this.appId = config.getAppId();
        this.trafficPercent = config.getTrafficPercent();
        this.mode = config.getMode() != null ? config.getMode() : RouterProperties.VariantMode.SUBSTITUTE;
        this.variant = Map.copyOf(new LinkedHashMap<>(config.getVariant()));
        this.guardrail = config.getGuardrail() != null ? config.getGuardrail() : new RouterProperties.GuardrailConfig();
        this.cooldown = config.getCooldown();
        this.control = new VariantMetrics(guardrail.getWindowSize());
        this.treatment = new VariantMetrics(guardrail.getWindowSize());
    }

    public String getId() {
        return id;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getAppId() {
        return appId;
    }

    public RouterProperties.VariantMode getMode() {
        return mode;
    }

    public Map<String, Double> getVariant() {
        return variant;
    }

    public boolean appliesTo(RequestContext request) {
        return appId.equals(request.appId()) && (tenantId == null || tenantId.equals(request.tenantId()));
    }

    /**
     * Current state, re-activating the experiment once its cool-down has elapsed.
     */
    public synchronized ExperimentState state(Instant now) {
        if (state == ExperimentState.ROLLED_BACK && !now.isBefore(rolledBackAt.plus(cooldown))) {
            state = ExperimentState.ACTIVE;
            rolledBackAt = null;
            rollbackReason = null;
            control.reset();
            treatment.reset();
        }
        return state;
    }

    public synchronized double effectiveTrafficPercent(Instant now) {
        return state(now) == ExperimentState.ACTIVE ? trafficPercent : 0.0d;
    }

    public boolean enrolls(RequestContext request, Instant now) {
        return StableHasher.inTraffic(id, request.stableKey(), effectiveTrafficPercent(now));
    }

    void record(ExperimentArm arm, long latencyMs, BigDecimal cost, boolean success) {
        (arm == ExperimentArm.TREATMENT ? treatment : control).record(latencyMs, cost, success);
    }

    /**
     * Evaluates the guardrail and rolls back when the treatment regressed.
     *
     * @return the breach description when this call rolled the experiment back, otherwise null
     */
    synchronized String checkGuardrail(Instant now) {
        if (state != ExperimentState.ACTIVE) {
            return null;
        }
        ArmStats c = control.stats();
        ArmStats t = treatment.stats();
        if (c.samples() < guardrail.getMinSamples() || t.samples() < guardrail.getMinSamples()) {
            return null;
        }
        String breach = null;
        if (t.p95LatencyMs() > c.p95LatencyMs() * (1.0d + guardrail.getMaxLatencyRegression())) {
            breach = "latency_regression";
        } else if (t.successRate() < c.successRate() - guardrail.getMaxSuccessRateDrop()) {
            breach = "success_rate_drop";
        }
        if (breach != null) {
            state = ExperimentState.ROLLED_BACK;
            rolledBackAt = now;
            rollbackReason = breach;
        }
        return breach;
    }

    public synchronized ExperimentStatus status(Instant now) {
        ExperimentState current = state(now);
        return new ExperimentStatus(id, tenantId, appId, mode.name(), current,
                current == ExperimentState.ACTIVE ? trafficPercent : 0.0d,
                variant, rolledBackAt, rollbackReason, control.stats(), treatment.stats());
    }
}
