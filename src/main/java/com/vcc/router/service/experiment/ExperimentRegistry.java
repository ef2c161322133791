package com.vcc.router.service.experiment;

import com.vcc.router.config.RouterProperties;
import com.vcc.router.model.RequestContext;
import com.vcc.router.service.metrics.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Configured experiments and their per-arm outcome windows. Rollbacks only change what later
 * requests see; requests already routed to the treatment are left alone.
 */
@Service
public class ExperimentRegistry {
    private static final Logger log = LoggerFactory.getLogger(ExperimentRegistry.class);

    private final Map<String, Experiment> experiments;
    private final Clock clock;
    private final MetricsSink metrics;

    public ExperimentRegistry(RouterProperties properties, Clock clock, MetricsSink metrics) {
        this.clock = clock;
        this.metrics = metrics;
        Map<String, Experiment> loaded = new LinkedHashMap<>();
        for (RouterProperties.ExperimentConfig config : properties.getExperiments()) {
            loaded.put(config.getId(), new Experiment(config));
            log.info("Experiment registered: id={}, app={}, tenant={}, traffic={}%, mode={}, variant={}",
                    config.getId(), config.getAppId(), config.getTenantId(), config.getTrafficPercent(),
                    config.getMode(), config.getVariant());
        }
        this.experiments = Map.copyOf(loaded);
    }

    /**
     * First experiment configured for the request's app and tenant, whatever its state.
     */
    public Optional<Experiment> forRequest(RequestContext request) {
        return experiments.values().stream()
                .filter(e -> e.appliesTo(request))
                .sorted(Comparator.comparing(Experiment::getId))
                .findFirst();
    }

    public Optional<Experiment> find(String experimentId) {
        return Optional.ofNullable(experiments.get(experimentId));
    }

    /**
     * Record one request outcome for an arm and re-check the guardrail.
     */
    public void recordOutcome(String experimentId, ExperimentArm arm, Duration latency, BigDecimal cost,
                              boolean success) {
        Experiment experiment = experiments.get(experimentId);
        if (experiment == null) {
            return;
        }
        if (experiment.state(clock.instant()) != ExperimentState.ACTIVE) {
            return;
        }
        experiment.record(arm, latency.toMillis(), cost, success);
        String breach = experiment.checkGuardrail(clock.instant());
        if (breach != null) {
            log.warn("Experiment rolled back: id={}, app={}, reason={}", experimentId, experiment.getAppId(), breach);
            metrics.increment("experiment_rollback", experiment.getAppId(), null, null, breach);
        }
    }

    public List<ExperimentStatus> statuses() {
        return experiments.values().stream()
                .map(e -> e.status(clock.instant()))
                .sorted(Comparator.comparing(ExperimentStatus::id))
                .toList();
    }
}
