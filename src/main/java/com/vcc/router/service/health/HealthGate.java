package com.vcc.router.service.health;

import com.vcc.router.model.Candidate;
import com.vcc.router.model.CandidateSet;
import com.vcc.router.service.metrics.MetricsSink;
import com.vcc.router.service.pipeline.CandidateFilter;
import com.vcc.router.service.pipeline.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Drops candidates whose circuit is open. Half-open candidates stay only for the one request
 * that wins the trial slot; that request carries them flagged as probe.
 */
@Component
public class HealthGate implements CandidateFilter {
    private static final Logger log = LoggerFactory.getLogger(HealthGate.class);

    private final HealthTracker healthTracker;
    private final MetricsSink metrics;

    public HealthGate(HealthTracker healthTracker, MetricsSink metrics) {
        this.healthTracker = healthTracker;
        this.metrics = metrics;
    }

    @Override
    public String name() {
        return "health_gate";
    }

    @Override
    public CandidateSet apply(CandidateSet candidates, RoutingContext context) {
        List<Candidate> kept = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates.candidates()) {
            switch (healthTracker.state(candidate.modelId())) {
                case CLOSED -> kept.add(candidate);
                case OPEN -> log.debug("auditId={} model={} skipped: circuit open",
                        context.auditId(), candidate.modelId());
                case HALF_OPEN -> {
                    if (context.holdsProbe(candidate.modelId())
                            || healthTracker.tryAcquireProbe(candidate.modelId())) {
                        context.holdProbe(candidate.modelId());
                        kept.add(candidate.asProbe());
                    } else {
                        metrics.increment("probe_bypassed", context.request().appId(), candidate.modelId(),
                                candidate.model().provider(), null);
                    }
                }
            }
        }
        return candidates.withCandidates(candidates.kind(), kept);
    }
}
