package com.vcc.router.service.experiment;

import com.vcc.router.config.RouterProperties;
import com.vcc.router.model.Candidate;
import com.vcc.router.model.CandidateSet;
import com.vcc.router.model.DirectiveKind;
import com.vcc.router.service.pipeline.CandidateFilter;
import com.vcc.router.service.pipeline.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies an active experiment's variant to enrolled requests. Enrollment is a deterministic hash
 * of the request key, so the same caller lands in the same arm on every request.
 */
@Component
public class ExperimentOverlay implements CandidateFilter {
    private static final Logger log = LoggerFactory.getLogger(ExperimentOverlay.class);

    private final ExperimentRegistry registry;
    private final Clock clock;

    public ExperimentOverlay(ExperimentRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "experiment";
    }

    @Override
    public CandidateSet apply(CandidateSet candidates, RoutingContext context) {
        Optional<Experiment> found = registry.forRequest(context.request());
        if (found.isEmpty()) {
            return candidates;
        }
        Experiment experiment = found.get();
        Instant now = clock.instant();
        if (experiment.state(now) != ExperimentState.ACTIVE) {
            return candidates;
        }
        if (!experiment.enrolls(context.request(), now)) {
            context.trace().recordExperiment(experiment.getId(), ExperimentArm.CONTROL.label());
            return candidates;
        }

        CandidateSet varied = experiment.getMode() == RouterProperties.VariantMode.REWEIGHT
                ? reweight(candidates, experiment.getVariant())
                : substitute(candidates, experiment.getVariant());
        if (varied == null) {
            log.debug("auditId={} experiment={} variant does not overlap candidates {}, not enrolled",
                    context.auditId(), experiment.getId(), candidates.modelIds());
            return candidates;
        }
        context.trace().recordExperiment(experiment.getId(), ExperimentArm.TREATMENT.label());
        log.debug("auditId={} experiment={} treatment candidates={}", context.auditId(), experiment.getId(), varied);
        return varied;
    }

    /**
     * Restrict to the variant models present in the set, weighted per the variant. Null when none overlap.
     */
    static CandidateSet substitute(CandidateSet candidates, Map<String, Double> variant) {
        List<Candidate> kept = candidates.candidates().stream()
                .filter(c -> variant.containsKey(c.modelId()))
                .toList();
        if (kept.isEmpty()) {
            return null;
        }
        double total = kept.stream().mapToDouble(c -> variant.get(c.modelId())).sum();
        List<Candidate> weighted = kept.stream()
                .map(c -> c.withWeight(normalise(variant.get(c.modelId()), total, kept.size())))
                .toList();
        return candidates.withCandidates(DirectiveKind.WEIGHTED, weighted);
    }

    /**
     * Replace the weights of variant models, keep the others, renormalise over primary candidates.
     * Null when no primary candidate is a variant model.
     */
    static CandidateSet reweight(CandidateSet candidates, Map<String, Double> variant) {
        if (candidates.primaries().stream().noneMatch(c -> variant.containsKey(c.modelId()))) {
            return null;
        }
        List<Candidate> replaced = candidates.candidates().stream()
                .map(c -> variant.containsKey(c.modelId()) && !c.fallbackOnly()
                        ? c.withWeight(variant.get(c.modelId()))
                        : c)
                .toList();
        List<Candidate> primaries = replaced.stream().filter(c -> !c.fallbackOnly()).toList();
        double total = primaries.stream().mapToDouble(Candidate::weight).sum();
        List<Candidate> normalised = replaced.stream()
                .map(c -> c.fallbackOnly() ? c : c.withWeight(normalise(c.weight(), total, primaries.size())))
                .toList();
        return candidates.withCandidates(DirectiveKind.WEIGHTED, normalised);
    }

    private static double normalise(double weight, double total, int count) {
        return total > 0.0d ? weight / total : 1.0d / count;
    }
}
