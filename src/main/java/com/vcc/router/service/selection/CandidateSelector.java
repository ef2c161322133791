package com.vcc.router.service.selection;

import com.vcc.router.model.Candidate;
import com.vcc.router.model.CandidateSet;
import com.vcc.router.model.DirectiveKind;
import com.vcc.router.service.health.HealthTracker;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SplittableRandom;
import java.util.UUID;
import java.util.function.ToDoubleFunction;

/**
 * Picks the recommended model and orders the fallback chain. The result depends only on the
 * candidate set, the seed and the health scores, so a request can be replayed exactly.
 */
@Component
public class CandidateSelector {

    private final HealthTracker healthTracker;

    public CandidateSelector(HealthTracker healthTracker) {
        this.healthTracker = healthTracker;
    }

    public Selection select(CandidateSet candidates, String auditId) {
        return select(candidates, seedOf(auditId), healthTracker::score);
    }

    public static Selection select(CandidateSet candidates, long seed, ToDoubleFunction<String> healthScore) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("cannot select from an empty candidate set");
        }
        List<Candidate> primaries = candidates.primaries();
        List<Candidate> fallbacks = candidates.fallbacks();
        if (primaries.isEmpty()) {
            primaries = fallbacks;
            fallbacks = List.of();
        }

        List<Candidate> ordered = new ArrayList<>(primaries);
        int pick = 0;
        if (candidates.kind() == DirectiveKind.WEIGHTED && ordered.size() > 1) {
            ordered.sort(weightedOrder(healthScore));
            pick = draw(ordered, new SplittableRandom(seed));
        }

        Candidate recommended = ordered.remove(pick);
        List<Candidate> chain = new ArrayList<>(ordered);
        chain.addAll(fallbacks);
        return new Selection(recommended, chain);
    }

    static Comparator<Candidate> weightedOrder(ToDoubleFunction<String> healthScore) {
        return Comparator.comparingDouble(Candidate::weight).reversed()
                .thenComparing(Comparator.comparingDouble((Candidate c) -> healthScore.applyAsDouble(c.modelId())).reversed())
                .thenComparing(Candidate::modelId);
    }

    private static int draw(List<Candidate> ordered, SplittableRandom random) {
        double total = ordered.stream().mapToDouble(Candidate::weight).sum();
        if (total <= 0.0d) {
            return 0;
        }
        double target = random.nextDouble() * total;
        double cumulative = 0.0d;
        for (int i = 0; i < ordered.size(); i++) {
            cumulative += ordered.get(i).weight();
            if (target < cumulative) {
                return i;
            }
        }
        return ordered.size() - 1;
    }

    /**
     * Selection seed for an audit id: the UUID's two halves XOR-ed, or the string hash otherwise.
     */
    public static long seedOf(String auditId) {
        try {
            UUID uuid = UUID.fromString(auditId);
            return uuid.getMostSignificantBits() ^ uuid.getLeastSignificantBits();
        } catch (IllegalArgumentException e) {
            return auditId.hashCode();
        }
    }
}
