package com.vcc.router.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Ordered, immutable list of candidates flowing through the routing pipeline.
 * Every stage returns a new set; none may add a model that was not already present.
 */
public final class CandidateSet {

    private static final CandidateSet EMPTY = new CandidateSet(DirectiveKind.ORDERED, null, List.of());

    private final DirectiveKind kind;
    private final String ruleId;
    private final List<Candidate> candidates;

    private CandidateSet(DirectiveKind kind, String ruleId, List<Candidate> candidates) {
        this.kind = kind;
        this.ruleId = ruleId;
        this.candidates = candidates;
    }

    public static CandidateSet empty() {
        return EMPTY;
    }

    public static CandidateSet of(DirectiveKind kind, String ruleId, List<Candidate> candidates) {
        return new CandidateSet(kind, ruleId, List.copyOf(candidates));
    }

    public DirectiveKind kind() {
        return kind;
    }

    public String ruleId() {
        return ruleId;
    }

    public List<Candidate> candidates() {
        return candidates;
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public int size() {
        return candidates.size();
    }

    public boolean contains(String modelId) {
        return candidates.stream().anyMatch(c -> c.modelId().equals(modelId));
    }

    public List<String> modelIds() {
        return candidates.stream().map(Candidate::modelId).toList();
    }

    public List<Candidate> primaries() {
        return candidates.stream().filter(c -> !c.fallbackOnly()).toList();
    }

    public List<Candidate> fallbacks() {
        return candidates.stream().filter(Candidate::fallbackOnly).toList();
    }

    public CandidateSet filter(Predicate<Candidate> keep) {
        List<Candidate> kept = candidates.stream().filter(keep).toList();
        if (kept.size() == candidates.size()) {
            return this;
        }
        return new CandidateSet(kind, ruleId, kept);
    }

    public CandidateSet map(UnaryOperator<Candidate> mapper) {
        return new CandidateSet(kind, ruleId, candidates.stream().map(mapper).toList());
    }

    /**
     * Stable re-ordering; the candidates themselves are unchanged.
     */
    public CandidateSet sorted(Comparator<Candidate> order) {
        List<Candidate> copy = new ArrayList<>(candidates);
        copy.sort(order);
        return new CandidateSet(kind, ruleId, Collections.unmodifiableList(copy));
    }

    public CandidateSet withKind(DirectiveKind newKind) {
        return new CandidateSet(newKind, ruleId, candidates);
    }

    public CandidateSet withCandidates(DirectiveKind newKind, List<Candidate> replacement) {
        return new CandidateSet(newKind, ruleId, List.copyOf(replacement));
    }

    @Override
    public String toString() {
        return "CandidateSet{kind=" + kind + ", ruleId='" + ruleId + "', models=" + modelIds() + '}';
    }
}
