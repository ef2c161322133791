package com.vcc.router.model;

/**
 * One entry of a {@link CandidateSet}.
 *
 * @param probe        true when this request holds the half-open trial slot for the model
 * @param fallbackOnly true when the model came from the rule's fallback chain rather than its directive
 */
public record Candidate(
        ModelDescriptor model,
        double weight,
        String ruleId,
        boolean probe,
        boolean fallbackOnly
) {

    public static Candidate of(ModelDescriptor model, double weight, String ruleId) {
        return new Candidate(model, weight, ruleId, false, false);
    }

    public String modelId() {
        return model.id();
    }

    public Candidate withWeight(double newWeight) {
        return new Candidate(model, newWeight, ruleId, probe, fallbackOnly);
    }

    public Candidate asProbe() {
        return new Candidate(model, weight, ruleId, true, fallbackOnly);
    }
}
