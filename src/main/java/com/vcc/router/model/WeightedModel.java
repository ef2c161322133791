package com.vcc.router.model;

/**
 * Model reference inside a routing directive. Weight is only meaningful for weighted directives.
 */
public record WeightedModel(
        String model,
        Double weight
) {

    public double effectiveWeight() {
        return weight != null ? weight : 1.0d;
    }
}
