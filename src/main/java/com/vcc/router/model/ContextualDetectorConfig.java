package com.vcc.router.model;

/**
 * Optional model-judged detector, consulted only when deterministic detectors are inconclusive.
 */
public record ContextualDetectorConfig(
        boolean enabled,
        String judgeModel
) {

    public static ContextualDetectorConfig disabled() {
        return new ContextualDetectorConfig(false, null);
    }
}
