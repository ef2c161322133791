package com.vcc.router.model;

import java.util.List;

public record FirewallPolicy(
        FirewallAction defaultAction,
        List<DetectorSpec> detectors,
        ContextualDetectorConfig contextual,
        String sanitizingModel
) {

    public static final List<String> DEFAULT_DETECTORS = List.of("credit_card", "email", "us_ssn", "api_key");

    public FirewallPolicy {
        defaultAction = defaultAction != null ? defaultAction : FirewallAction.FLAG;
        detectors = detectors != null && !detectors.isEmpty()
                ? List.copyOf(detectors)
                : DEFAULT_DETECTORS.stream().map(DetectorSpec::builtin).toList();
        contextual = contextual != null ? contextual : ContextualDetectorConfig.disabled();
    }

    public static FirewallPolicy defaults() {
        return new FirewallPolicy(null, null, null, null);
    }
}
