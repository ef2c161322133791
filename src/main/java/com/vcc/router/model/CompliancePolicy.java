package com.vcc.router.model;

import java.util.Set;

/**
 * @param sensitivityThreshold external models are excluded for requests above this level;
 *                             null defers to the service-wide default
 */
public record CompliancePolicy(
        Sensitivity sensitivityThreshold,
        Set<String> blockedTags
) {

    public CompliancePolicy {
        blockedTags = blockedTags != null ? Set.copyOf(blockedTags) : Set.of();
    }

    public static CompliancePolicy defaults() {
        return new CompliancePolicy(null, null);
    }
}
