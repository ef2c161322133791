package com.vcc.router.service.firewall;

import java.util.List;

/**
 * Result of one detector over one output.
 *
 * @param matches      raw matched spans; never logged or returned unmasked
 * @param inconclusive the detector saw something suspicious it could not confirm
 */
public record DetectionResult(String detector, List<String> matches, boolean inconclusive) {

    public DetectionResult {
        matches = matches != null ? List.copyOf(matches) : List.of();
    }

    public static DetectionResult none(String detector) {
        return new DetectionResult(detector, List.of(), false);
    }

    public boolean fired() {
        return !matches.isEmpty();
    }
}
