package com.vcc.router.model;

import java.util.List;

/**
 * @param output   text returned to the caller (the original unless redrafted)
 * @param degraded true when a redraft was requested but could not be performed
 */
public record FirewallOutcome(
        FirewallState state,
        String output,
        List<Violation> violations,
        String sanitizingModel,
        boolean degraded
) {

    public FirewallOutcome {
        violations = violations != null ? List.copyOf(violations) : List.of();
    }

    public static FirewallOutcome clean(String output) {
        return new FirewallOutcome(FirewallState.CLEAN, output, List.of(), null, false);
    }

    public static FirewallOutcome flagged(String output, List<Violation> violations, boolean degraded) {
        return new FirewallOutcome(FirewallState.FLAGGED, output, violations, null, degraded);
    }

    public static FirewallOutcome redrafted(String output, List<Violation> violations, String sanitizingModel) {
        return new FirewallOutcome(FirewallState.REDRAFTED, output, violations, sanitizingModel, false);
    }

    public boolean redrafted() {
        return state == FirewallState.REDRAFTED;
    }
}
