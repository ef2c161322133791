package com.vcc.router.dto;

import com.vcc.router.engine.RoutingOutcome;
import com.vcc.router.model.FirewallOutcome;
import com.vcc.router.model.FirewallState;
import com.vcc.router.model.TokenUsage;
import com.vcc.router.model.Violation;

import java.math.BigDecimal;
import java.util.List;

/**
 * Response DTO for a served request. Violation samples are already masked.
 */
public record RouteResponse(
        String output,
        String recommendedModel,
        String finalModel,
        boolean fellBack,
        boolean degradedCompletion,
        String ruleId,
        long policyVersion,
        TokenUsage usage,
        BigDecimal cost,
        Firewall firewall,
        String auditId
) {

    public record Firewall(
            FirewallState state,
            boolean redrafted,
            List<Violation> violations,
            String sanitizingModel,
            boolean degraded
    ) {
        static Firewall from(FirewallOutcome outcome) {
            return new Firewall(outcome.state(), outcome.redrafted(), outcome.violations(),
                    outcome.sanitizingModel(), outcome.degraded());
        }
    }

    public static RouteResponse from(RoutingOutcome outcome) {
        return new RouteResponse(
                outcome.output(),
                outcome.recommendedModel(),
                outcome.finalModel(),
                outcome.fellBack(),
                outcome.degradedCompletion(),
                outcome.ruleId(),
                outcome.policyVersion(),
                outcome.usage(),
                outcome.cost(),
                Firewall.from(outcome.firewall()),
                outcome.auditId());
    }
}
