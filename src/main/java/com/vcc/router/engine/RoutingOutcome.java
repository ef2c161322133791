package com.vcc.router.engine;

import com.vcc.router.model.FirewallOutcome;
import com.vcc.router.model.TokenUsage;

import java.math.BigDecimal;

/**
 * Everything the caller is told about a served request.
 */
public record RoutingOutcome(
        String auditId,
        String output,
        String recommendedModel,
        String finalModel,
        boolean fellBack,
        boolean degradedCompletion,
        String ruleId,
        long policyVersion,
        TokenUsage usage,
        BigDecimal cost,
        FirewallOutcome firewall
) {
}
