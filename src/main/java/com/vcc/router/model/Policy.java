package com.vcc.router.model;

import java.util.List;
import java.util.Optional;

/**
 * Versioned routing policy for one app. Never mutated: publishing a higher version supersedes it.
 */
public record Policy(
        String appId,
        long version,
        List<PolicyRule> rules,
        BudgetLimits budget,
        FirewallPolicy firewall,
        CompliancePolicy compliance,
        List<SubscriptionScope> subscriptionPrecedence,
        Boolean minimalCompletion
) {

    public Policy {
        rules = rules != null ? List.copyOf(rules) : List.of();
        budget = budget != null ? budget : BudgetLimits.unlimited();
        firewall = firewall != null ? firewall : FirewallPolicy.defaults();
        compliance = compliance != null ? compliance : CompliancePolicy.defaults();
        subscriptionPrecedence = subscriptionPrecedence != null && !subscriptionPrecedence.isEmpty()
                ? List.copyOf(subscriptionPrecedence)
                : SubscriptionScope.DEFAULT_PRECEDENCE;
    }

    public Optional<PolicyRule> rule(String ruleId) {
        return rules.stream().filter(r -> r.id() != null && r.id().equals(ruleId)).findFirst();
    }

    public boolean minimalCompletionOr(boolean serviceDefault) {
        return minimalCompletion != null ? minimalCompletion : serviceDefault;
    }
}
