package com.vcc.router.model;

import java.util.List;

/**
 * A rule matches when every condition holds (an empty condition list always matches).
 *
 * @param fallbackRule id of another rule whose directive models form this rule's fallback chain
 */
public record PolicyRule(
        String id,
        List<FieldCondition> when,
        RoutingDirective directive,
        String fallbackRule
) {

    public PolicyRule {
        when = when != null ? List.copyOf(when) : List.of();
    }
}
