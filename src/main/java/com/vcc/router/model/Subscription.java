package com.vcc.router.model;

import java.util.Set;

/**
 * Allow-list of models for one tenant, app or team.
 */
public record Subscription(
        SubscriptionScope scope,
        String targetId,
        Set<String> models,
        boolean enabled
) {

    public Subscription {
        models = models != null ? Set.copyOf(models) : Set.of();
    }
}
