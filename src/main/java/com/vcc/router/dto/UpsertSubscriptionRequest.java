package com.vcc.router.dto;

import com.vcc.router.model.Subscription;
import com.vcc.router.model.SubscriptionScope;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Set;

/**
 * Request DTO for creating or replacing the subscription of a tenant, app or team.
 */
public record UpsertSubscriptionRequest(
        @NotNull(message = "Scope is required")
        SubscriptionScope scope,

        @NotBlank(message = "Target ID is required")
        @Size(max = 64, message = "Target ID must be at most 64 characters")
        String targetId,

        @NotNull(message = "Models are required")
        Set<String> models,

        Boolean enabled
) {

    public Subscription toSubscription() {
        return new Subscription(scope, targetId, models, enabled == null || enabled);
    }
}
