package com.vcc.router.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.List;
import java.util.Locale;

public enum SubscriptionScope {
    APP,
    TEAM,
    TENANT;

    public static final List<SubscriptionScope> DEFAULT_PRECEDENCE = List.of(APP, TEAM, TENANT);

    /**
     * Identifier of this scope's target for the given request, or null if the request has none.
     */
    public String targetOf(RequestContext context) {
        return switch (this) {
            case APP -> context.appId();
            case TEAM -> context.teamId();
            case TENANT -> context.tenantId();
        };
    }

    @JsonCreator
    public static SubscriptionScope parse(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
