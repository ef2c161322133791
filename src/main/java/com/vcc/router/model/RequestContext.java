package com.vcc.router.model;

import java.util.Set;

/**
 * Immutable per-request snapshot taken once at ingress.
 */
public record RequestContext(
        String tenantId,
        String appId,
        String teamId,
        String userRole,
        Sensitivity sensitivity,
        int tokenEstimate,
        String language,
        Set<String> tags,
        String requestKey,
        RequestOptions options
) {

    public RequestContext {
        sensitivity = sensitivity != null ? sensitivity : Sensitivity.LOW;
        tags = tags != null ? Set.copyOf(tags) : Set.of();
        options = options != null ? options : RequestOptions.none();
    }

    /**
     * Rough token estimate for inputs that did not declare one (four characters per token).
     */
    public static int estimateTokens(String input) {
        if (input == null || input.isEmpty()) {
            return 0;
        }
        return (input.length() + 3) / 4;
    }

    /**
     * Key used for deterministic experiment bucketing.
     */
    public String stableKey() {
        if (requestKey != null && !requestKey.isBlank()) {
            return requestKey;
        }
        return tenantId + ":" + appId + ":" + (userRole != null ? userRole : "");
    }
}
