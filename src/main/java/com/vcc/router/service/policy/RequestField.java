package com.vcc.router.service.policy;

import com.vcc.router.model.RequestContext;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;

/**
 * Request fields a rule predicate may test.
 */
enum RequestField {
    TENANT_ID("tenantId", RequestContext::tenantId, false),
    APP_ID("appId", RequestContext::appId, false),
    TEAM_ID("teamId", RequestContext::teamId, false),
    USER_ROLE("userRole", RequestContext::userRole, false),
    SENSITIVITY("sensitivity", RequestContext::sensitivity, true),
    TOKEN_ESTIMATE("tokenEstimate", RequestContext::tokenEstimate, true),
    LANGUAGE("language", RequestContext::language, false),
    TAGS("tags", RequestContext::tags, false);

    private final String key;
    private final Function<RequestContext, Object> accessor;
    private final boolean ordered;

    RequestField(String key, Function<RequestContext, Object> accessor, boolean ordered) {
        this.key = key;
        this.accessor = accessor;
        this.ordered = ordered;
    }

    Object valueOf(RequestContext context) {
        return accessor.apply(context);
    }

    /**
     * Whether LT and GTE are meaningful for this field.
     */
    boolean isOrdered() {
        return ordered;
    }

    static Optional<RequestField> byKey(String key) {
        return Arrays.stream(values()).filter(f -> f.key.equals(key)).findFirst();
    }
}
