package com.vcc.router.exception;

import java.util.List;

/**
 * Raised when a policy fails static validation. Only ever thrown at load or publish time.
 */
public class InvalidPolicyException extends RoutingException {

    public static final String REASON = "invalid_policy";

    private final List<String> violations;

    public InvalidPolicyException(String appId, List<String> violations) {
        super(REASON, null, "Policy for app '" + appId + "' is invalid: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
