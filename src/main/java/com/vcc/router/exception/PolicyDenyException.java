package com.vcc.router.exception;

/**
 * The request was refused by policy. Never retried.
 */
public class PolicyDenyException extends RoutingException {

    private final DenyReason denyReason;

    public PolicyDenyException(DenyReason denyReason, String auditId, String message) {
        super(denyReason.code(), auditId, message);
        this.denyReason = denyReason;
    }

    public DenyReason getDenyReason() {
        return denyReason;
    }
}
