package com.vcc.router.exception;

/**
 * Base class for every failure reported to a routing caller. Carries a stable reason
 * code and the audit id of the request's decision trace.
 */
public abstract class RoutingException extends RuntimeException {

    private final String reason;
    private final String auditId;

    protected RoutingException(String reason, String auditId, String message) {
        super(message);
        this.reason = reason;
        this.auditId = auditId;
    }

    protected RoutingException(String reason, String auditId, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.auditId = auditId;
    }

    public String getReason() {
        return reason;
    }

    public String getAuditId() {
        return auditId;
    }
}
