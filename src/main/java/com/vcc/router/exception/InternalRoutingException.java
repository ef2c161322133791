package com.vcc.router.exception;

/**
 * Unexpected failure while routing. Wraps the cause so the caller still receives the audit id.
 */
public class InternalRoutingException extends RoutingException {

    public static final String REASON = "internal_error";

    public InternalRoutingException(String auditId, Throwable cause) {
        super(REASON, auditId, "Routing failed unexpectedly", cause);
    }
}
