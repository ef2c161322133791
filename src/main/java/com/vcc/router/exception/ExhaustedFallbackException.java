package com.vcc.router.exception;

import java.util.List;

/**
 * Every candidate in the fallback chain failed.
 */
public class ExhaustedFallbackException extends RoutingException {

    public static final String REASON = "exhausted_fallback";

    private final List<String> attemptedChain;
    private final String remediation;

    public ExhaustedFallbackException(String auditId, List<String> attemptedChain, String remediation,
                                      Throwable lastFailure) {
        super(REASON, auditId, "All candidate models failed: " + attemptedChain, lastFailure);
        this.attemptedChain = List.copyOf(attemptedChain);
        this.remediation = remediation;
    }

    public List<String> getAttemptedChain() {
        return attemptedChain;
    }

    public String getRemediation() {
        return remediation;
    }
}
