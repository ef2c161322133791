package com.vcc.router.model;

public enum ProviderErrorClass {
    TIMEOUT(true),
    RATE_LIMITED(true),
    SERVER_ERROR(true),
    AUTH_FAILURE(false),
    MALFORMED_REQUEST(false);

    private final boolean retryable;

    ProviderErrorClass(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Malformed requests are the caller's fault and say nothing about provider health.
     */
    public boolean countsAgainstProvider() {
        return this != MALFORMED_REQUEST;
    }
}
