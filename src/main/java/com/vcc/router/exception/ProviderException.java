package com.vcc.router.exception;

import com.vcc.router.model.ProviderErrorClass;

import java.time.Duration;

/**
 * Failure reported by a provider or sanitizing adapter.
 */
public class ProviderException extends RuntimeException {

    private final ProviderErrorClass errorClass;
    private final Duration retryAfter;

    public ProviderException(ProviderErrorClass errorClass, String message) {
        this(errorClass, message, null, null);
    }

    public ProviderException(ProviderErrorClass errorClass, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.errorClass = errorClass;
        this.retryAfter = retryAfter;
    }

    public ProviderErrorClass getErrorClass() {
        return errorClass;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    public boolean isRetryable() {
        return errorClass.isRetryable();
    }

    public static boolean isRetryable(Throwable t) {
        return t instanceof ProviderException pe && pe.isRetryable();
    }
}
