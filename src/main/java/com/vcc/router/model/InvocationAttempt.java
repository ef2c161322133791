package com.vcc.router.model;

/**
 * One provider call made while serving a request, in the order it was made.
 *
 * @param errorClass null when the attempt succeeded
 */
public record InvocationAttempt(
        String modelId,
        int attempt,
        boolean succeeded,
        ProviderErrorClass errorClass,
        long latencyMs
) {
}
