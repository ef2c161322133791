package com.vcc.router.model;

/**
 * A detector hit. {@code sample} is always masked.
 */
public record Violation(
        String detector,
        String sample
) {
}
