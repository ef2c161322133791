package com.vcc.router.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Declared data sensitivity of a request, ordered from least to most sensitive.
 */
public enum Sensitivity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAbove(Sensitivity other) {
        return other != null && compareTo(other) > 0;
    }

    @JsonCreator
    public static Sensitivity parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return LOW;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
