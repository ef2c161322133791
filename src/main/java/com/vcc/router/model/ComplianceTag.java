package com.vcc.router.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Where a model is hosted relative to the organisation's data boundary.
 */
public enum ComplianceTag {
    INTERNAL,
    EXTERNAL;

    @JsonCreator
    public static ComplianceTag parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return EXTERNAL;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
