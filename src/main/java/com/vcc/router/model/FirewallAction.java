package com.vcc.router.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum FirewallAction {
    FLAG,
    REDRAFT;

    @JsonCreator
    public static FirewallAction parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
