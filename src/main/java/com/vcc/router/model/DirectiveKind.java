package com.vcc.router.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Selection directive attached to a policy rule.
 */
public enum DirectiveKind {
    /** Exactly one fixed candidate. */
    SINGLE,
    /** Weighted draw over a set of candidates. */
    WEIGHTED,
    /** Priority list, always tried head first. */
    ORDERED;

    @JsonCreator
    public static DirectiveKind parse(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
