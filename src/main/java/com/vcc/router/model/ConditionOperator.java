package com.vcc.router.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum ConditionOperator {
    EQ,
    LT,
    GTE,
    IN;

    public boolean isNumeric() {
        return this == LT || this == GTE;
    }

    @JsonCreator
    public static ConditionOperator parse(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
