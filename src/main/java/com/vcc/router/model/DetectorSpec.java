package com.vcc.router.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Configuration of one output detector. Builtin detectors are referenced by name;
 * pattern detectors carry their own regular expression.
 */
public record DetectorSpec(
        String name,
        Type type,
        String pattern
) {

    public static DetectorSpec builtin(String name) {
        return new DetectorSpec(name, Type.BUILTIN, null);
    }

    public static DetectorSpec pattern(String name, String pattern) {
        return new DetectorSpec(name, Type.PATTERN, pattern);
    }

    public Type effectiveType() {
        return type != null ? type : (pattern != null ? Type.PATTERN : Type.BUILTIN);
    }

    public enum Type {
        BUILTIN,
        PATTERN;

        @JsonCreator
        public static Type parse(String raw) {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        }
    }
}
