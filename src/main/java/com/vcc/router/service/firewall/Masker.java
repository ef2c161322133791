package com.vcc.router.service.firewall;

/**
 * Masks sensitive spans before they are logged, stored or returned. Spans shorter than eight
 * characters are fully masked; longer spans keep only their last four characters.
 */
public final class Masker {

    static final int MIN_PARTIAL_LENGTH = 8;
    static final int VISIBLE_SUFFIX = 4;

    private Masker() {
    }

    public static String mask(String span) {
        if (span == null || span.isEmpty()) {
            return span;
        }
        int length = span.length();
        if (length < MIN_PARTIAL_LENGTH) {
            return stars(length);
        }
        return stars(length - VISIBLE_SUFFIX) + span.substring(length - VISIBLE_SUFFIX);
    }

    private static String stars(int count) {
        return "*".repeat(count);
    }
}
