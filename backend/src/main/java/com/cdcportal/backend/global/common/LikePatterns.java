package com.cdcportal.backend.global.common;

import java.util.Locale;

/**
 * Lower-case LIKE patterns for queries declaring {@code escape '\'}.
 */
public final class LikePatterns {

    private LikePatterns() {
    }

    /** Substring match; blank input matches everything. */
    public static String contains(String value) {
        if (value == null || value.isBlank()) {
            return "%";
        }
        return "%" + escape(value.trim().toLowerCase(Locale.ROOT)) + "%";
    }

    /** Whole-value match, still case-insensitive. */
    public static String exact(String value) {
        return escape(value.trim().toLowerCase(Locale.ROOT));
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
