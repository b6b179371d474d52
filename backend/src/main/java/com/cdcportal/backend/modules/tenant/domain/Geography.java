package com.cdcportal.backend.modules.tenant.domain;

import java.util.Locale;

/**
 * Administrative location. {@code region} may be null for addresses that omit it.
 */
public record Geography(String barangay, String municipality, String province, String region) {

    /**
     * Same municipality and province, compared trimmed and case-insensitively.
     */
    public boolean sameMunicipality(Geography other) {
        if (other == null) {
            return false;
        }
        return matches(municipality, other.municipality) && matches(province, other.province);
    }

    private static boolean matches(String left, String right) {
        if (left == null || right == null || left.isBlank() || right.isBlank()) {
            return false;
        }
        return normalize(left).equals(normalize(right));
    }

    static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
