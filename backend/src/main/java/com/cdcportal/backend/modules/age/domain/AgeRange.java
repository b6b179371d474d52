package com.cdcportal.backend.modules.age.domain;

/**
 * Inclusive age interval in months.
 */
public record AgeRange(int minMonths, int maxMonths) {

    public AgeRange {
        if (minMonths < 0 || minMonths > maxMonths) {
            throw new IllegalArgumentException("Invalid age range: " + minMonths + ".." + maxMonths);
        }
    }

    public boolean contains(int totalMonths) {
        return totalMonths >= minMonths && totalMonths <= maxMonths;
    }
}
