package com.cdcportal.backend.modules.age.domain;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Optional;

/**
 * Year bands {@code [n, n+1)} for n = 3, 4, 5. A child whose fourth birthday is
 * today is in 4-5.
 */
public enum CanonicalAgeBand {
    THREE_TO_FOUR("3-4", 3),
    FOUR_TO_FIVE("4-5", 4),
    FIVE_TO_SIX("5-6", 5);

    private final String key;
    private final int lowerYears;

    CanonicalAgeBand(String key, int lowerYears) {
        this.key = key;
        this.lowerYears = lowerYears;
    }

    public String key() {
        return key;
    }

    public AgeRange range() {
        return new AgeRange(lowerYears * 12, (lowerYears + 1) * 12 - 1);
    }

    /** Oldest birthdate in the band, inclusive. */
    public LocalDate earliestBirthdate(LocalDate asOf) {
        return asOf.minusYears(lowerYears + 1L).plusDays(1);
    }

    /** Youngest birthdate in the band, inclusive. */
    public LocalDate latestBirthdate(LocalDate asOf) {
        return asOf.minusYears(lowerYears);
    }

    public static Optional<CanonicalAgeBand> fromTotalMonths(int totalMonths) {
        return Arrays.stream(values())
                .filter(band -> band.range().contains(totalMonths))
                .findFirst();
    }

    public static Optional<CanonicalAgeBand> fromBirthdate(LocalDate birthdate, LocalDate asOf) {
        return Arrays.stream(values())
                .filter(band -> asOf.minusYears(band.lowerYears + 1L).isBefore(birthdate)
                        && !birthdate.isAfter(asOf.minusYears(band.lowerYears)))
                .findFirst();
    }

    public static Optional<CanonicalAgeBand> fromKey(String key) {
        return Arrays.stream(values()).filter(band -> band.key.equals(key)).findFirst();
    }
}
