package com.cdcportal.backend.modules.age.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Whole years and months between a birthdate and a reference date.
 */
public final class AgeClock {

    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);

    private AgeClock() {
    }

    /**
     * The month count drops by one when the reference day-of-month has not yet
     * reached the birth day-of-month; a negative month count then borrows twelve
     * from the years. Each borrow is applied once.
     *
     * @throws InvalidAgeException when {@code birthdate} is after {@code asOf}
     */
    public static ChildAge age(LocalDate birthdate, LocalDate asOf) {
        Objects.requireNonNull(birthdate, "birthdate");
        Objects.requireNonNull(asOf, "asOf");
        if (birthdate.isAfter(asOf)) {
            throw new InvalidAgeException(birthdate, asOf);
        }

        int years = asOf.getYear() - birthdate.getYear();
        int months = asOf.getMonthValue() - birthdate.getMonthValue();
        if (asOf.getDayOfMonth() < birthdate.getDayOfMonth()) {
            months--;
        }
        if (months < 0) {
            years--;
            months += 12;
        }

        int totalMonths = years * 12 + months;
        BigDecimal decimalYears = BigDecimal.valueOf(totalMonths).divide(MONTHS_PER_YEAR, 1, RoundingMode.HALF_UP);
        return new ChildAge(years, months, totalMonths, decimalYears);
    }
}
