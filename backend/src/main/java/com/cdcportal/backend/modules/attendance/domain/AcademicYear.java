package com.cdcportal.backend.modules.attendance.domain;

import java.time.LocalDate;
import java.time.Month;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.cdcportal.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * School year written {@code 2025-2026}: June 1 of the first year through
 * March 31 of the second.
 */
public record AcademicYear(int startYear) {

    private static final Pattern FORMAT = Pattern.compile("^(\\d{4})-(\\d{4})$");

    public static AcademicYear parse(String value) {
        Matcher matcher = value == null ? null : FORMAT.matcher(value.trim());
        if (matcher == null || !matcher.matches()) {
            throw invalid(value);
        }
        int first = Integer.parseInt(matcher.group(1));
        int second = Integer.parseInt(matcher.group(2));
        if (second != first + 1) {
            throw invalid(value);
        }
        return new AcademicYear(first);
    }

    /** The school year a date is counted under; April and May belong to the year just ended. */
    public static AcademicYear containing(LocalDate date) {
        return new AcademicYear(date.getMonthValue() >= Month.JUNE.getValue() ? date.getYear() : date.getYear() - 1);
    }

    public LocalDate start() {
        return LocalDate.of(startYear, Month.JUNE, 1);
    }

    public LocalDate end() {
        return LocalDate.of(startYear + 1, Month.MARCH, 31);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start()) && !date.isAfter(end());
    }

    public String label() {
        return startYear + "-" + (startYear + 1);
    }

    private static ProblemException invalid(String value) {
        return new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_ACADEMIC_YEAR",
                "Academic year must look like 2025-2026: " + value);
    }
}
