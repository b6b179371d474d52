package com.cdcportal.backend.modules.attendance.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;

import com.cdcportal.backend.global.error.ProblemException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class AcademicYearTest {

    @Test
    void runsFromJuneToMarch() {
        AcademicYear year = AcademicYear.parse("2025-2026");

        assertThat(year.start()).isEqualTo(LocalDate.of(2025, 6, 1));
        assertThat(year.end()).isEqualTo(LocalDate.of(2026, 3, 31));
        assertThat(year.contains(LocalDate.of(2025, 6, 1))).isTrue();
        assertThat(year.contains(LocalDate.of(2026, 3, 31))).isTrue();
        assertThat(year.contains(LocalDate.of(2026, 4, 1))).isFalse();
        assertThat(year.contains(LocalDate.of(2025, 5, 31))).isFalse();
        assertThat(year.label()).isEqualTo("2025-2026");
    }

    @ParameterizedTest
    @ValueSource(strings = {"2025-2027", "2025", "25-26", "2025/2026", ""})
    void malformedYearsAreRejected(String value) {
        assertThatThrownBy(() -> AcademicYear.parse(value))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("INVALID_ACADEMIC_YEAR");
    }

    @Test
    void nullIsRejected() {
        assertThatThrownBy(() -> AcademicYear.parse(null)).isInstanceOf(ProblemException.class);
    }

    @Test
    void aprilAndMayBelongToTheYearJustEnded() {
        assertThat(AcademicYear.containing(LocalDate.of(2026, 5, 20)).label()).isEqualTo("2025-2026");
        assertThat(AcademicYear.containing(LocalDate.of(2026, 6, 1)).label()).isEqualTo("2026-2027");
        assertThat(AcademicYear.containing(LocalDate.of(2026, 1, 15)).label()).isEqualTo("2025-2026");
    }
}
