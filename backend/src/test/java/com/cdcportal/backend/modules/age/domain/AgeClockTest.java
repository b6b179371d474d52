package com.cdcportal.backend.modules.age.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AgeClockTest {

    @Test
    @DisplayName("2021-06-15 as of 2025-01-10 is three years six months")
    void computesYearsAndMonths() {
        ChildAge age = AgeClock.age(LocalDate.of(2021, 6, 15), LocalDate.of(2025, 1, 10));

        assertThat(age.years()).isEqualTo(3);
        assertThat(age.months()).isEqualTo(6);
        assertThat(age.totalMonths()).isEqualTo(42);
        assertThat(age.decimalYears()).isEqualByComparingTo(new BigDecimal("3.5"));
        assertThat(AgeBandTable.canonical().classify(age.totalMonths())).contains("3-4");
    }

    @Test
    @DisplayName("birthday on the reference date counts the full year")
    void birthdayCountsFullYear() {
        ChildAge age = AgeClock.age(LocalDate.of(2021, 3, 1), LocalDate.of(2025, 3, 1));

        assertThat(age.years()).isEqualTo(4);
        assertThat(age.months()).isZero();
        assertThat(age.totalMonths()).isEqualTo(48);
    }

    @Test
    @DisplayName("the day before a birthday borrows a month and a year")
    void dayBeforeBirthdayBorrows() {
        ChildAge age = AgeClock.age(LocalDate.of(2021, 3, 2), LocalDate.of(2025, 3, 1));

        assertThat(age.years()).isEqualTo(3);
        assertThat(age.months()).isEqualTo(11);
        assertThat(age.totalMonths()).isEqualTo(47);
    }

    @Test
    @DisplayName("a birthdate equal to the reference date is zero months old")
    void newborn() {
        LocalDate today = LocalDate.of(2025, 1, 10);

        ChildAge age = AgeClock.age(today, today);

        assertThat(age.totalMonths()).isZero();
        assertThat(age.decimalYears()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    @DisplayName("a future birthdate is rejected")
    void futureBirthdateRejected() {
        assertThatThrownBy(() -> AgeClock.age(LocalDate.of(2025, 1, 11), LocalDate.of(2025, 1, 10)))
                .isInstanceOf(InvalidAgeException.class);
    }

    @Test
    @DisplayName("total months never decrease and grow by at most one per day")
    void totalMonthsIsMonotonic() {
        LocalDate[] birthdates = {
                LocalDate.of(2020, 1, 31),
                LocalDate.of(2020, 2, 29),
                LocalDate.of(2021, 6, 15),
                LocalDate.of(2019, 12, 1)
        };
        for (LocalDate birthdate : birthdates) {
            int previous = 0;
            for (LocalDate day = birthdate; day.isBefore(birthdate.plusYears(4)); day = day.plusDays(1)) {
                int current = AgeClock.age(birthdate, day).totalMonths();
                assertThat(current - previous)
                        .as("step on %s for birthdate %s", day, birthdate)
                        .isBetween(0, 1);
                previous = current;
            }
        }
    }

    @Test
    @DisplayName("total months increase exactly on the day the birth day-of-month is reached")
    void incrementsOnBirthDayOfMonth() {
        LocalDate birthdate = LocalDate.of(2021, 6, 15);

        for (LocalDate month = LocalDate.of(2022, 1, 1); month.isBefore(LocalDate.of(2024, 1, 1)); month = month.plusMonths(1)) {
            LocalDate before = month.withDayOfMonth(14);
            LocalDate reached = month.withDayOfMonth(15);

            assertThat(AgeClock.age(birthdate, reached).totalMonths())
                    .isEqualTo(AgeClock.age(birthdate, before).totalMonths() + 1);
        }
    }
}
