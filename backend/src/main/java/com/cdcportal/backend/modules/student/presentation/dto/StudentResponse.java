package com.cdcportal.backend.modules.student.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record StudentResponse(
        Long id,
        String firstName,
        String middleName,
        String lastName,
        LocalDate birthdate,
        String gender,
        Long cdcId,
        Integer ageYears,
        Integer ageMonths,
        Integer totalMonths,
        BigDecimal decimalYears,
        String ageBand
) {
}
