package com.cdcportal.backend.modules.age.presentation.dto;

public record AgeBandResponse(
        Long id,
        String ageRange,
        boolean parsed,
        Integer minMonths,
        Integer maxMonths
) {
}
