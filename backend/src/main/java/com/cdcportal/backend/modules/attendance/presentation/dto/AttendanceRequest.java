package com.cdcportal.backend.modules.attendance.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record AttendanceRequest(
        @NotNull Long studentId,
        @NotNull LocalDate date,
        @NotBlank String status
) {
}
