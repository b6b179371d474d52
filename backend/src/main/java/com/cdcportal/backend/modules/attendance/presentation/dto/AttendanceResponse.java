package com.cdcportal.backend.modules.attendance.presentation.dto;

import java.time.LocalDate;

public record AttendanceResponse(Long id, Long studentId, LocalDate date, String status) {
}
