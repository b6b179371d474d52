package com.cdcportal.backend.modules.attendance.presentation.dto;

import java.util.Map;

public record AttendanceSummaryResponse(
        Long studentId,
        String academicYear,
        Map<String, Long> counts,
        long total,
        int attendanceRate
) {
}
