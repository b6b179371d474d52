package com.cdcportal.backend.modules.attendance.presentation.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

public record BulkAttendanceRequest(
        @NotEmpty @Size(max = 200) List<@Valid AttendanceRequest> entries
) {
}
