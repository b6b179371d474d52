package com.cdcportal.backend.modules.student.presentation.dto;

public record EnrollStudentResponse(Long studentId) {
}
