package com.cdcportal.backend.modules.content.presentation.dto;

import java.time.LocalDate;

public record ActivityResponse(
        Long id,
        String title,
        String description,
        LocalDate dueDate,
        Long ageBandId,
        Long cdcId,
        String filePath,
        String fileName
) {
}
