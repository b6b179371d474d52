package com.cdcportal.backend.modules.content.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ActivityRequest(
        @NotBlank @Size(max = 200) String title,
        String description,
        LocalDate dueDate,
        Long ageBandId,
        @Size(max = 500) String filePath,
        @Size(max = 255) String fileName
) {
}
