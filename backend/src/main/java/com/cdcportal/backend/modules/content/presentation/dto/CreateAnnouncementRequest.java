package com.cdcportal.backend.modules.content.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

public record CreateAnnouncementRequest(
        @NotBlank @Size(max = 200) String title,
        @NotBlank String message,
        String ageFilter,
        @NotEmpty List<String> roleFilter,
        @Size(max = 500) String attachmentPath,
        @Size(max = 255) String attachmentName
) {
}
