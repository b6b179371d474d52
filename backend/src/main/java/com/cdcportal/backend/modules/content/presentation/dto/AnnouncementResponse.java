package com.cdcportal.backend.modules.content.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

public record AnnouncementResponse(
        Long id,
        String title,
        String message,
        String authorName,
        String ageFilter,
        List<String> roleFilter,
        Long cdcId,
        String attachmentPath,
        String attachmentName,
        OffsetDateTime createdAt
) {
}
