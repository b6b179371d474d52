package com.cdcportal.backend.modules.content.presentation.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

public record MultiCdcAnnouncementRequest(
        @NotNull @Valid CreateAnnouncementRequest announcement,
        @NotEmpty List<Long> cdcIds
) {
}
