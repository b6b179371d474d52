package com.cdcportal.backend.modules.content.presentation.dto;

import java.util.List;

public record MultiCdcAnnouncementResponse(List<Created> created, List<Failed> failures) {

    public record Created(Long cdcId, Long announcementId) {
    }

    public record Failed(Long cdcId, String code) {
    }
}
