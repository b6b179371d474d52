package com.cdcportal.backend.modules.dashboard.presentation.dto;

import java.util.List;

public record CdcDistributionResponse(List<Item> items, long total) {

    public record Item(Long cdcId, String name, long students) {
    }
}
