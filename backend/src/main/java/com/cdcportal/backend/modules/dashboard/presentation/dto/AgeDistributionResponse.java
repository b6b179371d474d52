package com.cdcportal.backend.modules.dashboard.presentation.dto;

import java.util.Map;

public record AgeDistributionResponse(Map<String, Long> buckets, long total) {
}
