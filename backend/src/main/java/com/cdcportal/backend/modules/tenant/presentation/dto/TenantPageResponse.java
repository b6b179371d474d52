package com.cdcportal.backend.modules.tenant.presentation.dto;

import java.util.List;

public record TenantPageResponse(
        List<TenantResponse> items,
        int page,
        int size,
        long totalElements
) {
}
