package com.cdcportal.backend.modules.tenant.presentation.dto;

public record TenantResponse(
        Long id,
        String name,
        String status,
        String region,
        String province,
        String municipality,
        String barangay
) {
}
