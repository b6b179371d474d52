package com.cdcportal.backend.modules.tenant.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * Required fields are checked by the service so every missing one is reported at once.
 */
public record CreateTenantRequest(
        @Size(max = 150) String name,
        @Size(max = 100) String region,
        @Size(max = 100) String province,
        @Size(max = 100) String municipality,
        @Size(max = 100) String barangay
) {
}
