package com.cdcportal.backend.modules.account.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateFocalAccountRequest(
        @NotBlank @Size(max = 50) String username,
        @NotBlank @Size(min = 8, max = 128) String password,
        @NotBlank @Size(max = 150) String fullName,
        @NotBlank @Size(max = 100) String barangay,
        @NotBlank @Size(max = 100) String municipality,
        @NotBlank @Size(max = 100) String province,
        @Size(max = 100) String region
) {
}
