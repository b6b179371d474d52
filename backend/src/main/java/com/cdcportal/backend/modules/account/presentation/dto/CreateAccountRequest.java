package com.cdcportal.backend.modules.account.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateAccountRequest(
        @NotBlank @Size(max = 50) String username,
        @NotBlank @Size(min = 8, max = 128) String password,
        @NotBlank @Size(max = 150) String fullName,
        @NotBlank String role,
        @Size(max = 500) String address
) {
}
