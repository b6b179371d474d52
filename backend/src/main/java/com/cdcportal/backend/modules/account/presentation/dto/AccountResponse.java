package com.cdcportal.backend.modules.account.presentation.dto;

public record AccountResponse(
        Long id,
        String username,
        String fullName,
        String role,
        Long cdcId,
        String address
) {
}
