package com.cdcportal.backend.modules.account.presentation.dto;

public record FocalAvailabilityResponse(String municipality, String province, boolean exists) {
}
