package com.cdcportal.backend.modules.tenant.domain;

public enum TenantStatus {
    ACTIVE,
    DEACTIVATED
}
