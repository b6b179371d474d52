package com.cdcportal.backend.modules.access.domain;

import com.cdcportal.backend.modules.tenant.domain.Geography;
import com.cdcportal.backend.modules.tenant.domain.TenantStatus;

/**
 * Tenant and student an operation touches, derived from stored records.
 */
public record AccessTarget(Long tenantId, TenantStatus tenantStatus, Long studentId, Geography tenantGeography) {

    private static final AccessTarget NONE = new AccessTarget(null, null, null, null);

    public static AccessTarget none() {
        return NONE;
    }

    public static AccessTarget tenant(Long tenantId, TenantStatus tenantStatus, Geography tenantGeography) {
        return new AccessTarget(tenantId, tenantStatus, null, tenantGeography);
    }

    public static AccessTarget student(Long studentId, Long tenantId, TenantStatus tenantStatus, Geography tenantGeography) {
        return new AccessTarget(tenantId, tenantStatus, studentId, tenantGeography);
    }

    public boolean hasTenant() {
        return tenantId != null;
    }
}
