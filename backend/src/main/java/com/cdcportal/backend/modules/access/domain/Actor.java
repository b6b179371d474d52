package com.cdcportal.backend.modules.access.domain;

import com.cdcportal.backend.modules.account.domain.UserRoleType;
import com.cdcportal.backend.modules.tenant.domain.Geography;
import com.cdcportal.backend.modules.tenant.domain.TenantStatus;

/**
 * Caller as re-read from the store. For parents the home tenant is the tenant
 * of the linked child.
 */
public record Actor(
        Long userId,
        UserRoleType role,
        Long homeTenantId,
        TenantStatus homeTenantStatus,
        Long linkedStudentId,
        Geography geography
) {

    /** Caller whose stored account is missing or disagrees with the token. */
    public static Actor unauthenticated(Long userId) {
        return new Actor(userId, UserRoleType.UNASSIGNED, null, null, null, null);
    }
}
