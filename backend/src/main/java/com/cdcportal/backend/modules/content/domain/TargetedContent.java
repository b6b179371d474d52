package com.cdcportal.backend.modules.content.domain;

import java.util.Set;

import com.cdcportal.backend.modules.account.domain.UserRoleType;
import com.cdcportal.backend.modules.tenant.domain.Geography;

/**
 * Targeting attributes of an announcement or activity. A null {@code tenantId}
 * marks a broadcast item; {@code tenantGeography} is the location of the owning tenant.
 */
public record TargetedContent(
        Long id,
        Long tenantId,
        String ageFilter,
        Set<UserRoleType> audience,
        Geography tenantGeography
) {
}
