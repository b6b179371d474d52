package com.cdcportal.backend.modules.access.domain;

import com.cdcportal.backend.modules.account.domain.UserRoleType;

/**
 * Identity claimed by a verified access token, before it is checked against the store.
 */
public record CallerIdentity(Long userId, UserRoleType role, Long tenantId) {
}
