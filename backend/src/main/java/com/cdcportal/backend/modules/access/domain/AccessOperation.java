package com.cdcportal.backend.modules.access.domain;

import static com.cdcportal.backend.modules.account.domain.UserRoleType.ADMIN;
import static com.cdcportal.backend.modules.account.domain.UserRoleType.FOCAL;
import static com.cdcportal.backend.modules.account.domain.UserRoleType.MSW;
import static com.cdcportal.backend.modules.account.domain.UserRoleType.PARENT;
import static com.cdcportal.backend.modules.account.domain.UserRoleType.PRESIDENT;
import static com.cdcportal.backend.modules.account.domain.UserRoleType.WORKER;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import com.cdcportal.backend.modules.account.domain.UserRoleType;

/**
 * Scoped operations with the roles allowed to perform them. Roles in the
 * unrestricted set get read-only access across all tenants.
 */
public enum AccessOperation {
    VIEW_USERS(EnumSet.of(PRESIDENT, ADMIN)),
    MANAGE_USERS(EnumSet.of(PRESIDENT, ADMIN)),
    CREATE_PRESIDENT(EnumSet.of(ADMIN)),
    CREATE_FOCAL_ACCOUNT(EnumSet.of(ADMIN)),
    MANAGE_TENANTS(EnumSet.of(ADMIN)),
    VIEW_TENANT_DIRECTORY(EnumSet.of(ADMIN, PRESIDENT, FOCAL, MSW), EnumSet.of(ADMIN, MSW)),
    VIEW_STUDENTS(EnumSet.of(WORKER, PRESIDENT, ADMIN, PARENT)),
    ENROLL_STUDENTS(EnumSet.of(WORKER, PRESIDENT)),
    VIEW_ATTENDANCE(EnumSet.of(WORKER, PRESIDENT, ADMIN, PARENT)),
    RECORD_ATTENDANCE(EnumSet.of(WORKER)),
    VIEW_ACTIVITIES(EnumSet.of(WORKER, PRESIDENT, PARENT)),
    MANAGE_ACTIVITIES(EnumSet.of(WORKER)),
    VIEW_CONTENT(EnumSet.of(PRESIDENT, ADMIN, WORKER, PARENT, FOCAL)),
    PUBLISH_CONTENT(EnumSet.of(PRESIDENT, ADMIN, WORKER, FOCAL)),
    VIEW_AGGREGATES(EnumSet.of(PRESIDENT, ADMIN, WORKER, MSW), EnumSet.of(MSW));

    private final Set<UserRoleType> permittedRoles;
    private final Set<UserRoleType> unrestrictedRoles;

    AccessOperation(Set<UserRoleType> permittedRoles) {
        this(permittedRoles, EnumSet.noneOf(UserRoleType.class));
    }

    AccessOperation(Set<UserRoleType> permittedRoles, Set<UserRoleType> unrestrictedRoles) {
        this.permittedRoles = Collections.unmodifiableSet(permittedRoles);
        this.unrestrictedRoles = Collections.unmodifiableSet(unrestrictedRoles);
    }

    public boolean permits(UserRoleType role) {
        return role != null && permittedRoles.contains(role);
    }

    public boolean isUnrestrictedFor(UserRoleType role) {
        return role != null && unrestrictedRoles.contains(role);
    }
}
