package com.cdcportal.backend.modules.access.domain;

import java.util.Objects;

import com.cdcportal.backend.modules.account.domain.UserRoleType;
import com.cdcportal.backend.modules.tenant.domain.Geography;
import com.cdcportal.backend.modules.tenant.domain.TenantStatus;

/**
 * Decides whether an actor may perform an operation on a target. Stateless; the
 * same inputs always give the same decision.
 */
public final class AccessPolicy {

    public AccessDecision authorize(Actor actor, AccessOperation operation, AccessTarget target) {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(operation, "operation");
        AccessTarget effectiveTarget = target == null ? AccessTarget.none() : target;

        UserRoleType role = actor.role();
        if (!operation.permits(role)) {
            return AccessDecision.deny(DenyReason.UNAUTHENTICATED_ROLE);
        }
        if (operation.isUnrestrictedFor(role)) {
            return AccessDecision.unrestricted();
        }

        return switch (role.scope()) {
            case CHILD -> authorizeParent(actor, effectiveTarget);
            case GEOGRAPHY -> authorizeGeography(actor, effectiveTarget);
            case TENANT -> authorizeTenantMember(actor, effectiveTarget);
            case NONE -> AccessDecision.deny(DenyReason.UNAUTHENTICATED_ROLE);
        };
    }

    private AccessDecision authorizeParent(Actor actor, AccessTarget target) {
        if (actor.linkedStudentId() == null || actor.homeTenantId() == null) {
            return AccessDecision.deny(DenyReason.NO_LINKED_STUDENT);
        }
        if (target.studentId() != null && !target.studentId().equals(actor.linkedStudentId())) {
            return AccessDecision.deny(DenyReason.FOREIGN_STUDENT);
        }
        if (actor.homeTenantStatus() != TenantStatus.ACTIVE) {
            return AccessDecision.deny(DenyReason.DEACTIVATED_TENANT);
        }
        if (target.hasTenant() && !target.tenantId().equals(actor.homeTenantId())) {
            return AccessDecision.deny(DenyReason.CROSS_TENANT);
        }
        return AccessDecision.tenant(actor.homeTenantId());
    }

    private AccessDecision authorizeGeography(Actor actor, AccessTarget target) {
        Geography geography = actor.geography();
        if (!target.hasTenant()) {
            return geography == null
                    ? AccessDecision.deny(DenyReason.UNAUTHENTICATED_ROLE)
                    : AccessDecision.geography(geography);
        }
        if (geography == null || !geography.sameMunicipality(target.tenantGeography())) {
            return AccessDecision.deny(DenyReason.CROSS_TENANT);
        }
        if (target.tenantStatus() != TenantStatus.ACTIVE) {
            return AccessDecision.deny(DenyReason.DEACTIVATED_TENANT);
        }
        return AccessDecision.tenant(target.tenantId());
    }

    private AccessDecision authorizeTenantMember(Actor actor, AccessTarget target) {
        if (actor.homeTenantId() == null) {
            return AccessDecision.deny(DenyReason.UNAUTHENTICATED_ROLE);
        }
        if (actor.homeTenantStatus() != TenantStatus.ACTIVE) {
            return AccessDecision.deny(DenyReason.DEACTIVATED_TENANT);
        }
        if (target.hasTenant() && !target.tenantId().equals(actor.homeTenantId())) {
            return AccessDecision.deny(DenyReason.CROSS_TENANT);
        }
        if (target.hasTenant() && target.tenantStatus() != TenantStatus.ACTIVE) {
            return AccessDecision.deny(DenyReason.DEACTIVATED_TENANT);
        }
        return AccessDecision.tenant(actor.homeTenantId());
    }
}
