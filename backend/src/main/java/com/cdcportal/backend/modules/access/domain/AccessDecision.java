package com.cdcportal.backend.modules.access.domain;

import com.cdcportal.backend.modules.tenant.domain.Geography;

/**
 * Outcome of an authorization check. Allowed decisions name the scope the
 * caller may act in.
 */
public record AccessDecision(Outcome outcome, Long tenantId, Geography geography, DenyReason reason) {

    public enum Outcome {
        DENY,
        TENANT,
        GEOGRAPHY,
        UNRESTRICTED
    }

    private static final AccessDecision UNRESTRICTED = new AccessDecision(Outcome.UNRESTRICTED, null, null, null);

    public static AccessDecision deny(DenyReason reason) {
        return new AccessDecision(Outcome.DENY, null, null, reason);
    }

    public static AccessDecision tenant(Long tenantId) {
        return new AccessDecision(Outcome.TENANT, tenantId, null, null);
    }

    public static AccessDecision geography(Geography geography) {
        return new AccessDecision(Outcome.GEOGRAPHY, null, geography, null);
    }

    public static AccessDecision unrestricted() {
        return UNRESTRICTED;
    }

    public boolean isAllowed() {
        return outcome != Outcome.DENY;
    }

    public boolean isTenantScoped() {
        return outcome == Outcome.TENANT;
    }

    public boolean isUnrestricted() {
        return outcome == Outcome.UNRESTRICTED;
    }

    /**
     * Tenant the caller is confined to.
     *
     * @throws IllegalStateException when the decision is not tenant-scoped
     */
    public Long requireTenantId() {
        if (outcome != Outcome.TENANT) {
            throw new IllegalStateException("Decision is not tenant scoped: " + outcome);
        }
        return tenantId;
    }
}
