package com.cdcportal.backend.modules.account.domain;

import java.util.Arrays;
import java.util.Locale;

/**
 * Account roles and how each one is scoped.
 */
public enum UserRoleType {
    PRESIDENT(ScopeKind.TENANT),
    ADMIN(ScopeKind.TENANT),
    WORKER(ScopeKind.TENANT),
    PARENT(ScopeKind.CHILD),
    FOCAL(ScopeKind.GEOGRAPHY),
    MSW(ScopeKind.GEOGRAPHY),
    UNASSIGNED(ScopeKind.NONE);

    private final ScopeKind scope;

    UserRoleType(ScopeKind scope) {
        this.scope = scope;
    }

    public ScopeKind scope() {
        return scope;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static UserRoleType fromCode(String code) {
        if (code == null) {
            return UNASSIGNED;
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(role -> role.name().equals(normalized))
                .findFirst()
                .orElse(UNASSIGNED);
    }

    public enum ScopeKind {
        /** Bound to the account's own tenant. */
        TENANT,
        /** Bound to the tenant of the linked child. */
        CHILD,
        /** Bound to a municipality rather than a tenant. */
        GEOGRAPHY,
        NONE
    }
}
