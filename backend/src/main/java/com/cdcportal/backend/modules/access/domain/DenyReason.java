package com.cdcportal.backend.modules.access.domain;

public enum DenyReason {
    CROSS_TENANT("cross-tenant"),
    NO_LINKED_STUDENT("no-linked-student"),
    DEACTIVATED_TENANT("deactivated-tenant"),
    UNAUTHENTICATED_ROLE("unauthenticated-role"),
    FOREIGN_STUDENT("foreign-student"),
    /** Target record does not exist; reported to the client like any other refusal. */
    UNKNOWN_TARGET("unknown-target");

    private final String code;

    DenyReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
