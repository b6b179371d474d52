package com.cdcportal.backend.modules.tenant.domain;

import com.cdcportal.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * A tenant row without its location row. Data integrity fault, never a client error.
 */
public class OrphanTenantException extends ProblemException {

    private final Long tenantId;

    public OrphanTenantException(Long tenantId) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "ORPHAN_TENANT", "Tenant location is missing");
        this.tenantId = tenantId;
    }

    public Long getTenantId() {
        return tenantId;
    }
}
