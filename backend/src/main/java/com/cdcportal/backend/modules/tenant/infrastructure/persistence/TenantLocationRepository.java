package com.cdcportal.backend.modules.tenant.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import com.cdcportal.backend.modules.tenant.domain.TenantLocation;

public interface TenantLocationRepository extends JpaRepository<TenantLocation, Long> {
}
