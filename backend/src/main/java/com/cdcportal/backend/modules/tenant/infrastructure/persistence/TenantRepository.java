package com.cdcportal.backend.modules.tenant.infrastructure.persistence;

import java.util.Optional;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.cdcportal.backend.modules.tenant.domain.Tenant;
import com.cdcportal.backend.modules.tenant.domain.TenantStatus;

public interface TenantRepository extends JpaRepository<Tenant, Long> {

    @Query("""
            select t
              from Tenant t
              left join fetch t.location
             where t.id = :id
            """)
    Optional<Tenant> findWithLocationById(@Param("id") Long id);

    @Query(value = """
            select t
              from Tenant t
              join fetch t.location l
             where t.status = :status
               and (:tenantId is null or t.id = :tenantId)
               and lower(l.province) like :provincePattern escape '\\'
               and lower(l.municipality) like :municipalityPattern escape '\\'
               and lower(l.barangay) like :barangayPattern escape '\\'
             order by l.province, l.municipality, l.barangay, t.name
            """,
            countQuery = """
            select count(t)
              from Tenant t
              join t.location l
             where t.status = :status
               and (:tenantId is null or t.id = :tenantId)
               and lower(l.province) like :provincePattern escape '\\'
               and lower(l.municipality) like :municipalityPattern escape '\\'
               and lower(l.barangay) like :barangayPattern escape '\\'
            """)
    Page<Tenant> searchDirectory(
            @Param("status") TenantStatus status,
            @Param("tenantId") Long tenantId,
            @Param("provincePattern") String provincePattern,
            @Param("municipalityPattern") String municipalityPattern,
            @Param("barangayPattern") String barangayPattern,
            Pageable pageable
    );
}
