package com.cdcportal.backend.modules.content.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.cdcportal.backend.modules.content.domain.Announcement;
import com.cdcportal.backend.modules.tenant.domain.TenantStatus;

public interface AnnouncementRepository extends JpaRepository<Announcement, Long> {

    @Query("""
            select a
              from Announcement a
              left join fetch a.tenant t
             where t.id = :tenantId
             order by a.createdAt desc, a.id desc
            """)
    List<Announcement> findByTenantIdNewestFirst(@Param("tenantId") Long tenantId);

    /**
     * Broadcast items plus the tenant's own.
     */
    @Query("""
            select a
              from Announcement a
              left join fetch a.tenant t
              left join fetch t.location
             where a.tenant is null
                or t.id = :tenantId
             order by a.createdAt desc, a.id desc
            """)
    List<Announcement> findFeedCandidates(@Param("tenantId") Long tenantId);

    @Query("""
            select a
              from Announcement a
              join fetch a.tenant t
              join fetch t.location l
             where lower(trim(l.municipality)) = :municipality
               and lower(trim(l.province)) = :province
               and t.status = :status
             order by a.createdAt desc, a.id desc
            """)
    List<Announcement> findInMunicipality(
            @Param("municipality") String municipality,
            @Param("province") String province,
            @Param("status") TenantStatus status
    );
}
