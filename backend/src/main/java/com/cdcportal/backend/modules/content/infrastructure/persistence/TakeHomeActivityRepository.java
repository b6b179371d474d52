package com.cdcportal.backend.modules.content.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.cdcportal.backend.modules.content.domain.TakeHomeActivity;

public interface TakeHomeActivityRepository extends JpaRepository<TakeHomeActivity, Long> {

    @Query("""
            select a
              from TakeHomeActivity a
              left join fetch a.ageBand
             where a.tenant.id = :tenantId
             order by a.dueDate asc nulls last, a.id desc
            """)
    List<TakeHomeActivity> findByTenantId(@Param("tenantId") Long tenantId);
}
