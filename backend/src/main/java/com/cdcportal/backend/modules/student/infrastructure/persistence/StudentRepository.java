package com.cdcportal.backend.modules.student.infrastructure.persistence;

import java.time.LocalDate;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.cdcportal.backend.modules.student.domain.Student;
import com.cdcportal.backend.modules.tenant.domain.TenantStatus;

public interface StudentRepository extends JpaRepository<Student, Long> {

    List<Student> findByTenantIdOrderByLastNameAscFirstNameAsc(Long tenantId);

    List<Student> findByTenantIdAndBirthdateBetweenOrderByLastNameAscFirstNameAsc(
            Long tenantId,
            LocalDate earliest,
            LocalDate latest
    );

    @Query("""
            select s
              from Student s
              join fetch s.tenant t
              join fetch t.location l
             where t.status = :status
               and (:tenantId is null or t.id = :tenantId)
               and lower(l.province) like :provincePattern escape '\\'
               and lower(l.municipality) like :municipalityPattern escape '\\'
               and lower(l.barangay) like :barangayPattern escape '\\'
            """)
    List<Student> findForAgeDistribution(
            @Param("status") TenantStatus status,
            @Param("tenantId") Long tenantId,
            @Param("provincePattern") String provincePattern,
            @Param("municipalityPattern") String municipalityPattern,
            @Param("barangayPattern") String barangayPattern
    );

    @Query("""
            select t.id, t.name, count(s.id)
              from Tenant t
              left join Student s on s.tenant = t
             where t.status = :status
               and (:tenantId is null or t.id = :tenantId)
             group by t.id, t.name
             order by t.name
            """)
    List<Object[]> countStudentsPerTenant(@Param("status") TenantStatus status, @Param("tenantId") Long tenantId);
}
