package com.cdcportal.backend.modules.dashboard.application;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.cdcportal.backend.global.common.LikePatterns;
import com.cdcportal.backend.modules.access.application.AccessScopeService;
import com.cdcportal.backend.modules.access.domain.AccessDecision;
import com.cdcportal.backend.modules.access.domain.AccessOperation;
import com.cdcportal.backend.modules.access.domain.CallerIdentity;
import com.cdcportal.backend.modules.age.domain.AgeClock;
import com.cdcportal.backend.modules.age.domain.InvalidAgeException;
import com.cdcportal.backend.modules.dashboard.domain.AgeBucket;
import com.cdcportal.backend.modules.student.domain.Student;
import com.cdcportal.backend.modules.student.infrastructure.persistence.StudentRepository;
import com.cdcportal.backend.modules.tenant.domain.TenantStatus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class DashboardService {

    private static final Logger log = LoggerFactory.getLogger(DashboardService.class);

    private final StudentRepository studentRepository;
    private final AccessScopeService accessScopeService;
    private final Clock clock;

    public DashboardService(StudentRepository studentRepository, AccessScopeService accessScopeService, Clock clock) {
        this.studentRepository = studentRepository;
        this.accessScopeService = accessScopeService;
        this.clock = clock;
    }

    /**
     * Students of active tenants bucketed by age. Tenant roles only ever see
     * their own tenant and the geography filter then only narrows within it.
     */
    public AgeDistribution ageDistribution(CallerIdentity caller, GeographyFilter filter) {
        AccessDecision decision = accessScopeService.require(caller, AccessOperation.VIEW_AGGREGATES);
        Long tenantId = decision.isUnrestricted() ? null : decision.requireTenantId();
        GeographyFilter effective = filter == null ? GeographyFilter.NONE : filter;

        List<Student> students = studentRepository.findForAgeDistribution(
                TenantStatus.ACTIVE,
                tenantId,
                LikePatterns.contains(effective.province()),
                LikePatterns.contains(effective.municipality()),
                LikePatterns.contains(effective.barangay())
        );

        LocalDate today = LocalDate.now(clock);
        Map<AgeBucket, Long> counts = new EnumMap<>(AgeBucket.class);
        for (AgeBucket bucket : AgeBucket.values()) {
            counts.put(bucket, 0L);
        }
        long total = 0;
        for (Student student : students) {
            try {
                counts.merge(AgeBucket.of(AgeClock.age(student.getBirthdate(), today)), 1L, Long::sum);
                total++;
            } catch (InvalidAgeException ex) {
                log.warn("Skipping student with birthdate after today: studentId={}, tenantId={}",
                        student.getId(), student.getTenantId());
            }
        }
        return new AgeDistribution(counts, total);
    }

    public List<TenantCount> tenantDistribution(CallerIdentity caller) {
        AccessDecision decision = accessScopeService.require(caller, AccessOperation.VIEW_AGGREGATES);
        Long tenantId = decision.isUnrestricted() ? null : decision.requireTenantId();
        List<TenantCount> result = new ArrayList<>();
        for (Object[] row : studentRepository.countStudentsPerTenant(TenantStatus.ACTIVE, tenantId)) {
            result.add(new TenantCount((Long) row[0], (String) row[1], ((Number) row[2]).longValue()));
        }
        return result;
    }

    public record GeographyFilter(String province, String municipality, String barangay) {

        public static final GeographyFilter NONE = new GeographyFilter(null, null, null);
    }

    public record AgeDistribution(Map<AgeBucket, Long> counts, long total) {
    }

    public record TenantCount(Long tenantId, String tenantName, long students) {
    }
}
