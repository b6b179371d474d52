package com.cdcportal.backend.modules.dashboard.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import com.cdcportal.backend.modules.access.application.AccessScopeService;
import com.cdcportal.backend.modules.access.domain.AccessDecision;
import com.cdcportal.backend.modules.access.domain.AccessOperation;
import com.cdcportal.backend.modules.access.domain.CallerIdentity;
import com.cdcportal.backend.modules.account.domain.UserRoleType;
import com.cdcportal.backend.modules.dashboard.application.DashboardService.AgeDistribution;
import com.cdcportal.backend.modules.dashboard.application.DashboardService.GeographyFilter;
import com.cdcportal.backend.modules.dashboard.application.DashboardService.TenantCount;
import com.cdcportal.backend.modules.dashboard.domain.AgeBucket;
import com.cdcportal.backend.modules.student.infrastructure.persistence.StudentRepository;
import com.cdcportal.backend.modules.tenant.domain.Tenant;
import com.cdcportal.backend.modules.tenant.domain.TenantStatus;
import com.cdcportal.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DashboardServiceTest {

    @Mock
    private StudentRepository studentRepository;

    @Mock
    private AccessScopeService accessScopeService;

    private DashboardService dashboardService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-01-10T00:00:00Z").toInstant(), ZoneOffset.UTC);
        dashboardService = new DashboardService(studentRepository, accessScopeService, clock);
    }

    @Test
    void mswBucketsEveryActiveTenantByGeography() {
        CallerIdentity msw = new CallerIdentity(30L, UserRoleType.MSW, null);
        Tenant tenant = TestEntities.tenant(7L, "Lian", "Batangas");
        when(accessScopeService.require(msw, AccessOperation.VIEW_AGGREGATES)).thenReturn(AccessDecision.unrestricted());
        when(studentRepository.findForAgeDistribution(eq(TenantStatus.ACTIVE), isNull(), eq("%batangas%"),
                eq("%lian%"), eq("%"))).thenReturn(List.of(
                TestEntities.student(1L, LocalDate.of(2023, 1, 1), tenant),
                TestEntities.student(2L, LocalDate.of(2021, 6, 15), tenant),
                TestEntities.student(3L, LocalDate.of(2021, 1, 10), tenant),
                TestEntities.student(4L, LocalDate.of(2019, 3, 1), tenant),
                TestEntities.student(5L, LocalDate.of(2018, 1, 10), tenant),
                TestEntities.student(6L, LocalDate.of(2025, 2, 1), tenant)));

        AgeDistribution distribution = dashboardService.ageDistribution(msw,
                new GeographyFilter(" Batangas", "Lian ", null));

        assertThat(distribution.counts()).containsEntry(AgeBucket.UNDER_3, 1L)
                .containsEntry(AgeBucket.THREE_TO_FOUR, 1L)
                .containsEntry(AgeBucket.FOUR_TO_FIVE, 1L)
                .containsEntry(AgeBucket.FIVE_TO_SIX, 1L)
                .containsEntry(AgeBucket.OVER_6, 1L);
        assertThat(distribution.total()).isEqualTo(5);
    }

    @Test
    void tenantRolesOnlyCountTheirOwnTenant() {
        CallerIdentity worker = new CallerIdentity(10L, UserRoleType.WORKER, 7L);
        when(accessScopeService.require(worker, AccessOperation.VIEW_AGGREGATES)).thenReturn(AccessDecision.tenant(7L));
        when(studentRepository.countStudentsPerTenant(TenantStatus.ACTIVE, 7L))
                .thenReturn(List.<Object[]>of(new Object[] {7L, "CDC Lian", 12L}));

        List<TenantCount> counts = dashboardService.tenantDistribution(worker);

        assertThat(counts).containsExactly(new TenantCount(7L, "CDC Lian", 12L));
    }
}
