package com.cdcportal.backend.modules.content.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import com.cdcportal.backend.global.error.ProblemException;
import com.cdcportal.backend.modules.access.application.AccessScopeService;
import com.cdcportal.backend.modules.access.domain.AccessDecision;
import com.cdcportal.backend.modules.access.domain.AccessOperation;
import com.cdcportal.backend.modules.access.domain.AccessTarget;
import com.cdcportal.backend.modules.access.domain.Actor;
import com.cdcportal.backend.modules.access.domain.CallerIdentity;
import com.cdcportal.backend.modules.access.domain.DenyReason;
import com.cdcportal.backend.modules.access.domain.NotAuthorizedException;
import com.cdcportal.backend.modules.account.domain.UserRoleType;
import com.cdcportal.backend.modules.account.infrastructure.persistence.UserAccountRepository;
import com.cdcportal.backend.modules.age.domain.AgeClock;
import com.cdcportal.backend.modules.content.application.AnnouncementService.AnnouncementDraft;
import com.cdcportal.backend.modules.content.application.AnnouncementService.MultiTenantResult;
import com.cdcportal.backend.modules.content.domain.Announcement;
import com.cdcportal.backend.modules.content.domain.Viewer;
import com.cdcportal.backend.modules.content.infrastructure.persistence.AnnouncementRepository;
import com.cdcportal.backend.modules.tenant.domain.Geography;
import com.cdcportal.backend.modules.tenant.domain.Tenant;
import com.cdcportal.backend.modules.tenant.domain.TenantStatus;
import com.cdcportal.backend.modules.tenant.infrastructure.persistence.TenantRepository;
import com.cdcportal.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AnnouncementServiceTest {

    private static final Geography LIAN = new Geography("Bagong Pook", "Lian", "Batangas", null);
    private static final CallerIdentity FOCAL_CALLER = new CallerIdentity(20L, UserRoleType.FOCAL, null);
    private static final Actor FOCAL = new Actor(20L, UserRoleType.FOCAL, null, null, null, LIAN);

    @Mock
    private AnnouncementRepository announcementRepository;

    @Mock
    private TenantRepository tenantRepository;

    @Mock
    private UserAccountRepository userAccountRepository;

    @Mock
    private AccessScopeService accessScopeService;

    @Mock
    private ViewerResolver viewerResolver;

    private AnnouncementService announcementService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-01-10T00:00:00Z").toInstant(), ZoneOffset.UTC);
        announcementService = new AnnouncementService(announcementRepository, tenantRepository, userAccountRepository,
                accessScopeService, viewerResolver, clock);
        lenient().when(announcementRepository.save(any(Announcement.class)))
                .thenAnswer(invocation -> TestEntities.withId(invocation.getArgument(0, Announcement.class), 500L));
    }

    @Test
    @DisplayName("multi-CDC publishing creates copies for allowed tenants and reports the rest")
    void publishToTenantsReportsFailures() {
        AccessTarget lian = AccessTarget.tenant(7L, TenantStatus.ACTIVE, LIAN);
        AccessTarget nasugbu = AccessTarget.tenant(9L, TenantStatus.ACTIVE,
                new Geography("Wawa", "Nasugbu", "Batangas", null));
        when(accessScopeService.resolveActor(FOCAL_CALLER)).thenReturn(FOCAL);
        when(accessScopeService.require(FOCAL, AccessOperation.PUBLISH_CONTENT, AccessTarget.none()))
                .thenReturn(AccessDecision.geography(LIAN));
        when(accessScopeService.findTenantTarget(FOCAL, 7L)).thenReturn(Optional.of(lian));
        when(accessScopeService.findTenantTarget(FOCAL, 9L)).thenReturn(Optional.of(nasugbu));
        when(accessScopeService.findTenantTarget(FOCAL, 11L)).thenReturn(Optional.empty());
        when(accessScopeService.authorize(FOCAL, AccessOperation.PUBLISH_CONTENT, lian))
                .thenReturn(AccessDecision.tenant(7L));
        when(accessScopeService.authorize(FOCAL, AccessOperation.PUBLISH_CONTENT, nasugbu))
                .thenReturn(AccessDecision.deny(DenyReason.CROSS_TENANT));
        when(tenantRepository.getReferenceById(7L)).thenReturn(TestEntities.tenant(7L, "Lian", "Batangas"));

        MultiTenantResult result = announcementService.publishToTenants(FOCAL_CALLER, draft("all", List.of("parent")),
                List.of(7L, 9L, 11L, 7L));

        assertThat(result.created()).extracting(AnnouncementService.Published::tenantId).containsExactly(7L);
        assertThat(result.failures()).containsExactly(
                new AnnouncementService.Failure(9L, "NOT_AUTHORIZED"),
                new AnnouncementService.Failure(11L, "TENANT_NOT_FOUND"));
        verify(announcementRepository, times(1)).save(any(Announcement.class));
    }

    @Test
    @DisplayName("nothing created is a failure")
    void publishToTenantsAllRefused() {
        when(accessScopeService.resolveActor(FOCAL_CALLER)).thenReturn(FOCAL);
        when(accessScopeService.require(FOCAL, AccessOperation.PUBLISH_CONTENT, AccessTarget.none()))
                .thenReturn(AccessDecision.geography(LIAN));
        when(accessScopeService.findTenantTarget(FOCAL, 11L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> announcementService.publishToTenants(FOCAL_CALLER, draft("all", List.of("focal")),
                List.of(11L)))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("NO_ANNOUNCEMENTS_CREATED");
        verify(announcementRepository, never()).save(any());
    }

    @Test
    @DisplayName("a focal user must name target CDCs")
    void focalSinglePublishNeedsTargets() {
        when(accessScopeService.resolveActor(FOCAL_CALLER)).thenReturn(FOCAL);
        when(accessScopeService.require(FOCAL, AccessOperation.PUBLISH_CONTENT, AccessTarget.none()))
                .thenReturn(AccessDecision.geography(LIAN));

        assertThatThrownBy(() -> announcementService.publish(FOCAL_CALLER, draft("all", List.of("parent"))))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("TARGET_CDCS_REQUIRED");
    }

    @Test
    @DisplayName("a worker publishes to their own CDC with a normalised draft")
    void workerPublishesToOwnTenant() {
        CallerIdentity caller = new CallerIdentity(10L, UserRoleType.WORKER, 7L);
        Actor worker = new Actor(10L, UserRoleType.WORKER, 7L, TenantStatus.ACTIVE, null, null);
        when(accessScopeService.resolveActor(caller)).thenReturn(worker);
        when(accessScopeService.require(worker, AccessOperation.PUBLISH_CONTENT, AccessTarget.none()))
                .thenReturn(AccessDecision.tenant(7L));
        when(tenantRepository.getReferenceById(7L)).thenReturn(TestEntities.tenant(7L, "Lian", "Batangas"));

        Announcement saved = announcementService.publish(caller,
                new AnnouncementDraft("  Field trip ", "Bring water", " 4-5 ", List.of("PARENT", "worker"), null, null));

        assertThat(saved.getTitle()).isEqualTo("Field trip");
        assertThat(saved.getAgeFilter()).isEqualTo("4-5");
        assertThat(saved.getAudience()).containsExactlyInAnyOrder(UserRoleType.PARENT, UserRoleType.WORKER);
        assertThat(saved.getTenantId()).isEqualTo(7L);
    }

    @Test
    @DisplayName("drafts with unknown age or role filters are rejected")
    void draftValidation() {
        assertThatThrownBy(() -> announcementService.validate(draft("6-7", List.of("parent"))))
                .extracting("code").isEqualTo("INVALID_AGE_FILTER");
        assertThatThrownBy(() -> announcementService.validate(draft("all", List.of("msw"))))
                .extracting("code").isEqualTo("INVALID_ROLE_FILTER");
        assertThatThrownBy(() -> announcementService.validate(draft("all", List.of())))
                .extracting("code").isEqualTo("INVALID_ROLE_FILTER");
        assertThatThrownBy(() -> announcementService.validate(
                new AnnouncementDraft(" ", "body", "all", List.of("parent"), null, null)))
                .extracting("code").isEqualTo("TITLE_AND_MESSAGE_REQUIRED");
    }

    @Test
    @DisplayName("a parent's feed keeps items for their child's band and drops others")
    void parentFeedFiltersByAge() {
        CallerIdentity caller = new CallerIdentity(12L, UserRoleType.PARENT, null);
        Actor parent = new Actor(12L, UserRoleType.PARENT, 7L, TenantStatus.ACTIVE, 55L, null);
        Tenant tenant = TestEntities.tenant(7L, "Lian", "Batangas");
        Announcement fourToFive = TestEntities.withId(new Announcement("A", "a", null, "4-5",
                EnumSet.of(UserRoleType.PARENT), tenant), 1L);
        Announcement threeToFour = TestEntities.withId(new Announcement("B", "b", null, "3-4",
                EnumSet.of(UserRoleType.PARENT), tenant), 2L);
        Announcement staffOnly = TestEntities.withId(new Announcement("C", "c", null, "all",
                EnumSet.of(UserRoleType.WORKER), tenant), 3L);
        Announcement broadcast = TestEntities.withId(new Announcement("D", "d", null, "all",
                EnumSet.of(UserRoleType.PARENT), null), 4L);
        when(accessScopeService.resolveActor(caller)).thenReturn(parent);
        when(accessScopeService.require(parent, AccessOperation.VIEW_CONTENT, AccessTarget.none()))
                .thenReturn(AccessDecision.tenant(7L));
        when(viewerResolver.resolve(eq(parent), any(LocalDate.class)))
                .thenReturn(Viewer.parent(7L, AgeClock.age(LocalDate.of(2020, 11, 1), LocalDate.of(2025, 1, 10))));
        when(announcementRepository.findFeedCandidates(7L))
                .thenReturn(List.of(fourToFive, threeToFour, staffOnly, broadcast));

        List<Announcement> feed = announcementService.feed(caller);

        assertThat(feed).extracting(Announcement::getId).containsExactly(1L, 4L);
    }

    @Test
    @DisplayName("a focal feed only reads announcements of active CDCs in the focal's municipality")
    void focalFeedReadsActiveTenantsOnly() {
        Tenant lianCdc = TestEntities.tenant(7L, "Lian", "Batangas");
        Announcement forFocal = TestEntities.withId(new Announcement("E", "e", null, "all",
                EnumSet.of(UserRoleType.FOCAL), lianCdc), 5L);
        when(accessScopeService.resolveActor(FOCAL_CALLER)).thenReturn(FOCAL);
        when(accessScopeService.require(FOCAL, AccessOperation.VIEW_CONTENT, AccessTarget.none()))
                .thenReturn(AccessDecision.geography(LIAN));
        when(viewerResolver.resolve(eq(FOCAL), any(LocalDate.class)))
                .thenReturn(Viewer.geographyScoped(UserRoleType.FOCAL, LIAN));
        when(announcementRepository.findInMunicipality("lian", "batangas", TenantStatus.ACTIVE))
                .thenReturn(List.of(forFocal));

        List<Announcement> feed = announcementService.feed(FOCAL_CALLER);

        assertThat(feed).extracting(Announcement::getId).containsExactly(5L);
        verify(announcementRepository).findInMunicipality("lian", "batangas", TenantStatus.ACTIVE);
    }

    @Test
    @DisplayName("broadcast announcements cannot be deleted through a tenant scope")
    void broadcastDeleteRefused() {
        CallerIdentity caller = new CallerIdentity(10L, UserRoleType.WORKER, 7L);
        Actor worker = new Actor(10L, UserRoleType.WORKER, 7L, TenantStatus.ACTIVE, null, null);
        Announcement broadcast = TestEntities.withId(new Announcement("D", "d", null, "all",
                EnumSet.of(UserRoleType.WORKER), null), 4L);
        when(accessScopeService.resolveActor(caller)).thenReturn(worker);
        when(announcementRepository.findById(4L)).thenReturn(Optional.of(broadcast));

        assertThatThrownBy(() -> announcementService.delete(caller, 4L))
                .isInstanceOf(NotAuthorizedException.class);
        verify(announcementRepository, never()).delete(any());
    }

    private static AnnouncementDraft draft(String ageFilter, List<String> roles) {
        return new AnnouncementDraft("Title", "Message", ageFilter, roles, null, null);
    }
}
