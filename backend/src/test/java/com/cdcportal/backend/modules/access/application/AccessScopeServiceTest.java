package com.cdcportal.backend.modules.access.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.util.Optional;

import com.cdcportal.backend.modules.access.domain.AccessOperation;
import com.cdcportal.backend.modules.access.domain.AccessTarget;
import com.cdcportal.backend.modules.access.domain.Actor;
import com.cdcportal.backend.modules.access.domain.CallerIdentity;
import com.cdcportal.backend.modules.access.domain.DenyReason;
import com.cdcportal.backend.modules.access.domain.NotAuthorizedException;
import com.cdcportal.backend.modules.account.domain.UserAccount;
import com.cdcportal.backend.modules.account.domain.UserRoleType;
import com.cdcportal.backend.modules.account.infrastructure.persistence.UserAccountRepository;
import com.cdcportal.backend.modules.student.domain.GuardianInfo;
import com.cdcportal.backend.modules.student.domain.Student;
import com.cdcportal.backend.modules.student.infrastructure.persistence.GuardianInfoRepository;
import com.cdcportal.backend.modules.student.infrastructure.persistence.StudentRepository;
import com.cdcportal.backend.modules.tenant.application.TenantDirectory;
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
class AccessScopeServiceTest {

    @Mock
    private UserAccountRepository userAccountRepository;

    @Mock
    private TenantRepository tenantRepository;

    @Mock
    private StudentRepository studentRepository;

    @Mock
    private GuardianInfoRepository guardianInfoRepository;

    private AccessScopeService accessScopeService;

    private Tenant tenantSeven;
    private Tenant tenantNine;

    @BeforeEach
    void setUp() {
        accessScopeService = new AccessScopeService(userAccountRepository, tenantRepository, studentRepository,
                new TenantDirectory(tenantRepository, guardianInfoRepository));
        tenantSeven = TestEntities.tenant(7L, "Lian", "Batangas");
        tenantNine = TestEntities.tenant(9L, "Nasugbu", "Batangas");
        lenient().when(tenantRepository.findWithLocationById(7L)).thenReturn(Optional.of(tenantSeven));
        lenient().when(tenantRepository.findWithLocationById(9L)).thenReturn(Optional.of(tenantNine));
    }

    @Test
    @DisplayName("a token whose tenant no longer matches the stored account resolves to an unauthenticated actor")
    void staleTokenIsUnauthenticated() {
        UserAccount worker = TestEntities.user(10L, UserRoleType.WORKER, tenantSeven);
        when(userAccountRepository.findById(10L)).thenReturn(Optional.of(worker));

        Actor actor = accessScopeService.resolveActor(new CallerIdentity(10L, UserRoleType.WORKER, 9L));

        assertThat(actor.role()).isEqualTo(UserRoleType.UNASSIGNED);
        assertThatThrownBy(() -> accessScopeService.require(actor, AccessOperation.VIEW_STUDENTS, AccessTarget.none()))
                .isInstanceOf(NotAuthorizedException.class)
                .extracting("denyReason")
                .isEqualTo(DenyReason.UNAUTHENTICATED_ROLE);
    }

    @Test
    @DisplayName("a token for a deleted account resolves to an unauthenticated actor")
    void missingAccountIsUnauthenticated() {
        when(userAccountRepository.findById(10L)).thenReturn(Optional.empty());

        Actor actor = accessScopeService.resolveActor(new CallerIdentity(10L, UserRoleType.ADMIN, 7L));

        assertThat(actor).isEqualTo(Actor.unauthenticated(10L));
    }

    @Test
    @DisplayName("a parent's home tenant is the tenant of the linked child")
    void parentUsesChildTenant() {
        UserAccount parent = TestEntities.user(12L, UserRoleType.PARENT, null);
        Student child = TestEntities.student(55L, LocalDate.of(2020, 11, 1), tenantNine);
        GuardianInfo guardian = new GuardianInfo(child, "Parent 12");
        guardian.setGuardianUser(parent);
        when(userAccountRepository.findById(12L)).thenReturn(Optional.of(parent));
        when(guardianInfoRepository.findByGuardianUserId(12L)).thenReturn(Optional.of(guardian));

        Actor actor = accessScopeService.resolveActor(new CallerIdentity(12L, UserRoleType.PARENT, null));

        assertThat(actor.homeTenantId()).isEqualTo(9L);
        assertThat(actor.homeTenantStatus()).isEqualTo(TenantStatus.ACTIVE);
        assertThat(actor.linkedStudentId()).isEqualTo(55L);
    }

    @Test
    @DisplayName("a parent without a linked child is refused")
    void parentWithoutChildRefused() {
        UserAccount parent = TestEntities.user(12L, UserRoleType.PARENT, null);
        when(userAccountRepository.findById(12L)).thenReturn(Optional.of(parent));
        when(guardianInfoRepository.findByGuardianUserId(12L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> accessScopeService.require(new CallerIdentity(12L, UserRoleType.PARENT, null),
                AccessOperation.VIEW_STUDENTS))
                .isInstanceOf(NotAuthorizedException.class)
                .extracting("denyReason")
                .isEqualTo(DenyReason.NO_LINKED_STUDENT);
    }

    @Test
    @DisplayName("a focal user's geography comes from their address and targets carry tenant locations")
    void focalGeographyFromAddress() {
        UserAccount focal = TestEntities.user(20L, UserRoleType.FOCAL, null);
        focal.setAddress("Bagong Pook, Lian, Batangas");
        when(userAccountRepository.findById(20L)).thenReturn(Optional.of(focal));
        when(tenantRepository.findById(7L)).thenReturn(Optional.of(tenantSeven));
        when(tenantRepository.findById(9L)).thenReturn(Optional.of(tenantNine));

        Actor actor = accessScopeService.resolveActor(new CallerIdentity(20L, UserRoleType.FOCAL, null));
        AccessTarget lian = accessScopeService.tenantTarget(actor, AccessOperation.PUBLISH_CONTENT, 7L);
        AccessTarget nasugbu = accessScopeService.tenantTarget(actor, AccessOperation.PUBLISH_CONTENT, 9L);

        assertThat(actor.geography()).isEqualTo(new Geography("Bagong Pook", "Lian", "Batangas", null));
        assertThat(accessScopeService.authorize(actor, AccessOperation.PUBLISH_CONTENT, lian).requireTenantId())
                .isEqualTo(7L);
        assertThat(accessScopeService.authorize(actor, AccessOperation.PUBLISH_CONTENT, nasugbu).reason())
                .isEqualTo(DenyReason.CROSS_TENANT);
    }

    @Test
    @DisplayName("unknown students are refused without revealing that they do not exist")
    void unknownStudentRefused() {
        UserAccount worker = TestEntities.user(10L, UserRoleType.WORKER, tenantSeven);
        when(userAccountRepository.findById(10L)).thenReturn(Optional.of(worker));
        when(studentRepository.findById(404L)).thenReturn(Optional.empty());

        Actor actor = accessScopeService.resolveActor(new CallerIdentity(10L, UserRoleType.WORKER, 7L));

        assertThatThrownBy(() -> accessScopeService.studentTarget(actor, AccessOperation.VIEW_STUDENTS, 404L))
                .isInstanceOf(NotAuthorizedException.class)
                .hasMessageContaining("NOT_AUTHORIZED")
                .extracting("denyReason")
                .isEqualTo(DenyReason.UNKNOWN_TARGET);
    }

    @Test
    @DisplayName("a worker is refused a student of another tenant")
    void crossTenantStudentRefused() {
        UserAccount worker = TestEntities.user(10L, UserRoleType.WORKER, tenantSeven);
        Student foreign = TestEntities.student(77L, LocalDate.of(2021, 2, 2), tenantNine);
        when(userAccountRepository.findById(10L)).thenReturn(Optional.of(worker));
        when(studentRepository.findById(77L)).thenReturn(Optional.of(foreign));

        Actor actor = accessScopeService.resolveActor(new CallerIdentity(10L, UserRoleType.WORKER, 7L));
        AccessTarget target = accessScopeService.studentTarget(actor, AccessOperation.VIEW_STUDENTS, 77L);

        assertThatThrownBy(() -> accessScopeService.require(actor, AccessOperation.VIEW_STUDENTS, target))
                .isInstanceOf(NotAuthorizedException.class)
                .extracting("denyReason")
                .isEqualTo(DenyReason.CROSS_TENANT);
    }
}
