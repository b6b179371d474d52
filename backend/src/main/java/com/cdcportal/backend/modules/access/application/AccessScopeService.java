package com.cdcportal.backend.modules.access.application;

import java.util.Objects;
import java.util.Optional;

import com.cdcportal.backend.modules.access.domain.AccessDecision;
import com.cdcportal.backend.modules.access.domain.AccessOperation;
import com.cdcportal.backend.modules.access.domain.AccessPolicy;
import com.cdcportal.backend.modules.access.domain.AccessTarget;
import com.cdcportal.backend.modules.access.domain.Actor;
import com.cdcportal.backend.modules.access.domain.CallerIdentity;
import com.cdcportal.backend.modules.access.domain.DenyReason;
import com.cdcportal.backend.modules.access.domain.NotAuthorizedException;
import com.cdcportal.backend.modules.account.domain.UserAccount;
import com.cdcportal.backend.modules.account.domain.UserRoleType;
import com.cdcportal.backend.modules.account.infrastructure.persistence.UserAccountRepository;
import com.cdcportal.backend.modules.student.domain.Student;
import com.cdcportal.backend.modules.student.infrastructure.persistence.StudentRepository;
import com.cdcportal.backend.modules.tenant.application.TenantDirectory;
import com.cdcportal.backend.modules.tenant.domain.Geography;
import com.cdcportal.backend.modules.tenant.domain.Tenant;
import com.cdcportal.backend.modules.tenant.infrastructure.persistence.TenantRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Entry point of every scoped operation: re-validates the caller against the
 * store, derives targets from stored records and applies {@link AccessPolicy}.
 */
@Service
@Transactional(readOnly = true)
public class AccessScopeService {

    private final UserAccountRepository userAccountRepository;
    private final TenantRepository tenantRepository;
    private final StudentRepository studentRepository;
    private final TenantDirectory tenantDirectory;
    private final AccessPolicy accessPolicy = new AccessPolicy();

    public AccessScopeService(
            UserAccountRepository userAccountRepository,
            TenantRepository tenantRepository,
            StudentRepository studentRepository,
            TenantDirectory tenantDirectory
    ) {
        this.userAccountRepository = userAccountRepository;
        this.tenantRepository = tenantRepository;
        this.studentRepository = studentRepository;
        this.tenantDirectory = tenantDirectory;
    }

    /**
     * Stored view of the caller. A missing account, or one whose role or tenant
     * no longer matches the token, resolves to an actor every operation refuses.
     */
    public Actor resolveActor(CallerIdentity caller) {
        Objects.requireNonNull(caller, "caller");
        Optional<UserAccount> stored = caller.userId() == null
                ? Optional.empty()
                : userAccountRepository.findById(caller.userId());
        if (stored.isEmpty()) {
            return Actor.unauthenticated(caller.userId());
        }
        UserAccount account = stored.get();
        if (account.getRole() != caller.role() || !Objects.equals(account.getTenantId(), caller.tenantId())) {
            return Actor.unauthenticated(caller.userId());
        }

        return switch (account.getRole().scope()) {
            case CHILD -> tenantDirectory.linkedStudentOf(account)
                    .map(student -> new Actor(account.getId(), account.getRole(), student.getTenantId(),
                            student.getTenant().getStatus(), student.getId(), null))
                    .orElseGet(() -> new Actor(account.getId(), account.getRole(), null, null, null, null));
            case GEOGRAPHY -> new Actor(account.getId(), account.getRole(), account.getTenantId(),
                    account.getTenant() == null ? null : account.getTenant().getStatus(), null,
                    account.getRole() == UserRoleType.FOCAL ? tenantDirectory.resolveViewerGeography(account) : null);
            case TENANT -> new Actor(account.getId(), account.getRole(), account.getTenantId(),
                    account.getTenant() == null ? null : account.getTenant().getStatus(), null, null);
            case NONE -> Actor.unauthenticated(account.getId());
        };
    }

    public AccessDecision authorize(Actor actor, AccessOperation operation, AccessTarget target) {
        return accessPolicy.authorize(actor, operation, target);
    }

    public AccessDecision require(Actor actor, AccessOperation operation, AccessTarget target) {
        AccessDecision decision = accessPolicy.authorize(actor, operation, target);
        if (!decision.isAllowed()) {
            throw new NotAuthorizedException(operation, actor.userId(), decision.reason());
        }
        return decision;
    }

    public AccessDecision require(CallerIdentity caller, AccessOperation operation) {
        return require(resolveActor(caller), operation, AccessTarget.none());
    }

    /**
     * Target for a stored tenant. An unknown id is refused like any denial.
     */
    public AccessTarget tenantTarget(Actor actor, AccessOperation operation, Long tenantId) {
        return findTenantTarget(actor, tenantId)
                .orElseThrow(() -> new NotAuthorizedException(operation, actor.userId(), DenyReason.UNKNOWN_TARGET));
    }

    public Optional<AccessTarget> findTenantTarget(Actor actor, Long tenantId) {
        if (tenantId == null) {
            return Optional.empty();
        }
        return tenantRepository.findById(tenantId)
                .map(tenant -> AccessTarget.tenant(tenant.getId(), tenant.getStatus(), geographyFor(actor, tenant)));
    }

    /**
     * Target for a stored student; the tenant comes from the student record.
     */
    public AccessTarget studentTarget(Actor actor, AccessOperation operation, Long studentId) {
        Student student = (studentId == null ? Optional.<Student>empty() : studentRepository.findById(studentId))
                .orElseThrow(() -> new NotAuthorizedException(operation, actor.userId(), DenyReason.UNKNOWN_TARGET));
        return studentTarget(actor, student);
    }

    public AccessTarget studentTarget(Actor actor, Student student) {
        Tenant tenant = tenantDirectory.tenantOf(student);
        return AccessTarget.student(student.getId(), tenant.getId(), tenant.getStatus(), geographyFor(actor, tenant));
    }

    // location is only read for geography-scoped actors
    private Geography geographyFor(Actor actor, Tenant tenant) {
        if (actor.role().scope() != UserRoleType.ScopeKind.GEOGRAPHY) {
            return null;
        }
        return tenantDirectory.locationOf(tenant.getId());
    }
}
