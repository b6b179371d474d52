package com.cdcportal.backend.modules.content.application;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import com.cdcportal.backend.global.error.ProblemException;
import com.cdcportal.backend.modules.access.application.AccessScopeService;
import com.cdcportal.backend.modules.access.domain.AccessDecision;
import com.cdcportal.backend.modules.access.domain.AccessOperation;
import com.cdcportal.backend.modules.access.domain.AccessTarget;
import com.cdcportal.backend.modules.access.domain.Actor;
import com.cdcportal.backend.modules.access.domain.CallerIdentity;
import com.cdcportal.backend.modules.access.domain.DenyReason;
import com.cdcportal.backend.modules.access.domain.NotAuthorizedException;
import com.cdcportal.backend.modules.account.domain.UserAccount;
import com.cdcportal.backend.modules.account.domain.UserRoleType;
import com.cdcportal.backend.modules.account.infrastructure.persistence.UserAccountRepository;
import com.cdcportal.backend.modules.age.domain.AgeBandTable;
import com.cdcportal.backend.modules.content.domain.Announcement;
import com.cdcportal.backend.modules.content.domain.ContentTargeting;
import com.cdcportal.backend.modules.content.domain.Viewer;
import com.cdcportal.backend.modules.content.infrastructure.persistence.AnnouncementRepository;
import com.cdcportal.backend.modules.tenant.domain.Geography;
import com.cdcportal.backend.modules.tenant.domain.Tenant;
import com.cdcportal.backend.modules.tenant.domain.TenantStatus;
import com.cdcportal.backend.modules.tenant.infrastructure.persistence.TenantRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Publishing and reading announcements. Feeds are filtered with the canonical
 * year bands.
 */
@Service
@Transactional
public class AnnouncementService {

    private static final Logger log = LoggerFactory.getLogger(AnnouncementService.class);

    static final Set<UserRoleType> ALLOWED_AUDIENCE =
            EnumSet.of(UserRoleType.WORKER, UserRoleType.PRESIDENT, UserRoleType.PARENT, UserRoleType.FOCAL);

    private final AnnouncementRepository announcementRepository;
    private final TenantRepository tenantRepository;
    private final UserAccountRepository userAccountRepository;
    private final AccessScopeService accessScopeService;
    private final ViewerResolver viewerResolver;
    private final Clock clock;
    private final AgeBandTable canonicalBands = AgeBandTable.canonical();
    private final ContentTargeting targeting = new ContentTargeting(canonicalBands);

    public AnnouncementService(
            AnnouncementRepository announcementRepository,
            TenantRepository tenantRepository,
            UserAccountRepository userAccountRepository,
            AccessScopeService accessScopeService,
            ViewerResolver viewerResolver,
            Clock clock
    ) {
        this.announcementRepository = announcementRepository;
        this.tenantRepository = tenantRepository;
        this.userAccountRepository = userAccountRepository;
        this.accessScopeService = accessScopeService;
        this.viewerResolver = viewerResolver;
        this.clock = clock;
    }

    /**
     * Publishes to the caller's own tenant. Geography-scoped publishers have no
     * tenant and must name their targets through {@link #publishToTenants}.
     */
    public Announcement publish(CallerIdentity caller, AnnouncementDraft draft) {
        Actor actor = accessScopeService.resolveActor(caller);
        AccessDecision decision = accessScopeService.require(actor, AccessOperation.PUBLISH_CONTENT,
                AccessTarget.none());
        if (!decision.isTenantScoped()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "TARGET_CDCS_REQUIRED",
                    "Select the CDCs to publish to");
        }
        ValidatedDraft validated = validate(draft);
        return save(validated, actor, tenantRepository.getReferenceById(decision.requireTenantId()));
    }

    /**
     * One copy per requested tenant. Tenants that are unknown or outside the
     * caller's scope are reported back; the others are still published.
     */
    public MultiTenantResult publishToTenants(CallerIdentity caller, AnnouncementDraft draft, List<Long> tenantIds) {
        Actor actor = accessScopeService.resolveActor(caller);
        accessScopeService.require(actor, AccessOperation.PUBLISH_CONTENT, AccessTarget.none());
        ValidatedDraft validated = validate(draft);
        if (tenantIds == null || tenantIds.isEmpty()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "TARGET_CDCS_REQUIRED");
        }

        List<Published> created = new ArrayList<>();
        List<Failure> failures = new ArrayList<>();
        for (Long tenantId : new LinkedHashSet<>(tenantIds)) {
            Optional<AccessTarget> target = accessScopeService.findTenantTarget(actor, tenantId);
            if (target.isEmpty()) {
                failures.add(new Failure(tenantId, "TENANT_NOT_FOUND"));
                continue;
            }
            AccessDecision decision = accessScopeService.authorize(actor, AccessOperation.PUBLISH_CONTENT,
                    target.get());
            if (!decision.isAllowed()) {
                log.warn("Announcement for tenant {} refused for user {}: {}", tenantId, actor.userId(),
                        decision.reason().code());
                failures.add(new Failure(tenantId, "NOT_AUTHORIZED"));
                continue;
            }
            Announcement saved = save(validated, actor, tenantRepository.getReferenceById(tenantId));
            created.add(new Published(tenantId, saved.getId()));
        }

        if (created.isEmpty()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "NO_ANNOUNCEMENTS_CREATED",
                    "None of the " + failures.size() + " requested CDCs accepted the announcement");
        }
        log.info("Announcement published to {} tenant(s) by user {}, {} refused", created.size(), actor.userId(),
                failures.size());
        return new MultiTenantResult(created, failures);
    }

    @Transactional(readOnly = true)
    public List<Announcement> listManaged(CallerIdentity caller) {
        Actor actor = accessScopeService.resolveActor(caller);
        AccessDecision decision = accessScopeService.require(actor, AccessOperation.PUBLISH_CONTENT,
                AccessTarget.none());
        if (decision.isTenantScoped()) {
            return announcementRepository.findByTenantIdNewestFirst(decision.requireTenantId());
        }
        return inMunicipality(decision.geography());
    }

    @Transactional(readOnly = true)
    public List<Announcement> feed(CallerIdentity caller) {
        Actor actor = accessScopeService.resolveActor(caller);
        AccessDecision decision = accessScopeService.require(actor, AccessOperation.VIEW_CONTENT, AccessTarget.none());
        Viewer viewer = viewerResolver.resolve(actor, LocalDate.now(clock));

        List<Announcement> candidates = decision.isTenantScoped()
                ? announcementRepository.findFeedCandidates(decision.requireTenantId())
                : inMunicipality(decision.geography());
        return candidates.stream()
                .filter(announcement -> targeting.visible(announcement.toTargetedContent(), viewer))
                .toList();
    }

    public void delete(CallerIdentity caller, Long announcementId) {
        Actor actor = accessScopeService.resolveActor(caller);
        Announcement announcement = announcementRepository.findById(announcementId)
                .orElseThrow(() -> new NotAuthorizedException(AccessOperation.PUBLISH_CONTENT, actor.userId(),
                        DenyReason.UNKNOWN_TARGET));
        if (announcement.getTenantId() == null) {
            // broadcasts belong to no tenant scope
            throw new NotAuthorizedException(AccessOperation.PUBLISH_CONTENT, actor.userId(), DenyReason.CROSS_TENANT);
        }
        AccessTarget target = accessScopeService.tenantTarget(actor, AccessOperation.PUBLISH_CONTENT,
                announcement.getTenantId());
        accessScopeService.require(actor, AccessOperation.PUBLISH_CONTENT, target);
        announcementRepository.delete(announcement);
        log.info("Announcement {} deleted by user {}", announcementId, actor.userId());
    }

    private List<Announcement> inMunicipality(Geography geography) {
        return announcementRepository.findInMunicipality(
                geography.municipality().trim().toLowerCase(Locale.ROOT),
                geography.province().trim().toLowerCase(Locale.ROOT),
                TenantStatus.ACTIVE);
    }

    private Announcement save(ValidatedDraft draft, Actor actor, Tenant tenant) {
        UserAccount author = userAccountRepository.getReferenceById(actor.userId());
        Announcement announcement = new Announcement(draft.title(), draft.message(), author, draft.ageFilter(),
                draft.audience(), tenant);
        announcement.setAttachment(draft.attachmentPath(), draft.attachmentName());
        return announcementRepository.save(announcement);
    }

    ValidatedDraft validate(AnnouncementDraft draft) {
        if (draft.title() == null || draft.title().isBlank() || draft.message() == null || draft.message().isBlank()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "TITLE_AND_MESSAGE_REQUIRED");
        }
        String ageFilter = draft.ageFilter() == null || draft.ageFilter().isBlank()
                ? ContentTargeting.ALL_AGES
                : draft.ageFilter().trim().toLowerCase(Locale.ROOT);
        if (!ageFilter.equals(ContentTargeting.ALL_AGES) && !canonicalBands.hasBand(ageFilter)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_AGE_FILTER",
                    "Age filter must be one of all, " + String.join(", ", canonicalBands.keys()));
        }

        Set<UserRoleType> audience = EnumSet.noneOf(UserRoleType.class);
        for (String code : draft.roleFilter() == null ? List.<String>of() : draft.roleFilter()) {
            UserRoleType role = UserRoleType.fromCode(code);
            if (!ALLOWED_AUDIENCE.contains(role)) {
                throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_ROLE_FILTER",
                        "Unknown audience role: " + code);
            }
            audience.add(role);
        }
        if (audience.isEmpty()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_ROLE_FILTER",
                    "At least one audience role is required");
        }
        return new ValidatedDraft(draft.title().trim(), draft.message().trim(), ageFilter, audience,
                draft.attachmentPath(), draft.attachmentName());
    }

    public record AnnouncementDraft(
            String title,
            String message,
            String ageFilter,
            List<String> roleFilter,
            String attachmentPath,
            String attachmentName
    ) {
    }

    record ValidatedDraft(
            String title,
            String message,
            String ageFilter,
            Set<UserRoleType> audience,
            String attachmentPath,
            String attachmentName
    ) {
    }

    public record Published(Long tenantId, Long announcementId) {
    }

    public record Failure(Long tenantId, String code) {
    }

    public record MultiTenantResult(List<Published> created, List<Failure> failures) {
    }
}
