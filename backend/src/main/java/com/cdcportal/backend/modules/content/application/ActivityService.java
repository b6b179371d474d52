package com.cdcportal.backend.modules.content.application;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

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
import com.cdcportal.backend.modules.age.application.AgeBandCatalog;
import com.cdcportal.backend.modules.age.domain.AgeBand;
import com.cdcportal.backend.modules.age.infrastructure.persistence.AgeBandRepository;
import com.cdcportal.backend.modules.content.domain.ContentTargeting;
import com.cdcportal.backend.modules.content.domain.TakeHomeActivity;
import com.cdcportal.backend.modules.content.domain.Viewer;
import com.cdcportal.backend.modules.content.infrastructure.persistence.TakeHomeActivityRepository;
import com.cdcportal.backend.modules.tenant.infrastructure.persistence.TenantRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Take-home activities. Staff see every activity of their tenant; parents see
 * those whose catalog band matches their child.
 */
@Service
@Transactional
public class ActivityService {

    private final TakeHomeActivityRepository activityRepository;
    private final TenantRepository tenantRepository;
    private final UserAccountRepository userAccountRepository;
    private final AgeBandRepository ageBandRepository;
    private final AgeBandCatalog ageBandCatalog;
    private final AccessScopeService accessScopeService;
    private final ViewerResolver viewerResolver;
    private final Clock clock;

    public ActivityService(
            TakeHomeActivityRepository activityRepository,
            TenantRepository tenantRepository,
            UserAccountRepository userAccountRepository,
            AgeBandRepository ageBandRepository,
            AgeBandCatalog ageBandCatalog,
            AccessScopeService accessScopeService,
            ViewerResolver viewerResolver,
            Clock clock
    ) {
        this.activityRepository = activityRepository;
        this.tenantRepository = tenantRepository;
        this.userAccountRepository = userAccountRepository;
        this.ageBandRepository = ageBandRepository;
        this.ageBandCatalog = ageBandCatalog;
        this.accessScopeService = accessScopeService;
        this.viewerResolver = viewerResolver;
        this.clock = clock;
    }

    public TakeHomeActivity create(CallerIdentity caller, ActivityDraft draft) {
        Actor actor = accessScopeService.resolveActor(caller);
        AccessDecision decision = accessScopeService.require(actor, AccessOperation.MANAGE_ACTIVITIES,
                AccessTarget.none());
        TakeHomeActivity activity = new TakeHomeActivity(
                tenantRepository.getReferenceById(decision.requireTenantId()),
                userAccountRepository.getReferenceById(actor.userId()));
        apply(activity, draft);
        return activityRepository.save(activity);
    }

    public TakeHomeActivity update(CallerIdentity caller, Long activityId, ActivityDraft draft) {
        TakeHomeActivity activity = loadForManagement(caller, activityId);
        apply(activity, draft);
        return activity;
    }

    public void delete(CallerIdentity caller, Long activityId) {
        activityRepository.delete(loadForManagement(caller, activityId));
    }

    @Transactional(readOnly = true)
    public List<TakeHomeActivity> list(CallerIdentity caller) {
        Actor actor = accessScopeService.resolveActor(caller);
        AccessDecision decision = accessScopeService.require(actor, AccessOperation.VIEW_ACTIVITIES,
                AccessTarget.none());
        List<TakeHomeActivity> activities = activityRepository.findByTenantId(decision.requireTenantId());
        if (actor.role() != UserRoleType.PARENT) {
            return activities;
        }
        ContentTargeting targeting = new ContentTargeting(ageBandCatalog.loadTable());
        Viewer viewer = viewerResolver.resolve(actor, LocalDate.now(clock));
        return activities.stream()
                .filter(activity -> targeting.visible(activity.toTargetedContent(), viewer))
                .toList();
    }

    private TakeHomeActivity loadForManagement(CallerIdentity caller, Long activityId) {
        Actor actor = accessScopeService.resolveActor(caller);
        TakeHomeActivity activity = activityRepository.findById(activityId)
                .orElseThrow(() -> new NotAuthorizedException(AccessOperation.MANAGE_ACTIVITIES, actor.userId(),
                        DenyReason.UNKNOWN_TARGET));
        AccessTarget target = accessScopeService.tenantTarget(actor, AccessOperation.MANAGE_ACTIVITIES,
                activity.getTenantId());
        accessScopeService.require(actor, AccessOperation.MANAGE_ACTIVITIES, target);
        return activity;
    }

    private void apply(TakeHomeActivity activity, ActivityDraft draft) {
        if (draft.title() == null || draft.title().isBlank()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "TITLE_REQUIRED");
        }
        AgeBand ageBand = null;
        if (draft.ageBandId() != null) {
            ageBand = ageBandRepository.findById(draft.ageBandId())
                    .orElseThrow(() -> new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "UNKNOWN_AGE_BAND"));
        }
        activity.setTitle(draft.title().trim());
        activity.setDescription(draft.description());
        activity.setDueDate(draft.dueDate());
        activity.setAgeBand(ageBand);
        activity.setFile(draft.filePath(), draft.fileName());
    }

    public record ActivityDraft(
            String title,
            String description,
            LocalDate dueDate,
            Long ageBandId,
            String filePath,
            String fileName
    ) {
    }
}
