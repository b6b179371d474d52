package com.cdcportal.backend.modules.tenant.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.cdcportal.backend.global.common.LikePatterns;
import com.cdcportal.backend.global.error.ProblemException;
import com.cdcportal.backend.modules.access.application.AccessScopeService;
import com.cdcportal.backend.modules.access.domain.AccessDecision;
import com.cdcportal.backend.modules.access.domain.AccessOperation;
import com.cdcportal.backend.modules.access.domain.AccessTarget;
import com.cdcportal.backend.modules.access.domain.Actor;
import com.cdcportal.backend.modules.access.domain.CallerIdentity;
import com.cdcportal.backend.modules.audit.application.AuditLogService;
import com.cdcportal.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.cdcportal.backend.modules.tenant.domain.Geography;
import com.cdcportal.backend.modules.tenant.domain.Tenant;
import com.cdcportal.backend.modules.tenant.domain.TenantLocation;
import com.cdcportal.backend.modules.tenant.domain.TenantStatus;
import com.cdcportal.backend.modules.tenant.infrastructure.persistence.TenantLocationRepository;
import com.cdcportal.backend.modules.tenant.infrastructure.persistence.TenantRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Tenant onboarding, soft deactivation and the tenant directory.
 */
@Service
@Transactional
public class TenantService {

    private static final Logger log = LoggerFactory.getLogger(TenantService.class);
    private static final String RESOURCE_TYPE = "CDC";

    private final TenantRepository tenantRepository;
    private final TenantLocationRepository tenantLocationRepository;
    private final AccessScopeService accessScopeService;
    private final AuditLogService auditLogService;

    public TenantService(
            TenantRepository tenantRepository,
            TenantLocationRepository tenantLocationRepository,
            AccessScopeService accessScopeService,
            AuditLogService auditLogService
    ) {
        this.tenantRepository = tenantRepository;
        this.tenantLocationRepository = tenantLocationRepository;
        this.accessScopeService = accessScopeService;
        this.auditLogService = auditLogService;
    }

    public TenantView createTenant(CallerIdentity caller, CreateTenantCommand command) {
        Actor actor = accessScopeService.resolveActor(caller);
        accessScopeService.require(actor, AccessOperation.MANAGE_TENANTS, AccessTarget.none());

        List<String> missing = command.missingFields();
        if (!missing.isEmpty()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "MISSING_FIELDS",
                    "Missing required fields: " + String.join(", ", missing));
        }

        TenantLocation location = tenantLocationRepository.save(new TenantLocation(
                command.region().trim(),
                command.province().trim(),
                command.municipality().trim(),
                command.barangay().trim()
        ));
        Tenant tenant = tenantRepository.save(new Tenant(command.name().trim(), location));

        auditLogService.record(AuditLogCommand.of(AuditLogService.ACTION_TENANT_CREATED, RESOURCE_TYPE, tenant.getId(),
                actor.userId(), Map.of("name", tenant.getName(), "municipality", location.getMunicipality(),
                        "province", location.getProvince())));
        log.info("Tenant {} '{}' created in {}, {} by user {}", tenant.getId(), tenant.getName(),
                location.getMunicipality(), location.getProvince(), actor.userId());
        return TenantView.from(tenant);
    }

    public TenantView deactivate(CallerIdentity caller, Long tenantId) {
        return changeStatus(caller, tenantId, TenantStatus.DEACTIVATED, AuditLogService.ACTION_TENANT_DEACTIVATED);
    }

    public TenantView reactivate(CallerIdentity caller, Long tenantId) {
        return changeStatus(caller, tenantId, TenantStatus.ACTIVE, AuditLogService.ACTION_TENANT_REACTIVATED);
    }

    private TenantView changeStatus(CallerIdentity caller, Long tenantId, TenantStatus status, String action) {
        Actor actor = accessScopeService.resolveActor(caller);
        accessScopeService.require(actor, AccessOperation.MANAGE_TENANTS, AccessTarget.none());

        Tenant tenant = tenantRepository.findWithLocationById(tenantId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "TENANT_NOT_FOUND"));
        if (tenant.getStatus() == status) {
            return TenantView.from(tenant);
        }
        tenant.setStatus(status);

        auditLogService.record(AuditLogCommand.of(action, RESOURCE_TYPE, tenant.getId(), actor.userId(),
                Map.of("status", status.name())));
        log.info("Tenant {} set to {} by user {}", tenant.getId(), status, actor.userId());
        return TenantView.from(tenant);
    }

    @Transactional(readOnly = true)
    public Page<TenantView> searchDirectory(CallerIdentity caller, DirectoryQuery query, Pageable pageable) {
        Actor actor = accessScopeService.resolveActor(caller);
        AccessDecision decision = accessScopeService.require(actor, AccessOperation.VIEW_TENANT_DIRECTORY,
                AccessTarget.none());

        Long tenantId = null;
        String provincePattern = LikePatterns.contains(query.province());
        String municipalityPattern = LikePatterns.contains(query.municipality());
        String barangayPattern = LikePatterns.contains(query.barangay());

        switch (decision.outcome()) {
            case TENANT -> tenantId = decision.requireTenantId();
            case GEOGRAPHY -> {
                // focal callers are pinned to their own municipality whatever they ask for
                Geography geography = decision.geography();
                provincePattern = LikePatterns.exact(geography.province());
                municipalityPattern = LikePatterns.exact(geography.municipality());
            }
            default -> {
            }
        }

        return tenantRepository.searchDirectory(TenantStatus.ACTIVE, tenantId, provincePattern,
                        municipalityPattern, barangayPattern, pageable)
                .map(TenantView::from);
    }

    @Transactional(readOnly = true)
    public TenantView getTenant(CallerIdentity caller, Long tenantId) {
        Actor actor = accessScopeService.resolveActor(caller);
        AccessTarget target = accessScopeService.tenantTarget(actor, AccessOperation.VIEW_TENANT_DIRECTORY, tenantId);
        accessScopeService.require(actor, AccessOperation.VIEW_TENANT_DIRECTORY, target);
        Tenant tenant = tenantRepository.findWithLocationById(tenantId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "TENANT_NOT_FOUND"));
        return TenantView.from(tenant);
    }

    public record CreateTenantCommand(String name, String region, String province, String municipality, String barangay) {

        List<String> missingFields() {
            List<String> missing = new ArrayList<>();
            if (isBlank(name)) {
                missing.add("name");
            }
            if (isBlank(region)) {
                missing.add("region");
            }
            if (isBlank(province)) {
                missing.add("province");
            }
            if (isBlank(municipality)) {
                missing.add("municipality");
            }
            if (isBlank(barangay)) {
                missing.add("barangay");
            }
            return missing;
        }

        private static boolean isBlank(String value) {
            return value == null || value.isBlank();
        }
    }

    public record DirectoryQuery(String province, String municipality, String barangay) {
    }

    public record TenantView(
            Long id,
            String name,
            TenantStatus status,
            String region,
            String province,
            String municipality,
            String barangay
    ) {

        static TenantView from(Tenant tenant) {
            TenantLocation location = tenant.getLocation();
            if (location == null) {
                return new TenantView(tenant.getId(), tenant.getName(), tenant.getStatus(), null, null, null, null);
            }
            return new TenantView(tenant.getId(), tenant.getName(), tenant.getStatus(), location.getRegion(),
                    location.getProvince(), location.getMunicipality(), location.getBarangay());
        }
    }
}
