package com.cdcportal.backend.modules.audit.application;

import java.util.Map;

import com.cdcportal.backend.global.web.RequestIdFilter;
import com.cdcportal.backend.modules.audit.domain.AuditLog;
import com.cdcportal.backend.modules.audit.infrastructure.persistence.AuditLogRepository;

import org.slf4j.MDC;
import org.springframework.data.domain.AuditorAware;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Appends audit rows inside the caller's transaction. Without an explicit actor
 * the authenticated caller is recorded.
 */
@Service
public class AuditLogService {

    public static final String ACTION_TENANT_CREATED = "TENANT_CREATED";
    public static final String ACTION_TENANT_DEACTIVATED = "TENANT_DEACTIVATED";
    public static final String ACTION_TENANT_REACTIVATED = "TENANT_REACTIVATED";
    public static final String ACTION_ACCOUNT_CREATED = "ACCOUNT_CREATED";
    public static final String ACTION_ACCOUNT_DELETED = "ACCOUNT_DELETED";
    public static final String ACTION_FOCAL_ACCOUNT_CREATED = "FOCAL_ACCOUNT_CREATED";
    public static final String ACTION_STUDENT_ENROLLED = "STUDENT_ENROLLED";

    private final AuditLogRepository auditLogRepository;
    private final AuditorAware<Long> callerAuditorAware;

    public AuditLogService(AuditLogRepository auditLogRepository, AuditorAware<Long> callerAuditorAware) {
        this.auditLogRepository = auditLogRepository;
        this.callerAuditorAware = callerAuditorAware;
    }

    @Transactional
    public void record(AuditLogCommand command) {
        Long actor = command.actorUserId() != null
                ? command.actorUserId()
                : callerAuditorAware.getCurrentAuditor().orElse(null);
        String correlationId = command.correlationId() != null
                ? command.correlationId()
                : MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY);
        AuditLog auditLog = new AuditLog(command.actionType(), command.resourceType(), command.resourceKey(),
                actor, correlationId, command.detail());

        auditLogRepository.save(auditLog);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            Long actorUserId,
            String correlationId,
            Map<String, Object> detail
    ) {

        public static AuditLogCommand of(String actionType, String resourceType, Object resourceKey,
                                         Long actorUserId, Map<String, Object> detail) {
            return new AuditLogCommand(actionType, resourceType, String.valueOf(resourceKey), actorUserId, null, detail);
        }
    }
}
