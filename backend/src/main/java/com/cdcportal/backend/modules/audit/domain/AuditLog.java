package com.cdcportal.backend.modules.audit.domain;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Append-only record of an administrative change. Rows are never updated.
 */
@Entity
@Table(name = "audit_log")
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "action_type", nullable = false, length = 64, updatable = false)
    private String actionType;

    @Column(name = "resource_type", nullable = false, length = 64, updatable = false)
    private String resourceType;

    @Column(name = "resource_key", nullable = false, length = 128, updatable = false)
    private String resourceKey;

    // plain id: the actor's account may be deleted later
    @Column(name = "actor_user_id", updatable = false)
    private Long actorUserId;

    @Column(name = "correlation_id", length = 64, updatable = false)
    private String correlationId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "detail", columnDefinition = "jsonb", updatable = false)
    private Map<String, Object> detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected AuditLog() {
    }

    public AuditLog(String actionType, String resourceType, String resourceKey, Long actorUserId,
                    String correlationId, Map<String, Object> detail) {
        this.actionType = Objects.requireNonNull(actionType, "actionType is required");
        this.resourceType = Objects.requireNonNull(resourceType, "resourceType is required");
        this.resourceKey = Objects.requireNonNull(resourceKey, "resourceKey is required");
        this.actorUserId = actorUserId;
        this.correlationId = correlationId;
        this.detail = detail == null || detail.isEmpty() ? null : new HashMap<>(detail);
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now(ZoneOffset.UTC);
        }
    }

    public Long getId() {
        return id;
    }

    public String getActionType() {
        return actionType;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceKey() {
        return resourceKey;
    }

    public Long getActorUserId() {
        return actorUserId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Map<String, Object> getDetail() {
        return detail == null ? Map.of() : Collections.unmodifiableMap(detail);
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
