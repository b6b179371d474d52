package com.cdcportal.backend.modules.access.domain;

import com.cdcportal.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Refusal of a scoped operation. The response never carries the reason.
 */
public class NotAuthorizedException extends ProblemException {

    private final AccessOperation operation;
    private final Long actorUserId;
    private final DenyReason denyReason;

    public NotAuthorizedException(AccessOperation operation, Long actorUserId, DenyReason reason) {
        super(HttpStatus.FORBIDDEN, "NOT_AUTHORIZED", "Not authorized");
        this.operation = operation;
        this.actorUserId = actorUserId;
        this.denyReason = reason;
    }

    public AccessOperation getOperation() {
        return operation;
    }

    public Long getActorUserId() {
        return actorUserId;
    }

    public DenyReason getDenyReason() {
        return denyReason;
    }
}
