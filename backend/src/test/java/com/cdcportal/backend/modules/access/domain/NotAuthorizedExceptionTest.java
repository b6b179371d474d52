package com.cdcportal.backend.modules.access.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class NotAuthorizedExceptionTest {

    @Test
    void keepsDenyReasonApartFromTheResponseReason() {
        NotAuthorizedException ex = new NotAuthorizedException(AccessOperation.VIEW_STUDENTS, 10L,
                DenyReason.FOREIGN_STUDENT);

        assertThat(ex.getDenyReason()).isEqualTo(DenyReason.FOREIGN_STUDENT);
        assertThat(ex.getReason()).isEqualTo("NOT_AUTHORIZED");
        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(ex.getDetailMessage()).isEqualTo("Not authorized");
        assertThat(ex.getOperation()).isEqualTo(AccessOperation.VIEW_STUDENTS);
        assertThat(ex.getActorUserId()).isEqualTo(10L);
    }
}
