package com.cdcportal.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Failure raised by application services. The {@code code} is the stable,
 * upper-snake identifier clients branch on; the detail is human readable and
 * defaults to the code.
 */
public class ProblemException extends ResponseStatusException {

    private final String code;
    private final String detail;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        super(status, requireCode(code));
        this.code = code;
        this.detail = detail == null || detail.isBlank() ? code : detail;
    }

    private static String requireCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("problem code must not be blank");
        }
        return code;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }
}
