package com.cdcportal.backend.global.error;

import java.util.Locale;

import org.springframework.http.HttpStatus;

/**
 * Error body returned by every endpoint. {@code type} is derived from the code,
 * e.g. {@code NOT_AUTHORIZED} becomes {@code urn:cdc-portal:problem:not-authorized}.
 */
public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    private static final String TYPE_PREFIX = "urn:cdc-portal:problem:";

    public static ProblemResponse of(HttpStatus status, String code, String detail, String instance) {
        String effectiveCode = code == null || code.isBlank() ? status.name() : code;
        String effectiveDetail = detail == null || detail.isBlank() ? status.getReasonPhrase() : detail;
        return new ProblemResponse(typeOf(effectiveCode), status.getReasonPhrase(), status.value(),
                effectiveDetail, instance, effectiveCode);
    }

    public static ProblemResponse of(ProblemException ex, String instance) {
        return of(HttpStatus.valueOf(ex.getStatusCode().value()), ex.getCode(), ex.getDetailMessage(), instance);
    }

    static String typeOf(String code) {
        return TYPE_PREFIX + code.toLowerCase(Locale.ROOT).replace('_', '-').replaceAll("[^a-z0-9.-]+", "-");
    }
}
