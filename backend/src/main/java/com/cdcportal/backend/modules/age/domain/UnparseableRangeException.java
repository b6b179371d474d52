package com.cdcportal.backend.modules.age.domain;

public class UnparseableRangeException extends RuntimeException {

    private final String rawRange;

    public UnparseableRangeException(String rawRange, String message) {
        super(message + ": '" + rawRange + "'");
        this.rawRange = rawRange;
    }

    public String getRawRange() {
        return rawRange;
    }
}
