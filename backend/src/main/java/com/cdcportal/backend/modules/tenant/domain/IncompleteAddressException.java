package com.cdcportal.backend.modules.tenant.domain;

import com.cdcportal.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class IncompleteAddressException extends ProblemException {

    public IncompleteAddressException(int partCount) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "INCOMPLETE_ADDRESS",
                "Address needs barangay, municipality and province; found " + partCount + " part(s)");
    }
}
