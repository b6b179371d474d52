package com.cdcportal.backend.modules.age.domain;

import java.time.LocalDate;

import com.cdcportal.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class InvalidAgeException extends ProblemException {

    public InvalidAgeException(LocalDate birthdate, LocalDate asOf) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_AGE",
                "Birthdate " + birthdate + " is after the reference date " + asOf);
    }
}
