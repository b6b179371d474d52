package com.cdcportal.backend.modules.student.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record EnrollStudentRequest(
        @NotBlank @Size(max = 100) String firstName,
        @Size(max = 100) String middleName,
        @NotBlank @Size(max = 100) String lastName,
        @NotNull LocalDate birthdate,
        @NotBlank @Size(max = 16) String gender,
        @Valid ChildInfo childInfo,
        @NotNull @Valid Guardian guardian,
        @Valid Parent mother,
        @Valid Parent father,
        Long parentUserId
) {

    public record ChildInfo(
            @PositiveOrZero Integer birthOrder,
            @PositiveOrZero Integer numberOfSiblings,
            @Size(max = 100) String ethnicity,
            @Size(max = 100) String religion,
            @Size(max = 500) String specialNeeds
    ) {
    }

    public record Guardian(
            @NotBlank @Size(max = 150) String name,
            @Size(max = 50) String relationship,
            @Size(max = 150) String email,
            @Size(max = 30) String contactNumber,
            @Size(max = 500) String address
    ) {
    }

    public record Parent(
            @Size(max = 150) String fullName,
            @Size(max = 100) String occupation,
            @Size(max = 100) String education,
            @Size(max = 30) String contactNumber
    ) {
    }
}
