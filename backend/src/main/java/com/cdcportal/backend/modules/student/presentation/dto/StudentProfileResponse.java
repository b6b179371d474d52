package com.cdcportal.backend.modules.student.presentation.dto;

import java.util.List;

public record StudentProfileResponse(
        StudentResponse student,
        GuardianResponse guardian,
        ChildInfoResponse childInfo,
        List<ParentResponse> parents
) {

    public record GuardianResponse(
            String name,
            String relationship,
            String email,
            String contactNumber,
            String address,
            Long linkedUserId
    ) {
    }

    public record ChildInfoResponse(
            Integer birthOrder,
            Integer numberOfSiblings,
            String ethnicity,
            String religion,
            String specialNeeds
    ) {
    }

    public record ParentResponse(
            String kind,
            String fullName,
            String occupation,
            String education,
            String contactNumber
    ) {
    }
}
