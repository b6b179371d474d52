package com.cdcportal.backend.modules.student.presentation;

import java.util.List;

import com.cdcportal.backend.global.security.SecurityUtils;
import com.cdcportal.backend.modules.student.application.StudentQueryService;
import com.cdcportal.backend.modules.student.application.StudentQueryService.StudentProfile;
import com.cdcportal.backend.modules.student.application.StudentQueryService.StudentSummary;
import com.cdcportal.backend.modules.student.application.StudentRegistrationService;
import com.cdcportal.backend.modules.student.application.StudentRegistrationService.ChildDetails;
import com.cdcportal.backend.modules.student.application.StudentRegistrationService.EnrollStudentCommand;
import com.cdcportal.backend.modules.student.application.StudentRegistrationService.GuardianDetails;
import com.cdcportal.backend.modules.student.application.StudentRegistrationService.ParentDetails;
import com.cdcportal.backend.modules.student.domain.ChildOtherInfo;
import com.cdcportal.backend.modules.student.domain.GuardianInfo;
import com.cdcportal.backend.modules.student.presentation.dto.EnrollStudentRequest;
import com.cdcportal.backend.modules.student.presentation.dto.EnrollStudentResponse;
import com.cdcportal.backend.modules.student.presentation.dto.StudentProfileResponse;
import com.cdcportal.backend.modules.student.presentation.dto.StudentProfileResponse.ChildInfoResponse;
import com.cdcportal.backend.modules.student.presentation.dto.StudentProfileResponse.GuardianResponse;
import com.cdcportal.backend.modules.student.presentation.dto.StudentProfileResponse.ParentResponse;
import com.cdcportal.backend.modules.student.presentation.dto.StudentResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/students")
public class StudentController {

    private final StudentRegistrationService registrationService;
    private final StudentQueryService queryService;

    public StudentController(StudentRegistrationService registrationService, StudentQueryService queryService) {
        this.registrationService = registrationService;
        this.queryService = queryService;
    }

    @Operation(summary = "Enroll a student", description = "Writes the student, child info, guardian and both parent rows atomically.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Enrolled"),
            @ApiResponse(responseCode = "409", description = "Parent account already linked to another child"),
            @ApiResponse(responseCode = "422", description = "Invalid birthdate or parent account")
    })
    @PostMapping
    public ResponseEntity<EnrollStudentResponse> enroll(@Valid @RequestBody EnrollStudentRequest request) {
        EnrollStudentRequest.ChildInfo childInfo = request.childInfo();
        EnrollStudentRequest.Guardian guardian = request.guardian();
        Long studentId = registrationService.enroll(SecurityUtils.getCurrentIdentity(), new EnrollStudentCommand(
                request.firstName(),
                request.middleName(),
                request.lastName(),
                request.birthdate(),
                request.gender(),
                childInfo == null ? null : new ChildDetails(childInfo.birthOrder(), childInfo.numberOfSiblings(),
                        childInfo.ethnicity(), childInfo.religion(), childInfo.specialNeeds()),
                new GuardianDetails(guardian.name(), guardian.relationship(), guardian.email(),
                        guardian.contactNumber(), guardian.address()),
                toParentDetails(request.mother()),
                toParentDetails(request.father()),
                request.parentUserId()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(new EnrollStudentResponse(studentId));
    }

    @Operation(summary = "List students", description = "Optional ageFilter: 3-4, 4-5 or 5-6.")
    @GetMapping
    public ResponseEntity<List<StudentResponse>> listStudents(
            @RequestParam(name = "ageFilter", required = false) String ageFilter
    ) {
        List<StudentResponse> response = queryService.listStudents(SecurityUtils.getCurrentIdentity(), ageFilter)
                .stream()
                .map(StudentController::toResponse)
                .toList();
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Get a student profile")
    @GetMapping("/{studentId}")
    public ResponseEntity<StudentProfileResponse> getProfile(@PathVariable("studentId") Long studentId) {
        StudentProfile profile = queryService.getProfile(SecurityUtils.getCurrentIdentity(), studentId);
        GuardianInfo guardian = profile.guardian();
        ChildOtherInfo childInfo = profile.childInfo();
        List<ParentResponse> parents = profile.parents().stream()
                .map(parent -> new ParentResponse(parent.getKind().name(), parent.getFullName(),
                        parent.getOccupation(), parent.getEducation(), parent.getContactNumber()))
                .toList();
        return ResponseEntity.ok(new StudentProfileResponse(
                toResponse(profile.student()),
                guardian == null ? null : new GuardianResponse(guardian.getGuardianName(), guardian.getRelationship(),
                        guardian.getEmail(), guardian.getContactNumber(), guardian.getAddress(),
                        guardian.getGuardianUser() == null ? null : guardian.getGuardianUser().getId()),
                childInfo == null ? null : new ChildInfoResponse(childInfo.getBirthOrder(),
                        childInfo.getNumberOfSiblings(), childInfo.getEthnicity(), childInfo.getReligion(),
                        childInfo.getSpecialNeeds()),
                parents
        ));
    }

    private static ParentDetails toParentDetails(EnrollStudentRequest.Parent parent) {
        if (parent == null) {
            return null;
        }
        return new ParentDetails(parent.fullName(), parent.occupation(), parent.education(), parent.contactNumber());
    }

    private static StudentResponse toResponse(StudentSummary summary) {
        return new StudentResponse(
                summary.id(),
                summary.firstName(),
                summary.middleName(),
                summary.lastName(),
                summary.birthdate(),
                summary.gender(),
                summary.tenantId(),
                summary.ageYears(),
                summary.ageMonths(),
                summary.totalMonths(),
                summary.decimalYears(),
                summary.ageBand()
        );
    }
}
