package com.cdcportal.backend.modules.student.application;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import com.cdcportal.backend.global.error.ProblemException;
import com.cdcportal.backend.modules.access.application.AccessScopeService;
import com.cdcportal.backend.modules.access.domain.AccessDecision;
import com.cdcportal.backend.modules.access.domain.AccessOperation;
import com.cdcportal.backend.modules.access.domain.AccessTarget;
import com.cdcportal.backend.modules.access.domain.Actor;
import com.cdcportal.backend.modules.access.domain.CallerIdentity;
import com.cdcportal.backend.modules.account.domain.UserRoleType;
import com.cdcportal.backend.modules.age.domain.AgeClock;
import com.cdcportal.backend.modules.age.domain.CanonicalAgeBand;
import com.cdcportal.backend.modules.age.domain.ChildAge;
import com.cdcportal.backend.modules.age.domain.InvalidAgeException;
import com.cdcportal.backend.modules.student.domain.ChildOtherInfo;
import com.cdcportal.backend.modules.student.domain.GuardianInfo;
import com.cdcportal.backend.modules.student.domain.ParentProfile;
import com.cdcportal.backend.modules.student.domain.Student;
import com.cdcportal.backend.modules.student.infrastructure.persistence.ChildOtherInfoRepository;
import com.cdcportal.backend.modules.student.infrastructure.persistence.GuardianInfoRepository;
import com.cdcportal.backend.modules.student.infrastructure.persistence.ParentProfileRepository;
import com.cdcportal.backend.modules.student.infrastructure.persistence.StudentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class StudentQueryService {

    private static final Logger log = LoggerFactory.getLogger(StudentQueryService.class);

    private final StudentRepository studentRepository;
    private final GuardianInfoRepository guardianInfoRepository;
    private final ChildOtherInfoRepository childOtherInfoRepository;
    private final ParentProfileRepository parentProfileRepository;
    private final AccessScopeService accessScopeService;
    private final Clock clock;

    public StudentQueryService(
            StudentRepository studentRepository,
            GuardianInfoRepository guardianInfoRepository,
            ChildOtherInfoRepository childOtherInfoRepository,
            ParentProfileRepository parentProfileRepository,
            AccessScopeService accessScopeService,
            Clock clock
    ) {
        this.studentRepository = studentRepository;
        this.guardianInfoRepository = guardianInfoRepository;
        this.childOtherInfoRepository = childOtherInfoRepository;
        this.parentProfileRepository = parentProfileRepository;
        this.accessScopeService = accessScopeService;
        this.clock = clock;
    }

    /**
     * Students of the caller's tenant, optionally limited to one canonical band.
     * A parent only ever sees the linked child.
     */
    public List<StudentSummary> listStudents(CallerIdentity caller, String ageFilter) {
        Optional<CanonicalAgeBand> band = parseAgeFilter(ageFilter);
        Actor actor = accessScopeService.resolveActor(caller);
        AccessDecision decision = accessScopeService.require(actor, AccessOperation.VIEW_STUDENTS, AccessTarget.none());
        Long tenantId = decision.requireTenantId();
        LocalDate asOf = LocalDate.now(clock);

        List<Student> students;
        if (actor.role() == UserRoleType.PARENT) {
            students = studentRepository.findById(actor.linkedStudentId()).stream()
                    .filter(student -> band.isEmpty()
                            || band.equals(CanonicalAgeBand.fromBirthdate(student.getBirthdate(), asOf)))
                    .toList();
        } else if (band.isPresent()) {
            students = studentRepository.findByTenantIdAndBirthdateBetweenOrderByLastNameAscFirstNameAsc(
                    tenantId, band.get().earliestBirthdate(asOf), band.get().latestBirthdate(asOf));
        } else {
            students = studentRepository.findByTenantIdOrderByLastNameAscFirstNameAsc(tenantId);
        }
        return students.stream().map(student -> summarize(student, asOf)).toList();
    }

    public StudentProfile getProfile(CallerIdentity caller, Long studentId) {
        Actor actor = accessScopeService.resolveActor(caller);
        AccessTarget target = accessScopeService.studentTarget(actor, AccessOperation.VIEW_STUDENTS, studentId);
        accessScopeService.require(actor, AccessOperation.VIEW_STUDENTS, target);

        Student student = studentRepository.findById(studentId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "STUDENT_NOT_FOUND"));
        return new StudentProfile(
                summarize(student, LocalDate.now(clock)),
                guardianInfoRepository.findByStudentId(studentId).orElse(null),
                childOtherInfoRepository.findByStudentId(studentId).orElse(null),
                parentProfileRepository.findByStudentId(studentId)
        );
    }

    /**
     * A stored birthdate after {@code asOf} leaves the age fields empty; the row itself is still listed.
     */
    static StudentSummary summarize(Student student, LocalDate asOf) {
        ChildAge age;
        try {
            age = AgeClock.age(student.getBirthdate(), asOf);
        } catch (InvalidAgeException ex) {
            log.warn("Student birthdate is after {}: studentId={}, tenantId={}", asOf, student.getId(),
                    student.getTenantId());
            age = null;
        }
        return StudentSummary.of(student, age);
    }

    static Optional<CanonicalAgeBand> parseAgeFilter(String ageFilter) {
        if (ageFilter == null || ageFilter.isBlank() || ageFilter.trim().equalsIgnoreCase("all")) {
            return Optional.empty();
        }
        return Optional.of(CanonicalAgeBand.fromKey(ageFilter.trim())
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_AGE_FILTER")));
    }

    public record StudentSummary(
            Long id,
            String firstName,
            String middleName,
            String lastName,
            LocalDate birthdate,
            String gender,
            Long tenantId,
            Integer ageYears,
            Integer ageMonths,
            Integer totalMonths,
            BigDecimal decimalYears,
            String ageBand
    ) {

        static StudentSummary of(Student student, ChildAge age) {
            if (age == null) {
                return new StudentSummary(student.getId(), student.getFirstName(), student.getMiddleName(),
                        student.getLastName(), student.getBirthdate(), student.getGender(), student.getTenantId(),
                        null, null, null, null, null);
            }
            String band = CanonicalAgeBand.fromTotalMonths(age.totalMonths()).map(CanonicalAgeBand::key).orElse(null);
            return new StudentSummary(student.getId(), student.getFirstName(), student.getMiddleName(),
                    student.getLastName(), student.getBirthdate(), student.getGender(), student.getTenantId(),
                    age.years(), age.months(), age.totalMonths(), age.decimalYears(), band);
        }
    }

    public record StudentProfile(
            StudentSummary student,
            GuardianInfo guardian,
            ChildOtherInfo childInfo,
            List<ParentProfile> parents
    ) {
    }
}
