package com.cdcportal.backend.modules.student.application;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;

import com.cdcportal.backend.global.error.ProblemException;
import com.cdcportal.backend.modules.access.application.AccessScopeService;
import com.cdcportal.backend.modules.access.domain.AccessDecision;
import com.cdcportal.backend.modules.access.domain.AccessOperation;
import com.cdcportal.backend.modules.access.domain.AccessTarget;
import com.cdcportal.backend.modules.access.domain.Actor;
import com.cdcportal.backend.modules.access.domain.CallerIdentity;
import com.cdcportal.backend.modules.account.domain.UserAccount;
import com.cdcportal.backend.modules.account.domain.UserRoleType;
import com.cdcportal.backend.modules.account.infrastructure.persistence.UserAccountRepository;
import com.cdcportal.backend.modules.age.domain.AgeClock;
import com.cdcportal.backend.modules.audit.application.AuditLogService;
import com.cdcportal.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.cdcportal.backend.modules.student.domain.ChildOtherInfo;
import com.cdcportal.backend.modules.student.domain.GuardianInfo;
import com.cdcportal.backend.modules.student.domain.ParentKind;
import com.cdcportal.backend.modules.student.domain.ParentProfile;
import com.cdcportal.backend.modules.student.domain.Student;
import com.cdcportal.backend.modules.student.infrastructure.persistence.ChildOtherInfoRepository;
import com.cdcportal.backend.modules.student.infrastructure.persistence.GuardianInfoRepository;
import com.cdcportal.backend.modules.student.infrastructure.persistence.ParentProfileRepository;
import com.cdcportal.backend.modules.student.infrastructure.persistence.StudentRepository;
import com.cdcportal.backend.modules.tenant.domain.Tenant;
import com.cdcportal.backend.modules.tenant.infrastructure.persistence.TenantRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Enrolls a child with its profile rows. Everything is written in one transaction.
 */
@Service
@Transactional
public class StudentRegistrationService {

    private static final Logger log = LoggerFactory.getLogger(StudentRegistrationService.class);

    private final StudentRepository studentRepository;
    private final ChildOtherInfoRepository childOtherInfoRepository;
    private final GuardianInfoRepository guardianInfoRepository;
    private final ParentProfileRepository parentProfileRepository;
    private final UserAccountRepository userAccountRepository;
    private final TenantRepository tenantRepository;
    private final AccessScopeService accessScopeService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public StudentRegistrationService(
            StudentRepository studentRepository,
            ChildOtherInfoRepository childOtherInfoRepository,
            GuardianInfoRepository guardianInfoRepository,
            ParentProfileRepository parentProfileRepository,
            UserAccountRepository userAccountRepository,
            TenantRepository tenantRepository,
            AccessScopeService accessScopeService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.studentRepository = studentRepository;
        this.childOtherInfoRepository = childOtherInfoRepository;
        this.guardianInfoRepository = guardianInfoRepository;
        this.parentProfileRepository = parentProfileRepository;
        this.userAccountRepository = userAccountRepository;
        this.tenantRepository = tenantRepository;
        this.accessScopeService = accessScopeService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public Long enroll(CallerIdentity caller, EnrollStudentCommand command) {
        Actor actor = accessScopeService.resolveActor(caller);
        AccessDecision decision = accessScopeService.require(actor, AccessOperation.ENROLL_STUDENTS, AccessTarget.none());

        // rejects birthdates in the future
        AgeClock.age(command.birthdate(), LocalDate.now(clock));

        UserAccount parentAccount = resolveParentAccount(command.parentUserId());
        Tenant tenant = tenantRepository.getReferenceById(decision.requireTenantId());

        Student student = studentRepository.save(new Student(
                command.firstName().trim(),
                trimToNull(command.middleName()),
                command.lastName().trim(),
                command.birthdate(),
                command.gender().trim(),
                tenant
        ));

        ChildOtherInfo childInfo = new ChildOtherInfo(student);
        ChildDetails child = command.child() == null ? ChildDetails.EMPTY : command.child();
        childInfo.setBirthOrder(child.birthOrder());
        childInfo.setNumberOfSiblings(child.numberOfSiblings());
        childInfo.setEthnicity(child.ethnicity());
        childInfo.setReligion(child.religion());
        childInfo.setSpecialNeeds(child.specialNeeds());
        childOtherInfoRepository.save(childInfo);

        GuardianDetails guardian = command.guardian();
        GuardianInfo guardianInfo = new GuardianInfo(student, guardian.name().trim());
        guardianInfo.setRelationship(guardian.relationship());
        guardianInfo.setEmail(guardian.email());
        guardianInfo.setContactNumber(guardian.contactNumber());
        guardianInfo.setAddress(guardian.address());
        guardianInfo.setGuardianUser(parentAccount);
        guardianInfoRepository.save(guardianInfo);

        parentProfileRepository.save(toProfile(student, ParentKind.MOTHER, command.mother()));
        parentProfileRepository.save(toProfile(student, ParentKind.FATHER, command.father()));

        auditLogService.record(AuditLogCommand.of(AuditLogService.ACTION_STUDENT_ENROLLED, "STUDENT", student.getId(),
                actor.userId(), Map.of("cdcId", decision.requireTenantId(),
                        "linkedParent", parentAccount != null)));
        log.info("Student {} enrolled in tenant {} by user {}", student.getId(), decision.requireTenantId(),
                actor.userId());
        return student.getId();
    }

    private UserAccount resolveParentAccount(Long parentUserId) {
        if (parentUserId == null) {
            return null;
        }
        UserAccount account = userAccountRepository.findById(parentUserId)
                .filter(candidate -> candidate.getRole() == UserRoleType.PARENT)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_PARENT_ACCOUNT"));
        if (guardianInfoRepository.existsByGuardianUserId(account.getId())) {
            throw new ProblemException(HttpStatus.CONFLICT, "GUARDIAN_ALREADY_LINKED");
        }
        return account;
    }

    private static ParentProfile toProfile(Student student, ParentKind kind, ParentDetails details) {
        ParentProfile profile = new ParentProfile(student, kind);
        if (details != null) {
            profile.setFullName(details.fullName());
            profile.setOccupation(details.occupation());
            profile.setEducation(details.education());
            profile.setContactNumber(details.contactNumber());
        }
        return profile;
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public record EnrollStudentCommand(
            String firstName,
            String middleName,
            String lastName,
            LocalDate birthdate,
            String gender,
            ChildDetails child,
            GuardianDetails guardian,
            ParentDetails mother,
            ParentDetails father,
            Long parentUserId
    ) {
    }

    public record ChildDetails(
            Integer birthOrder,
            Integer numberOfSiblings,
            String ethnicity,
            String religion,
            String specialNeeds
    ) {
        static final ChildDetails EMPTY = new ChildDetails(null, null, null, null, null);
    }

    public record GuardianDetails(String name, String relationship, String email, String contactNumber, String address) {
    }

    public record ParentDetails(String fullName, String occupation, String education, String contactNumber) {
    }
}
