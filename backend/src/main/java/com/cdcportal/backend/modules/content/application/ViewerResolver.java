package com.cdcportal.backend.modules.content.application;

import java.time.LocalDate;

import com.cdcportal.backend.modules.access.domain.Actor;
import com.cdcportal.backend.modules.age.domain.AgeClock;
import com.cdcportal.backend.modules.age.domain.ChildAge;
import com.cdcportal.backend.modules.age.domain.InvalidAgeException;
import com.cdcportal.backend.modules.content.domain.Viewer;
import com.cdcportal.backend.modules.student.domain.Student;
import com.cdcportal.backend.modules.student.infrastructure.persistence.StudentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns an authorized actor into a content {@link Viewer} as of a given date.
 * A parent whose child has no computable age gets a viewer without one, so
 * age-filtered items stay hidden.
 */
@Component
public class ViewerResolver {

    private static final Logger log = LoggerFactory.getLogger(ViewerResolver.class);

    private final StudentRepository studentRepository;

    public ViewerResolver(StudentRepository studentRepository) {
        this.studentRepository = studentRepository;
    }

    public Viewer resolve(Actor actor, LocalDate asOf) {
        return switch (actor.role().scope()) {
            case CHILD -> Viewer.parent(actor.homeTenantId(), actor.linkedStudentId() == null ? null
                    : studentRepository.findById(actor.linkedStudentId())
                            .map(student -> childAge(student, asOf))
                            .orElse(null));
            case GEOGRAPHY -> Viewer.geographyScoped(actor.role(), actor.geography());
            case TENANT, NONE -> Viewer.tenantMember(actor.role(), actor.homeTenantId());
        };
    }

    private static ChildAge childAge(Student student, LocalDate asOf) {
        try {
            return AgeClock.age(student.getBirthdate(), asOf);
        } catch (InvalidAgeException ex) {
            log.warn("Linked child birthdate is after {}: studentId={}", asOf, student.getId());
            return null;
        }
    }
}
