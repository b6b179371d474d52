package com.cdcportal.backend.modules.student.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.cdcportal.backend.modules.student.domain.ParentProfile;

public interface ParentProfileRepository extends JpaRepository<ParentProfile, Long> {

    List<ParentProfile> findByStudentId(Long studentId);
}
