package com.cdcportal.backend.modules.student.infrastructure.persistence;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import com.cdcportal.backend.modules.student.domain.GuardianInfo;

public interface GuardianInfoRepository extends JpaRepository<GuardianInfo, Long> {

    Optional<GuardianInfo> findByGuardianUserId(Long guardianUserId);

    Optional<GuardianInfo> findByStudentId(Long studentId);

    boolean existsByGuardianUserId(Long guardianUserId);
}
