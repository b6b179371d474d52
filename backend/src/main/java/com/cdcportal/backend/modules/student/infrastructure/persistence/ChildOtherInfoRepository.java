package com.cdcportal.backend.modules.student.infrastructure.persistence;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import com.cdcportal.backend.modules.student.domain.ChildOtherInfo;

public interface ChildOtherInfoRepository extends JpaRepository<ChildOtherInfo, Long> {

    Optional<ChildOtherInfo> findByStudentId(Long studentId);
}
