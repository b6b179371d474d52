package com.cdcportal.backend.modules.age.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.cdcportal.backend.modules.age.domain.AgeBand;

public interface AgeBandRepository extends JpaRepository<AgeBand, Long> {

    List<AgeBand> findAllByOrderByIdAsc();
}
