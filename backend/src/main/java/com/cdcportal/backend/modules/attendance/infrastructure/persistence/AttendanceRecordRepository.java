package com.cdcportal.backend.modules.attendance.infrastructure.persistence;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.cdcportal.backend.modules.attendance.domain.AttendanceRecord;

public interface AttendanceRecordRepository extends JpaRepository<AttendanceRecord, Long> {

    Optional<AttendanceRecord> findByStudentIdAndAttendanceDate(Long studentId, LocalDate attendanceDate);

    List<AttendanceRecord> findByStudentIdAndAttendanceDateBetween(Long studentId, LocalDate start, LocalDate end);

    @Query("""
            select r
              from AttendanceRecord r
              join fetch r.student s
             where s.tenant.id = :tenantId
               and r.attendanceDate = :date
             order by s.lastName, s.firstName
            """)
    List<AttendanceRecord> findByTenantAndDate(@Param("tenantId") Long tenantId, @Param("date") LocalDate date);
}
