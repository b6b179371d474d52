package com.cdcportal.backend.modules.attendance.application;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.cdcportal.backend.global.error.ProblemException;
import com.cdcportal.backend.modules.access.application.AccessScopeService;
import com.cdcportal.backend.modules.access.domain.AccessDecision;
import com.cdcportal.backend.modules.access.domain.AccessOperation;
import com.cdcportal.backend.modules.access.domain.AccessTarget;
import com.cdcportal.backend.modules.access.domain.Actor;
import com.cdcportal.backend.modules.access.domain.CallerIdentity;
import com.cdcportal.backend.modules.account.domain.UserRoleType;
import com.cdcportal.backend.modules.attendance.domain.AcademicYear;
import com.cdcportal.backend.modules.attendance.domain.AttendanceRecord;
import com.cdcportal.backend.modules.attendance.domain.AttendanceStatus;
import com.cdcportal.backend.modules.attendance.infrastructure.persistence.AttendanceRecordRepository;
import com.cdcportal.backend.modules.student.domain.Student;
import com.cdcportal.backend.modules.student.infrastructure.persistence.StudentRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AttendanceService {

    private final AttendanceRecordRepository attendanceRecordRepository;
    private final StudentRepository studentRepository;
    private final AccessScopeService accessScopeService;
    private final Clock clock;

    public AttendanceService(
            AttendanceRecordRepository attendanceRecordRepository,
            StudentRepository studentRepository,
            AccessScopeService accessScopeService,
            Clock clock
    ) {
        this.attendanceRecordRepository = attendanceRecordRepository;
        this.studentRepository = studentRepository;
        this.accessScopeService = accessScopeService;
        this.clock = clock;
    }

    /** One record per student and date; a second call overwrites the status. */
    public AttendanceRecord record(CallerIdentity caller, AttendanceEntry entry) {
        return recordBulk(caller, List.of(entry)).get(0);
    }

    /**
     * Every entry is authorized and validated before the first write, so a bad
     * entry leaves nothing behind.
     */
    public List<AttendanceRecord> recordBulk(CallerIdentity caller, List<AttendanceEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "NO_ATTENDANCE_ENTRIES");
        }
        Actor actor = accessScopeService.resolveActor(caller);
        LocalDate today = LocalDate.now(clock);

        List<Student> students = new ArrayList<>(entries.size());
        for (AttendanceEntry entry : entries) {
            AccessTarget target = accessScopeService.studentTarget(actor, AccessOperation.RECORD_ATTENDANCE,
                    entry.studentId());
            accessScopeService.require(actor, AccessOperation.RECORD_ATTENDANCE, target);
            if (entry.date() == null || entry.status() == null) {
                throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "DATE_AND_STATUS_REQUIRED");
            }
            if (entry.date().isAfter(today)) {
                throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "FUTURE_ATTENDANCE_DATE");
            }
            students.add(studentRepository.getReferenceById(entry.studentId()));
        }

        List<AttendanceRecord> saved = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            AttendanceEntry entry = entries.get(i);
            Student student = students.get(i);
            AttendanceRecord record = attendanceRecordRepository
                    .findByStudentIdAndAttendanceDate(entry.studentId(), entry.date())
                    .orElseGet(() -> new AttendanceRecord(student, entry.date()));
            record.record(entry.status(), actor.userId());
            saved.add(attendanceRecordRepository.save(record));
        }
        return saved;
    }

    @Transactional(readOnly = true)
    public List<AttendanceRecord> listByDate(CallerIdentity caller, LocalDate date) {
        Actor actor = accessScopeService.resolveActor(caller);
        AccessDecision decision = accessScopeService.require(actor, AccessOperation.VIEW_ATTENDANCE,
                AccessTarget.none());
        LocalDate effectiveDate = date == null ? LocalDate.now(clock) : date;
        if (actor.role() == UserRoleType.PARENT) {
            return attendanceRecordRepository.findByStudentIdAndAttendanceDate(actor.linkedStudentId(), effectiveDate)
                    .map(List::of)
                    .orElse(List.of());
        }
        return attendanceRecordRepository.findByTenantAndDate(decision.requireTenantId(), effectiveDate);
    }

    @Transactional(readOnly = true)
    public AttendanceSummary summarize(CallerIdentity caller, Long studentId, String academicYear) {
        Actor actor = accessScopeService.resolveActor(caller);
        AccessTarget target = accessScopeService.studentTarget(actor, AccessOperation.VIEW_ATTENDANCE, studentId);
        accessScopeService.require(actor, AccessOperation.VIEW_ATTENDANCE, target);

        AcademicYear year = academicYear == null || academicYear.isBlank()
                ? AcademicYear.containing(LocalDate.now(clock))
                : AcademicYear.parse(academicYear);
        List<AttendanceRecord> records = attendanceRecordRepository.findByStudentIdAndAttendanceDateBetween(
                studentId, year.start(), year.end());
        return AttendanceSummary.of(studentId, year, records);
    }

    public record AttendanceEntry(Long studentId, LocalDate date, AttendanceStatus status) {
    }

    public record AttendanceSummary(
            Long studentId,
            String academicYear,
            Map<AttendanceStatus, Long> counts,
            long total,
            int attendanceRate
    ) {

        static AttendanceSummary of(Long studentId, AcademicYear year, List<AttendanceRecord> records) {
            Map<AttendanceStatus, Long> counts = new EnumMap<>(AttendanceStatus.class);
            for (AttendanceStatus status : AttendanceStatus.values()) {
                counts.put(status, 0L);
            }
            long attended = 0;
            for (AttendanceRecord record : records) {
                counts.merge(record.getStatus(), 1L, Long::sum);
                if (record.getStatus().countsAsAttended()) {
                    attended++;
                }
            }
            int rate = records.isEmpty() ? 0 : BigDecimal.valueOf(attended * 100)
                    .divide(BigDecimal.valueOf(records.size()), 0, RoundingMode.HALF_UP)
                    .intValue();
            return new AttendanceSummary(studentId, year.label(), counts, records.size(), rate);
        }
    }
}
