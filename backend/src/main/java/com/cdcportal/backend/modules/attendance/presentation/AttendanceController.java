package com.cdcportal.backend.modules.attendance.presentation;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.cdcportal.backend.global.error.ProblemException;
import com.cdcportal.backend.global.security.SecurityUtils;
import com.cdcportal.backend.modules.attendance.application.AttendanceService;
import com.cdcportal.backend.modules.attendance.application.AttendanceService.AttendanceEntry;
import com.cdcportal.backend.modules.attendance.application.AttendanceService.AttendanceSummary;
import com.cdcportal.backend.modules.attendance.domain.AttendanceRecord;
import com.cdcportal.backend.modules.attendance.domain.AttendanceStatus;
import com.cdcportal.backend.modules.attendance.presentation.dto.AttendanceRequest;
import com.cdcportal.backend.modules.attendance.presentation.dto.AttendanceResponse;
import com.cdcportal.backend.modules.attendance.presentation.dto.AttendanceSummaryResponse;
import com.cdcportal.backend.modules.attendance.presentation.dto.BulkAttendanceRequest;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/attendance")
public class AttendanceController {

    private final AttendanceService attendanceService;

    public AttendanceController(AttendanceService attendanceService) {
        this.attendanceService = attendanceService;
    }

    @Operation(summary = "Record attendance for one student and date")
    @PutMapping
    public ResponseEntity<AttendanceResponse> record(@Valid @RequestBody AttendanceRequest request) {
        AttendanceRecord record = attendanceService.record(SecurityUtils.getCurrentIdentity(), toEntry(request));
        return ResponseEntity.ok(toResponse(record));
    }

    @Operation(summary = "Record attendance for several students", description = "All entries are written or none.")
    @PutMapping("/bulk")
    public ResponseEntity<List<AttendanceResponse>> recordBulk(@Valid @RequestBody BulkAttendanceRequest request) {
        List<AttendanceEntry> entries = request.entries().stream().map(AttendanceController::toEntry).toList();
        List<AttendanceResponse> response = attendanceService.recordBulk(SecurityUtils.getCurrentIdentity(), entries)
                .stream()
                .map(AttendanceController::toResponse)
                .toList();
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Attendance of the caller's CDC on a date")
    @GetMapping
    public ResponseEntity<List<AttendanceResponse>> listByDate(
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        List<AttendanceResponse> response = attendanceService.listByDate(SecurityUtils.getCurrentIdentity(), date)
                .stream()
                .map(AttendanceController::toResponse)
                .toList();
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Attendance summary of a student for an academic year")
    @GetMapping("/students/{studentId}/summary")
    public ResponseEntity<AttendanceSummaryResponse> summary(
            @PathVariable("studentId") Long studentId,
            @RequestParam(name = "academicYear", required = false) String academicYear
    ) {
        AttendanceSummary summary = attendanceService.summarize(SecurityUtils.getCurrentIdentity(), studentId,
                academicYear);
        Map<String, Long> counts = new LinkedHashMap<>();
        summary.counts().forEach((status, count) -> counts.put(status.name(), count));
        return ResponseEntity.ok(new AttendanceSummaryResponse(summary.studentId(), summary.academicYear(), counts,
                summary.total(), summary.attendanceRate()));
    }

    private static AttendanceEntry toEntry(AttendanceRequest request) {
        AttendanceStatus status = AttendanceStatus.fromCode(request.status())
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_STATUS",
                        "Unknown attendance status: " + request.status()));
        return new AttendanceEntry(request.studentId(), request.date(), status);
    }

    private static AttendanceResponse toResponse(AttendanceRecord record) {
        return new AttendanceResponse(record.getId(), record.getStudent().getId(), record.getAttendanceDate(),
                record.getStatus().name());
    }
}
