package com.cdcportal.backend.modules.attendance.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum AttendanceStatus {
    PRESENT,
    ABSENT,
    LATE,
    EXCUSED;

    /** Present and late both count towards the attendance rate. */
    public boolean countsAsAttended() {
        return this == PRESENT || this == LATE;
    }

    public static Optional<AttendanceStatus> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(status -> status.name().equals(normalized)).findFirst();
    }
}
