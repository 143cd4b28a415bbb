package com.mediapulse.analytics.repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

public final class StoreTime {

    private StoreTime() {}

    public static ZoneId zone() {
        return ZoneId.systemDefault();
    }

    static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    static LocalDate day(Date date) {
        return date == null ? null : date.toLocalDate();
    }

    static Instant startOf(LocalDate day) {
        return day.atStartOfDay(zone()).toInstant();
    }

    static Instant startOf(LocalDate day, int hour) {
        return day.atTime(hour, 0).atZone(zone()).toInstant();
    }

    static LocalDate day(Instant instant) {
        return instant.atZone(zone()).toLocalDate();
    }
}
