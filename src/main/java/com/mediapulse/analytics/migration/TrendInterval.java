package com.mediapulse.analytics.migration;

import com.fasterxml.jackson.annotation.JsonValue;
import com.mediapulse.analytics.filter.AnalyticsFilter;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

public enum TrendInterval {
    DAY("day"),
    WEEK("week"),
    MONTH("month"),
    QUARTER("quarter");

    private final String label;

    TrendInterval(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static TrendInterval forFilter(AnalyticsFilter filter) {
        if (filter.startDate() == null || filter.endDate() == null) return WEEK;
        long days = Duration.between(filter.startDate(), filter.endDate()).toHours() / 24;
        if (days <= 7) return DAY;
        if (days <= 60) return WEEK;
        if (days <= 365) return MONTH;
        return QUARTER;
    }

    public LocalDate periodStart(LocalDate day) {
        return switch (this) {
            case DAY -> day;
            case WEEK -> day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH -> day.withDayOfMonth(1);
            case QUARTER -> LocalDate.of(day.getYear(), ((day.getMonthValue() - 1) / 3) * 3 + 1, 1);
        };
    }
}
