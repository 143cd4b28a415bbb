package com.mediapulse.analytics.cohort;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

public enum CohortGranularity {
    WEEK("week") {
        @Override
        public LocalDate periodStart(LocalDate day) {
            return day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        }

        @Override
        public int offset(LocalDate cohortStart, LocalDate periodStart) {
            return (int) ChronoUnit.WEEKS.between(cohortStart, periodStart);
        }

        @Override
        public LocalDate plus(LocalDate periodStart, int offset) {
            return periodStart.plusWeeks(offset);
        }
    },
    MONTH("month") {
        @Override
        public LocalDate periodStart(LocalDate day) {
            return day.withDayOfMonth(1);
        }

        @Override
        public int offset(LocalDate cohortStart, LocalDate periodStart) {
            return (int) ChronoUnit.MONTHS.between(cohortStart, periodStart);
        }

        @Override
        public LocalDate plus(LocalDate periodStart, int offset) {
            return periodStart.plusMonths(offset);
        }
    };

    private final String label;

    CohortGranularity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public abstract LocalDate periodStart(LocalDate day);

    public abstract int offset(LocalDate cohortStart, LocalDate periodStart);

    public abstract LocalDate plus(LocalDate periodStart, int offset);
}
