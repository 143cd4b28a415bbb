package com.mediapulse.analytics.metrics;

import com.mediapulse.analytics.filter.AnalyticsFilter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

public record DataRange(Instant start, Instant end) {

    public static DataRange of(AnalyticsFilter filter, Clock clock, int defaultDays) {
        Instant end = filter.endDate() != null ? filter.endDate() : clock.instant();
        Instant start = filter.startDate() != null ? filter.startDate() : end.minus(Duration.ofDays(defaultDays));
        return new DataRange(start, end);
    }

    public Duration length() {
        return Duration.between(start, end);
    }
}
