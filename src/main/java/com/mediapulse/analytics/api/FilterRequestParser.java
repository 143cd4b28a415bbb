package com.mediapulse.analytics.api;

import com.mediapulse.analytics.filter.AnalyticsFilter;
import com.mediapulse.analytics.filter.Dimension;
import com.mediapulse.analytics.filter.ValueKind;
import org.springframework.stereotype.Component;

import java.time.*;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class FilterRequestParser {
    private final Clock clock;

    public FilterRequestParser(Clock clock) {
        this.clock = clock;
    }

    public AnalyticsFilter parse(Map<String, String> params) {
        AnalyticsFilter.Builder builder = AnalyticsFilter.builder();
        Instant start = instant(params.get("start_date"), false);
        Instant end = instant(params.get("end_date"), true);
        Integer days = integer("days", params.get("days"));
        if (start == null && days != null) {
            if (days < 1) throw new IllegalArgumentException("days must be positive");
            start = (end != null ? end : clock.instant()).minus(Duration.ofDays(days));
        }
        if (start != null && end != null && start.isAfter(end)) {
            throw new IllegalArgumentException("start_date must not be after end_date");
        }
        builder.startDate(start).endDate(end).limit(integer("limit", params.get("limit")));

        for (Dimension dimension : Dimension.values()) {
            String name = dimension.name().toLowerCase(Locale.ROOT);
            List<String> values = split(params.get(name));
            if (values.isEmpty()) continue;
            if (dimension.kind() == ValueKind.INT_LIST) {
                builder.ints(dimension, values.stream().map(v -> integer(name, v)).toList());
            } else {
                builder.strings(dimension, values);
            }
        }
        return builder.build();
    }

    private static List<String> split(String raw) {
        if (raw == null || raw.isBlank()) return List.of();
        return Arrays.stream(raw.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    private static Instant instant(String raw, boolean endOfDay) {
        if (raw == null || raw.isBlank()) return null;
        try {
            if (raw.length() == 10) {
                LocalDate date = LocalDate.parse(raw);
                return endOfDay
                        ? date.atTime(LocalTime.MAX).toInstant(ZoneOffset.UTC)
                        : date.atStartOfDay().toInstant(ZoneOffset.UTC);
            }
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid date: " + raw, e);
        }
    }

    private static Integer integer(String name, String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + name + ": " + raw, e);
        }
    }
}
