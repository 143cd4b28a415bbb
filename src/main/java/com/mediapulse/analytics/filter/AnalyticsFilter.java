package com.mediapulse.analytics.filter;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record AnalyticsFilter(Instant startDate,
                              Instant endDate,
                              Map<Dimension, DimensionValues> dimensions,
                              Integer limit) {

    public AnalyticsFilter {
        EnumMap<Dimension, DimensionValues> copy = new EnumMap<>(Dimension.class);
        if (dimensions != null) {
            dimensions.forEach((d, v) -> {
                if (d != null && v != null) copy.put(d, v);
            });
        }
        dimensions = Collections.unmodifiableMap(copy);
    }

    public static AnalyticsFilter empty() {
        return new AnalyticsFilter(null, null, Map.of(), null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public DimensionValues values(Dimension dimension) {
        return dimensions.getOrDefault(dimension, DimensionValues.ofStrings(List.of()));
    }

    public List<String> users() {
        return values(Dimension.USERS).strings();
    }

    public List<String> mediaTypes() {
        return values(Dimension.MEDIA_TYPES).strings();
    }

    public List<String> platforms() {
        return values(Dimension.PLATFORMS).strings();
    }

    public int limitOr(int defaultLimit, int maxLimit) {
        if (limit == null || limit < 1) return defaultLimit;
        return Math.min(limit, maxLimit);
    }

    public Builder toBuilder() {
        Builder b = new Builder().startDate(startDate).endDate(endDate).limit(limit);
        b.dimensions.putAll(dimensions);
        return b;
    }

    public static final class Builder {
        private Instant startDate;
        private Instant endDate;
        private Integer limit;
        private final EnumMap<Dimension, DimensionValues> dimensions = new EnumMap<>(Dimension.class);

        private Builder() {}

        public Builder startDate(Instant startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(Instant endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder strings(Dimension dimension, List<String> values) {
            dimensions.put(dimension, DimensionValues.ofStrings(values));
            return this;
        }

        public Builder ints(Dimension dimension, List<Integer> values) {
            dimensions.put(dimension, DimensionValues.ofInts(values));
            return this;
        }

        public Builder raw(Dimension dimension, Object value) {
            dimensions.put(dimension, DimensionValues.from(value));
            return this;
        }

        public Builder users(String... users) {
            return strings(Dimension.USERS, Arrays.asList(users));
        }

        public Builder mediaTypes(String... mediaTypes) {
            return strings(Dimension.MEDIA_TYPES, Arrays.asList(mediaTypes));
        }

        public Builder platforms(String... platforms) {
            return strings(Dimension.PLATFORMS, Arrays.asList(platforms));
        }

        public Builder years(Integer... years) {
            return ints(Dimension.YEARS, Arrays.asList(years));
        }

        public AnalyticsFilter build() {
            return new AnalyticsFilter(startDate, endDate, dimensions, limit);
        }
    }
}
