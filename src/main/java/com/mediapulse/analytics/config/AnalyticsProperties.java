package com.mediapulse.analytics.config;

import com.mediapulse.analytics.cohort.CohortGranularity;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties("analytics")
public record AnalyticsProperties(Integer defaultRangeDays,
                                  Query query,
                                  Cohort cohort,
                                  Migration migration,
                                  Binge binge) {

    public AnalyticsProperties {
        if (defaultRangeDays == null || defaultRangeDays < 1) defaultRangeDays = 30;
        if (query == null) query = new Query(null, null);
        if (cohort == null) cohort = new Cohort(null, null, null);
        if (migration == null) migration = new Migration(null, null, null, null);
        if (binge == null) binge = new Binge(null, null);
    }

    public static AnalyticsProperties defaults() {
        return new AnalyticsProperties(null, null, null, null, null);
    }

    public record Query(Duration timeout, Integer fanOutThreads) {
        public Query {
            if (timeout == null || timeout.isNegative() || timeout.isZero()) timeout = Duration.ofSeconds(30);
            if (fanOutThreads == null || fanOutThreads < 1) fanOutThreads = 4;
        }
    }

    public record Cohort(Integer maxWeeks, Integer minCohortSize, CohortGranularity granularity) {
        public Cohort {
            if (maxWeeks == null || maxWeeks < 1) maxWeeks = 12;
            if (minCohortSize == null || minCohortSize < 1) minCohortSize = 5;
            if (granularity == null) granularity = CohortGranularity.WEEK;
        }
    }

    public record Migration(Integer topProfiles, Integer recentLimit, Integer transitionLimit, Integer windowDays) {
        public Migration {
            if (topProfiles == null || topProfiles < 1) topProfiles = 20;
            if (recentLimit == null || recentLimit < 1) recentLimit = 50;
            if (transitionLimit == null || transitionLimit < 1) transitionLimit = 10;
            if (windowDays == null || windowDays < 1) windowDays = 30;
        }
    }

    public record Binge(Integer gapHours, Integer minEpisodes) {
        public Binge {
            if (gapHours == null || gapHours < 1) gapHours = 6;
            if (minEpisodes == null || minEpisodes < 2) minEpisodes = 3;
        }
    }
}
