package com.mediapulse.analytics.cohort;

import com.mediapulse.analytics.config.AnalyticsProperties;
import com.mediapulse.analytics.filter.AnalyticsFilter;
import com.mediapulse.analytics.filter.CompiledPredicate;
import com.mediapulse.analytics.filter.PredicateCompiler;
import com.mediapulse.analytics.metrics.DataRange;
import com.mediapulse.analytics.metrics.QueryHash;
import com.mediapulse.analytics.query.AnalyticsQueryExecutor;
import com.mediapulse.analytics.query.QueryContext;
import com.mediapulse.analytics.repository.CohortJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Service
public class CohortRetentionService {
    private static final Logger log = LoggerFactory.getLogger(CohortRetentionService.class);

    private final CohortJdbcRepository repository;
    private final AnalyticsQueryExecutor executor;
    private final AnalyticsProperties properties;
    private final Clock clock;

    public CohortRetentionService(CohortJdbcRepository repository, AnalyticsQueryExecutor executor,
                                  AnalyticsProperties properties, Clock clock) {
        this.repository = repository;
        this.executor = executor;
        this.properties = properties;
        this.clock = clock;
    }

    public CohortModels.CohortRetentionReport report(AnalyticsFilter filter) {
        return report(filter, QueryContext.withTimeout(properties.query().timeout(), clock));
    }

    public CohortModels.CohortRetentionReport report(AnalyticsFilter filter, QueryContext ctx) {
        Instant started = clock.instant();
        AnalyticsFilter f = filter == null ? AnalyticsFilter.empty() : filter;
        AnalyticsProperties.Cohort config = properties.cohort();
        CompiledPredicate predicate = PredicateCompiler.compile(f);

        List<CohortModels.Activity> activity = repository.activity(ctx, predicate);
        CohortModels.CohortAnalysis analysis = new CohortCalculator(config.granularity(), config.maxWeeks(), config.minCohortSize())
                .analyze(activity);
        long events = executor.bestEffort("cohort event count", 0L, () -> repository.eventCount(ctx, predicate)).value();

        DataRange range = DataRange.of(f, clock, properties.defaultRangeDays());
        long elapsed = Duration.between(started, clock.instant()).toMillis();
        CohortModels.CohortMetadata metadata = new CohortModels.CohortMetadata(
                queryHash(f, config), range.start(), range.end(), config.granularity(),
                config.maxWeeks(), config.minCohortSize(), events, clock.instant(), elapsed);

        log.debug("Cohort retention: cohorts={}, activityRows={}, events={}, took {} ms",
                analysis.cohorts().size(), activity.size(), events, elapsed);
        return new CohortModels.CohortRetentionReport(analysis.cohorts(), analysis.retentionCurve(), analysis.summary(), metadata);
    }

    static String queryHash(AnalyticsFilter filter, AnalyticsProperties.Cohort config) {
        return QueryHash.forReport("cohort")
                .instant("start", filter.startDate())
                .instant("end", filter.endDate())
                .list("users", filter.users())
                .list("media_types", filter.mediaTypes())
                .value("max_weeks", config.maxWeeks())
                .value("min_cohort_size", config.minCohortSize())
                .value("granularity", config.granularity().label())
                .digest();
    }
}
