package com.mediapulse.analytics.quality;

import com.mediapulse.analytics.config.AnalyticsProperties;
import com.mediapulse.analytics.filter.AnalyticsFilter;
import com.mediapulse.analytics.filter.CompiledPredicate;
import com.mediapulse.analytics.filter.PredicateCompiler;
import com.mediapulse.analytics.issue.Issue;
import com.mediapulse.analytics.metrics.DataRange;
import com.mediapulse.analytics.metrics.MetricMath;
import com.mediapulse.analytics.metrics.QueryHash;
import com.mediapulse.analytics.query.QueryContext;
import com.mediapulse.analytics.repository.DataQualityJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

@Service
public class DataQualityService {
    private static final Logger log = LoggerFactory.getLogger(DataQualityService.class);
    private static final List<String> ANALYZED_TABLES = List.of("playback_events");
    private static final List<String> RULES_APPLIED = List.of("null_check", "validity_check", "future_date_check");

    private final DataQualityJdbcRepository repository;
    private final AnalyticsProperties properties;
    private final Clock clock;

    public DataQualityService(DataQualityJdbcRepository repository, AnalyticsProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public DataQualityModels.DataQualityReport report(AnalyticsFilter filter) {
        return report(filter, QueryContext.withTimeout(properties.query().timeout(), clock));
    }

    public DataQualityModels.DataQualityReport report(AnalyticsFilter filter, QueryContext ctx) {
        Instant started = clock.instant();
        AnalyticsFilter f = filter == null ? AnalyticsFilter.empty() : filter;
        CompiledPredicate predicate = PredicateCompiler.compile(f);
        Instant now = clock.instant();

        DataQualityJdbcRepository.FieldCountsRow counts = repository.fieldCounts(ctx, predicate, now);
        List<DataQualityModels.FieldQualityMetric> fields = Arrays.stream(QualityField.values())
                .map(field -> DataQualityScoring.field(field, counts.total(), counts.counts().get(field)))
                .toList();

        List<DataQualityModels.DailyQualityTrend> daily = repository.daily(ctx, predicate, now).stream()
                .map(d -> new DataQualityModels.DailyQualityTrend(d.day(), d.events(),
                        DataQualityScoring.dayScore(d.events(), d.requiredNulls(), d.invalidValues()),
                        MetricMath.percentage(d.rowsWithNulls(), d.events()),
                        MetricMath.percentage(d.rowsWithInvalid(), d.events())))
                .toList();

        List<DataQualityJdbcRepository.SourceRow> sourceRows = repository.sources(ctx, predicate);
        long sourceTotal = sourceRows.stream().mapToLong(DataQualityJdbcRepository.SourceRow::events).sum();
        List<DataQualityModels.SourceQuality> sources = sourceRows.stream()
                .map(s -> {
                    double nullRate = MetricMath.percentage(s.rowsWithNulls(), s.events());
                    double invalidRate = MetricMath.percentage(s.rowsWithInvalid(), s.events());
                    return new DataQualityModels.SourceQuality(s.source(), s.serverId(), s.events(),
                            MetricMath.percentage(s.events(), sourceTotal), nullRate, invalidRate,
                            DataQualityScoring.sourceScore(nullRate, invalidRate),
                            DataQualityScoring.sourceStatus(nullRate, invalidRate));
                })
                .toList();

        DataQualityModels.DataQualitySummary summary = DataQualityScoring.summary(counts.total(), fields, daily);
        List<Issue> issues = DataQualityIssues.detect(fields, summary);

        DataRange range = DataRange.of(f, clock, properties.defaultRangeDays());
        long elapsed = Duration.between(started, clock.instant()).toMillis();
        DataQualityModels.DataQualityMetadata metadata = new DataQualityModels.DataQualityMetadata(
                queryHash(f), range.start(), range.end(), ANALYZED_TABLES, RULES_APPLIED, clock.instant(), elapsed);

        log.debug("Data quality: events={}, score={}, issues={}, took {} ms",
                summary.totalEvents(), summary.overallScore(), issues.size(), elapsed);
        return new DataQualityModels.DataQualityReport(summary, fields, daily, issues, sources, metadata);
    }

    static String queryHash(AnalyticsFilter filter) {
        return QueryHash.forReport("data_quality")
                .instant("start", filter.startDate())
                .instant("end", filter.endDate())
                .list("users", filter.users())
                .list("media_types", filter.mediaTypes())
                .list("platforms", filter.platforms())
                .digest();
    }
}
