package com.mediapulse.analytics.qoe;

import com.mediapulse.analytics.config.AnalyticsProperties;
import com.mediapulse.analytics.filter.AnalyticsFilter;
import com.mediapulse.analytics.filter.CompiledPredicate;
import com.mediapulse.analytics.filter.PredicateCompiler;
import com.mediapulse.analytics.metrics.DataRange;
import com.mediapulse.analytics.metrics.Grades;
import com.mediapulse.analytics.metrics.QueryHash;
import com.mediapulse.analytics.query.AnalyticsQueryException;
import com.mediapulse.analytics.query.AnalyticsQueryExecutor;
import com.mediapulse.analytics.query.BestEffort;
import com.mediapulse.analytics.query.QueryContext;
import com.mediapulse.analytics.repository.QoeJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static com.mediapulse.analytics.metrics.MetricMath.percentage;

@Service
public class QoeService {
    private static final Logger log = LoggerFactory.getLogger(QoeService.class);
    private static final double KBPS_PER_MBPS = 1000.0;

    private final QoeJdbcRepository repository;
    private final AnalyticsQueryExecutor executor;
    private final ExecutorService fanOut;
    private final AnalyticsProperties properties;
    private final Clock clock;

    public QoeService(QoeJdbcRepository repository,
                      AnalyticsQueryExecutor executor,
                      @Qualifier("analyticsFanOutExecutor") ExecutorService fanOut,
                      AnalyticsProperties properties,
                      Clock clock) {
        this.repository = repository;
        this.executor = executor;
        this.fanOut = fanOut;
        this.properties = properties;
        this.clock = clock;
    }

    public QoeModels.QoeDashboard dashboard(AnalyticsFilter filter) {
        return dashboard(filter, QueryContext.withTimeout(properties.query().timeout(), clock));
    }

    public QoeModels.QoeDashboard dashboard(AnalyticsFilter filter, QueryContext ctx) {
        Instant started = clock.instant();
        AnalyticsFilter f = filter == null ? AnalyticsFilter.empty() : filter;
        CompiledPredicate predicate = PredicateCompiler.compile(f);
        DataRange range = DataRange.of(f, clock, properties.defaultRangeDays());
        boolean hourly = range.length().compareTo(Duration.ofDays(7)) < 0;

        AtomicReference<Throwable> firstFailure = new AtomicReference<>();
        CompletableFuture<QoeJdbcRepository.SummaryRow> summaryF = submit(ctx, firstFailure, () -> repository.summary(ctx, predicate));
        CompletableFuture<List<QoeJdbcRepository.TrendRow>> trendF = submit(ctx, firstFailure, () -> repository.trend(ctx, predicate, hourly));
        CompletableFuture<List<QoeJdbcRepository.PlatformRow>> platformF = submit(ctx, firstFailure, () -> repository.byPlatform(ctx, predicate));
        CompletableFuture<List<QoeJdbcRepository.TranscodeRow>> transcodeF = submit(ctx, firstFailure, () -> repository.byTranscodeDecision(ctx, predicate));

        try {
            CompletableFuture.allOf(summaryF, trendF, platformF, transcodeF).join();
        } catch (CompletionException e) {
            throw unwrap(firstFailure.get() != null ? firstFailure.get() : e);
        }

        BestEffort<QoeJdbcRepository.BitratePercentiles> percentiles = executor.bestEffort("QoE bitrate percentile query",
                new QoeJdbcRepository.BitratePercentiles(0, 0),
                () -> repository.bitratePercentiles(ctx, predicate));

        QoeModels.QoeSummary summary = summary(summaryF.join(), percentiles.value());
        long total = summary.totalSessions();
        List<QoeModels.QoeTrendPoint> trends = trendF.join().stream().map(this::trendPoint).toList();
        List<QoeModels.QoeByPlatform> platforms = platformF.join().stream().map(r -> platform(r, total)).toList();
        List<QoeModels.QoeByTranscode> transcodes = transcodeF.join().stream().map(r -> transcode(r, total)).toList();

        long elapsed = Duration.between(started, clock.instant()).toMillis();
        QoeModels.QoeMetadata metadata = new QoeModels.QoeMetadata(
                queryHash(f), range.start(), range.end(), hourly ? "hour" : "day",
                summary.totalSessions(), clock.instant(), elapsed, !percentiles.degraded());
        log.debug("QoE dashboard: sessions={}, score={}, took {} ms", summary.totalSessions(), summary.qoeScore(), elapsed);
        return new QoeModels.QoeDashboard(summary, trends, platforms, transcodes,
                QoeIssues.detect(summary, platforms), metadata);
    }

    static String queryHash(AnalyticsFilter filter) {
        return QueryHash.forReport("qoe")
                .instant("start", filter.startDate())
                .instant("end", filter.endDate())
                .list("users", filter.users())
                .list("media_types", filter.mediaTypes())
                .list("platforms", filter.platforms())
                .digest();
    }

    private <T> CompletableFuture<T> submit(QueryContext ctx, AtomicReference<Throwable> firstFailure, Supplier<T> query) {
        return CompletableFuture.supplyAsync(query, fanOut).whenComplete((v, e) -> {
            if (e == null) return;
            if (firstFailure.compareAndSet(null, e instanceof CompletionException && e.getCause() != null ? e.getCause() : e)) {
                ctx.cancel();
            }
        });
    }

    private RuntimeException unwrap(Throwable t) {
        Throwable cause = t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
        if (cause instanceof AnalyticsQueryException aqe) return aqe;
        return new AnalyticsQueryException("QoE dashboard", cause);
    }

    private QoeModels.QoeSummary summary(QoeJdbcRepository.SummaryRow r, QoeJdbcRepository.BitratePercentiles p) {
        double sessions = r.sessions();
        double ebvsRate = percentage(r.ebvs(), sessions);
        double degradeRate = percentage(r.degraded(), sessions);
        double pauseRate = percentage(r.paused(), sessions);
        double score = QoeScoring.score(ebvsRate, degradeRate, pauseRate, r.avgCompletion());
        return new QoeModels.QoeSummary(
                r.sessions(),
                r.ebvs(), ebvsRate,
                r.degraded(), degradeRate,
                r.transcoded(), percentage(r.transcoded(), sessions),
                r.directPlay(), percentage(r.directPlay(), sessions),
                r.avgCompletion(),
                percentage(r.highCompletion(), sessions),
                pauseRate,
                r.avgPauseCount(),
                percentage(r.relayed(), sessions),
                percentage(r.secure(), sessions),
                r.avgBitrateKbps() / KBPS_PER_MBPS,
                p.p50Kbps() / KBPS_PER_MBPS,
                p.p95Kbps() / KBPS_PER_MBPS,
                score,
                Grades.qoe(score));
    }

    private QoeModels.QoeTrendPoint trendPoint(QoeJdbcRepository.TrendRow r) {
        double ebvsRate = percentage(r.ebvs(), r.sessions());
        double degradeRate = percentage(r.degraded(), r.sessions());
        return new QoeModels.QoeTrendPoint(r.bucket(), r.sessions(), ebvsRate, degradeRate,
                percentage(r.transcoded(), r.sessions()), r.avgCompletion(), r.avgBitrateKbps() / KBPS_PER_MBPS,
                QoeScoring.score(ebvsRate, degradeRate, r.avgCompletion()));
    }

    private QoeModels.QoeByPlatform platform(QoeJdbcRepository.PlatformRow r, long totalSessions) {
        double ebvsRate = percentage(r.ebvs(), r.sessions());
        double degradeRate = percentage(r.degraded(), r.sessions());
        double score = QoeScoring.score(ebvsRate, degradeRate, r.avgCompletion());
        return new QoeModels.QoeByPlatform(r.platform(), r.sessions(), percentage(r.sessions(), totalSessions),
                ebvsRate, degradeRate, percentage(r.transcoded(), r.sessions()), percentage(r.directPlay(), r.sessions()),
                r.avgCompletion(), r.avgBitrateKbps() / KBPS_PER_MBPS, score, Grades.qoe(score));
    }

    private QoeModels.QoeByTranscode transcode(QoeJdbcRepository.TranscodeRow r, long totalSessions) {
        double ebvsRate = percentage(r.ebvs(), r.sessions());
        return new QoeModels.QoeByTranscode(r.decision(), r.sessions(), percentage(r.sessions(), totalSessions),
                ebvsRate, r.avgCompletion(), r.avgBitrateKbps() / KBPS_PER_MBPS,
                QoeScoring.score(ebvsRate, r.avgCompletion()));
    }
}
