package com.mediapulse.analytics.binge;

import com.mediapulse.analytics.config.AnalyticsProperties;
import com.mediapulse.analytics.filter.AnalyticsFilter;
import com.mediapulse.analytics.filter.CompiledPredicate;
import com.mediapulse.analytics.filter.PredicateCompiler;
import com.mediapulse.analytics.metrics.MetricMath;
import com.mediapulse.analytics.query.QueryContext;
import com.mediapulse.analytics.repository.BingeJdbcRepository;
import com.mediapulse.analytics.repository.StoreTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

@Service
public class BingeService {
    private static final Logger log = LoggerFactory.getLogger(BingeService.class);
    private static final int TOP_LIMIT = 10;
    private static final int MAX_RECENT = 100;

    private final BingeJdbcRepository repository;
    private final AnalyticsProperties properties;
    private final Clock clock;

    public BingeService(BingeJdbcRepository repository, AnalyticsProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public BingeModels.BingeAnalytics analytics(AnalyticsFilter filter) {
        return analytics(filter, QueryContext.withTimeout(properties.query().timeout(), clock));
    }

    public BingeModels.BingeAnalytics analytics(AnalyticsFilter filter, QueryContext ctx) {
        Instant started = clock.instant();
        AnalyticsFilter f = filter == null ? AnalyticsFilter.empty() : filter;
        CompiledPredicate predicate = PredicateCompiler.compile(f);
        AnalyticsProperties.Binge config = properties.binge();

        List<BingeModels.EpisodePlay> plays = repository.episodePlays(ctx, predicate);
        List<BingeModels.BingeSession> binges = new BingeDetector(Duration.ofHours(config.gapHours()), config.minEpisodes())
                .detect(plays);

        long episodes = binges.stream().mapToLong(BingeModels.BingeSession::episodeCount).sum();
        double minutes = binges.stream().mapToDouble(BingeModels.BingeSession::totalDurationMinutes).sum();
        List<BingeModels.BingeSession> recent = binges.stream()
                .sorted(Comparator.comparing(BingeModels.BingeSession::firstEpisodeTime).reversed())
                .limit(f.limitOr(TOP_LIMIT, MAX_RECENT))
                .toList();

        log.debug("Binge analytics: plays={}, binges={}, took {} ms",
                plays.size(), binges.size(), Duration.between(started, clock.instant()).toMillis());
        return new BingeModels.BingeAnalytics(
                binges.size(),
                episodes,
                MetricMath.ratio(episodes, binges.size()),
                MetricMath.ratio(minutes, binges.size()),
                recent,
                topShows(binges),
                topWatchers(binges),
                byDayOfWeek(binges));
    }

    private List<BingeModels.BingeShowStats> topShows(List<BingeModels.BingeSession> binges) {
        return binges.stream()
                .collect(Collectors.groupingBy(BingeModels.BingeSession::showName))
                .entrySet().stream()
                .map(e -> {
                    List<BingeModels.BingeSession> sessions = e.getValue();
                    long episodes = sessions.stream().mapToLong(BingeModels.BingeSession::episodeCount).sum();
                    long watchers = sessions.stream().map(BingeModels.BingeSession::userId).distinct().count();
                    return new BingeModels.BingeShowStats(e.getKey(), sessions.size(), episodes, watchers,
                            MetricMath.ratio(episodes, sessions.size()));
                })
                .sorted(Comparator.comparingLong(BingeModels.BingeShowStats::bingeCount).reversed()
                        .thenComparing(BingeModels.BingeShowStats::showName))
                .limit(TOP_LIMIT)
                .toList();
    }

    private List<BingeModels.BingeUserStats> topWatchers(List<BingeModels.BingeSession> binges) {
        return binges.stream()
                .collect(Collectors.groupingBy(BingeModels.BingeSession::userId))
                .values().stream()
                .map(sessions -> {
                    long episodes = sessions.stream().mapToLong(BingeModels.BingeSession::episodeCount).sum();
                    String favourite = sessions.stream()
                            .collect(Collectors.groupingBy(BingeModels.BingeSession::showName, TreeMap::new, Collectors.counting()))
                            .entrySet().stream()
                            .max(Map.Entry.comparingByValue())
                            .map(Map.Entry::getKey)
                            .orElse(null);
                    return new BingeModels.BingeUserStats(sessions.get(0).userId(), sessions.get(0).username(),
                            sessions.size(), episodes, MetricMath.ratio(episodes, sessions.size()), favourite);
                })
                .sorted(Comparator.comparingLong(BingeModels.BingeUserStats::bingeCount).reversed()
                        .thenComparingLong(BingeModels.BingeUserStats::userId))
                .limit(TOP_LIMIT)
                .toList();
    }

    private List<BingeModels.BingesByDayOfWeek> byDayOfWeek(List<BingeModels.BingeSession> binges) {
        Map<Integer, List<BingeModels.BingeSession>> byDay = binges.stream()
                .collect(Collectors.groupingBy(b -> b.firstEpisodeTime().atZone(StoreTime.zone()).getDayOfWeek().getValue() % 7));
        List<BingeModels.BingesByDayOfWeek> days = new ArrayList<>();
        for (int day = 0; day < 7; day++) {
            List<BingeModels.BingeSession> sessions = byDay.getOrDefault(day, List.of());
            double avg = sessions.stream().mapToInt(BingeModels.BingeSession::episodeCount).average().orElse(0.0);
            days.add(new BingeModels.BingesByDayOfWeek(day, sessions.size(), (int) avg));
        }
        return days;
    }
}
