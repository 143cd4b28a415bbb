package com.mediapulse.analytics.migration;

import com.mediapulse.analytics.config.AnalyticsProperties;
import com.mediapulse.analytics.filter.AnalyticsFilter;
import com.mediapulse.analytics.filter.CompiledPredicate;
import com.mediapulse.analytics.filter.PredicateCompiler;
import com.mediapulse.analytics.metrics.DataRange;
import com.mediapulse.analytics.metrics.MetricMath;
import com.mediapulse.analytics.metrics.QueryHash;
import com.mediapulse.analytics.query.AnalyticsQueryExecutor;
import com.mediapulse.analytics.query.QueryContext;
import com.mediapulse.analytics.repository.DeviceMigrationJdbcRepository;
import com.mediapulse.analytics.repository.DeviceMigrationJdbcRepository.DailyUsageRow;
import com.mediapulse.analytics.repository.DeviceMigrationJdbcRepository.EventCounts;
import com.mediapulse.analytics.repository.DeviceMigrationJdbcRepository.MigrationRow;
import com.mediapulse.analytics.repository.DeviceMigrationJdbcRepository.UserPlatformRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

@Service
public class DeviceMigrationService {
    private static final Logger log = LoggerFactory.getLogger(DeviceMigrationService.class);
    private static final int MAX_RECENT = 500;
    private static final double SECONDS_PER_DAY = 86_400.0;

    private final DeviceMigrationJdbcRepository repository;
    private final AnalyticsQueryExecutor executor;
    private final AnalyticsProperties properties;
    private final Clock clock;

    public DeviceMigrationService(DeviceMigrationJdbcRepository repository, AnalyticsQueryExecutor executor,
                                  AnalyticsProperties properties, Clock clock) {
        this.repository = repository;
        this.executor = executor;
        this.properties = properties;
        this.clock = clock;
    }

    public MigrationModels.DeviceMigrationReport analytics(AnalyticsFilter filter) {
        return analytics(filter, QueryContext.withTimeout(properties.query().timeout(), clock));
    }

    public MigrationModels.DeviceMigrationReport analytics(AnalyticsFilter filter, QueryContext ctx) {
        Instant started = clock.instant();
        AnalyticsFilter f = filter == null ? AnalyticsFilter.empty() : filter;
        AnalyticsProperties.Migration config = properties.migration();
        CompiledPredicate predicate = PredicateCompiler.compile(f);
        Instant now = clock.instant();
        Instant activeCutoff = now.minus(Duration.ofDays(config.windowDays()));
        TrendInterval interval = TrendInterval.forFilter(f);

        List<UserPlatformRow> usage = repository.userPlatforms(ctx, predicate);
        List<MigrationRow> migrations = repository.migrations(ctx, predicate);
        List<DailyUsageRow> daily = repository.dailyUsage(ctx, predicate);

        Map<Long, List<UserPlatformRow>> byUser = usage.stream()
                .collect(Collectors.groupingBy(UserPlatformRow::userId, TreeMap::new, Collectors.toList()));
        Map<Long, Long> migrationsByUser = migrations.stream()
                .collect(Collectors.groupingBy(MigrationRow::userId, Collectors.counting()));

        List<MigrationModels.UserDeviceProfile> profiles = byUser.values().stream()
                .map(rows -> profile(rows, migrationsByUser, now, activeCutoff))
                .toList();

        MigrationModels.MigrationSummary summary = summary(profiles, usage, migrations.size(), activeCutoff);
        List<MigrationModels.UserDeviceProfile> top = profiles.stream()
                .sorted(Comparator.comparingInt(MigrationModels.UserDeviceProfile::totalPlatformsUsed).reversed()
                        .thenComparing(Comparator.comparingLong(MigrationModels.UserDeviceProfile::totalSessions).reversed())
                        .thenComparing(MigrationModels.UserDeviceProfile::username, Comparator.nullsLast(Comparator.naturalOrder())))
                .limit(config.topProfiles())
                .toList();
        List<MigrationModels.DeviceMigration> recent = migrations.stream()
                .limit(f.limitOr(config.recentLimit(), MAX_RECENT))
                .map(m -> new MigrationModels.DeviceMigration(m.userId(), m.username(), m.fromPlatform(), m.toPlatform(),
                        m.migrationDate(), m.sessionsBefore(), m.sessionsAfter(), m.permanent()))
                .toList();

        EventCounts counts = executor.bestEffort("migration event count", new EventCounts(0, 0),
                () -> repository.eventCounts(ctx, predicate)).value();
        DataRange range = DataRange.of(f, clock, properties.defaultRangeDays());
        long elapsed = Duration.between(started, clock.instant()).toMillis();
        MigrationModels.MigrationMetadata metadata = new MigrationModels.MigrationMetadata(
                queryHash(f, range, config.windowDays()), config.windowDays(), interval, range.start(), range.end(),
                counts.events(), counts.platforms(), clock.instant(), elapsed);

        log.debug("Device migration: users={}, migrations={}, interval={}, took {} ms",
                summary.totalUsers(), summary.totalMigrations(), interval.label(), elapsed);
        return new MigrationModels.DeviceMigrationReport(summary, top, recent,
                adoptionTrends(daily, interval), transitions(migrations, config.transitionLimit()),
                distribution(usage), metadata);
    }

    static String queryHash(AnalyticsFilter filter, DataRange range, int windowDays) {
        return QueryHash.forReport("device_migration")
                .instant("start", range.start())
                .instant("end", range.end())
                .list("users", filter.users())
                .list("media_types", filter.mediaTypes())
                .list("platforms", filter.platforms())
                .value("window_days", windowDays)
                .digest();
    }

    private MigrationModels.UserDeviceProfile profile(List<UserPlatformRow> rows, Map<Long, Long> migrationsByUser,
                                                      Instant now, Instant activeCutoff) {
        long total = rows.stream().mapToLong(UserPlatformRow::sessions).sum();
        List<UserPlatformRow> ranked = rows.stream()
                .sorted(Comparator.comparingLong(UserPlatformRow::sessions).reversed()
                        .thenComparing(UserPlatformRow::platform))
                .toList();
        List<MigrationModels.PlatformUsage> history = new ArrayList<>();
        for (int i = 0; i < ranked.size(); i++) {
            UserPlatformRow r = ranked.get(i);
            history.add(new MigrationModels.PlatformUsage(r.platform(), r.firstUsed(), r.lastUsed(), r.sessions(),
                    r.watchSeconds() / 60.0, MetricMath.percentage(r.sessions(), total), i == 0,
                    r.lastUsed() != null && !r.lastUsed().isBefore(activeCutoff)));
        }

        UserPlatformRow first = ranked.get(0);
        Instant firstSeen = rows.stream().map(UserPlatformRow::firstUsed).filter(Objects::nonNull).min(Comparator.naturalOrder()).orElse(null);
        Instant lastSeen = rows.stream().map(UserPlatformRow::lastUsed).filter(Objects::nonNull).max(Comparator.naturalOrder()).orElse(null);
        int platforms = rows.size();
        return new MigrationModels.UserDeviceProfile(
                first.userId(),
                rows.stream().map(UserPlatformRow::username).filter(Objects::nonNull).findFirst().orElse(null),
                platforms,
                total,
                firstSeen,
                lastSeen,
                daysBetween(firstSeen, now),
                daysBetween(lastSeen, now),
                platforms >= 2,
                history.get(0).platform(),
                history.get(0).percentage(),
                migrationsByUser.getOrDefault(first.userId(), 0L).intValue(),
                history);
    }

    private MigrationModels.MigrationSummary summary(List<MigrationModels.UserDeviceProfile> profiles,
                                                     List<UserPlatformRow> usage, long totalMigrations, Instant activeCutoff) {
        long users = profiles.size();
        long multi = profiles.stream().filter(MigrationModels.UserDeviceProfile::multiDevice).count();
        double avgPlatforms = MetricMath.average(profiles.stream().map(p -> (double) p.totalPlatformsUsed()).toList());

        String mostCommonPrimary = mostFrequent(profiles.stream()
                .collect(Collectors.groupingBy(MigrationModels.UserDeviceProfile::primaryPlatform, Collectors.counting())));
        String fastestGrowing = mostFrequent(usage.stream()
                .filter(r -> r.lastUsed() != null && !r.lastUsed().isBefore(activeCutoff))
                .collect(Collectors.groupingBy(UserPlatformRow::platform, Collectors.counting())));

        return new MigrationModels.MigrationSummary(users, multi, MetricMath.percentage(multi, users), avgPlatforms,
                mostCommonPrimary, fastestGrowing, totalMigrations);
    }

    static List<MigrationModels.PlatformTransition> transitions(List<MigrationRow> migrations, int limit) {
        Map<List<String>, List<MigrationRow>> byPair = migrations.stream()
                .collect(Collectors.groupingBy(m -> List.of(m.fromPlatform(), m.toPlatform()), LinkedHashMap::new, Collectors.toList()));
        return byPair.entrySet().stream()
                .map(e -> {
                    List<MigrationRow> rows = e.getValue();
                    long returned = rows.stream().filter(m -> !m.permanent()).count();
                    return new MigrationModels.PlatformTransition(
                            e.getKey().get(0),
                            e.getKey().get(1),
                            rows.size(),
                            rows.stream().map(MigrationRow::userId).distinct().count(),
                            MetricMath.average(rows.stream().map(DeviceMigrationService::daysGap).filter(Objects::nonNull).toList()),
                            MetricMath.percentage(returned, rows.size()));
                })
                .sorted(Comparator.comparingLong(MigrationModels.PlatformTransition::transitionCount).reversed()
                        .thenComparing(MigrationModels.PlatformTransition::fromPlatform)
                        .thenComparing(MigrationModels.PlatformTransition::toPlatform))
                .limit(limit)
                .toList();
    }

    static List<MigrationModels.PlatformAdoptionTrend> adoptionTrends(List<DailyUsageRow> daily, TrendInterval interval) {
        record Key(LocalDate period, String platform) {}
        Map<Key, Long> sessions = new HashMap<>();
        Map<Key, Set<Long>> active = new HashMap<>();
        Map<LocalDate, Long> periodTotals = new HashMap<>();
        Map<List<Object>, LocalDate> firstPeriod = new HashMap<>();

        for (DailyUsageRow row : daily) {
            LocalDate period = interval.periodStart(row.day());
            Key key = new Key(period, row.platform());
            sessions.merge(key, row.sessions(), Long::sum);
            active.computeIfAbsent(key, k -> new HashSet<>()).add(row.userId());
            periodTotals.merge(period, row.sessions(), Long::sum);
            firstPeriod.merge(List.of(row.userId(), row.platform()), period, (a, b) -> a.isBefore(b) ? a : b);
        }

        Map<Key, Long> newUsers = firstPeriod.entrySet().stream()
                .collect(Collectors.groupingBy(e -> new Key(e.getValue(), (String) e.getKey().get(1)), Collectors.counting()));

        return sessions.entrySet().stream()
                .map(e -> new MigrationModels.PlatformAdoptionTrend(
                        e.getKey().period(),
                        e.getKey().platform(),
                        newUsers.getOrDefault(e.getKey(), 0L),
                        active.get(e.getKey()).size(),
                        e.getValue(),
                        MetricMath.percentage(e.getValue(), periodTotals.get(e.getKey().period()))))
                .sorted(Comparator.comparing(MigrationModels.PlatformAdoptionTrend::period).reversed()
                        .thenComparing(Comparator.comparingLong(MigrationModels.PlatformAdoptionTrend::sessionCount).reversed())
                        .thenComparing(MigrationModels.PlatformAdoptionTrend::platform))
                .toList();
    }

    static List<MigrationModels.PlatformShare> distribution(List<UserPlatformRow> usage) {
        long total = usage.stream().mapToLong(UserPlatformRow::sessions).sum();
        Map<String, List<UserPlatformRow>> byPlatform = usage.stream()
                .collect(Collectors.groupingBy(UserPlatformRow::platform));
        return byPlatform.entrySet().stream()
                .map(e -> {
                    long sessions = e.getValue().stream().mapToLong(UserPlatformRow::sessions).sum();
                    return new MigrationModels.PlatformShare(e.getKey(), sessions, e.getValue().size(),
                            MetricMath.percentage(sessions, total));
                })
                .sorted(Comparator.comparingLong(MigrationModels.PlatformShare::sessionCount).reversed()
                        .thenComparing(MigrationModels.PlatformShare::platform))
                .toList();
    }

    private static Double daysGap(MigrationRow m) {
        if (m.previousSessionAt() == null || m.migrationDate() == null) return null;
        return Duration.between(m.previousSessionAt(), m.migrationDate()).getSeconds() / SECONDS_PER_DAY;
    }

    private static long daysBetween(Instant from, Instant to) {
        if (from == null) return 0;
        return Math.max(0, Duration.between(from, to).toDays());
    }

    private static String mostFrequent(Map<String, Long> counts) {
        return counts.entrySet().stream()
                .max(Map.Entry.<String, Long>comparingByValue().thenComparing(Map.Entry.<String, Long>comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElse(null);
    }
}
