package com.mediapulse.analytics.repository;

import com.mediapulse.analytics.filter.CompiledPredicate;
import com.mediapulse.analytics.query.AnalyticsQueryExecutor;
import com.mediapulse.analytics.query.QueryContext;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Repository
public class DeviceMigrationJdbcRepository {
    private static final String WITH_PLATFORM = "user_id IS NOT NULL AND platform IS NOT NULL AND platform <> ''";

    private final AnalyticsQueryExecutor executor;

    public DeviceMigrationJdbcRepository(AnalyticsQueryExecutor executor) {
        this.executor = executor;
    }

    public List<UserPlatformRow> userPlatforms(QueryContext ctx, CompiledPredicate predicate) {
        String sql = "SELECT user_id, MAX(username), platform, COUNT(*), COALESCE(SUM(play_duration), 0), " +
                "MIN(started_at), MAX(started_at) " +
                "FROM playback_events WHERE " + predicate.conjunction() + " AND " + WITH_PLATFORM + " " +
                "GROUP BY user_id, platform";
        return executor.query(ctx, "user platform query", sql, predicate.args(),
                (rs, n) -> new UserPlatformRow(
                        rs.getLong(1), rs.getString(2), rs.getString(3), rs.getLong(4), rs.getLong(5),
                        StoreTime.instant(rs.getTimestamp(6)), StoreTime.instant(rs.getTimestamp(7))
                ));
    }

    // switches between filtered sessions; before, after and permanent read the whole history
    public List<MigrationRow> migrations(QueryContext ctx, CompiledPredicate predicate) {
        String sql = "SELECT m.user_id, m.username, m.from_platform, m.to_platform, m.migration_date, m.prev_started_at, " +
                "(SELECT COUNT(*) FROM playback_events p WHERE p.user_id = m.user_id AND p.platform = m.from_platform " +
                "AND p.started_at < m.migration_date) AS sessions_before, " +
                "(SELECT COUNT(*) FROM playback_events p WHERE p.user_id = m.user_id AND p.platform = m.to_platform " +
                "AND p.started_at >= m.migration_date) AS sessions_after, " +
                "CASE WHEN EXISTS (SELECT 1 FROM playback_events p WHERE p.user_id = m.user_id " +
                "AND p.platform = m.from_platform AND p.started_at > m.migration_date) THEN 0 ELSE 1 END AS permanent " +
                "FROM (" +
                "SELECT us.user_id, us.username, us.prev_platform AS from_platform, us.platform AS to_platform, " +
                "us.started_at AS migration_date, us.prev_started_at " +
                "FROM (" +
                "SELECT user_id, username, platform, started_at, " +
                "LAG(platform) OVER (PARTITION BY user_id ORDER BY started_at, id) AS prev_platform, " +
                "LAG(started_at) OVER (PARTITION BY user_id ORDER BY started_at, id) AS prev_started_at " +
                "FROM playback_events WHERE " + predicate.conjunction() + " AND " + WITH_PLATFORM +
                ") us WHERE us.prev_platform IS NOT NULL AND us.prev_platform <> us.platform" +
                ") m ORDER BY m.migration_date DESC, m.user_id";
        return executor.query(ctx, "platform migration query", sql, predicate.args(),
                (rs, n) -> new MigrationRow(
                        rs.getLong(1), rs.getString(2), rs.getString(3), rs.getString(4),
                        StoreTime.instant(rs.getTimestamp(5)), StoreTime.instant(rs.getTimestamp(6)),
                        rs.getLong(7), rs.getLong(8), rs.getInt(9) == 1
                ));
    }

    public List<DailyUsageRow> dailyUsage(QueryContext ctx, CompiledPredicate predicate) {
        String day = "CAST(started_at AS DATE)";
        String sql = "SELECT " + day + " AS usage_day, platform, user_id, COUNT(*) " +
                "FROM playback_events WHERE " + predicate.conjunction() + " AND " + WITH_PLATFORM + " " +
                "GROUP BY " + day + ", platform, user_id ORDER BY usage_day";
        return executor.query(ctx, "platform adoption query", sql, predicate.args(),
                (rs, n) -> new DailyUsageRow(StoreTime.day(rs.getDate(1)), rs.getString(2), rs.getLong(3), rs.getLong(4)));
    }

    public EventCounts eventCounts(QueryContext ctx, CompiledPredicate predicate) {
        String sql = "SELECT COUNT(*), COUNT(DISTINCT platform) FROM playback_events " +
                "WHERE " + predicate.conjunction() + " AND platform IS NOT NULL AND platform <> ''";
        return executor.queryForObject(ctx, "migration event count", sql, predicate.args(),
                (rs, n) -> new EventCounts(rs.getLong(1), rs.getLong(2)));
    }

    public record UserPlatformRow(long userId, String username, String platform, long sessions,
                                  long watchSeconds, Instant firstUsed, Instant lastUsed) {}

    public record MigrationRow(long userId, String username, String fromPlatform, String toPlatform,
                               Instant migrationDate, Instant previousSessionAt,
                               long sessionsBefore, long sessionsAfter, boolean permanent) {}

    public record DailyUsageRow(LocalDate day, String platform, long userId, long sessions) {}

    public record EventCounts(long events, long platforms) {}
}
