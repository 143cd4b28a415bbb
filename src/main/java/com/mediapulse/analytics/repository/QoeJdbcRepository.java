package com.mediapulse.analytics.repository;

import com.mediapulse.analytics.filter.CompiledPredicate;
import com.mediapulse.analytics.query.AnalyticsQueryExecutor;
import com.mediapulse.analytics.query.QueryContext;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class QoeJdbcRepository {
    static final String EBVS =
            "CASE WHEN percent_complete = 0 AND COALESCE(play_duration, 0) < 10 THEN 1 ELSE 0 END";
    static final String DEGRADED =
            "CASE WHEN video_resolution IS NOT NULL AND stream_video_resolution IS NOT NULL AND (" +
                    "(video_resolution = '4k' AND stream_video_resolution IN ('1080', '720', '480', 'sd')) OR " +
                    "(video_resolution = '1080' AND stream_video_resolution IN ('720', '480', 'sd')) OR " +
                    "(video_resolution = '720' AND stream_video_resolution IN ('480', 'sd')) OR " +
                    "(video_resolution = '480' AND stream_video_resolution = 'sd')" +
                    ") THEN 1 ELSE 0 END";
    static final String TRANSCODE = "CASE WHEN LOWER(transcode_decision) = 'transcode' THEN 1 ELSE 0 END";
    static final String DIRECT_PLAY = "CASE WHEN LOWER(transcode_decision) = 'direct play' THEN 1 ELSE 0 END";
    static final String COMPLETION = "CAST(percent_complete AS DOUBLE PRECISION)";
    static final String BITRATE = "CASE WHEN stream_bitrate > 0 THEN CAST(stream_bitrate AS DOUBLE PRECISION) ELSE NULL END";

    private static final int PLATFORM_LIMIT = 20;

    private final AnalyticsQueryExecutor executor;

    public QoeJdbcRepository(AnalyticsQueryExecutor executor) {
        this.executor = executor;
    }

    public SummaryRow summary(QueryContext ctx, CompiledPredicate predicate) {
        String sql = "SELECT COUNT(*), " +
                "COALESCE(SUM(" + EBVS + "), 0), " +
                "COALESCE(SUM(" + DEGRADED + "), 0), " +
                "COALESCE(SUM(" + TRANSCODE + "), 0), " +
                "COALESCE(SUM(" + DIRECT_PLAY + "), 0), " +
                "COALESCE(AVG(" + COMPLETION + "), 0), " +
                "COALESCE(SUM(CASE WHEN percent_complete >= 80 THEN 1 ELSE 0 END), 0), " +
                "COALESCE(SUM(CASE WHEN paused_counter > 0 THEN 1 ELSE 0 END), 0), " +
                "COALESCE(AVG(CAST(COALESCE(paused_counter, 0) AS DOUBLE PRECISION)), 0), " +
                "COALESCE(SUM(CASE WHEN relayed = TRUE THEN 1 ELSE 0 END), 0), " +
                "COALESCE(SUM(CASE WHEN secure = TRUE THEN 1 ELSE 0 END), 0), " +
                "COALESCE(AVG(" + BITRATE + "), 0) " +
                "FROM playback_events WHERE " + predicate.conjunction();
        return executor.queryForObject(ctx, "QoE summary query", sql, predicate.args(),
                (rs, n) -> new SummaryRow(
                        rs.getLong(1), rs.getLong(2), rs.getLong(3), rs.getLong(4), rs.getLong(5),
                        rs.getDouble(6), rs.getLong(7), rs.getLong(8), rs.getDouble(9),
                        rs.getLong(10), rs.getLong(11), rs.getDouble(12)
                ));
    }

    public BitratePercentiles bitratePercentiles(QueryContext ctx, CompiledPredicate predicate) {
        String sql = "SELECT " +
                "PERCENTILE_CONT(0.5) WITHIN GROUP (ORDER BY stream_bitrate), " +
                "PERCENTILE_CONT(0.95) WITHIN GROUP (ORDER BY stream_bitrate) " +
                "FROM playback_events WHERE " + predicate.conjunction() + " AND stream_bitrate > 0";
        return executor.queryForObject(ctx, "QoE bitrate percentile query", sql, predicate.args(),
                (rs, n) -> new BitratePercentiles(rs.getDouble(1), rs.getDouble(2)));
    }

    public List<TrendRow> trend(QueryContext ctx, CompiledPredicate predicate, boolean hourly) {
        String day = "CAST(started_at AS DATE)";
        String hour = hourly ? "EXTRACT(HOUR FROM started_at)" : "0";
        String groupBy = hourly ? day + ", EXTRACT(HOUR FROM started_at)" : day;
        String sql = "SELECT " + day + " AS bucket_day, " + hour + " AS bucket_hour, COUNT(*), " +
                "COALESCE(SUM(" + EBVS + "), 0), " +
                "COALESCE(SUM(" + DEGRADED + "), 0), " +
                "COALESCE(SUM(" + TRANSCODE + "), 0), " +
                "COALESCE(AVG(" + COMPLETION + "), 0), " +
                "COALESCE(AVG(" + BITRATE + "), 0) " +
                "FROM playback_events WHERE " + predicate.conjunction() + " " +
                "GROUP BY " + groupBy + " ORDER BY bucket_day, bucket_hour";
        return executor.query(ctx, "QoE trends query", sql, predicate.args(),
                (rs, n) -> new TrendRow(
                        StoreTime.startOf(StoreTime.day(rs.getDate(1)), rs.getInt(2)),
                        rs.getLong(3), rs.getLong(4), rs.getLong(5), rs.getLong(6),
                        rs.getDouble(7), rs.getDouble(8)
                ));
    }

    public List<PlatformRow> byPlatform(QueryContext ctx, CompiledPredicate predicate) {
        String platform = "COALESCE(platform, 'Unknown')";
        String sql = "SELECT " + platform + " AS platform_name, COUNT(*) AS session_count, " +
                "COALESCE(SUM(" + EBVS + "), 0), " +
                "COALESCE(SUM(" + DEGRADED + "), 0), " +
                "COALESCE(SUM(" + TRANSCODE + "), 0), " +
                "COALESCE(SUM(" + DIRECT_PLAY + "), 0), " +
                "COALESCE(AVG(" + COMPLETION + "), 0), " +
                "COALESCE(AVG(" + BITRATE + "), 0) " +
                "FROM playback_events WHERE " + predicate.conjunction() + " " +
                "GROUP BY " + platform + " " +
                "ORDER BY session_count DESC, platform_name LIMIT " + PLATFORM_LIMIT;
        return executor.query(ctx, "QoE platform query", sql, predicate.args(),
                (rs, n) -> new PlatformRow(
                        rs.getString(1), rs.getLong(2), rs.getLong(3), rs.getLong(4),
                        rs.getLong(5), rs.getLong(6), rs.getDouble(7), rs.getDouble(8)
                ));
    }

    public List<TranscodeRow> byTranscodeDecision(QueryContext ctx, CompiledPredicate predicate) {
        String decision = "COALESCE(LOWER(transcode_decision), 'unknown')";
        String sql = "SELECT " + decision + " AS decision, COUNT(*) AS session_count, " +
                "COALESCE(SUM(" + EBVS + "), 0), " +
                "COALESCE(AVG(" + COMPLETION + "), 0), " +
                "COALESCE(AVG(" + BITRATE + "), 0) " +
                "FROM playback_events WHERE " + predicate.conjunction() + " " +
                "GROUP BY " + decision + " " +
                "ORDER BY session_count DESC, decision";
        return executor.query(ctx, "QoE transcode query", sql, predicate.args(),
                (rs, n) -> new TranscodeRow(
                        rs.getString(1), rs.getLong(2), rs.getLong(3), rs.getDouble(4), rs.getDouble(5)
                ));
    }

    public record SummaryRow(long sessions, long ebvs, long degraded, long transcoded, long directPlay,
                             double avgCompletion, long highCompletion, long paused, double avgPauseCount,
                             long relayed, long secure, double avgBitrateKbps) {}

    public record BitratePercentiles(double p50Kbps, double p95Kbps) {}

    public record TrendRow(Instant bucket, long sessions, long ebvs, long degraded, long transcoded,
                           double avgCompletion, double avgBitrateKbps) {}

    public record PlatformRow(String platform, long sessions, long ebvs, long degraded,
                              long transcoded, long directPlay, double avgCompletion, double avgBitrateKbps) {}

    public record TranscodeRow(String decision, long sessions, long ebvs,
                               double avgCompletion, double avgBitrateKbps) {}
}
