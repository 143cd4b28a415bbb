package com.mediapulse.analytics.repository;

import com.mediapulse.analytics.filter.CompiledPredicate;
import com.mediapulse.analytics.quality.DataQualityModels;
import com.mediapulse.analytics.quality.QualityField;
import com.mediapulse.analytics.query.AnalyticsQueryExecutor;
import com.mediapulse.analytics.query.QueryContext;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Repository
public class DataQualityJdbcRepository {
    private static final int DAILY_LIMIT = 30;
    private static final String ROW_NULL = "user_id IS NULL OR username IS NULL OR username = '' OR ip_address IS NULL";
    private static final String ROW_INVALID = "percent_complete < 0 OR percent_complete > 100 OR play_duration < 0";
    private static final List<QualityField> DAILY_REQUIRED = List.of(
            QualityField.USER_ID, QualityField.USERNAME, QualityField.IP_ADDRESS,
            QualityField.STARTED_AT, QualityField.MEDIA_TYPE, QualityField.TITLE);

    private final AnalyticsQueryExecutor executor;

    public DataQualityJdbcRepository(AnalyticsQueryExecutor executor) {
        this.executor = executor;
    }

    public FieldCountsRow fieldCounts(QueryContext ctx, CompiledPredicate predicate, Instant now) {
        StringBuilder select = new StringBuilder("SELECT COUNT(*) AS total_records");
        List<Object> args = new ArrayList<>();
        for (QualityField field : QualityField.values()) {
            String name = field.column();
            select.append(", COALESCE(SUM(CASE WHEN ").append(field.nullCheck()).append(" THEN 1 ELSE 0 END), 0) AS null_").append(name);
            if (field.hasInvalidCheck()) {
                select.append(", COALESCE(SUM(CASE WHEN ").append(field.invalidCheck()).append(" THEN 1 ELSE 0 END), 0) AS invalid_").append(name);
                if (field.bindsNow()) args.add(now);
            }
            if (field.countDistinct()) {
                select.append(", COUNT(DISTINCT ").append(name).append(") AS unique_").append(name);
            }
        }
        select.append(" FROM playback_events WHERE ").append(predicate.conjunction());
        args.addAll(predicate.args());

        return executor.queryForObject(ctx, "field quality query", select.toString(), args, (rs, n) -> {
            Map<QualityField, DataQualityModels.FieldCounts> counts = new EnumMap<>(QualityField.class);
            for (QualityField field : QualityField.values()) {
                String name = field.column();
                counts.put(field, new DataQualityModels.FieldCounts(
                        rs.getLong("null_" + name),
                        field.hasInvalidCheck() ? rs.getLong("invalid_" + name) : 0,
                        field.countDistinct() ? rs.getLong("unique_" + name) : 0));
            }
            return new FieldCountsRow(rs.getLong("total_records"), counts);
        });
    }

    public List<DailyRow> daily(QueryContext ctx, CompiledPredicate predicate, Instant now) {
        String day = "CAST(started_at AS DATE)";
        StringBuilder requiredNulls = new StringBuilder();
        for (QualityField field : DAILY_REQUIRED) {
            if (requiredNulls.length() > 0) requiredNulls.append(" + ");
            requiredNulls.append("SUM(CASE WHEN ").append(field.nullCheck()).append(" THEN 1 ELSE 0 END)");
        }
        String sql = "SELECT " + day + " AS quality_day, COUNT(*), " +
                "COALESCE(" + requiredNulls + ", 0), " +
                "COALESCE(SUM(CASE WHEN percent_complete < 0 OR percent_complete > 100 THEN 1 ELSE 0 END) + " +
                "SUM(CASE WHEN play_duration < 0 THEN 1 ELSE 0 END) + " +
                "SUM(CASE WHEN started_at > ? THEN 1 ELSE 0 END), 0), " +
                "COALESCE(SUM(CASE WHEN " + ROW_NULL + " THEN 1 ELSE 0 END), 0), " +
                "COALESCE(SUM(CASE WHEN " + ROW_INVALID + " OR started_at > ? THEN 1 ELSE 0 END), 0) " +
                "FROM playback_events WHERE " + predicate.conjunction() + " AND started_at IS NOT NULL " +
                "GROUP BY " + day + " ORDER BY quality_day DESC LIMIT " + DAILY_LIMIT;
        List<Object> args = new ArrayList<>();
        args.add(now);
        args.add(now);
        args.addAll(predicate.args());
        return executor.query(ctx, "daily quality query", sql, args,
                (rs, n) -> new DailyRow(StoreTime.day(rs.getDate(1)), rs.getLong(2), rs.getLong(3), rs.getLong(4),
                        rs.getLong(5), rs.getLong(6)));
    }

    public List<SourceRow> sources(QueryContext ctx, CompiledPredicate predicate) {
        String source = "COALESCE(source, 'unknown')";
        String server = "COALESCE(server_id, 'default')";
        String sql = "SELECT " + source + " AS source_name, " + server + " AS server_name, COUNT(*), " +
                "COALESCE(SUM(CASE WHEN " + ROW_NULL + " THEN 1 ELSE 0 END), 0), " +
                "COALESCE(SUM(CASE WHEN " + ROW_INVALID + " THEN 1 ELSE 0 END), 0) " +
                "FROM playback_events WHERE " + predicate.conjunction() + " " +
                "GROUP BY " + source + ", " + server + " ORDER BY COUNT(*) DESC, source_name, server_name";
        return executor.query(ctx, "source quality query", sql, predicate.args(),
                (rs, n) -> new SourceRow(rs.getString(1), rs.getString(2), rs.getLong(3), rs.getLong(4), rs.getLong(5)));
    }

    public record FieldCountsRow(long total, Map<QualityField, DataQualityModels.FieldCounts> counts) {}

    public record DailyRow(LocalDate day, long events, long requiredNulls, long invalidValues,
                           long rowsWithNulls, long rowsWithInvalid) {}

    public record SourceRow(String source, String serverId, long events, long rowsWithNulls, long rowsWithInvalid) {}
}
