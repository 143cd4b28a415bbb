package com.mediapulse.analytics.repository;

import com.mediapulse.analytics.cohort.CohortModels;
import com.mediapulse.analytics.filter.CompiledPredicate;
import com.mediapulse.analytics.query.AnalyticsQueryExecutor;
import com.mediapulse.analytics.query.QueryContext;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class CohortJdbcRepository {
    private final AnalyticsQueryExecutor executor;

    public CohortJdbcRepository(AnalyticsQueryExecutor executor) {
        this.executor = executor;
    }

    public List<CohortModels.Activity> activity(QueryContext ctx, CompiledPredicate predicate) {
        String sql = "SELECT DISTINCT username, CAST(started_at AS DATE) AS active_day " +
                "FROM playback_events WHERE " + predicate.conjunction() + " " +
                "AND username IS NOT NULL AND started_at IS NOT NULL " +
                "ORDER BY active_day, username";
        return executor.query(ctx, "cohort activity query", sql, predicate.args(),
                (rs, n) -> new CohortModels.Activity(rs.getString(1), StoreTime.day(rs.getDate(2))));
    }

    public long eventCount(QueryContext ctx, CompiledPredicate predicate) {
        return executor.queryForObject(ctx, "cohort event count", "SELECT COUNT(*) FROM playback_events WHERE " + predicate.conjunction(),
                predicate.args(), (rs, n) -> rs.getLong(1));
    }
}
