package com.mediapulse.analytics.repository;

import com.mediapulse.analytics.binge.BingeModels;
import com.mediapulse.analytics.filter.CompiledPredicate;
import com.mediapulse.analytics.query.AnalyticsQueryExecutor;
import com.mediapulse.analytics.query.QueryContext;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class BingeJdbcRepository {
    private final AnalyticsQueryExecutor executor;

    public BingeJdbcRepository(AnalyticsQueryExecutor executor) {
        this.executor = executor;
    }

    public List<BingeModels.EpisodePlay> episodePlays(QueryContext ctx, CompiledPredicate predicate) {
        String sql = "SELECT user_id, username, grandparent_title, started_at, COALESCE(play_duration, 0), " +
                "COALESCE(percent_complete, 0), " +
                "LAG(started_at) OVER (PARTITION BY user_id, grandparent_title ORDER BY started_at, id) AS prev_started_at " +
                "FROM playback_events WHERE " + predicate.conjunction() + " " +
                "AND media_type = 'episode' AND user_id IS NOT NULL AND started_at IS NOT NULL " +
                "AND grandparent_title IS NOT NULL AND grandparent_title <> '' " +
                "ORDER BY user_id, grandparent_title, started_at, id";
        return executor.query(ctx, "binge episode query", sql, predicate.args(),
                (rs, n) -> new BingeModels.EpisodePlay(
                        rs.getLong(1), rs.getString(2), rs.getString(3),
                        StoreTime.instant(rs.getTimestamp(4)), StoreTime.instant(rs.getTimestamp(7)),
                        rs.getLong(5), rs.getDouble(6)
                ));
    }
}
