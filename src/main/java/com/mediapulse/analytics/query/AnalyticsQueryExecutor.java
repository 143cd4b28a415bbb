package com.mediapulse.analytics.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

@Component
public class AnalyticsQueryExecutor {
    private static final Logger log = LoggerFactory.getLogger(AnalyticsQueryExecutor.class);

    private final JdbcTemplate jdbcTemplate;

    public AnalyticsQueryExecutor(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public <T> List<T> query(QueryContext ctx, String operation, String sql, List<Object> args, RowMapper<T> mapper) {
        ctx.ensureActive(operation);
        List<PreparedStatement> issued = new ArrayList<>(1);
        try {
            return jdbcTemplate.query(creator(ctx, sql, args, issued), mapper);
        } catch (DataAccessException e) {
            if (ctx.isCancelled() || ctx.isExpired()) {
                throw new AnalyticsQueryException(operation, "query interrupted by context: " + e.getMostSpecificCause().getMessage());
            }
            throw new AnalyticsQueryException(operation, e.getMostSpecificCause());
        } finally {
            issued.forEach(ctx::unregister);
        }
    }

    public <T> T queryForObject(QueryContext ctx, String operation, String sql, List<Object> args, RowMapper<T> mapper) {
        List<T> rows = query(ctx, operation, sql, args, mapper);
        if (rows.isEmpty()) throw new AnalyticsQueryException(operation, "no rows returned");
        return rows.get(0);
    }

    public <T> BestEffort<T> bestEffort(String operation, T fallback, Supplier<T> query) {
        try {
            T value = query.get();
            return BestEffort.ok(value == null ? fallback : value);
        } catch (RuntimeException e) {
            log.warn("Best-effort query '{}' failed, using fallback: {}", operation, e.getMessage());
            return BestEffort.fallback(fallback, e.getMessage());
        }
    }

    private PreparedStatementCreator creator(QueryContext ctx, String sql, List<Object> args, List<PreparedStatement> issued) {
        Object[] bound = args.stream().map(AnalyticsQueryExecutor::toJdbc).toArray();
        return con -> {
            PreparedStatement ps = con.prepareStatement(sql);
            ps.setQueryTimeout(ctx.remainingSeconds());
            new ArgumentPreparedStatementSetter(bound).setValues(ps);
            issued.add(ps);
            ctx.register(ps);
            return ps;
        };
    }

    static Object toJdbc(Object value) {
        if (value instanceof Instant instant) return Timestamp.from(instant);
        return value;
    }
}
