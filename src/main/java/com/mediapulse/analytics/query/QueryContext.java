package com.mediapulse.analytics.query;

import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deadline and cancellation for one report call. Statements issued under the
 * context get the remaining time as their JDBC query timeout, and
 * {@link #cancel()} forwards to every statement still running.
 */
public final class QueryContext {
    private final Instant deadline;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Set<Statement> running = ConcurrentHashMap.newKeySet();

    private QueryContext(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    public static QueryContext withTimeout(Duration timeout, Clock clock) {
        return new QueryContext(clock.instant().plus(timeout), clock);
    }

    public static QueryContext withDeadline(Instant deadline, Clock clock) {
        return new QueryContext(deadline, clock);
    }

    public Instant deadline() {
        return deadline;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(deadline);
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) return;
        for (Statement statement : running) {
            try {
                statement.cancel();
            } catch (SQLException ignored) {
                // statement already finished or driver cannot cancel; the timeout still applies
            }
        }
    }

    public void ensureActive(String operation) {
        if (isCancelled()) throw new AnalyticsQueryException(operation, "query context cancelled");
        if (isExpired()) throw new AnalyticsQueryException(operation, "query deadline exceeded");
    }

    /** Whole seconds left before the deadline, never below 1 (0 would mean "no timeout" to JDBC). */
    public int remainingSeconds() {
        long millis = Duration.between(clock.instant(), deadline).toMillis();
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, (millis + 999) / 1000));
    }

    void register(Statement statement) {
        running.add(statement);
        if (isCancelled()) {
            try {
                statement.cancel();
            } catch (SQLException ignored) {
                // cancellation is best effort
            }
        }
    }

    void unregister(Statement statement) {
        running.remove(statement);
    }
}
