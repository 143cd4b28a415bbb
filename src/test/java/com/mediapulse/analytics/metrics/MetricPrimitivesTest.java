package com.mediapulse.analytics.metrics;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetricPrimitivesTest {

    @Test
    void percentageHandlesZeroDenominatorAndIsUnclamped() {
        assertEquals(0.0, MetricMath.percentage(42, 0));
        assertEquals(0.0, MetricMath.percentage(0, 17));
        assertEquals(100.0, MetricMath.percentage(17, 17));
        assertEquals(150.0, MetricMath.percentage(3, 2));
    }

    @Test
    void aggregatesReturnZeroOnEmptyInput() {
        assertEquals(0.0, MetricMath.average(List.of()));
        assertEquals(0.0, MetricMath.median(List.of()));
        assertEquals(0.0, MetricMath.min(List.of()));
        assertEquals(0.0, MetricMath.max(null));
    }

    @Test
    void medianAveragesMiddlePairOnEvenLength() {
        assertEquals(2.0, MetricMath.median(List.of(3.0, 1.0, 2.0)));
        assertEquals(2.5, MetricMath.median(List.of(4.0, 1.0, 3.0, 2.0)));
        assertEquals(2.0, MetricMath.average(Arrays.asList(1.0, null, 3.0)));
        assertEquals(1.0, MetricMath.min(List.of(3.0, 1.0)));
        assertEquals(3.0, MetricMath.max(List.of(3.0, 1.0)));
    }

    @Test
    void severityUsesInclusiveThresholds() {
        assertEquals(Severity.INFO, Severity.classify(4.99, 5, 10));
        assertEquals(Severity.WARNING, Severity.classify(5, 5, 10));
        assertEquals(Severity.CRITICAL, Severity.classify(10, 5, 10));
        assertEquals("critical", Severity.CRITICAL.label());
    }

    @Test
    void gradeBandsDifferPerModule() {
        assertEquals("A", Grades.qoe(90));
        assertEquals("B", Grades.qoe(89.9));
        assertEquals("D", Grades.qoe(60));
        assertEquals("F", Grades.qoe(59.9));

        assertEquals("B", Grades.dataQuality(90));
        assertEquals("A", Grades.dataQuality(95));
        assertEquals("D", Grades.dataQuality(65));
        assertEquals("F", Grades.dataQuality(64.9));
    }

    @Test
    void trendNeedsToExceedThreshold() {
        assertEquals(TrendDirection.IMPROVING, TrendDirection.of(50, 55.1, 5));
        assertEquals(TrendDirection.STABLE, TrendDirection.of(50, 55, 5));
        assertEquals(TrendDirection.DECLINING, TrendDirection.of(50, 44.9, 5));
        assertEquals("insufficient_data", TrendDirection.INSUFFICIENT_DATA.label());
    }

    @Test
    void queryHashIsDeterministicAndSkipsEmptyParts() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        QueryHash a = QueryHash.forReport("qoe").instant("start", start).instant("end", null).list("users", List.of("alice"));
        QueryHash b = QueryHash.forReport("qoe").instant("start", start).list("users", List.of("alice")).list("platforms", List.of());

        assertEquals("qoe|start=2024-01-01T00:00:00Z|users=[alice]|", a.canonical());
        assertEquals(a.digest(), b.digest());
        assertEquals(16, a.digest().length());
        assertTrue(a.digest().matches("[0-9a-f]{16}"));
        assertNotEquals(a.digest(), QueryHash.forReport("cohort").instant("start", start).list("users", List.of("alice")).digest());
    }
}
