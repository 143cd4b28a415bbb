package com.mediapulse.analytics.cohort;

import com.mediapulse.analytics.metrics.TrendDirection;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public class CohortModels {
    public record Activity(String username, LocalDate day) {}

    public record RetentionPoint(int offset, long activeUsers, double retentionRate) {}

    public record CohortData(LocalDate cohortStart,
                             long initialUsers,
                             List<RetentionPoint> retention,
                             double averageRetention,
                             double churnRate) {}

    public record RetentionCurvePoint(int offset,
                                      double averageRetention,
                                      double medianRetention,
                                      double minRetention,
                                      double maxRetention,
                                      int cohortsWithData) {}

    public record CohortSummary(int totalCohorts,
                                long totalUsers,
                                double averageWeek1Retention,
                                double averageWeek4Retention,
                                double averageWeek12Retention,
                                double overallAverageRetention,
                                LocalDate bestCohort,
                                double bestCohortRetention,
                                LocalDate worstCohort,
                                double worstCohortRetention,
                                TrendDirection retentionTrend) {}

    public record CohortMetadata(String queryHash,
                                 Instant dataRangeStart,
                                 Instant dataRangeEnd,
                                 CohortGranularity granularity,
                                 int maxWeeks,
                                 int minCohortSize,
                                 long eventCount,
                                 Instant generatedAt,
                                 long queryTimeMs) {}

    public record CohortRetentionReport(List<CohortData> cohorts,
                                        List<RetentionCurvePoint> retentionCurve,
                                        CohortSummary summary,
                                        CohortMetadata metadata) {}

    public record CohortAnalysis(List<CohortData> cohorts,
                                 List<RetentionCurvePoint> retentionCurve,
                                 CohortSummary summary) {}
}
