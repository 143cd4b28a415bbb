package com.mediapulse.analytics.quality;

import com.mediapulse.analytics.issue.Issue;
import com.mediapulse.analytics.metrics.TrendDirection;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public class DataQualityModels {
    public record FieldCounts(long nullCount, long invalidCount, long uniqueCount) {}

    public record FieldQualityMetric(String fieldName,
                                     String category,
                                     long totalRecords,
                                     long nullCount,
                                     double nullRate,
                                     long invalidCount,
                                     double invalidRate,
                                     long uniqueCount,
                                     double cardinality,
                                     double qualityScore,
                                     boolean required,
                                     QualityStatus status) {}

    public record DailyQualityTrend(LocalDate date,
                                    long eventCount,
                                    double overallScore,
                                    double nullRate,
                                    double invalidRate) {}

    public record SourceQuality(String source,
                                String serverId,
                                long eventCount,
                                double eventPercentage,
                                double nullRate,
                                double invalidRate,
                                double qualityScore,
                                QualityStatus status) {}

    public record DataQualitySummary(long totalEvents,
                                     double overallScore,
                                     String grade,
                                     double completenessScore,
                                     double validityScore,
                                     double consistencyScore,
                                     double nullFieldRate,
                                     double invalidValueRate,
                                     int issueCount,
                                     int criticalIssueCount,
                                     TrendDirection trendDirection) {}

    public record DataQualityMetadata(String queryHash,
                                      Instant dataRangeStart,
                                      Instant dataRangeEnd,
                                      List<String> analyzedTables,
                                      List<String> rulesApplied,
                                      Instant generatedAt,
                                      long queryTimeMs) {}

    public record DataQualityReport(DataQualitySummary summary,
                                    List<FieldQualityMetric> fieldQuality,
                                    List<DailyQualityTrend> dailyTrends,
                                    List<Issue> issues,
                                    List<SourceQuality> sourceBreakdown,
                                    DataQualityMetadata metadata) {}
}
