package com.mediapulse.analytics.qoe;

import com.mediapulse.analytics.issue.Issue;

import java.time.Instant;
import java.util.List;

public class QoeModels {
    public record QoeSummary(long totalSessions,
                             long ebvsCount,
                             double ebvsRate,
                             long qualityDegradeCount,
                             double qualityDegradeRate,
                             long transcodeCount,
                             double transcodeRate,
                             long directPlayCount,
                             double directPlayRate,
                             double avgCompletion,
                             double highCompletionRate,
                             double pauseRate,
                             double avgPauseCount,
                             double relayedRate,
                             double secureConnectionRate,
                             double avgBitrateMbps,
                             double bitrateP50Mbps,
                             double bitrateP95Mbps,
                             double qoeScore,
                             String qoeGrade) {}

    public record QoeTrendPoint(Instant timestamp,
                                long sessionCount,
                                double ebvsRate,
                                double qualityDegradeRate,
                                double transcodeRate,
                                double avgCompletion,
                                double avgBitrateMbps,
                                double qoeScore) {}

    public record QoeByPlatform(String platform,
                                long sessionCount,
                                double sessionPercentage,
                                double ebvsRate,
                                double qualityDegradeRate,
                                double transcodeRate,
                                double directPlayRate,
                                double avgCompletion,
                                double avgBitrateMbps,
                                double qoeScore,
                                String qoeGrade) {}

    public record QoeByTranscode(String transcodeDecision,
                                 long sessionCount,
                                 double sessionPercentage,
                                 double ebvsRate,
                                 double avgCompletion,
                                 double avgBitrateMbps,
                                 double qoeScore) {}

    public record QoeMetadata(String queryHash,
                              Instant dataRangeStart,
                              Instant dataRangeEnd,
                              String trendInterval,
                              long eventCount,
                              Instant generatedAt,
                              long queryTimeMs,
                              boolean percentilesAvailable) {}

    public record QoeDashboard(QoeSummary summary,
                               List<QoeTrendPoint> trends,
                               List<QoeByPlatform> byPlatform,
                               List<QoeByTranscode> byTranscodeDecision,
                               List<Issue> topIssues,
                               QoeMetadata metadata) {}
}
