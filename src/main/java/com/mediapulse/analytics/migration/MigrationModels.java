package com.mediapulse.analytics.migration;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public class MigrationModels {
    public record MigrationSummary(long totalUsers,
                                   long multiDeviceUsers,
                                   double multiDevicePercentage,
                                   double avgPlatformsPerUser,
                                   String mostCommonPrimaryPlatform,
                                   String fastestGrowingPlatform,
                                   long totalMigrations) {}

    public record PlatformUsage(String platform,
                                Instant firstUsed,
                                Instant lastUsed,
                                long sessionCount,
                                double totalWatchTimeMinutes,
                                double percentage,
                                boolean primary,
                                boolean active) {}

    public record UserDeviceProfile(long userId,
                                    String username,
                                    int totalPlatformsUsed,
                                    long totalSessions,
                                    Instant firstSeenAt,
                                    Instant lastSeenAt,
                                    long daysSinceFirstSeen,
                                    long daysSinceLastSeen,
                                    boolean multiDevice,
                                    String primaryPlatform,
                                    double primaryPlatformPercentage,
                                    int totalMigrations,
                                    List<PlatformUsage> platformHistory) {}

    public record DeviceMigration(long userId,
                                  String username,
                                  String fromPlatform,
                                  String toPlatform,
                                  Instant migrationDate,
                                  long sessionsBeforeMigration,
                                  long sessionsAfterMigration,
                                  boolean permanentSwitch) {}

    public record PlatformAdoptionTrend(LocalDate period,
                                        String platform,
                                        long newUsers,
                                        long activeUsers,
                                        long sessionCount,
                                        double marketShare) {}

    public record PlatformTransition(String fromPlatform,
                                     String toPlatform,
                                     long transitionCount,
                                     long uniqueUsers,
                                     double avgDaysBeforeSwitch,
                                     double returnRate) {}

    public record PlatformShare(String platform, long sessionCount, long userCount, double percentage) {}

    public record MigrationMetadata(String queryHash,
                                    int migrationWindowDays,
                                    TrendInterval trendInterval,
                                    Instant dataRangeStart,
                                    Instant dataRangeEnd,
                                    long totalEventsAnalyzed,
                                    long uniquePlatformsFound,
                                    Instant generatedAt,
                                    long executionTimeMs) {}

    public record DeviceMigrationReport(MigrationSummary summary,
                                        List<UserDeviceProfile> topUserProfiles,
                                        List<DeviceMigration> recentMigrations,
                                        List<PlatformAdoptionTrend> adoptionTrends,
                                        List<PlatformTransition> commonTransitions,
                                        List<PlatformShare> platformDistribution,
                                        MigrationMetadata metadata) {}
}
