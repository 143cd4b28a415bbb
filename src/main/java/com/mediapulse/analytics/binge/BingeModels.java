package com.mediapulse.analytics.binge;

import java.time.Instant;
import java.util.List;

public class BingeModels {
    public record EpisodePlay(long userId,
                              String username,
                              String showName,
                              Instant startedAt,
                              Instant previousStartedAt,
                              long playDurationSeconds,
                              double percentComplete) {}

    public record BingeSession(long userId,
                               String username,
                               String showName,
                               int episodeCount,
                               Instant firstEpisodeTime,
                               Instant lastEpisodeTime,
                               double totalDurationMinutes,
                               double avgCompletion) {}

    public record BingeShowStats(String showName, long bingeCount, long totalEpisodes, long uniqueWatchers, double avgEpisodes) {}

    public record BingeUserStats(long userId, String username, long bingeCount, long totalEpisodes,
                                 double avgEpisodes, String favoriteShow) {}

    public record BingesByDayOfWeek(int dayOfWeek, long bingeCount, int avgEpisodes) {}

    public record BingeAnalytics(long totalBingeSessions,
                                 long totalEpisodesBinged,
                                 double avgEpisodesPerBinge,
                                 double avgBingeDurationMinutes,
                                 List<BingeSession> recentBinges,
                                 List<BingeShowStats> topBingeShows,
                                 List<BingeUserStats> topBingeWatchers,
                                 List<BingesByDayOfWeek> bingesByDay) {}
}
