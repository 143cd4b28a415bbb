package com.mediapulse.analytics.binge;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BingeDetectorTest {
    private static final Instant T0 = Instant.parse("2024-06-01T18:00:00Z");

    private final BingeDetector detector = new BingeDetector(Duration.ofHours(4), 3);

    @Test
    void episodesAnHourApartFormOneBinge() {
        List<BingeModels.BingeSession> binges = detector.detect(plays(1, "alice", "Severance", 5, Duration.ofHours(1)));

        assertEquals(1, binges.size());
        BingeModels.BingeSession binge = binges.get(0);
        assertEquals(5, binge.episodeCount());
        assertEquals(T0, binge.firstEpisodeTime());
        assertEquals(T0.plus(Duration.ofHours(4)), binge.lastEpisodeTime());
        assertEquals(250.0, binge.totalDurationMinutes(), 1e-9);
        assertEquals(90.0, binge.avgCompletion(), 1e-9);
    }

    @Test
    void dailyEpisodesAreNotABinge() {
        assertTrue(detector.detect(plays(1, "alice", "Severance", 5, Duration.ofHours(24))).isEmpty());
    }

    @Test
    void gapSplitsSessions() {
        List<BingeModels.EpisodePlay> plays = new ArrayList<>(plays(1, "alice", "Severance", 3, Duration.ofHours(1)));
        Instant later = T0.plus(Duration.ofDays(2));
        Instant previous = plays.get(plays.size() - 1).startedAt();
        for (int i = 0; i < 3; i++) {
            Instant at = later.plus(Duration.ofMinutes(50L * i));
            plays.add(new BingeModels.EpisodePlay(1, "alice", "Severance", at, previous, 3000, 90));
            previous = at;
        }

        assertEquals(2, detector.detect(plays).size());
    }

    @Test
    void differentShowsOrUsersNeverMerge() {
        List<BingeModels.EpisodePlay> plays = new ArrayList<>();
        plays.addAll(plays(1, "alice", "Andor", 2, Duration.ofMinutes(40)));
        plays.addAll(plays(1, "alice", "Severance", 2, Duration.ofMinutes(40)));
        plays.addAll(plays(2, "bob", "Severance", 2, Duration.ofMinutes(40)));

        assertTrue(detector.detect(plays).isEmpty());
    }

    private static List<BingeModels.EpisodePlay> plays(long userId, String user, String show, int count, Duration gap) {
        List<BingeModels.EpisodePlay> plays = new ArrayList<>();
        Instant previous = null;
        for (int i = 0; i < count; i++) {
            Instant at = T0.plus(gap.multipliedBy(i));
            plays.add(new BingeModels.EpisodePlay(userId, user, show, at, previous, 3000, 90));
            previous = at;
        }
        return plays;
    }
}
