package com.mediapulse.analytics.binge;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class BingeDetector {
    private final Duration maxGap;
    private final int minEpisodes;

    public BingeDetector(Duration maxGap, int minEpisodes) {
        this.maxGap = maxGap;
        this.minEpisodes = minEpisodes;
    }

    public List<BingeModels.BingeSession> detect(List<BingeModels.EpisodePlay> plays) {
        List<BingeModels.BingeSession> binges = new ArrayList<>();
        List<BingeModels.EpisodePlay> current = new ArrayList<>();
        for (BingeModels.EpisodePlay play : plays) {
            if (!current.isEmpty() && startsNewSession(current.get(current.size() - 1), play)) {
                close(current, binges);
            }
            current.add(play);
        }
        close(current, binges);
        return binges;
    }

    private boolean startsNewSession(BingeModels.EpisodePlay last, BingeModels.EpisodePlay play) {
        if (last.userId() != play.userId() || !Objects.equals(last.showName(), play.showName())) return true;
        if (play.previousStartedAt() == null) return true;
        return Duration.between(play.previousStartedAt(), play.startedAt()).compareTo(maxGap) > 0;
    }

    private void close(List<BingeModels.EpisodePlay> session, List<BingeModels.BingeSession> out) {
        if (session.size() >= minEpisodes) {
            BingeModels.EpisodePlay first = session.get(0);
            BingeModels.EpisodePlay last = session.get(session.size() - 1);
            long seconds = session.stream().mapToLong(BingeModels.EpisodePlay::playDurationSeconds).sum();
            double completion = session.stream().mapToDouble(BingeModels.EpisodePlay::percentComplete).average().orElse(0.0);
            out.add(new BingeModels.BingeSession(first.userId(), first.username(), first.showName(), session.size(),
                    first.startedAt(), last.startedAt(), seconds / 60.0, completion));
        }
        session.clear();
    }
}
