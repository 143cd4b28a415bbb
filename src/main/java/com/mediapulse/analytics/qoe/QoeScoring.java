package com.mediapulse.analytics.qoe;

import com.mediapulse.analytics.metrics.MetricMath;

public final class QoeScoring {
    static final double EBVS_WEIGHT = 5.0;
    static final double DEGRADE_WEIGHT = 2.0;
    static final double PAUSE_WEIGHT = 1.0;
    static final double COMPLETION_WEIGHT = 0.3;

    private QoeScoring() {}

    public static double score(double ebvsRate, double degradeRate, double pauseRate, double avgCompletion) {
        double penalty = ebvsRate * EBVS_WEIGHT
                + degradeRate * DEGRADE_WEIGHT
                + pauseRate * PAUSE_WEIGHT
                + (100.0 - avgCompletion) * COMPLETION_WEIGHT;
        return MetricMath.clamp(100.0 - penalty, 0.0, 100.0);
    }

    public static double score(double ebvsRate, double degradeRate, double avgCompletion) {
        return score(ebvsRate, degradeRate, 0.0, avgCompletion);
    }

    public static double score(double ebvsRate, double avgCompletion) {
        return score(ebvsRate, 0.0, 0.0, avgCompletion);
    }
}
