package com.mediapulse.analytics.metrics;

public final class Grades {

    private Grades() {}

    public static String qoe(double score) {
        if (score >= 90) return "A";
        if (score >= 80) return "B";
        if (score >= 70) return "C";
        if (score >= 60) return "D";
        return "F";
    }

    public static String dataQuality(double score) {
        if (score >= 95) return "A";
        if (score >= 85) return "B";
        if (score >= 75) return "C";
        if (score >= 65) return "D";
        return "F";
    }
}
