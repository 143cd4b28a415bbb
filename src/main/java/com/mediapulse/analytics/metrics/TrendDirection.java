package com.mediapulse.analytics.metrics;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendDirection {
    IMPROVING("improving"),
    DECLINING("declining"),
    STABLE("stable"),
    INSUFFICIENT_DATA("insufficient_data");

    private final String label;

    TrendDirection(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static TrendDirection of(double earlier, double later, double threshold) {
        double diff = later - earlier;
        if (diff > threshold) return IMPROVING;
        if (diff < -threshold) return DECLINING;
        return STABLE;
    }
}
