package com.mediapulse.analytics.metrics;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    INFO("info"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Severity classify(double value, double warning, double critical) {
        if (value >= critical) return CRITICAL;
        if (value >= warning) return WARNING;
        return INFO;
    }
}
