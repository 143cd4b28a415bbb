package com.mediapulse.analytics.quality;

import com.fasterxml.jackson.annotation.JsonValue;

public enum QualityStatus {
    HEALTHY("healthy"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String label;

    QualityStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
