package com.mediapulse.analytics.query;

public record BestEffort<T>(T value, boolean degraded, String failure) {

    public static <T> BestEffort<T> ok(T value) {
        return new BestEffort<>(value, false, null);
    }

    public static <T> BestEffort<T> fallback(T value, String failure) {
        return new BestEffort<>(value, true, failure);
    }
}
