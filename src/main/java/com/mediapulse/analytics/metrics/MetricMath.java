package com.mediapulse.analytics.metrics;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

public final class MetricMath {

    private MetricMath() {}

    public static double percentage(double numerator, double denominator) {
        if (denominator == 0) return 0.0;
        return numerator / denominator * 100.0;
    }

    public static double ratio(double numerator, double denominator) {
        if (denominator == 0) return 0.0;
        return numerator / denominator;
    }

    public static double average(Collection<Double> values) {
        return clean(values).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    public static double median(Collection<Double> values) {
        List<Double> sorted = clean(values).stream().sorted().toList();
        int n = sorted.size();
        if (n == 0) return 0.0;
        if (n % 2 == 1) return sorted.get(n / 2);
        return (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }

    public static double min(Collection<Double> values) {
        return clean(values).stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
    }

    public static double max(Collection<Double> values) {
        return clean(values).stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }

    public static double clamp(double value, double low, double high) {
        return Math.max(low, Math.min(high, value));
    }

    private static List<Double> clean(Collection<Double> values) {
        if (values == null) return List.of();
        return values.stream().filter(Objects::nonNull).toList();
    }
}
