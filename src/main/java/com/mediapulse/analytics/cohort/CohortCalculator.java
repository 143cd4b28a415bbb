package com.mediapulse.analytics.cohort;

import com.mediapulse.analytics.metrics.MetricMath;
import com.mediapulse.analytics.metrics.TrendDirection;

import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Builds retention cohorts from distinct (user, active day) pairs.
 *
 * <p>A user's cohort is the period of their first activity. Offsets run from 0
 * to {@code maxOffsets} but never past the last period that has any activity.
 */
public final class CohortCalculator {
    static final double TREND_THRESHOLD = 5.0;
    static final int MIN_COHORTS_FOR_TREND = 4;

    private final CohortGranularity granularity;
    private final int maxOffsets;
    private final int minCohortSize;

    public CohortCalculator(CohortGranularity granularity, int maxOffsets, int minCohortSize) {
        this.granularity = granularity;
        this.maxOffsets = maxOffsets;
        this.minCohortSize = minCohortSize;
    }

    public CohortModels.CohortAnalysis analyze(List<CohortModels.Activity> activity) {
        Map<String, Set<LocalDate>> periodsByUser = new HashMap<>();
        LocalDate horizon = null;
        for (CohortModels.Activity a : activity) {
            if (a.username() == null || a.day() == null) continue;
            LocalDate period = granularity.periodStart(a.day());
            periodsByUser.computeIfAbsent(a.username(), k -> new TreeSet<>()).add(period);
            if (horizon == null || period.isAfter(horizon)) horizon = period;
        }

        Map<LocalDate, List<Set<LocalDate>>> usersByCohort = new TreeMap<>();
        periodsByUser.values().forEach(periods ->
                usersByCohort.computeIfAbsent(periods.iterator().next(), k -> new ArrayList<>()).add(periods));

        List<CohortModels.CohortData> cohorts = new ArrayList<>();
        for (var entry : usersByCohort.entrySet()) {
            if (entry.getValue().size() < minCohortSize) continue;
            cohorts.add(cohort(entry.getKey(), entry.getValue(), horizon));
        }

        List<CohortModels.RetentionCurvePoint> curve = curve(cohorts);
        return new CohortModels.CohortAnalysis(cohorts, curve, summary(cohorts));
    }

    private CohortModels.CohortData cohort(LocalDate start, List<Set<LocalDate>> members, LocalDate horizon) {
        int lastOffset = Math.min(maxOffsets, granularity.offset(start, horizon));
        long initial = members.size();
        List<CohortModels.RetentionPoint> points = new ArrayList<>();
        for (int k = 0; k <= lastOffset; k++) {
            LocalDate period = granularity.plus(start, k);
            long active = members.stream().filter(p -> p.contains(period)).count();
            points.add(new CohortModels.RetentionPoint(k, active, MetricMath.percentage(active, initial)));
        }
        List<Double> later = points.stream()
                .filter(p -> p.offset() > 0)
                .map(CohortModels.RetentionPoint::retentionRate)
                .toList();
        double average = MetricMath.average(later);
        return new CohortModels.CohortData(start, initial, points, average, 100.0 - average);
    }

    private List<CohortModels.RetentionCurvePoint> curve(List<CohortModels.CohortData> cohorts) {
        List<CohortModels.RetentionCurvePoint> curve = new ArrayList<>();
        for (int k = 0; k <= maxOffsets; k++) {
            List<Double> rates = retentionAt(cohorts, k);
            if (rates.isEmpty()) continue;
            curve.add(new CohortModels.RetentionCurvePoint(k,
                    MetricMath.average(rates), MetricMath.median(rates),
                    MetricMath.min(rates), MetricMath.max(rates), rates.size()));
        }
        return curve;
    }

    private CohortModels.CohortSummary summary(List<CohortModels.CohortData> cohorts) {
        long users = cohorts.stream().mapToLong(CohortModels.CohortData::initialUsers).sum();
        double overall = MetricMath.average(cohorts.stream().map(CohortModels.CohortData::averageRetention).toList());

        Optional<CohortModels.CohortData> best = cohorts.stream()
                .max(Comparator.comparingDouble(CohortModels.CohortData::averageRetention));
        Optional<CohortModels.CohortData> worst = cohorts.stream()
                .min(Comparator.comparingDouble(CohortModels.CohortData::averageRetention));

        return new CohortModels.CohortSummary(
                cohorts.size(),
                users,
                MetricMath.average(retentionAt(cohorts, 1)),
                MetricMath.average(retentionAt(cohorts, 4)),
                MetricMath.average(retentionAt(cohorts, 12)),
                overall,
                best.map(CohortModels.CohortData::cohortStart).orElse(null),
                best.map(CohortModels.CohortData::averageRetention).orElse(0.0),
                worst.map(CohortModels.CohortData::cohortStart).orElse(null),
                worst.map(CohortModels.CohortData::averageRetention).orElse(0.0),
                trend(cohorts));
    }

    /** First half of cohorts (by start) against the second half; fewer than 4 cohorts is not enough. */
    static TrendDirection trend(List<CohortModels.CohortData> cohorts) {
        if (cohorts.size() < MIN_COHORTS_FOR_TREND) return TrendDirection.INSUFFICIENT_DATA;
        List<Double> ordered = cohorts.stream()
                .sorted(Comparator.comparing(CohortModels.CohortData::cohortStart))
                .map(CohortModels.CohortData::averageRetention)
                .toList();
        int half = ordered.size() / 2;
        return TrendDirection.of(
                MetricMath.average(ordered.subList(0, half)),
                MetricMath.average(ordered.subList(half, ordered.size())),
                TREND_THRESHOLD);
    }

    private static List<Double> retentionAt(List<CohortModels.CohortData> cohorts, int offset) {
        return cohorts.stream()
                .flatMap(c -> c.retention().stream())
                .filter(p -> p.offset() == offset)
                .map(CohortModels.RetentionPoint::retentionRate)
                .collect(Collectors.toList());
    }
}
