package com.mediapulse.analytics.quality;

import com.mediapulse.analytics.metrics.Grades;
import com.mediapulse.analytics.metrics.MetricMath;
import com.mediapulse.analytics.metrics.TrendDirection;

import java.util.List;

/** Scores, statuses and the summary roll-up of the data-quality report. */
public final class DataQualityScoring {
    static final double CONSISTENCY_SCORE = 95.0;
    static final int TREND_WINDOW_DAYS = 7;
    static final double TREND_THRESHOLD = 3.0;
    static final int DAILY_REQUIRED_FIELDS = 6;

    private DataQualityScoring() {}

    public static DataQualityModels.FieldQualityMetric field(QualityField field, long total, DataQualityModels.FieldCounts counts) {
        double nullRate = MetricMath.percentage(counts.nullCount(), total);
        double invalidRate = MetricMath.percentage(counts.invalidCount(), total);
        long nonNull = total - counts.nullCount();
        double cardinality = nonNull > 0 && counts.uniqueCount() > 0 ? (double) counts.uniqueCount() / nonNull : 0.0;

        double nullPenalty = field.required() ? nullRate * 2 : nullRate;
        double score = Math.max(0.0, 100.0 - (nullPenalty + invalidRate * 2));

        return new DataQualityModels.FieldQualityMetric(field.column(), field.category(), total,
                counts.nullCount(), nullRate, counts.invalidCount(), invalidRate, counts.uniqueCount(), cardinality,
                score, field.required(), fieldStatus(field.required(), nullRate, invalidRate));
    }

    /**
     * Any null in a required field is critical regardless of rate. The two warning
     * bands both map to {@code warning}; the stricter one is kept so a future
     * distinct label only needs a change here.
     */
    public static QualityStatus fieldStatus(boolean required, double nullRate, double invalidRate) {
        if (required && nullRate > 0) return QualityStatus.CRITICAL;
        if (nullRate > 10 || invalidRate > 5) return QualityStatus.WARNING;
        if (nullRate > 5 || invalidRate > 2) return QualityStatus.WARNING;
        return QualityStatus.HEALTHY;
    }

    public static double dayScore(long events, long requiredNulls, long invalidValues) {
        if (events == 0) return 100.0;
        double nullPenalty = (double) requiredNulls / (events * DAILY_REQUIRED_FIELDS) * 100.0 * 2;
        double invalidPenalty = (double) invalidValues / events * 100.0 * 3;
        return MetricMath.clamp(100.0 - (nullPenalty + invalidPenalty), 0.0, 100.0);
    }

    public static double sourceScore(double nullRate, double invalidRate) {
        return Math.max(0.0, 100.0 - (nullRate * 2 + invalidRate * 3));
    }

    public static QualityStatus sourceStatus(double nullRate, double invalidRate) {
        if (nullRate > 5 || invalidRate > 2) return QualityStatus.CRITICAL;
        if (nullRate > 2 || invalidRate > 1) return QualityStatus.WARNING;
        return QualityStatus.HEALTHY;
    }

    /** Mean of the newest 7 days against the mean of up to 7 days before them. */
    public static TrendDirection trend(List<DataQualityModels.DailyQualityTrend> newestFirst) {
        if (newestFirst.size() < TREND_WINDOW_DAYS) return TrendDirection.INSUFFICIENT_DATA;
        List<Double> scores = newestFirst.stream().map(DataQualityModels.DailyQualityTrend::overallScore).toList();
        List<Double> older = scores.subList(TREND_WINDOW_DAYS, Math.min(scores.size(), TREND_WINDOW_DAYS * 2));
        if (older.isEmpty()) return TrendDirection.STABLE;
        return TrendDirection.of(MetricMath.average(older),
                MetricMath.average(scores.subList(0, TREND_WINDOW_DAYS)), TREND_THRESHOLD);
    }

    public static DataQualityModels.DataQualitySummary summary(long totalEvents,
                                                               List<DataQualityModels.FieldQualityMetric> fields,
                                                               List<DataQualityModels.DailyQualityTrend> daily) {
        double completeness = MetricMath.average(fields.stream().map(f -> 100.0 - f.nullRate()).toList());
        double validity = MetricMath.average(fields.stream().map(f -> 100.0 - f.invalidRate()).toList());
        double overall = completeness * 0.4 + validity * 0.4 + CONSISTENCY_SCORE * 0.2;

        long nulls = fields.stream().mapToLong(DataQualityModels.FieldQualityMetric::nullCount).sum();
        long invalid = fields.stream().mapToLong(DataQualityModels.FieldQualityMetric::invalidCount).sum();
        double cells = (double) totalEvents * fields.size();
        int critical = (int) fields.stream().filter(f -> f.status() == QualityStatus.CRITICAL).count();
        int warnings = (int) fields.stream().filter(f -> f.status() == QualityStatus.WARNING).count();

        return new DataQualityModels.DataQualitySummary(totalEvents, overall, Grades.dataQuality(overall),
                completeness, validity, CONSISTENCY_SCORE,
                MetricMath.percentage(nulls, cells), MetricMath.percentage(invalid, cells),
                critical + warnings, critical, trend(daily));
    }
}
