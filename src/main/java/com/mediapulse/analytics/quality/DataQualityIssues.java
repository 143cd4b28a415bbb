package com.mediapulse.analytics.quality;

import com.mediapulse.analytics.issue.Issue;
import com.mediapulse.analytics.issue.IssueGenerator;
import com.mediapulse.analytics.metrics.Severity;

import java.util.List;

final class DataQualityIssues {
    static final double OVERALL_TARGET = 80;

    private DataQualityIssues() {}

    static List<Issue> detect(List<DataQualityModels.FieldQualityMetric> fields, DataQualityModels.DataQualitySummary summary) {
        IssueGenerator issues = IssueGenerator.create();
        for (DataQualityModels.FieldQualityMetric f : fields) {
            String name = f.fieldName();
            issues.when(f.required() && f.nullCount() > 0, () -> new Issue(
                    "null_required",
                    Severity.CRITICAL,
                    "Missing required field: " + name,
                    String.format("%.1f%% of records (%d) have null/empty %s", f.nullRate(), f.nullCount(), name),
                    f.nullCount(), f.nullRate(),
                    "Investigate the data source for missing " + name + " values",
                    "field:" + name));
            issues.whenAbove(f.invalidCount(), 0, () -> new Issue(
                    "invalid_value",
                    Severity.classify(f.invalidRate(), 1, 5),
                    "Invalid values in " + name,
                    String.format("%.1f%% of records (%d) have invalid %s values", f.invalidRate(), f.invalidCount(), name),
                    f.invalidCount(), f.invalidRate(),
                    "Review data validation for the " + name + " field",
                    "field:" + name));
        }
        issues.whenBelow(summary.overallScore(), OVERALL_TARGET, () -> new Issue(
                "low_quality",
                Severity.classify(100 - summary.overallScore(), 10, 25),
                "Overall Data Quality Below Target",
                String.format("Overall quality score is %.1f%% (target: 80%%+)", summary.overallScore()),
                summary.totalEvents(), 100 - summary.overallScore(),
                "Review the data pipeline and source integrations"));
        return issues.issues();
    }
}
