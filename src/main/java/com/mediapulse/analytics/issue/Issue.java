package com.mediapulse.analytics.issue;

import com.mediapulse.analytics.metrics.Severity;

public record Issue(String type,
                    Severity severity,
                    String title,
                    String description,
                    long affectedRecords,
                    double impactPercentage,
                    String recommendation,
                    String relatedDimension) {

    public Issue(String type, Severity severity, String title, String description,
                 long affectedRecords, double impactPercentage, String recommendation) {
        this(type, severity, title, description, affectedRecords, impactPercentage, recommendation, null);
    }
}
