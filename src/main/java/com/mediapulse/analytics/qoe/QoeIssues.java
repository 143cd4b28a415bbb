package com.mediapulse.analytics.qoe;

import com.mediapulse.analytics.issue.Issue;
import com.mediapulse.analytics.issue.IssueGenerator;
import com.mediapulse.analytics.metrics.Severity;

import java.util.List;

final class QoeIssues {
    static final double EBVS_TRIGGER = 5;
    static final double DEGRADE_TRIGGER = 20;
    static final double TRANSCODE_TRIGGER = 50;
    static final double PAUSE_TRIGGER = 30;
    static final double COMPLETION_FLOOR = 50;
    static final double PLATFORM_EBVS_TRIGGER = 10;
    static final long PLATFORM_MIN_SESSIONS = 50;

    private QoeIssues() {}

    static List<Issue> detect(QoeModels.QoeSummary s, List<QoeModels.QoeByPlatform> platforms) {
        IssueGenerator issues = IssueGenerator.create()
                .whenAbove(s.ebvsRate(), EBVS_TRIGGER, () -> new Issue(
                        "high_ebvs",
                        Severity.classify(s.ebvsRate(), 5, 10),
                        "High Exit Before Video Starts Rate",
                        String.format("%.1f%% of sessions exit before video starts (%d sessions)", s.ebvsRate(), s.ebvsCount()),
                        s.ebvsCount(), s.ebvsRate(),
                        "Check server startup time, network latency, and client application performance"))
                .whenAbove(s.qualityDegradeRate(), DEGRADE_TRIGGER, () -> new Issue(
                        "quality_degradation",
                        Severity.classify(s.qualityDegradeRate(), 20, 40),
                        "High Quality Degradation Rate",
                        String.format("%.1f%% of sessions experience quality reduction (%d sessions)", s.qualityDegradeRate(), s.qualityDegradeCount()),
                        s.qualityDegradeCount(), s.qualityDegradeRate(),
                        "Consider optimizing the library for common device capabilities or upgrading network bandwidth"))
                .whenAbove(s.transcodeRate(), TRANSCODE_TRIGGER, () -> new Issue(
                        "high_transcode",
                        Severity.classify(s.transcodeRate(), 50, 75),
                        "High Transcoding Rate",
                        String.format("%.1f%% of sessions require transcoding (%d sessions)", s.transcodeRate(), s.transcodeCount()),
                        s.transcodeCount(), s.transcodeRate(),
                        "Add media in formats your clients can direct play (H.264 for broad compatibility) or upgrade server CPU"))
                .whenAbove(s.pauseRate(), PAUSE_TRIGGER, () -> new Issue(
                        "high_pause",
                        Severity.WARNING,
                        "High Pause Event Rate",
                        String.format("%.1f%% of sessions have pause events (avg %.1f pauses per session)", s.pauseRate(), s.avgPauseCount()),
                        Math.round(s.totalSessions() * s.pauseRate() / 100.0), s.pauseRate(),
                        "This may indicate buffering. Check bandwidth, server load and CDN configuration"))
                .whenBelow(s.avgCompletion(), COMPLETION_FLOOR, () -> new Issue(
                        "low_completion",
                        Severity.classify(COMPLETION_FLOOR - s.avgCompletion(), 20, 35),
                        "Low Average Completion Rate",
                        String.format("Average completion is only %.1f%%", s.avgCompletion()),
                        s.totalSessions(), 100.0 - s.avgCompletion(),
                        "Investigate content quality, playback issues, or user engagement factors"));

        for (QoeModels.QoeByPlatform p : platforms) {
            issues.when(p.ebvsRate() > PLATFORM_EBVS_TRIGGER && p.sessionCount() > PLATFORM_MIN_SESSIONS, () -> new Issue(
                    "platform_ebvs",
                    Severity.WARNING,
                    "High EBVS on " + p.platform(),
                    String.format("%s has %.1f%% EBVS rate (%d sessions)", p.platform(), p.ebvsRate(), p.sessionCount()),
                    Math.round(p.sessionCount() * p.ebvsRate() / 100.0), p.ebvsRate(),
                    "Investigate " + p.platform() + " client app performance and compatibility",
                    "platform:" + p.platform()));
        }
        return issues.issues();
    }
}
