package com.mediapulse.analytics.quality;

import com.mediapulse.analytics.filter.AnalyticsFilter;
import com.mediapulse.analytics.issue.Issue;
import com.mediapulse.analytics.metrics.Severity;
import com.mediapulse.analytics.metrics.TrendDirection;
import com.mediapulse.analytics.testutil.FixedClockConfig;
import com.mediapulse.analytics.testutil.PlaybackEventFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.LocalDate;
import java.util.List;

import static com.mediapulse.analytics.testutil.PlaybackEventFixtures.event;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Import(FixedClockConfig.class)
class DataQualityServiceTest {
    @Autowired
    private DataQualityService dataQualityService;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    private PlaybackEventFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new PlaybackEventFixtures(jdbcTemplate);
        fixtures.clear();
    }

    @Test
    void cleanDataIsHealthy() {
        for (int i = 0; i < 5; i++) fixtures.insert(event());

        DataQualityModels.DataQualityReport report = dataQualityService.report(AnalyticsFilter.empty());

        assertEquals(QualityField.values().length, report.fieldQuality().size());
        assertTrue(report.fieldQuality().stream().allMatch(f -> f.status() == QualityStatus.HEALTHY));
        assertTrue(report.issues().isEmpty());
        assertEquals(5, report.summary().totalEvents());
        assertEquals(99.0, report.summary().overallScore(), 1e-9);
        assertEquals("A", report.summary().grade());
        assertEquals(1, report.fieldQuality().get(QualityField.USERNAME.ordinal()).uniqueCount());
        assertEquals(5, report.fieldQuality().get(QualityField.USERNAME.ordinal()).totalRecords());
    }

    @Test
    void flagsMissingAndInvalidValues() {
        for (int i = 0; i < 7; i++) fixtures.insert(event().at("2024-06-03T12:00:00Z"));
        fixtures.insert(
                event().at("2024-06-03T12:00:00Z").username(null),
                event().at("2024-06-04T12:00:00Z").completion(150, 3600),
                event().at("2024-06-04T12:00:00Z").source("jellyfin", "srv-9"));

        DataQualityModels.DataQualityReport report = dataQualityService.report(AnalyticsFilter.empty());

        DataQualityModels.FieldQualityMetric username = report.fieldQuality().get(QualityField.USERNAME.ordinal());
        assertEquals("username", username.fieldName());
        assertEquals(1, username.nullCount());
        assertEquals(10.0, username.nullRate(), 1e-9);
        assertEquals(QualityStatus.CRITICAL, username.status());

        DataQualityModels.FieldQualityMetric completion = report.fieldQuality().get(QualityField.PERCENT_COMPLETE.ordinal());
        assertEquals(1, completion.invalidCount());
        assertEquals(QualityStatus.WARNING, completion.status());

        List<Issue> issues = report.issues();
        assertEquals(List.of("null_required", "invalid_value"), issues.stream().map(Issue::type).toList());
        assertEquals(Severity.CRITICAL, issues.get(0).severity());
        assertEquals(Severity.CRITICAL, issues.get(1).severity());
        assertEquals(1, report.summary().criticalIssueCount());

        List<DataQualityModels.DailyQualityTrend> daily = report.dailyTrends();
        assertEquals(2, daily.size());
        assertEquals(LocalDate.of(2024, 6, 4), daily.get(0).date());
        assertEquals(2, daily.get(0).eventCount());
        assertEquals(50.0, daily.get(0).invalidRate(), 1e-9);
        assertEquals(TrendDirection.INSUFFICIENT_DATA, report.summary().trendDirection());

        List<DataQualityModels.SourceQuality> sources = report.sourceBreakdown();
        assertEquals(2, sources.size());
        assertEquals("plex", sources.get(0).source());
        assertEquals(9, sources.get(0).eventCount());
        assertEquals(90.0, sources.get(0).eventPercentage(), 1e-9);
        assertEquals("srv-9", sources.get(1).serverId());
        assertEquals(QualityStatus.HEALTHY, sources.get(1).status());
    }

    @Test
    void blankUsernameCountsAsMissingInDailyAndSourceRates() {
        for (int i = 0; i < 3; i++) fixtures.insert(event());
        fixtures.insert(event().username(""));

        DataQualityModels.DataQualityReport report = dataQualityService.report(AnalyticsFilter.empty());

        assertEquals(25.0, report.dailyTrends().get(0).nullRate(), 1e-9);
        assertEquals(25.0, report.sourceBreakdown().get(0).nullRate(), 1e-9);
    }

    @Test
    void futureStartTimesAreInvalid() {
        fixtures.insert(event(), event().at("2024-07-05T12:00:00Z"));

        DataQualityModels.DataQualityReport report = dataQualityService.report(AnalyticsFilter.empty());

        DataQualityModels.FieldQualityMetric startedAt = report.fieldQuality().get(QualityField.STARTED_AT.ordinal());
        assertEquals(1, startedAt.invalidCount());
        assertEquals(50.0, startedAt.invalidRate(), 1e-9);
    }

    @Test
    void emptyStoreScoresPerfectCompletenessAndValidity() {
        DataQualityModels.DataQualityReport report = dataQualityService.report(AnalyticsFilter.empty());

        assertEquals(0, report.summary().totalEvents());
        assertEquals(99.0, report.summary().overallScore(), 1e-9);
        assertTrue(report.dailyTrends().isEmpty());
        assertTrue(report.sourceBreakdown().isEmpty());
        assertEquals(List.of("playback_events"), report.metadata().analyzedTables());
        assertEquals(List.of("null_check", "validity_check", "future_date_check"), report.metadata().rulesApplied());
    }
}
