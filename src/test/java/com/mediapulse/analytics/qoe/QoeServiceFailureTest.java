package com.mediapulse.analytics.qoe;

import com.mediapulse.analytics.filter.AnalyticsFilter;
import com.mediapulse.analytics.query.AnalyticsQueryException;
import com.mediapulse.analytics.repository.QoeJdbcRepository;
import com.mediapulse.analytics.testutil.FixedClockConfig;
import com.mediapulse.analytics.testutil.PlaybackEventFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

import static com.mediapulse.analytics.testutil.PlaybackEventFixtures.event;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@SpringBootTest
@Import(FixedClockConfig.class)
class QoeServiceFailureTest {
    @Autowired
    private QoeService qoeService;
    @Autowired
    private JdbcTemplate jdbcTemplate;
    @SpyBean
    private QoeJdbcRepository repository;

    @BeforeEach
    void setUp() {
        PlaybackEventFixtures fixtures = new PlaybackEventFixtures(jdbcTemplate);
        fixtures.clear();
        fixtures.insert(event().at("2024-06-03T12:00:00Z"), event().at("2024-06-04T12:00:00Z").platform("Apple TV"));
    }

    @Test
    void oneFailingBreakdownFailsWholeDashboard() {
        doThrow(new AnalyticsQueryException("QoE transcode query", "connection reset"))
                .when(repository).byTranscodeDecision(any(), any());

        var e = assertThrows(AnalyticsQueryException.class, () -> qoeService.dashboard(AnalyticsFilter.empty()));

        assertEquals("QoE transcode query", e.operation());
        assertEquals("QoE transcode query: connection reset", e.getMessage());
        verify(repository).summary(any(), any());
        verify(repository).byPlatform(any(), any());
    }

    @Test
    void failingPercentilesStillBuildDashboard() {
        doThrow(new AnalyticsQueryException("QoE bitrate percentile query", "not supported"))
                .when(repository).bitratePercentiles(any(), any());

        QoeModels.QoeDashboard dashboard = qoeService.dashboard(AnalyticsFilter.empty());

        assertEquals(2, dashboard.summary().totalSessions());
        assertEquals(0.0, dashboard.summary().bitrateP50Mbps());
        assertFalse(dashboard.metadata().percentilesAvailable());
    }
}
