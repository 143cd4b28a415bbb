package com.mediapulse.analytics.api;

import com.mediapulse.analytics.testutil.FixedClockConfig;
import com.mediapulse.analytics.testutil.PlaybackEventFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;

import static com.mediapulse.analytics.testutil.PlaybackEventFixtures.event;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Import(FixedClockConfig.class)
class AnalyticsControllerTest {
    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        PlaybackEventFixtures fixtures = new PlaybackEventFixtures(jdbcTemplate);
        fixtures.clear();
        fixtures.insert(
                event().at("2024-06-03T12:00:00Z"),
                event().at("2024-06-04T12:00:00Z").user(2, "bob").platform("Apple TV"));
    }

    @Test
    void servesQoeDashboardForFilter() throws Exception {
        mockMvc.perform(get("/api/analytics/qoe")
                        .param("start_date", "2024-06-01")
                        .param("end_date", "2024-06-29")
                        .param("platforms", "Roku"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.totalSessions").value(1))
                .andExpect(jsonPath("$.byPlatform[0].platform").value("Roku"))
                .andExpect(jsonPath("$.metadata.trendInterval").value("day"));
    }

    @Test
    void servesEveryReport() throws Exception {
        mockMvc.perform(get("/api/analytics/cohorts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metadata.granularity").value("week"));
        mockMvc.perform(get("/api/analytics/device-migration").param("users", "alice,bob"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.totalUsers").value(2));
        mockMvc.perform(get("/api/analytics/data-quality"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metadata.analyzedTables[0]").value("playback_events"))
                .andExpect(jsonPath("$.fieldQuality[0].status").value("healthy"));
        mockMvc.perform(get("/api/analytics/binge").param("days", "30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bingesByDay.length()").value(7));
    }

    @Test
    void rejectsMalformedDate() throws Exception {
        mockMvc.perform(get("/api/analytics/qoe").param("start_date", "last-tuesday"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Invalid analytics request"))
                .andExpect(jsonPath("$.detail").value("invalid date: last-tuesday"));
    }

    @Test
    void rejectsNonNumericYear() throws Exception {
        mockMvc.perform(get("/api/analytics/cohorts").param("years", "2020,abc"))
                .andExpect(status().isBadRequest());
    }
}
