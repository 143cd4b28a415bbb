package com.mediapulse.analytics.cohort;

import com.mediapulse.analytics.metrics.TrendDirection;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CohortCalculatorTest {
    // a Monday
    private static final LocalDate W0 = LocalDate.of(2024, 1, 1);

    private final CohortCalculator weekly = new CohortCalculator(CohortGranularity.WEEK, 12, 2);

    @Test
    void offsetZeroIsAlwaysFullRetention() {
        List<CohortModels.Activity> activity = List.of(
                new CohortModels.Activity("alice", W0),
                new CohortModels.Activity("bob", W0.plusDays(3)),
                new CohortModels.Activity("carol", W0.plusDays(6)),
                new CohortModels.Activity("alice", W0.plusWeeks(1)),
                new CohortModels.Activity("bob", W0.plusWeeks(2)));

        CohortModels.CohortAnalysis analysis = weekly.analyze(activity);

        assertEquals(1, analysis.cohorts().size());
        CohortModels.CohortData cohort = analysis.cohorts().get(0);
        assertEquals(W0, cohort.cohortStart());
        assertEquals(3, cohort.initialUsers());
        assertEquals(3, cohort.retention().size());
        assertEquals(100.0, cohort.retention().get(0).retentionRate());
        assertEquals(100.0 / 3, cohort.retention().get(1).retentionRate(), 1e-9);
        assertEquals(100.0 / 3, cohort.averageRetention(), 1e-9);
        assertEquals(100.0 - cohort.averageRetention(), cohort.churnRate(), 1e-9);
    }

    @Test
    void cohortsBelowMinimumSizeAreDropped() {
        List<CohortModels.Activity> activity = List.of(
                new CohortModels.Activity("alice", W0),
                new CohortModels.Activity("bob", W0),
                new CohortModels.Activity("carol", W0.plusWeeks(1)));

        CohortModels.CohortAnalysis analysis = weekly.analyze(activity);

        assertEquals(1, analysis.cohorts().size());
        assertEquals(2, analysis.summary().totalUsers());
        assertEquals(W0, analysis.summary().bestCohort());
    }

    @Test
    void emptyActivityGivesEmptyAnalysis() {
        CohortModels.CohortAnalysis analysis = weekly.analyze(List.of());

        assertTrue(analysis.cohorts().isEmpty());
        assertTrue(analysis.retentionCurve().isEmpty());
        assertEquals(0, analysis.summary().totalCohorts());
        assertNull(analysis.summary().bestCohort());
        assertEquals(TrendDirection.INSUFFICIENT_DATA, analysis.summary().retentionTrend());
    }

    @Test
    void curveReportsHowManyCohortsContribute() {
        List<CohortModels.Activity> activity = new ArrayList<>();
        for (int week = 0; week < 3; week++) {
            LocalDate start = W0.plusWeeks(week);
            activity.add(new CohortModels.Activity("a" + week, start));
            activity.add(new CohortModels.Activity("b" + week, start));
            activity.add(new CohortModels.Activity("a" + week, start.plusWeeks(1)));
        }

        CohortModels.CohortAnalysis analysis = weekly.analyze(activity);

        assertEquals(3, analysis.cohorts().size());
        CohortModels.RetentionCurvePoint zero = analysis.retentionCurve().get(0);
        assertEquals(0, zero.offset());
        assertEquals(3, zero.cohortsWithData());
        assertEquals(100.0, zero.averageRetention());
        CohortModels.RetentionCurvePoint one = analysis.retentionCurve().get(1);
        assertEquals(3, one.cohortsWithData());
        assertEquals(50.0, one.medianRetention());
        assertEquals(50.0, analysis.summary().averageWeek1Retention());
    }

    @Test
    void monthlyGranularityBucketsByCalendarMonth() {
        CohortCalculator monthly = new CohortCalculator(CohortGranularity.MONTH, 12, 1);
        CohortModels.CohortAnalysis analysis = monthly.analyze(List.of(
                new CohortModels.Activity("alice", LocalDate.of(2024, 1, 31)),
                new CohortModels.Activity("alice", LocalDate.of(2024, 2, 1))));

        CohortModels.CohortData cohort = analysis.cohorts().get(0);
        assertEquals(LocalDate.of(2024, 1, 1), cohort.cohortStart());
        assertEquals(100.0, cohort.retention().get(1).retentionRate());
    }

    @Test
    void trendComparesOlderAndNewerHalves() {
        assertEquals(TrendDirection.INSUFFICIENT_DATA, CohortCalculator.trend(cohorts(40, 50, 60)));
        assertEquals(TrendDirection.IMPROVING, CohortCalculator.trend(cohorts(40, 40, 60, 60)));
        assertEquals(TrendDirection.DECLINING, CohortCalculator.trend(cohorts(60, 60, 40, 40)));
        assertEquals(TrendDirection.STABLE, CohortCalculator.trend(cohorts(50, 50, 52, 52)));
    }

    private static List<CohortModels.CohortData> cohorts(double... averages) {
        List<CohortModels.CohortData> cohorts = new ArrayList<>();
        for (int i = 0; i < averages.length; i++) {
            cohorts.add(new CohortModels.CohortData(W0.plusWeeks(i), 10, List.of(), averages[i], 100 - averages[i]));
        }
        return cohorts;
    }
}
