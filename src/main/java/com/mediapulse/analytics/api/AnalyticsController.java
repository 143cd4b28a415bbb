package com.mediapulse.analytics.api;

import com.mediapulse.analytics.binge.BingeModels;
import com.mediapulse.analytics.binge.BingeService;
import com.mediapulse.analytics.cohort.CohortModels;
import com.mediapulse.analytics.cohort.CohortRetentionService;
import com.mediapulse.analytics.migration.DeviceMigrationService;
import com.mediapulse.analytics.migration.MigrationModels;
import com.mediapulse.analytics.qoe.QoeModels;
import com.mediapulse.analytics.qoe.QoeService;
import com.mediapulse.analytics.quality.DataQualityModels;
import com.mediapulse.analytics.quality.DataQualityService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/analytics")
public class AnalyticsController {
    private final FilterRequestParser filterParser;
    private final QoeService qoeService;
    private final CohortRetentionService cohortService;
    private final DeviceMigrationService migrationService;
    private final DataQualityService dataQualityService;
    private final BingeService bingeService;

    public AnalyticsController(FilterRequestParser filterParser,
                               QoeService qoeService,
                               CohortRetentionService cohortService,
                               DeviceMigrationService migrationService,
                               DataQualityService dataQualityService,
                               BingeService bingeService) {
        this.filterParser = filterParser;
        this.qoeService = qoeService;
        this.cohortService = cohortService;
        this.migrationService = migrationService;
        this.dataQualityService = dataQualityService;
        this.bingeService = bingeService;
    }

    @GetMapping("/qoe")
    public ResponseEntity<QoeModels.QoeDashboard> qoe(@RequestParam Map<String, String> params) {
        return ResponseEntity.ok(qoeService.dashboard(filterParser.parse(params)));
    }

    @GetMapping("/cohorts")
    public ResponseEntity<CohortModels.CohortRetentionReport> cohorts(@RequestParam Map<String, String> params) {
        return ResponseEntity.ok(cohortService.report(filterParser.parse(params)));
    }

    @GetMapping("/device-migration")
    public ResponseEntity<MigrationModels.DeviceMigrationReport> deviceMigration(@RequestParam Map<String, String> params) {
        return ResponseEntity.ok(migrationService.analytics(filterParser.parse(params)));
    }

    @GetMapping("/data-quality")
    public ResponseEntity<DataQualityModels.DataQualityReport> dataQuality(@RequestParam Map<String, String> params) {
        return ResponseEntity.ok(dataQualityService.report(filterParser.parse(params)));
    }

    @GetMapping("/binge")
    public ResponseEntity<BingeModels.BingeAnalytics> binge(@RequestParam Map<String, String> params) {
        return ResponseEntity.ok(bingeService.analytics(filterParser.parse(params)));
    }
}
