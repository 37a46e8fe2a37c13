package com.waste.anomaly.controller;

import com.waste.anomaly.model.AnomalyRecord;
import com.waste.anomaly.model.HighRiskSubject;
import com.waste.anomaly.model.OversightDashboard;
import com.waste.anomaly.security.OversightAccessGuard;
import com.waste.anomaly.service.OversightAnalyticsService;
import com.waste.anomaly.service.ReportArchiveService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/oversight")
@Tag(name = "Oversight", description = "Anomaly dashboard for the oversight role")
public class OversightController {

    private final OversightAnalyticsService analyticsService;
    private final ReportArchiveService reportArchiveService;
    private final OversightAccessGuard accessGuard;

    public OversightController(OversightAnalyticsService analyticsService,
                               ReportArchiveService reportArchiveService,
                               OversightAccessGuard accessGuard) {
        this.analyticsService = analyticsService;
        this.reportArchiveService = reportArchiveService;
        this.accessGuard = accessGuard;
    }

    @GetMapping("/dashboard")
    @Operation(summary = "Get the oversight dashboard",
               description = "Today's anomaly count, the 10 most recent anomalies and facilities with 3+ anomalies in 7 days")
    public ResponseEntity<OversightDashboard> getDashboard(HttpServletRequest request) {
        accessGuard.requireOversight(request);
        return ResponseEntity.ok(analyticsService.dashboard());
    }

    @GetMapping("/anomalies/today")
    @Operation(summary = "Count today's anomalies")
    public ResponseEntity<Map<String, Long>> getTodayCount(HttpServletRequest request) {
        accessGuard.requireOversight(request);
        return ResponseEntity.ok(Map.of("anomaliesToday", analyticsService.countToday()));
    }

    @GetMapping("/anomalies/recent")
    @Operation(summary = "List the most recent anomalies", description = "Newest first")
    public ResponseEntity<List<AnomalyRecord>> getRecent(
            HttpServletRequest request,
            @Parameter(description = "Max number of records", example = "10")
            @RequestParam(defaultValue = "10") int limit) {
        accessGuard.requireOversight(request);
        return ResponseEntity.ok(analyticsService.recent(limit));
    }

    @GetMapping("/subjects/high-risk")
    @Operation(summary = "List repeat-offender facilities",
               description = "Facilities with at least `threshold` anomalies in the trailing `days`")
    public ResponseEntity<List<HighRiskSubject>> getHighRisk(
            HttpServletRequest request,
            @Parameter(description = "Trailing window in days", example = "7")
            @RequestParam(defaultValue = "7") int days,
            @Parameter(description = "Minimum anomaly count (inclusive)", example = "3")
            @RequestParam(defaultValue = "3") int threshold) {
        accessGuard.requireOversight(request);
        return ResponseEntity.ok(analyticsService.highRiskDetails(days, threshold));
    }

    @GetMapping(value = "/reports/{reportKey}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get an archived anomaly report")
    public ResponseEntity<String> getReport(
            HttpServletRequest request,
            @Parameter(description = "Report key", example = "FAC-001:1760770800000")
            @PathVariable String reportKey) {
        accessGuard.requireOversight(request);
        return reportArchiveService.findReport(reportKey)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
