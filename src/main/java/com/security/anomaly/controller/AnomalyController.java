package com.security.anomaly.controller;

import com.security.anomaly.engine.EventTimestamps;
import com.security.anomaly.model.AnomalyEvent;
import com.security.anomaly.model.AnomalyQuery;
import com.security.anomaly.model.AnomalySeverity;
import com.security.anomaly.model.AnomalyStatus;
import com.security.anomaly.model.AnomalyType;
import com.security.anomaly.model.DashboardSummary;
import com.security.anomaly.service.AnomalyDashboardService;
import com.security.anomaly.service.AnomalyManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

@RestController
@RequestMapping("/api/v1/security/anomalies")
@Tag(name = "Anomalies", description = "Query, review and retention of detected security anomalies")
public class AnomalyController {

    private final AnomalyManager anomalyManager;
    private final AnomalyDashboardService dashboardService;

    public AnomalyController(AnomalyManager anomalyManager, AnomalyDashboardService dashboardService) {
        this.anomalyManager = anomalyManager;
        this.dashboardService = dashboardService;
    }

    @GetMapping
    @Operation(summary = "List anomalies",
               description = "Newest first. severity and type accept comma-separated values; "
                       + "fromDate/toDate are ISO-8601 and inclusive. limit is capped at the configured maximum.")
    public ResponseEntity<?> listAnomalies(
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String fromDate,
            @RequestParam(required = false) String toDate,
            @RequestParam(required = false) String userId) {
        if (limit <= 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "limit must be positive"));
        }

        try {
            AnomalyQuery query = AnomalyQuery.builder()
                    .limit(limit)
                    .status(status != null && !status.isBlank() ? AnomalyStatus.fromValue(status) : null)
                    .severities(parseList(severity, AnomalySeverity::fromValue))
                    .types(parseList(type, AnomalyType::fromValue))
                    .from(parseDate("fromDate", fromDate))
                    .to(parseDate("toDate", toDate))
                    .userId(userId)
                    .build();
            List<AnomalyEvent> anomalies = anomalyManager.getRecentAnomalies(query);
            return ResponseEntity.ok(anomalies);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/dashboard")
    @Operation(summary = "Dashboard summary",
               description = "Counts by severity, status and type, top users and IPs, and a 30-day daily chart")
    public ResponseEntity<DashboardSummary> getDashboard() {
        return ResponseEntity.ok(dashboardService.summarize());
    }

    @GetMapping("/{anomalyId}")
    @Operation(summary = "Get an anomaly")
    public ResponseEntity<AnomalyEvent> getAnomaly(@PathVariable String anomalyId) {
        AnomalyEvent anomaly = anomalyManager.getAnomaly(anomalyId);
        if (anomaly == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(anomaly);
    }

    @PutMapping("/{anomalyId}/status")
    @Operation(summary = "Update review status",
               description = "status must be one of new, under_review, resolved, false_positive")
    public ResponseEntity<?> updateStatus(@PathVariable String anomalyId,
                                          @RequestBody Map<String, String> body) {
        String status = body.get("status");
        if (status == null || status.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "status is required"));
        }

        try {
            AnomalyEvent updated = anomalyManager.updateAnomalyStatus(
                    anomalyId, status, body.get("comments"), body.get("reviewerId"));
            if (updated == null) {
                return ResponseEntity.notFound().build();
            }
            return ResponseEntity.ok(updated);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/cleanup")
    @Operation(summary = "Delete expired anomalies",
               description = "Removes anomalies older than the configured retention period")
    public ResponseEntity<Map<String, Object>> cleanup() {
        int removed = anomalyManager.cleanupOldAnomalies();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("removedCount", removed);
        return ResponseEntity.ok(response);
    }

    private static <T> Set<T> parseList(String csv, Function<String, T> parser) {
        if (csv == null || csv.isBlank()) {
            return null;
        }
        Set<T> values = new LinkedHashSet<>();
        Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(s -> values.add(parser.apply(s)));
        return values;
    }

    private static Instant parseDate(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return EventTimestamps.parse(value)
                .map(OffsetDateTime::toInstant)
                .orElseThrow(() -> new IllegalArgumentException("Invalid " + name + ": " + value));
    }
}
