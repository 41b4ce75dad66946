package com.security.anomaly.controller;

import com.security.anomaly.model.AccessEvent;
import com.security.anomaly.model.TrainingResult;
import com.security.anomaly.service.AnomalyManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.Data;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/security")
@Tag(name = "Detectors", description = "Detector training and runtime settings")
public class DetectorController {

    private final AnomalyManager anomalyManager;

    public DetectorController(AnomalyManager anomalyManager) {
        this.anomalyManager = anomalyManager;
    }

    @GetMapping("/settings")
    @Operation(summary = "Get detection settings",
               description = "Per-detector state and tunables plus general engine settings")
    public ResponseEntity<Map<String, Object>> getSettings() {
        return ResponseEntity.ok(anomalyManager.getSettings());
    }

    @PutMapping("/settings")
    @Operation(summary = "Update detection settings",
               description = "Body mirrors GET /settings: {detectors: {name: {...}}, general: {...}}. "
                       + "All values are validated before any is applied.")
    public ResponseEntity<?> updateSettings(@RequestBody Map<String, Object> body) {
        try {
            return ResponseEntity.ok(anomalyManager.updateSettings(body));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/train")
    @Operation(summary = "Train detectors",
               description = "Trains the listed detectors (all when omitted) on the supplied historical events "
                       + "and persists every model that trained successfully")
    public ResponseEntity<?> train(@RequestBody TrainingRequest request) {
        if (request.getEvents() == null || request.getEvents().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "events must not be empty"));
        }

        Map<String, TrainingResult> results = anomalyManager.trainDetectors(request.getEvents(), request.getDetectors());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", results.values().stream().anyMatch(TrainingResult::isSuccess));
        response.put("results", results);
        response.put("trainingEvents", request.getEvents().size());
        return ResponseEntity.ok(response);
    }

    @Data
    public static class TrainingRequest {
        private List<String> detectors;
        private List<AccessEvent> events;
    }
}
