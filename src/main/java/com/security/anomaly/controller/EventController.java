package com.security.anomaly.controller;

import com.security.anomaly.model.AccessEvent;
import com.security.anomaly.model.AnomalyEvent;
import com.security.anomaly.service.AnomalyManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/security/events")
@Tag(name = "Events", description = "Access and authentication event ingestion")
public class EventController {

    private final AnomalyManager anomalyManager;

    public EventController(AnomalyManager anomalyManager) {
        this.anomalyManager = anomalyManager;
    }

    @PostMapping
    @Operation(summary = "Process an access event",
               description = "Runs the event through every enabled detector and returns the anomalies it raised")
    public ResponseEntity<List<AnomalyEvent>> processEvent(@RequestBody AccessEvent event) {
        // Incomplete events are not an error: detectors that need a missing field skip the event
        List<AnomalyEvent> anomalies = anomalyManager.processEvent(event);
        return ResponseEntity.ok(anomalies);
    }
}
