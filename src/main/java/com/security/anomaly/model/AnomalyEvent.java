package com.security.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A detected anomaly. Detectors create it; afterwards only the review fields
 * change, and only through the manager's status update.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "A security anomaly emitted by one of the detectors")
public class AnomalyEvent {

    @Schema(description = "Unique anomaly identifier", example = "3f2c8a4e-5d1b-4c9e-9a77-0c1f6a2b9d10")
    String anomalyId;

    @Schema(description = "Time of the event that triggered the anomaly", example = "2026-03-14T02:15:00Z")
    Instant timestamp;

    @Schema(description = "Anomaly category", example = "access_time")
    AnomalyType anomalyType;

    @Schema(description = "Severity level", example = "high")
    AnomalySeverity severity;

    @Schema(description = "Source IP of the triggering event", example = "203.0.113.7")
    String sourceIp;

    @Schema(description = "User of the triggering event", example = "user-42")
    String userId;

    @Schema(description = "API endpoint of the triggering event", example = "/api/v1/login")
    String apiEndpoint;

    @Schema(description = "Detector-specific evidence (window, counts, locations, ...)")
    Map<String, Object> details;

    @Schema(description = "Recommended mitigations, ordered from mildest to strongest")
    List<ResponseAction> responseActions;

    @Builder.Default
    @Schema(description = "Review status", example = "new")
    AnomalyStatus status = AnomalyStatus.NEW;

    @Schema(description = "Reviewer comments", example = "Confirmed with user, travelling")
    String reviewComments;

    @Schema(description = "Reviewer identifier", example = "analyst-7")
    String reviewerId;
}
