package com.security.anomaly.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.security.anomaly.model.AnomalyType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * On-disk form of a detector model. The state node is detector specific and is
 * only read back by a detector with the same name and schema version.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectorModelEnvelope {

    public static final int SCHEMA_VERSION = 1;

    private int schemaVersion;
    private String detectorName;
    private AnomalyType anomalyType;
    private Instant savedAt;
    private Instant lastTrainingTime;
    private boolean baselineEstablished;
    private JsonNode state;
}
