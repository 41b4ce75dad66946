package com.security.anomaly.engine;

import com.security.anomaly.model.AccessEvent;
import com.security.anomaly.model.AnomalyEvent;
import com.security.anomaly.model.AnomalyType;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Interface for all anomaly detectors.
 * Each implementation owns its profile state and reports exactly one AnomalyType.
 */
public interface AnomalyDetector {

    /**
     * Stable registry name, also used as the model file name.
     */
    String getName();

    AnomalyType getAnomalyType();

    boolean isEnabled();

    void setEnabled(boolean enabled);

    boolean isBaselineEstablished();

    /**
     * Time of the last successful training run, null if never trained.
     */
    Instant getLastTrainingTime();

    /**
     * Build the detector's baseline from historical events.
     *
     * @return false when training could not run at all (e.g. not enough input)
     */
    boolean train(List<AccessEvent> events);

    /**
     * Evaluate a single event. Never blocks on I/O; disabled detectors return empty.
     */
    Optional<AnomalyEvent> detect(AccessEvent event);

    /**
     * Drop per-entity state whose windows have fully expired.
     *
     * @return number of entity keys removed
     */
    int evictExpiredState();

    boolean saveModel(Path storageRoot);

    boolean loadModel(Path storageRoot);

    /**
     * Detector tunables, keyed by their settings name.
     */
    Map<String, Object> getSettings();

    /**
     * Validate detector tunables and return the mutation that applies them.
     * Nothing changes until the returned action runs.
     *
     * @throws IllegalArgumentException if any value is invalid
     */
    Runnable prepareSettings(Map<String, Object> settings);
}
