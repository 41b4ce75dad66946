package com.security.anomaly.service;

import com.security.anomaly.config.AnomalyDetectionConfig;
import com.security.anomaly.config.MetricsConfig;
import com.security.anomaly.engine.AnomalyDetector;
import com.security.anomaly.engine.SettingValues;
import com.security.anomaly.model.AccessEvent;
import com.security.anomaly.model.AnomalyEvent;
import com.security.anomaly.model.AnomalyQuery;
import com.security.anomaly.model.AnomalyStatus;
import com.security.anomaly.model.TrainingResult;
import com.security.anomaly.repository.AnomalyRepository;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the detector registry and the anomaly lifecycle: fan-out of events to
 * detectors, storage of results, training, review status, retention and
 * runtime settings.
 */
@Service
public class AnomalyManager {

    private static final Logger log = LoggerFactory.getLogger(AnomalyManager.class);

    private static final Set<String> GENERAL_SETTINGS = Set.of(
            "storageRoot", "detectionThreshold", "enableResponses", "storageRetentionDays", "maxQueryLimit");

    private final AnomalyRepository anomalyRepository;
    private final ModelPersistenceService persistenceService;
    private final AnomalyResponder responder;
    private final AnomalyDetectionConfig config;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;
    private final Clock clock;

    // Replaced wholesale on registration, iteration order = registration order
    private volatile Map<String, AnomalyDetector> detectors = Collections.emptyMap();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public AnomalyManager(List<AnomalyDetector> detectors,
                          AnomalyRepository anomalyRepository,
                          ModelPersistenceService persistenceService,
                          AnomalyResponder responder,
                          AnomalyDetectionConfig config,
                          MetricsConfig metricsConfig,
                          Tracer tracer,
                          Clock clock) {
        this.anomalyRepository = anomalyRepository;
        this.persistenceService = persistenceService;
        this.responder = responder;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
        this.clock = clock;

        // Auto-register all detector beans, in @Order
        for (AnomalyDetector detector : detectors) {
            registerDetector(detector);
        }
    }

    public synchronized void registerDetector(AnomalyDetector detector) {
        Map<String, AnomalyDetector> updated = new LinkedHashMap<>(detectors);
        AnomalyDetector previous = updated.put(detector.getName(), detector);
        if (previous != null) {
            log.warn("Replacing registered detector {}", detector.getName());
        }
        detectors = Collections.unmodifiableMap(updated);
        log.info("Registered anomaly detector: {} -> {}", detector.getName(), detector.getClass().getSimpleName());
    }

    public Map<String, AnomalyDetector> getDetectors() {
        return detectors;
    }

    @PostConstruct
    public void loadModels() {
        for (AnomalyDetector detector : detectors.values()) {
            boolean loaded = persistenceService.load(detector);
            log.info("Startup model load for {}: {}", detector.getName(), loaded ? "loaded" : "not loaded");
        }
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown.set(true);
        log.info("Anomaly manager shutting down");
    }

    /**
     * Run one event through every enabled detector.
     *
     * @return anomalies raised for this event, in detector registration order
     */
    @Observed(name = "anomaly.process_event", contextualName = "process-event")
    public List<AnomalyEvent> processEvent(AccessEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Event must not be null");
        }

        List<AnomalyEvent> anomalies = new ArrayList<>();
        for (AnomalyDetector detector : detectors.values()) {
            if (!detector.isEnabled()) {
                continue;
            }

            Span span = tracer.nextSpan()
                    .name("detector.detect." + detector.getName())
                    .tag("detector.name", detector.getName())
                    .tag("detector.type", detector.getAnomalyType().getValue())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                Optional<AnomalyEvent> result = detector.detect(event);
                span.tag("anomaly.detected", String.valueOf(result.isPresent()));
                result.ifPresent(anomalies::add);
            } catch (Exception e) {
                span.error(e);
                metricsConfig.recordDetectorError(detector.getName());
                log.error("Error in detector {} for user {} ip {}: {}",
                        detector.getName(), event.getUserId(), event.getIpAddress(), e.getMessage(), e);
                // One failing detector must not hide the others' results
            } finally {
                span.end();
            }
        }

        for (AnomalyEvent anomaly : anomalies) {
            store(anomaly);
            metricsConfig.recordAnomaly(anomaly.getAnomalyType().getValue(), anomaly.getSeverity().getValue());
            if (config.isEnableResponses()) {
                try {
                    responder.respond(anomaly);
                } catch (Exception e) {
                    log.error("Responder failed for anomaly {}", anomaly.getAnomalyId(), e);
                }
            }
        }
        metricsConfig.recordEventProcessed(anomalies.size());
        return anomalies;
    }

    private void store(AnomalyEvent anomaly) {
        try {
            anomalyRepository.save(anomaly);
        } catch (Exception e) {
            log.error("Failed to store anomaly {} ({})", anomaly.getAnomalyId(),
                    anomaly.getAnomalyType().getValue(), e);
        }
    }

    /**
     * Train the named detectors (all registered when names is null or empty)
     * and persist each one that trained successfully.
     */
    @Observed(name = "anomaly.train", contextualName = "train-detectors")
    public Map<String, TrainingResult> trainDetectors(List<AccessEvent> events, Collection<String> names) {
        List<AccessEvent> input = events != null ? events : List.of();
        Map<String, AnomalyDetector> registry = detectors;
        Collection<String> targets = names == null || names.isEmpty() ? registry.keySet() : names;

        Map<String, TrainingResult> results = new LinkedHashMap<>();
        for (String name : targets) {
            AnomalyDetector detector = registry.get(name);
            if (detector == null) {
                results.put(name, TrainingResult.failed("Detector not registered"));
                continue;
            }

            try {
                boolean trained = detector.train(input);
                metricsConfig.recordTraining(name, trained);
                if (trained && !persistenceService.save(detector)) {
                    log.warn("Detector {} trained but its model could not be saved", name);
                }
                results.put(name, TrainingResult.builder()
                        .success(trained)
                        .baselineEstablished(detector.isBaselineEstablished())
                        .build());
            } catch (Exception e) {
                metricsConfig.recordTraining(name, false);
                log.error("Training failed for detector {}", name, e);
                results.put(name, TrainingResult.failed(e.getMessage()));
            }
        }
        return results;
    }

    public List<AnomalyEvent> getRecentAnomalies(AnomalyQuery query) {
        int limit = Math.min(Math.max(query.getLimit(), 0), config.getMaxQueryLimit());
        return anomalyRepository.find(query.toBuilder().limit(limit).build());
    }

    public AnomalyEvent getAnomaly(String anomalyId) {
        return anomalyRepository.findById(anomalyId);
    }

    /**
     * Set the review status of a stored anomaly.
     *
     * @return the updated anomaly, or null if no anomaly has this id
     * @throws IllegalArgumentException if status is not one of the review statuses
     */
    public AnomalyEvent updateAnomalyStatus(String anomalyId, String status, String comments, String reviewerId) {
        AnomalyStatus newStatus = AnomalyStatus.fromValue(status);

        AnomalyEvent existing = anomalyRepository.findById(anomalyId);
        if (existing == null) {
            return null;
        }

        // Review fields left out by the caller keep their stored values
        AnomalyEvent updated = existing.toBuilder()
                .status(newStatus)
                .reviewComments(comments != null ? comments : existing.getReviewComments())
                .reviewerId(reviewerId != null ? reviewerId : existing.getReviewerId())
                .build();
        anomalyRepository.save(updated);
        metricsConfig.recordStatusUpdate(newStatus.getValue());
        log.info("Anomaly {} status {} -> {} by {}", anomalyId,
                existing.getStatus().getValue(), newStatus.getValue(), reviewerId);
        return updated;
    }

    /**
     * Delete anomalies older than the retention period. Stops early on shutdown.
     *
     * @return number of anomalies removed
     */
    public int cleanupOldAnomalies() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(config.getStorageRetentionDays()));
        int removed = anomalyRepository.deleteOlderThan(cutoff, shuttingDown::get);
        metricsConfig.recordCleanup(removed);
        log.info("Removed {} anomalies older than {}", removed, cutoff);
        return removed;
    }

    /**
     * Drop detector state for users, IPs and endpoints with nothing left in
     * any window.
     *
     * @return number of entity keys removed across all detectors
     */
    public int evictExpiredDetectorState() {
        int removed = 0;
        for (AnomalyDetector detector : detectors.values()) {
            try {
                removed += detector.evictExpiredState();
            } catch (Exception e) {
                log.error("State eviction failed for detector {}", detector.getName(), e);
            }
        }
        return removed;
    }

    public Map<String, Object> getSettings() {
        Map<String, Object> detectorSettings = new LinkedHashMap<>();
        for (AnomalyDetector detector : detectors.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", detector.getName());
            entry.put("type", detector.getAnomalyType().getValue());
            entry.put("enabled", detector.isEnabled());
            entry.put("baselineEstablished", detector.isBaselineEstablished());
            Instant lastTraining = detector.getLastTrainingTime();
            entry.put("lastTrainingTime", lastTraining != null ? lastTraining.toString() : null);
            entry.putAll(detector.getSettings());
            detectorSettings.put(detector.getName(), entry);
        }

        Map<String, Object> general = new LinkedHashMap<>();
        general.put("storageRoot", config.getStorageRoot());
        general.put("detectionThreshold", config.getDetectionThreshold());
        general.put("enableResponses", config.isEnableResponses());
        general.put("storageRetentionDays", config.getStorageRetentionDays());
        general.put("maxQueryLimit", config.getMaxQueryLimit());

        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("detectors", detectorSettings);
        settings.put("general", general);
        return settings;
    }

    /**
     * Validate every value in the body first, then apply all of them.
     * Nothing changes when any value is invalid.
     *
     * @throws IllegalArgumentException on the first invalid value
     */
    @SuppressWarnings("unchecked")
    public synchronized Map<String, Object> updateSettings(Map<String, Object> body) {
        if (body == null || body.isEmpty()) {
            throw new IllegalArgumentException("Settings body must not be empty");
        }
        for (String key : body.keySet()) {
            if (!"detectors".equals(key) && !"general".equals(key)) {
                throw new IllegalArgumentException("Unknown settings section: " + key);
            }
        }

        List<Runnable> commits = new ArrayList<>();

        Object detectorSection = body.get("detectors");
        if (detectorSection != null) {
            if (!(detectorSection instanceof Map<?, ?> perDetector)) {
                throw new IllegalArgumentException("detectors must be an object keyed by detector name");
            }
            for (Map.Entry<?, ?> entry : perDetector.entrySet()) {
                String name = String.valueOf(entry.getKey());
                AnomalyDetector detector = detectors.get(name);
                if (detector == null) {
                    throw new IllegalArgumentException("Unknown detector: " + name);
                }
                if (!(entry.getValue() instanceof Map<?, ?> values)) {
                    throw new IllegalArgumentException("Settings for " + name + " must be an object");
                }
                commits.add(detector.prepareSettings((Map<String, Object>) values));
            }
        }

        Object generalSection = body.get("general");
        if (generalSection != null) {
            if (!(generalSection instanceof Map<?, ?> general)) {
                throw new IllegalArgumentException("general must be an object");
            }
            commits.add(prepareGeneral((Map<String, Object>) general));
        }

        commits.forEach(Runnable::run);
        log.info("Anomaly settings updated: {}", body.keySet());
        return getSettings();
    }

    private Runnable prepareGeneral(Map<String, Object> general) {
        for (String key : general.keySet()) {
            if (!GENERAL_SETTINGS.contains(key)) {
                throw new IllegalArgumentException("Unknown general setting: " + key);
            }
        }

        String storageRoot = null;
        if (general.containsKey("storageRoot")) {
            Object value = general.get("storageRoot");
            if (!(value instanceof String text) || text.isBlank()) {
                throw new IllegalArgumentException("storageRoot must be a non-empty path");
            }
            storageRoot = text;
        }
        Double threshold = general.containsKey("detectionThreshold")
                ? SettingValues.toDouble("detectionThreshold", general.get("detectionThreshold")) : null;
        Boolean enableResponses = general.containsKey("enableResponses")
                ? SettingValues.toBool("enableResponses", general.get("enableResponses")) : null;
        Integer retentionDays = general.containsKey("storageRetentionDays")
                ? SettingValues.toInt("storageRetentionDays", general.get("storageRetentionDays")) : null;
        Integer maxQueryLimit = general.containsKey("maxQueryLimit")
                ? SettingValues.toInt("maxQueryLimit", general.get("maxQueryLimit")) : null;

        if (threshold != null) SettingValues.requireRange("detectionThreshold", threshold, 0, 1);
        if (retentionDays != null) SettingValues.requirePositive("storageRetentionDays", retentionDays);
        if (maxQueryLimit != null) SettingValues.requirePositive("maxQueryLimit", maxQueryLimit);

        String newRoot = storageRoot;
        return () -> {
            if (newRoot != null) config.setStorageRoot(newRoot);
            if (threshold != null) config.setDetectionThreshold(threshold);
            if (enableResponses != null) config.setEnableResponses(enableResponses);
            if (retentionDays != null) config.setStorageRetentionDays(retentionDays);
            if (maxQueryLimit != null) config.setMaxQueryLimit(maxQueryLimit);
        };
    }
}
