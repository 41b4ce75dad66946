package com.security.anomaly.engine;

import com.security.anomaly.model.AccessEvent;
import com.security.anomaly.model.AnomalyEvent;
import com.security.anomaly.model.AnomalyType;
import com.security.anomaly.repository.DetectorModelEnvelope;
import com.security.anomaly.repository.DetectorModelRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Lifecycle, locking and persistence shared by all detectors.
 *
 * Detection holds the read lock, so events are evaluated concurrently; entity
 * level consistency comes from {@link #keyLocks}. Training, model snapshot,
 * model restore and settings commits hold the write lock.
 *
 * @param <S> the detector's persisted state type
 */
public abstract class AbstractAnomalyDetector<S> implements AnomalyDetector {

    // Keys the settings API reports but never accepts
    private static final Set<String> READ_ONLY_SETTINGS =
            Set.of("name", "type", "baselineEstablished", "lastTrainingTime");

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final String name;
    private final AnomalyType anomalyType;
    private final DetectorModelRepository modelRepository;
    protected final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    protected final KeyedLocks keyLocks = new KeyedLocks();

    private volatile boolean enabled;
    private volatile boolean baselineEstablished;
    private volatile Instant lastTrainingTime;

    protected AbstractAnomalyDetector(String name, AnomalyType anomalyType, boolean enabled,
                                      DetectorModelRepository modelRepository, Clock clock) {
        this.name = name;
        this.anomalyType = anomalyType;
        this.enabled = enabled;
        this.modelRepository = modelRepository;
        this.clock = clock;
    }

    /** Copy of the current state, called under the write lock. */
    protected abstract S snapshotState();

    /** Replace the current state, called under the write lock. */
    protected abstract void restoreState(S state);

    protected abstract Class<S> stateType();

    protected abstract boolean doTrain(List<AccessEvent> events);

    protected abstract Optional<AnomalyEvent> doDetect(AccessEvent event);

    /**
     * Remove entity keys with nothing left inside any window, called under the
     * write lock. Detectors without windowed state keep nothing to evict.
     */
    protected int doEvictExpired(long nowMillis) {
        return 0;
    }

    /**
     * Validate detector tunables and return the commit. Must not mutate anything itself.
     */
    protected abstract Runnable prepareTunables(Map<String, Object> settings);

    @Override
    public String getName() {
        return name;
    }

    @Override
    public AnomalyType getAnomalyType() {
        return anomalyType;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public boolean isBaselineEstablished() {
        return baselineEstablished;
    }

    protected void setBaselineEstablished(boolean baselineEstablished) {
        this.baselineEstablished = baselineEstablished;
    }

    @Override
    public Instant getLastTrainingTime() {
        return lastTrainingTime;
    }

    @Override
    public boolean train(List<AccessEvent> events) {
        List<AccessEvent> input = events != null ? events : List.of();
        lock.writeLock().lock();
        try {
            boolean trained = doTrain(input);
            if (trained) {
                lastTrainingTime = clock.instant();
            }
            log.info("Training {} on {} events: trained={}, baseline={}",
                    name, input.size(), trained, baselineEstablished);
            return trained;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<AnomalyEvent> detect(AccessEvent event) {
        if (!enabled || event == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return doDetect(event);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int evictExpiredState() {
        lock.writeLock().lock();
        try {
            int removed = doEvictExpired(clock.millis());
            if (removed > 0) {
                log.debug("Evicted {} expired keys from {}", removed, name);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean saveModel(Path storageRoot) {
        DetectorModelEnvelope envelope;
        lock.writeLock().lock();
        try {
            doEvictExpired(clock.millis());
            envelope = DetectorModelEnvelope.builder()
                    .schemaVersion(DetectorModelEnvelope.SCHEMA_VERSION)
                    .detectorName(name)
                    .anomalyType(anomalyType)
                    .savedAt(clock.instant())
                    .lastTrainingTime(lastTrainingTime)
                    .baselineEstablished(baselineEstablished)
                    .state(modelRepository.toTree(snapshotState()))
                    .build();
        } catch (RuntimeException e) {
            log.error("Failed to snapshot model for {}", name, e);
            return false;
        } finally {
            lock.writeLock().unlock();
        }

        try {
            modelRepository.save(storageRoot, envelope);
            log.info("Saved model for {} to {}", name, modelRepository.modelPath(storageRoot, name));
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to save model for {}", name, e);
            return false;
        }
    }

    @Override
    public boolean loadModel(Path storageRoot) {
        DetectorModelEnvelope envelope;
        S state;
        try {
            Optional<DetectorModelEnvelope> loaded = modelRepository.load(storageRoot, name);
            if (loaded.isEmpty()) {
                log.info("No saved model for {} under {}", name, storageRoot);
                return false;
            }
            envelope = loaded.get();
            state = modelRepository.readState(envelope, stateType());
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load model for {}", name, e);
            return false;
        }

        lock.writeLock().lock();
        try {
            restoreState(state);
            baselineEstablished = envelope.isBaselineEstablished();
            lastTrainingTime = envelope.getLastTrainingTime();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Loaded model for {} (saved {}, baseline={})", name, envelope.getSavedAt(), baselineEstablished);
        return true;
    }

    @Override
    public Runnable prepareSettings(Map<String, Object> settings) {
        Map<String, Object> tunables = new LinkedHashMap<>(settings);
        READ_ONLY_SETTINGS.forEach(tunables::remove);

        Boolean newEnabled = tunables.containsKey("enabled")
                ? SettingValues.toBool("enabled", tunables.remove("enabled"))
                : null;
        Runnable commitTunables = prepareTunables(tunables);

        return () -> {
            lock.writeLock().lock();
            try {
                commitTunables.run();
                if (newEnabled != null) {
                    enabled = newEnabled;
                }
            } finally {
                lock.writeLock().unlock();
            }
        };
    }

    /**
     * Fails on keys the detector does not know.
     */
    protected static void rejectUnknown(Map<String, Object> settings, Set<String> known) {
        List<String> unknown = new ArrayList<>();
        for (String key : settings.keySet()) {
            if (!known.contains(key)) {
                unknown.add(key);
            }
        }
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown settings: " + unknown);
        }
    }

    /**
     * Anomaly pre-filled with identity, type, time and the event's source fields.
     */
    protected AnomalyEvent.AnomalyEventBuilder newAnomaly(AccessEvent event, Instant timestamp) {
        return AnomalyEvent.builder()
                .anomalyId(UUID.randomUUID().toString())
                .timestamp(timestamp)
                .anomalyType(anomalyType)
                .sourceIp(event.getIpAddress())
                .userId(event.getUserId())
                .apiEndpoint(event.getEndpoint());
    }

    protected static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
