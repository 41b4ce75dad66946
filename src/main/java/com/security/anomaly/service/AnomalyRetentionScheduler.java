package com.security.anomaly.service;

import com.security.anomaly.config.AnomalyDetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

@Service
public class AnomalyRetentionScheduler {

    private static final Logger log = LoggerFactory.getLogger(AnomalyRetentionScheduler.class);

    private final AnomalyManager anomalyManager;
    private final AnomalyDetectionConfig config;

    public AnomalyRetentionScheduler(AnomalyManager anomalyManager, AnomalyDetectionConfig config) {
        this.anomalyManager = anomalyManager;
        this.config = config;
    }

    @Scheduled(fixedRateString = "${anomaly.cleanup.interval-minutes:60}",
               timeUnit = TimeUnit.MINUTES,
               initialDelayString = "5")
    public void purgeExpiredAnomalies() {
        if (!config.getCleanup().isEnabled()) {
            return;
        }
        try {
            int removed = anomalyManager.cleanupOldAnomalies();
            if (removed > 0) {
                log.info("Retention cleanup removed {} anomalies", removed);
            }
        } catch (Exception e) {
            log.error("Scheduled anomaly cleanup failed", e);
        }
    }

    @Scheduled(fixedRateString = "${anomaly.eviction-interval-minutes:5}",
               timeUnit = TimeUnit.MINUTES,
               initialDelayString = "5")
    public void evictExpiredDetectorState() {
        int removed = anomalyManager.evictExpiredDetectorState();
        if (removed > 0) {
            log.info("Evicted {} idle entity keys from detector state", removed);
        }
    }
}
