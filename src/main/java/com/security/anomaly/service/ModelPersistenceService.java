package com.security.anomaly.service;

import com.security.anomaly.config.AnomalyDetectionConfig;
import com.security.anomaly.engine.AnomalyDetector;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs detector model saves and loads on a dedicated thread with an upper
 * time bound, so slow storage never stalls training requests or startup.
 */
@Service
public class ModelPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(ModelPersistenceService.class);

    private final AnomalyDetectionConfig config;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "model-persistence");
        t.setDaemon(true);
        return t;
    });

    public ModelPersistenceService(AnomalyDetectionConfig config) {
        this.config = config;
    }

    public Path storageRoot() {
        return Path.of(config.getStorageRoot());
    }

    public boolean save(AnomalyDetector detector) {
        Path root = storageRoot();
        return runBounded(detector.getName(), "save", () -> detector.saveModel(root));
    }

    public boolean load(AnomalyDetector detector) {
        Path root = storageRoot();
        return runBounded(detector.getName(), "load", () -> detector.loadModel(root));
    }

    private boolean runBounded(String detectorName, String operation, Callable<Boolean> task) {
        Future<Boolean> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            log.warn("Model {} for {} rejected, persistence is shut down", operation, detectorName);
            return false;
        }

        try {
            return Boolean.TRUE.equals(future.get(config.getPersistenceTimeoutSeconds(), TimeUnit.SECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Model {} for {} timed out after {}s", operation, detectorName,
                    config.getPersistenceTimeoutSeconds());
            return false;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Interrupted during model {} for {}", operation, detectorName);
            return false;
        } catch (ExecutionException e) {
            log.error("Model {} for {} failed", operation, detectorName, e.getCause());
            return false;
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
