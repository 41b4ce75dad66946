package com.security.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEventProcessed(int anomalyCount) {
        Counter.builder("events.processed.count")
                .tag("anomalous", String.valueOf(anomalyCount > 0))
                .register(registry)
                .increment();
    }

    public void recordAnomaly(String anomalyType, String severity) {
        Counter.builder("anomaly.detected.count")
                .tag("type", anomalyType)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordDetectorError(String detector) {
        Counter.builder("detector.error.count")
                .tag("detector", detector)
                .register(registry)
                .increment();
    }

    public void recordTraining(String detector, boolean success) {
        Counter.builder("detector.training.count")
                .tag("detector", detector)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordStatusUpdate(String status) {
        Counter.builder("anomaly.status_update.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordCleanup(int removed) {
        Counter.builder("anomaly.cleanup.removed")
                .register(registry)
                .increment(removed);
    }
}
