package com.security.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Severity of a detected anomaly, declared from least to most severe so that
 * {@link #rank()} gives the total order used when several candidates compete.
 */
public enum AnomalySeverity {
    INFO("info"),
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    AnomalySeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int rank() {
        return ordinal();
    }

    public boolean isMoreSevereThan(AnomalySeverity other) {
        return rank() > other.rank();
    }

    /**
     * One level up, saturating at CRITICAL.
     */
    public AnomalySeverity escalate() {
        AnomalySeverity[] all = values();
        return all[Math.min(ordinal() + 1, all.length - 1)];
    }

    @JsonCreator
    public static AnomalySeverity fromValue(String value) {
        if (value != null) {
            for (AnomalySeverity severity : values()) {
                if (severity.value.equalsIgnoreCase(value.trim())) {
                    return severity;
                }
            }
        }
        throw new IllegalArgumentException("Invalid severity: " + value);
    }

    /**
     * Most severe anomaly among the candidates. When two share the highest rank
     * the one that appears first wins. Returns null for an empty list.
     */
    public static AnomalyEvent mostSevere(List<AnomalyEvent> candidates) {
        AnomalyEvent best = null;
        for (AnomalyEvent candidate : candidates) {
            if (best == null || candidate.getSeverity().isMoreSevereThan(best.getSeverity())) {
                best = candidate;
            }
        }
        return best;
    }
}
