package com.security.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Filters for listing stored anomalies. Null or empty fields do not filter.
 * The time range is inclusive on both ends.
 */
@Value
@Builder(toBuilder = true)
public class AnomalyQuery {
    @Builder.Default
    int limit = 100;
    AnomalyStatus status;
    Set<AnomalySeverity> severities;
    Set<AnomalyType> types;
    Instant from;
    Instant to;
    String userId;

    public boolean matches(AnomalyEvent anomaly) {
        if (status != null && anomaly.getStatus() != status) return false;
        if (severities != null && !severities.isEmpty() && !severities.contains(anomaly.getSeverity())) return false;
        if (types != null && !types.isEmpty() && !types.contains(anomaly.getAnomalyType())) return false;
        if (userId != null && !userId.isEmpty() && !userId.equals(anomaly.getUserId())) return false;
        Instant ts = anomaly.getTimestamp();
        if (from != null && (ts == null || ts.isBefore(from))) return false;
        if (to != null && (ts == null || ts.isAfter(to))) return false;
        return true;
    }
}
