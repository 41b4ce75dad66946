package com.security.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.security.anomaly.config.AerospikeConfig;
import com.security.anomaly.model.AnomalyEvent;
import com.security.anomaly.model.AnomalyQuery;
import com.security.anomaly.model.AnomalySeverity;
import com.security.anomaly.model.AnomalyStatus;
import com.security.anomaly.model.AnomalyType;
import com.security.anomaly.model.ResponseAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

@Repository
public class AnomalyRepository {

    private static final Logger log = LoggerFactory.getLogger(AnomalyRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AnomalyRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                             @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(AnomalyEvent anomaly) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALIES, anomaly.getAnomalyId());

        client.put(writePolicy, key,
                new Bin("anomalyId", anomaly.getAnomalyId()),
                new Bin("timestamp", anomaly.getTimestamp() != null ? anomaly.getTimestamp().toEpochMilli() : 0L),
                new Bin("anomalyType", anomaly.getAnomalyType().getValue()),
                new Bin("severity", anomaly.getSeverity().getValue()),
                new Bin("sourceIp", orEmpty(anomaly.getSourceIp())),
                new Bin("userId", orEmpty(anomaly.getUserId())),
                new Bin("apiEndpoint", orEmpty(anomaly.getApiEndpoint())),
                new Bin("details", serializeDetails(anomaly.getDetails())),
                new Bin("actions", serializeActions(anomaly.getResponseActions())),
                new Bin("status", anomaly.getStatus().getValue()),
                new Bin("reviewComments", orEmpty(anomaly.getReviewComments())),
                new Bin("reviewerId", orEmpty(anomaly.getReviewerId())));
    }

    public AnomalyEvent findById(String anomalyId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALIES, anomalyId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Anomalies matching the query, newest first, at most {@code query.getLimit()}.
     */
    public List<AnomalyEvent> find(AnomalyQuery query) {
        List<AnomalyEvent> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALIES,
                (key, record) -> {
                    try {
                        AnomalyEvent anomaly = mapRecord(record);
                        if (query.matches(anomaly)) {
                            synchronized (results) {
                                results.add(anomaly);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read anomaly record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparing(AnomalyEvent::getTimestamp,
                Comparator.nullsLast(Comparator.reverseOrder())));
        int limit = Math.max(0, query.getLimit());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    /**
     * Delete anomalies whose event time is before the cutoff. Stops between
     * deletions once {@code cancelled} reports true.
     *
     * @return number of records deleted
     */
    public int deleteOlderThan(Instant cutoff, BooleanSupplier cancelled) {
        long cutoffMillis = cutoff.toEpochMilli();
        List<Key> expired = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALIES,
                (key, record) -> {
                    try {
                        if (record.getLong("timestamp") < cutoffMillis) {
                            synchronized (expired) {
                                expired.add(key);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read anomaly record during cleanup: {}", e.getMessage());
                    }
                }, "timestamp");

        int deleted = 0;
        for (Key key : expired) {
            if (cancelled.getAsBoolean()) {
                log.info("Anomaly cleanup aborted after {} of {} deletions", deleted, expired.size());
                break;
            }
            if (client.delete(writePolicy, key)) {
                deleted++;
            }
        }
        return deleted;
    }

    private AnomalyEvent mapRecord(Record record) {
        long timestamp = record.getLong("timestamp");
        return AnomalyEvent.builder()
                .anomalyId(record.getString("anomalyId"))
                .timestamp(timestamp > 0 ? Instant.ofEpochMilli(timestamp) : null)
                .anomalyType(AnomalyType.fromValue(record.getString("anomalyType")))
                .severity(AnomalySeverity.fromValue(record.getString("severity")))
                .sourceIp(emptyToNull(record.getString("sourceIp")))
                .userId(emptyToNull(record.getString("userId")))
                .apiEndpoint(emptyToNull(record.getString("apiEndpoint")))
                .details(deserializeDetails(record.getString("details")))
                .responseActions(deserializeActions(record.getString("actions")))
                .status(AnomalyStatus.fromValue(record.getString("status")))
                .reviewComments(emptyToNull(record.getString("reviewComments")))
                .reviewerId(emptyToNull(record.getString("reviewerId")))
                .build();
    }

    private String serializeDetails(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details != null ? details : Collections.emptyMap());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize anomaly details", e);
            return "{}";
        }
    }

    private Map<String, Object> deserializeDetails(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyMap();
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize anomaly details", e);
            return Collections.emptyMap();
        }
    }

    private String serializeActions(List<ResponseAction> actions) {
        try {
            return objectMapper.writeValueAsString(actions != null ? actions : Collections.emptyList());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize response actions", e);
            return "[]";
        }
    }

    private List<ResponseAction> deserializeActions(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyList();
        try {
            return objectMapper.readValue(json, new TypeReference<List<ResponseAction>>() {});
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize response actions", e);
            return Collections.emptyList();
        }
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    private static String emptyToNull(String value) {
        return value != null && !value.isEmpty() ? value : null;
    }
}
