package com.security.anomaly.engine.detectors;

import com.security.anomaly.config.AnomalyDetectionConfig;
import com.security.anomaly.engine.AbstractAnomalyDetector;
import com.security.anomaly.engine.EventTimestamps;
import com.security.anomaly.engine.SettingValues;
import com.security.anomaly.engine.window.FailureEntry;
import com.security.anomaly.engine.window.SlidingWindows;
import com.security.anomaly.model.AccessEvent;
import com.security.anomaly.model.AnomalyEvent;
import com.security.anomaly.model.AnomalySeverity;
import com.security.anomaly.model.AnomalyType;
import com.security.anomaly.model.ResponseAction;
import com.security.anomaly.repository.DetectorModelRepository;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Detects brute force, distributed brute force and password spraying from
 * failed authentication attempts. Uses fixed thresholds, no training needed.
 *
 * Each failure is appended to the user's, the IP's and the endpoint's list.
 * A window fires when its failure count reaches the threshold. Failures for
 * one user from several IPs are "distributed"; failures from one IP against
 * several users are a "password spray". Both sit one severity level above a
 * single-source attack with the same counts.
 */
@Component
@Order(4)
public class AuthenticationFailureDetector extends AbstractAnomalyDetector<AuthenticationFailureDetector.State> {

    public static final String NAME = "authentication_failure_detector";

    private static final Set<String> TUNABLES = Set.of("thresholds");

    private final AnomalyDetectionConfig.AuthenticationFailure config;

    // Guarded by the entity's key lock, oldest first
    private final Map<String, Deque<FailureEntry>> userFailures = new ConcurrentHashMap<>();
    private final Map<String, Deque<FailureEntry>> ipFailures = new ConcurrentHashMap<>();
    private final Map<String, Deque<FailureEntry>> endpointFailures = new ConcurrentHashMap<>();

    public AuthenticationFailureDetector(AnomalyDetectionConfig config, DetectorModelRepository modelRepository,
                                         Clock clock) {
        super(NAME, AnomalyType.AUTHENTICATION_FAILURE, config.getAuthenticationFailure().isEnabled(),
                modelRepository, clock);
        this.config = config.getAuthenticationFailure();
        setBaselineEstablished(true);
    }

    @Override
    protected boolean doTrain(List<AccessEvent> events) {
        setBaselineEstablished(true);
        return true;
    }

    @Override
    protected Optional<AnomalyEvent> doDetect(AccessEvent event) {
        if (!Boolean.FALSE.equals(event.getAuthenticationSuccess())) {
            return Optional.empty();
        }
        Optional<OffsetDateTime> time = EventTimestamps.parse(event.getTimestamp());
        if (time.isEmpty()) {
            return Optional.empty();
        }

        String userId = hasText(event.getUserId()) ? event.getUserId() : null;
        String ip = hasText(event.getIpAddress()) ? event.getIpAddress() : null;
        String endpoint = hasText(event.getEndpoint()) ? event.getEndpoint() : null;
        if (userId == null && ip == null) {
            return Optional.empty();
        }

        long now = clock.millis();
        TreeMap<Long, Integer> thresholds = new TreeMap<>(config.getThresholds());
        long retentionCutoff = now - thresholds.lastKey() * 1000L;
        List<AnomalyEvent> candidates = new ArrayList<>();

        keyLocks.withLocks(() -> {
            Deque<FailureEntry> userList = userId != null ? append(userFailures, userId, now, ip, retentionCutoff) : null;
            Deque<FailureEntry> ipList = ip != null ? append(ipFailures, ip, now, userId, retentionCutoff) : null;
            Deque<FailureEntry> endpointList = endpoint != null
                    ? append(endpointFailures, endpoint, now, ip, retentionCutoff) : null;

            if (userList != null) {
                check(event, time.get(), now, Scope.USER, userList, endpointList, thresholds, candidates);
            }
            if (ipList != null) {
                check(event, time.get(), now, Scope.IP, ipList, endpointList, thresholds, candidates);
            }
            return null;
        }, userId != null ? "user:" + userId : null, ip != null ? "ip:" + ip : null,
                endpoint != null ? "endpoint:" + endpoint : null);

        return Optional.ofNullable(AnomalySeverity.mostSevere(candidates));
    }

    private static Deque<FailureEntry> append(Map<String, Deque<FailureEntry>> lists, String key,
                                              long now, String counterpart, long retentionCutoff) {
        Deque<FailureEntry> entries = lists.computeIfAbsent(key, k -> new ArrayDeque<>());
        entries.addLast(new FailureEntry(now, counterpart));
        SlidingWindows.prune(entries, retentionCutoff);
        return entries;
    }

    private void check(AccessEvent event, OffsetDateTime time, long now, Scope scope,
                       Deque<FailureEntry> entries, Deque<FailureEntry> endpointEntries,
                       Map<Long, Integer> thresholds, List<AnomalyEvent> candidates) {
        for (Map.Entry<Long, Integer> window : thresholds.entrySet()) {
            long cutoff = now - window.getKey() * 1000L;
            int failures = SlidingWindows.countSince(entries, cutoff);
            int threshold = window.getValue();
            if (failures < threshold) {
                continue;
            }

            int distinct = SlidingWindows.distinctCounterparts(entries, cutoff).size();
            boolean spread = distinct > 1;
            AnomalySeverity severity = severityFor((double) failures / threshold, spread);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("windowSeconds", window.getKey());
            details.put("failureCount", failures);
            details.put("threshold", threshold);
            if (scope == Scope.USER) {
                details.put("uniqueIps", distinct);
                details.put("distributed", spread);
            } else {
                details.put("uniqueUsers", distinct);
                details.put("passwordSpray", spread);
            }
            if (endpointEntries != null) {
                details.put("endpointFailureCount", SlidingWindows.countSince(endpointEntries, cutoff));
            }
            details.put("detectionMethod", scope.detectionMethod);

            candidates.add(newAnomaly(event, time.toInstant())
                    .severity(severity)
                    .details(details)
                    .responseActions(actionsFor(severity, scope))
                    .build());
        }
    }

    static AnomalySeverity severityFor(double ratio, boolean spread) {
        AnomalySeverity severity = AnomalySeverity.MEDIUM;
        if (ratio > 3) {
            severity = AnomalySeverity.CRITICAL;
        } else if (ratio > 1.5) {
            severity = AnomalySeverity.HIGH;
        }
        return spread ? severity.escalate() : severity;
    }

    private static List<ResponseAction> actionsFor(AnomalySeverity severity, Scope scope) {
        List<ResponseAction> actions = new ArrayList<>(List.of(ResponseAction.LOG_ONLY, ResponseAction.NOTIFY_ADMIN));
        if (scope == Scope.USER) {
            actions.add(ResponseAction.REQUIRE_MFA);
            if (severity.rank() >= AnomalySeverity.HIGH.rank()) actions.add(ResponseAction.LOCK_ACCOUNT);
        } else {
            actions.add(ResponseAction.RATE_LIMIT);
            if (severity.rank() >= AnomalySeverity.HIGH.rank()) actions.add(ResponseAction.REQUIRE_MFA);
        }
        if (severity == AnomalySeverity.CRITICAL) {
            actions.add(ResponseAction.BLOCK_IP);
        }
        return List.copyOf(actions);
    }

    @Override
    protected int doEvictExpired(long nowMillis) {
        long cutoff = nowMillis - longestWindowSeconds() * 1000L;
        return evict(userFailures, cutoff) + evict(ipFailures, cutoff) + evict(endpointFailures, cutoff);
    }

    private static int evict(Map<String, Deque<FailureEntry>> lists, long cutoff) {
        int before = lists.size();
        lists.values().forEach(entries -> SlidingWindows.prune(entries, cutoff));
        lists.values().removeIf(Deque::isEmpty);
        return before - lists.size();
    }

    private long longestWindowSeconds() {
        return new TreeMap<>(config.getThresholds()).lastKey();
    }

    @Override
    protected State snapshotState() {
        return new State(copy(userFailures), copy(ipFailures), copy(endpointFailures));
    }

    @Override
    protected void restoreState(State state) {
        restore(state.getUserFailures(), userFailures);
        restore(state.getIpFailures(), ipFailures);
        restore(state.getEndpointFailures(), endpointFailures);
    }

    private static Map<String, List<FailureEntry>> copy(Map<String, Deque<FailureEntry>> source) {
        Map<String, List<FailureEntry>> copy = new HashMap<>();
        source.forEach((key, entries) -> copy.put(key, new ArrayList<>(entries)));
        return copy;
    }

    private static void restore(Map<String, List<FailureEntry>> source, Map<String, Deque<FailureEntry>> target) {
        target.clear();
        if (source == null) return;
        source.forEach((key, entries) -> target.put(key, new ArrayDeque<>(entries)));
    }

    @Override
    protected Class<State> stateType() {
        return State.class;
    }

    @Override
    public Map<String, Object> getSettings() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("thresholds", new TreeMap<>(config.getThresholds()));
        settings.put("trackedUsers", userFailures.size());
        settings.put("trackedIps", ipFailures.size());
        settings.put("trackedEndpoints", endpointFailures.size());
        return settings;
    }

    @Override
    protected Runnable prepareTunables(Map<String, Object> settings) {
        settings.remove("trackedUsers");
        settings.remove("trackedIps");
        settings.remove("trackedEndpoints");
        rejectUnknown(settings, TUNABLES);

        Map<Long, Integer> thresholds = settings.containsKey("thresholds")
                ? SettingValues.toWindowTable("thresholds", settings.get("thresholds")) : null;
        if (thresholds != null && thresholds.isEmpty()) {
            throw new IllegalArgumentException("thresholds must not be empty");
        }

        return () -> {
            if (thresholds != null) config.setThresholds(new TreeMap<>(thresholds));
        };
    }

    private enum Scope {
        USER("user_auth_failures"),
        IP("ip_auth_failures");

        private final String detectionMethod;

        Scope(String detectionMethod) {
            this.detectionMethod = detectionMethod;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class State {
        private Map<String, List<FailureEntry>> userFailures;
        private Map<String, List<FailureEntry>> ipFailures;
        private Map<String, List<FailureEntry>> endpointFailures;
    }
}
