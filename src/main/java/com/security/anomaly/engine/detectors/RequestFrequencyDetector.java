package com.security.anomaly.engine.detectors;

import com.security.anomaly.config.AnomalyDetectionConfig;
import com.security.anomaly.engine.AbstractAnomalyDetector;
import com.security.anomaly.engine.EventTimestamps;
import com.security.anomaly.engine.SettingValues;
import com.security.anomaly.engine.window.CounterBucket;
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
 * Detects request bursts per user and per source IP.
 *
 * Logic: every request is counted into per-window bucket lists using the
 * current wall-clock time. After pruning, the window total is compared with
 * the entity's learned threshold (or the window default). excessRatio =
 * count / threshold decides severity: >5 CRITICAL, >3 HIGH, >1.5 MEDIUM,
 * otherwise LOW.
 *
 * Example: default 60s threshold is 30. The 31st request inside a minute gives
 * excessRatio 1.03 (LOW); the 151st gives 5.03 (CRITICAL).
 *
 * Training learns per-entity thresholds as mean + 2 * stdev of the sliding
 * request counts, never below the window default.
 */
@Component
@Order(3)
public class RequestFrequencyDetector extends AbstractAnomalyDetector<RequestFrequencyDetector.State> {

    public static final String NAME = "request_frequency_detector";

    private static final Set<String> TUNABLES = Set.of("minTrainingEvents", "bucketMergeMillis", "defaultThresholds");

    private final AnomalyDetectionConfig.RequestFrequency config;

    // entity -> window seconds -> learned threshold
    private final Map<String, Map<Long, Integer>> userThresholds = new ConcurrentHashMap<>();
    private final Map<String, Map<Long, Integer>> ipThresholds = new ConcurrentHashMap<>();

    // entity -> window seconds -> buckets, oldest first. Guarded by the entity's key lock.
    private final Map<String, Map<Long, Deque<CounterBucket>>> userCounters = new ConcurrentHashMap<>();
    private final Map<String, Map<Long, Deque<CounterBucket>>> ipCounters = new ConcurrentHashMap<>();

    public RequestFrequencyDetector(AnomalyDetectionConfig config, DetectorModelRepository modelRepository,
                                    Clock clock) {
        super(NAME, AnomalyType.REQUEST_FREQUENCY, config.getRequestFrequency().isEnabled(), modelRepository, clock);
        this.config = config.getRequestFrequency();
    }

    @Override
    protected boolean doTrain(List<AccessEvent> events) {
        if (events.size() < config.getMinTrainingEvents()) {
            log.warn("Insufficient training data for {}: {} events, need {}",
                    getName(), events.size(), config.getMinTrainingEvents());
            return false;
        }

        Map<String, List<Long>> userTimes = new HashMap<>();
        Map<String, List<Long>> ipTimes = new HashMap<>();
        for (AccessEvent event : events) {
            Optional<OffsetDateTime> time = EventTimestamps.parse(event.getTimestamp());
            if (time.isEmpty()) {
                continue;
            }
            long millis = time.get().toInstant().toEpochMilli();
            if (hasText(event.getUserId())) {
                userTimes.computeIfAbsent(event.getUserId(), k -> new ArrayList<>()).add(millis);
            }
            if (hasText(event.getIpAddress())) {
                ipTimes.computeIfAbsent(event.getIpAddress(), k -> new ArrayList<>()).add(millis);
            }
        }

        Map<Long, Integer> defaults = defaultThresholds();
        userTimes.forEach((user, times) -> userThresholds
                .computeIfAbsent(user, k -> new ConcurrentHashMap<>())
                .putAll(learnThresholds(times, defaults)));
        ipTimes.forEach((ip, times) -> ipThresholds
                .computeIfAbsent(ip, k -> new ConcurrentHashMap<>())
                .putAll(learnThresholds(times, defaults)));

        setBaselineEstablished(true);
        log.info("Learned frequency thresholds for {} users and {} IPs", userTimes.size(), ipTimes.size());
        return true;
    }

    /**
     * For each window: the count of events in [t, t + window] for every event
     * time t, reduced to mean + 2 * sample stdev (mean / 2 for one point).
     */
    static Map<Long, Integer> learnThresholds(List<Long> times, Map<Long, Integer> defaults) {
        long[] sorted = times.stream().mapToLong(Long::longValue).sorted().toArray();
        Map<Long, Integer> learned = new TreeMap<>();
        for (Map.Entry<Long, Integer> window : defaults.entrySet()) {
            long windowMillis = window.getKey() * 1000L;
            double[] counts = new double[sorted.length];
            int end = 0;
            for (int start = 0; start < sorted.length; start++) {
                if (end < start) end = start;
                while (end < sorted.length && sorted[end] <= sorted[start] + windowMillis) {
                    end++;
                }
                counts[start] = end - start;
            }
            if (counts.length == 0) {
                continue;
            }
            double mean = mean(counts);
            double stdev = counts.length > 1 ? sampleStdev(counts, mean) : mean / 2;
            int threshold = (int) (mean + 2 * stdev);
            learned.put(window.getKey(), Math.max(threshold, window.getValue()));
        }
        return learned;
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    private static double sampleStdev(double[] values, double mean) {
        double squares = 0;
        for (double v : values) squares += (v - mean) * (v - mean);
        return Math.sqrt(squares / (values.length - 1));
    }

    @Override
    protected Optional<AnomalyEvent> doDetect(AccessEvent event) {
        Optional<OffsetDateTime> time = EventTimestamps.parse(event.getTimestamp());
        if (time.isEmpty()) {
            return Optional.empty();
        }
        String userId = hasText(event.getUserId()) ? event.getUserId() : null;
        String ip = hasText(event.getIpAddress()) ? event.getIpAddress() : null;
        if (userId == null && ip == null) {
            return Optional.empty();
        }

        long now = clock.millis();
        Map<Long, Integer> defaults = defaultThresholds();
        List<AnomalyEvent> candidates = new ArrayList<>();

        keyLocks.withLocks(() -> {
            if (userId != null) {
                check(event, time.get(), now, Scope.USER, userId, userCounters, userThresholds, defaults, candidates);
            }
            if (ip != null) {
                check(event, time.get(), now, Scope.IP, ip, ipCounters, ipThresholds, defaults, candidates);
            }
            return null;
        }, userId != null ? "user:" + userId : null, ip != null ? "ip:" + ip : null);

        return Optional.ofNullable(AnomalySeverity.mostSevere(candidates));
    }

    private void check(AccessEvent event, OffsetDateTime time, long now, Scope scope, String entity,
                       Map<String, Map<Long, Deque<CounterBucket>>> counters,
                       Map<String, Map<Long, Integer>> learned,
                       Map<Long, Integer> defaults, List<AnomalyEvent> candidates) {
        Map<Long, Deque<CounterBucket>> windows = counters.computeIfAbsent(entity, k -> new ConcurrentHashMap<>());
        Map<Long, Integer> entityThresholds = learned.getOrDefault(entity, Map.of());

        for (Map.Entry<Long, Integer> window : defaults.entrySet()) {
            long windowSeconds = window.getKey();
            long cutoff = now - windowSeconds * 1000L;
            Deque<CounterBucket> buckets = windows.computeIfAbsent(windowSeconds, k -> new ArrayDeque<>());

            SlidingWindows.prune(buckets, cutoff);
            SlidingWindows.record(buckets, now, config.getBucketMergeMillis());
            int count = SlidingWindows.sumSince(buckets, cutoff);
            int threshold = entityThresholds.getOrDefault(windowSeconds, window.getValue());

            if (count > threshold) {
                double excessRatio = (double) count / threshold;
                AnomalySeverity severity = severityFor(excessRatio);

                Map<String, Object> details = new LinkedHashMap<>();
                details.put("windowSeconds", windowSeconds);
                details.put("requestCount", count);
                details.put("threshold", threshold);
                details.put("excessRatio", Math.round(excessRatio * 100.0) / 100.0);
                details.put("detectionMethod", scope.detectionMethod);

                candidates.add(newAnomaly(event, time.toInstant())
                        .severity(severity)
                        .details(details)
                        .responseActions(actionsFor(severity, scope))
                        .build());
            }
        }
    }

    static AnomalySeverity severityFor(double excessRatio) {
        if (excessRatio > 5) return AnomalySeverity.CRITICAL;
        if (excessRatio > 3) return AnomalySeverity.HIGH;
        if (excessRatio > 1.5) return AnomalySeverity.MEDIUM;
        return AnomalySeverity.LOW;
    }

    private static List<ResponseAction> actionsFor(AnomalySeverity severity, Scope scope) {
        return switch (severity) {
            case CRITICAL -> List.of(ResponseAction.LOG_ONLY, ResponseAction.NOTIFY_ADMIN,
                    ResponseAction.RATE_LIMIT, scope == Scope.USER ? ResponseAction.REQUIRE_MFA : ResponseAction.BLOCK_IP);
            case HIGH -> List.of(ResponseAction.LOG_ONLY, ResponseAction.NOTIFY_ADMIN, ResponseAction.RATE_LIMIT);
            case MEDIUM -> List.of(ResponseAction.LOG_ONLY, ResponseAction.NOTIFY_ADMIN);
            default -> List.of(ResponseAction.LOG_ONLY);
        };
    }

    private Map<Long, Integer> defaultThresholds() {
        return new TreeMap<>(config.getDefaultThresholds());
    }

    @Override
    protected int doEvictExpired(long nowMillis) {
        Map<Long, Integer> windows = defaultThresholds();
        return evict(userCounters, windows.keySet(), nowMillis) + evict(ipCounters, windows.keySet(), nowMillis);
    }

    private static int evict(Map<String, Map<Long, Deque<CounterBucket>>> counters, Set<Long> windows,
                             long nowMillis) {
        int before = counters.size();
        for (Map<Long, Deque<CounterBucket>> perWindow : counters.values()) {
            // windows dropped through settings no longer count anything
            perWindow.keySet().retainAll(windows);
            perWindow.forEach((windowSeconds, buckets) ->
                    SlidingWindows.prune(buckets, nowMillis - windowSeconds * 1000L));
            perWindow.values().removeIf(Deque::isEmpty);
        }
        counters.values().removeIf(Map::isEmpty);
        return before - counters.size();
    }

    @Override
    protected State snapshotState() {
        return new State(copyThresholds(userThresholds), copyThresholds(ipThresholds),
                copyCounters(userCounters), copyCounters(ipCounters));
    }

    @Override
    protected void restoreState(State state) {
        userThresholds.clear();
        ipThresholds.clear();
        userCounters.clear();
        ipCounters.clear();
        restoreThresholds(state.getUserThresholds(), userThresholds);
        restoreThresholds(state.getIpThresholds(), ipThresholds);
        restoreCounters(state.getUserCounters(), userCounters);
        restoreCounters(state.getIpCounters(), ipCounters);
    }

    private static Map<String, Map<Long, Integer>> copyThresholds(Map<String, Map<Long, Integer>> source) {
        Map<String, Map<Long, Integer>> copy = new HashMap<>();
        source.forEach((entity, windows) -> copy.put(entity, new TreeMap<>(windows)));
        return copy;
    }

    private static Map<String, Map<Long, List<CounterBucket>>> copyCounters(
            Map<String, Map<Long, Deque<CounterBucket>>> source) {
        Map<String, Map<Long, List<CounterBucket>>> copy = new HashMap<>();
        source.forEach((entity, windows) -> {
            Map<Long, List<CounterBucket>> perWindow = new TreeMap<>();
            windows.forEach((window, buckets) -> perWindow.put(window, new ArrayList<>(buckets)));
            copy.put(entity, perWindow);
        });
        return copy;
    }

    private static void restoreThresholds(Map<String, Map<Long, Integer>> source,
                                          Map<String, Map<Long, Integer>> target) {
        if (source == null) return;
        source.forEach((entity, windows) -> target.put(entity, new ConcurrentHashMap<>(windows)));
    }

    private static void restoreCounters(Map<String, Map<Long, List<CounterBucket>>> source,
                                        Map<String, Map<Long, Deque<CounterBucket>>> target) {
        if (source == null) return;
        source.forEach((entity, windows) -> {
            Map<Long, Deque<CounterBucket>> perWindow = new ConcurrentHashMap<>();
            windows.forEach((window, buckets) -> perWindow.put(window, new ArrayDeque<>(buckets)));
            target.put(entity, perWindow);
        });
    }

    @Override
    protected Class<State> stateType() {
        return State.class;
    }

    @Override
    public Map<String, Object> getSettings() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("minTrainingEvents", config.getMinTrainingEvents());
        settings.put("bucketMergeMillis", config.getBucketMergeMillis());
        settings.put("defaultThresholds", defaultThresholds());
        settings.put("learnedUsers", userThresholds.size());
        settings.put("learnedIps", ipThresholds.size());
        settings.put("trackedUsers", userCounters.size());
        settings.put("trackedIps", ipCounters.size());
        return settings;
    }

    @Override
    protected Runnable prepareTunables(Map<String, Object> settings) {
        settings.remove("learnedUsers");
        settings.remove("learnedIps");
        settings.remove("trackedUsers");
        settings.remove("trackedIps");
        rejectUnknown(settings, TUNABLES);

        Integer minTrainingEvents = settings.containsKey("minTrainingEvents")
                ? SettingValues.toInt("minTrainingEvents", settings.get("minTrainingEvents")) : null;
        Integer bucketMergeMillis = settings.containsKey("bucketMergeMillis")
                ? SettingValues.toInt("bucketMergeMillis", settings.get("bucketMergeMillis")) : null;
        Map<Long, Integer> thresholds = settings.containsKey("defaultThresholds")
                ? SettingValues.toWindowTable("defaultThresholds", settings.get("defaultThresholds")) : null;

        if (minTrainingEvents != null) SettingValues.requirePositive("minTrainingEvents", minTrainingEvents);
        if (bucketMergeMillis != null) SettingValues.requireRange("bucketMergeMillis", bucketMergeMillis, 0, 60_000);
        if (thresholds != null && thresholds.isEmpty()) {
            throw new IllegalArgumentException("defaultThresholds must not be empty");
        }

        return () -> {
            if (minTrainingEvents != null) config.setMinTrainingEvents(minTrainingEvents);
            if (bucketMergeMillis != null) config.setBucketMergeMillis(bucketMergeMillis);
            if (thresholds != null) config.setDefaultThresholds(new TreeMap<>(thresholds));
        };
    }

    private enum Scope {
        USER("user_frequency"),
        IP("ip_frequency");

        private final String detectionMethod;

        Scope(String detectionMethod) {
            this.detectionMethod = detectionMethod;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class State {
        private Map<String, Map<Long, Integer>> userThresholds;
        private Map<String, Map<Long, Integer>> ipThresholds;
        private Map<String, Map<Long, List<CounterBucket>>> userCounters;
        private Map<String, Map<Long, List<CounterBucket>>> ipCounters;
    }
}
