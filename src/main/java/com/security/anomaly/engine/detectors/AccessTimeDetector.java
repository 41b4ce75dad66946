package com.security.anomaly.engine.detectors;

import com.security.anomaly.config.AnomalyDetectionConfig;
import com.security.anomaly.engine.AbstractAnomalyDetector;
import com.security.anomaly.engine.EventTimestamps;
import com.security.anomaly.engine.SettingValues;
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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Flags access at hours a user does not normally work.
 *
 * Logic: training builds a 24-bucket hour histogram per user. A profile is
 * usable once it holds minDataPoints accesses spread over at least
 * minActiveHours distinct hours. An access at an hour with no history is
 * MEDIUM (HIGH inside the night window); an access at an hour seen less than
 * rareHourRatio of the user's busiest hour is LOW.
 *
 * Example: a user who only works 09:00-16:00 logging in at 02:00 gives a
 * HIGH unusual_access_hour anomaly.
 */
@Component
@Order(1)
public class AccessTimeDetector extends AbstractAnomalyDetector<AccessTimeDetector.State> {

    public static final String NAME = "access_time_detector";

    private static final Set<String> TUNABLES = Set.of(
            "minDataPoints", "minActiveHours", "rareHourRatio", "nightStartHour", "nightEndHour");

    private final AnomalyDetectionConfig.AccessTime config;

    // userId -> hour (0-23) -> access count
    private volatile Map<String, Map<Integer, Long>> userProfiles = new ConcurrentHashMap<>();

    public AccessTimeDetector(AnomalyDetectionConfig config, DetectorModelRepository modelRepository, Clock clock) {
        super(NAME, AnomalyType.ACCESS_TIME, config.getAccessTime().isEnabled(), modelRepository, clock);
        this.config = config.getAccessTime();
    }

    @Override
    protected boolean doTrain(List<AccessEvent> events) {
        if (events.isEmpty()) {
            log.warn("No events supplied for training {}", getName());
            return false;
        }

        Map<String, Map<Integer, Long>> profiles = new ConcurrentHashMap<>();
        for (AccessEvent event : events) {
            if (!hasText(event.getUserId())) {
                continue;
            }
            Optional<OffsetDateTime> time = EventTimestamps.parse(event.getTimestamp());
            if (time.isEmpty()) {
                continue;
            }
            profiles.computeIfAbsent(event.getUserId(), k -> new ConcurrentHashMap<>())
                    .merge(time.get().getHour(), 1L, Long::sum);
        }

        userProfiles = profiles;
        boolean baseline = profiles.values().stream()
                .anyMatch(hours -> total(hours) >= config.getMinDataPoints());
        setBaselineEstablished(baseline);
        log.info("Built access-time profiles for {} users", profiles.size());
        return true;
    }

    @Override
    protected Optional<AnomalyEvent> doDetect(AccessEvent event) {
        if (!isBaselineEstablished() || !hasText(event.getUserId())) {
            return Optional.empty();
        }
        Optional<OffsetDateTime> time = EventTimestamps.parse(event.getTimestamp());
        if (time.isEmpty()) {
            return Optional.empty();
        }

        Map<Integer, Long> profile = userProfiles.get(event.getUserId());
        if (profile == null || !isUsable(profile)) {
            return Optional.empty();
        }

        int hour = time.get().getHour();
        long atHour = profile.getOrDefault(hour, 0L);
        long max = profile.values().stream().mapToLong(Long::longValue).max().orElse(0L);

        if (atHour == 0) {
            AnomalySeverity severity = isNightHour(hour) ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM;
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("unusualHour", hour);
            details.put("typicalHours", hoursAbove(profile, 0));
            details.put("detectionMethod", "unusual_access_hour");

            return Optional.of(newAnomaly(event, time.get().toInstant())
                    .severity(severity)
                    .details(details)
                    .responseActions(List.of(ResponseAction.LOG_ONLY, ResponseAction.NOTIFY_ADMIN))
                    .build());
        }

        if (atHour < max * config.getRareHourRatio()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("unusualHour", hour);
            details.put("frequencyAtHour", atHour);
            details.put("maxFrequency", max);
            details.put("typicalHours", hoursAbove(profile, max * 0.5));
            details.put("detectionMethod", "rare_access_hour");

            return Optional.of(newAnomaly(event, time.get().toInstant())
                    .severity(AnomalySeverity.LOW)
                    .details(details)
                    .responseActions(List.of(ResponseAction.LOG_ONLY))
                    .build());
        }

        return Optional.empty();
    }

    private boolean isUsable(Map<Integer, Long> profile) {
        long activeHours = profile.values().stream().filter(count -> count > 0).count();
        return total(profile) >= config.getMinDataPoints() && activeHours >= config.getMinActiveHours();
    }

    /**
     * Inclusive on both ends; a start after the end wraps past midnight.
     */
    boolean isNightHour(int hour) {
        int start = config.getNightStartHour();
        int end = config.getNightEndHour();
        if (start <= end) {
            return hour >= start && hour <= end;
        }
        return hour >= start || hour <= end;
    }

    private static List<Integer> hoursAbove(Map<Integer, Long> profile, double floor) {
        return profile.entrySet().stream()
                .filter(e -> e.getValue() > floor)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    private static long total(Map<Integer, Long> profile) {
        return profile.values().stream().mapToLong(Long::longValue).sum();
    }

    @Override
    protected State snapshotState() {
        Map<String, Map<Integer, Long>> copy = new HashMap<>();
        userProfiles.forEach((user, hours) -> copy.put(user, new HashMap<>(hours)));
        return new State(copy);
    }

    @Override
    protected void restoreState(State state) {
        Map<String, Map<Integer, Long>> restored = new ConcurrentHashMap<>();
        if (state.getUserProfiles() != null) {
            state.getUserProfiles().forEach((user, hours) -> restored.put(user, new ConcurrentHashMap<>(hours)));
        }
        userProfiles = restored;
    }

    @Override
    protected Class<State> stateType() {
        return State.class;
    }

    @Override
    public Map<String, Object> getSettings() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("minDataPoints", config.getMinDataPoints());
        settings.put("minActiveHours", config.getMinActiveHours());
        settings.put("rareHourRatio", config.getRareHourRatio());
        settings.put("nightStartHour", config.getNightStartHour());
        settings.put("nightEndHour", config.getNightEndHour());
        settings.put("profiledUsers", userProfiles.size());
        return settings;
    }

    @Override
    protected Runnable prepareTunables(Map<String, Object> settings) {
        settings.remove("profiledUsers");
        rejectUnknown(settings, TUNABLES);

        Integer minDataPoints = settings.containsKey("minDataPoints")
                ? SettingValues.toInt("minDataPoints", settings.get("minDataPoints")) : null;
        Integer minActiveHours = settings.containsKey("minActiveHours")
                ? SettingValues.toInt("minActiveHours", settings.get("minActiveHours")) : null;
        Double rareHourRatio = settings.containsKey("rareHourRatio")
                ? SettingValues.toDouble("rareHourRatio", settings.get("rareHourRatio")) : null;
        Integer nightStart = settings.containsKey("nightStartHour")
                ? SettingValues.toInt("nightStartHour", settings.get("nightStartHour")) : null;
        Integer nightEnd = settings.containsKey("nightEndHour")
                ? SettingValues.toInt("nightEndHour", settings.get("nightEndHour")) : null;

        if (minDataPoints != null) SettingValues.requirePositive("minDataPoints", minDataPoints);
        if (minActiveHours != null) SettingValues.requireRange("minActiveHours", minActiveHours, 1, 24);
        if (rareHourRatio != null) SettingValues.requireRange("rareHourRatio", rareHourRatio, 0, 1);
        if (nightStart != null) SettingValues.requireRange("nightStartHour", nightStart, 0, 23);
        if (nightEnd != null) SettingValues.requireRange("nightEndHour", nightEnd, 0, 23);

        return () -> {
            if (minDataPoints != null) config.setMinDataPoints(minDataPoints);
            if (minActiveHours != null) config.setMinActiveHours(minActiveHours);
            if (rareHourRatio != null) config.setRareHourRatio(rareHourRatio);
            if (nightStart != null) config.setNightStartHour(nightStart);
            if (nightEnd != null) config.setNightEndHour(nightEnd);
        };
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class State {
        private Map<String, Map<Integer, Long>> userProfiles;
    }
}
