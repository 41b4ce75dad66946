package com.security.anomaly.engine.detectors;

import com.security.anomaly.config.AnomalyDetectionConfig;
import com.security.anomaly.engine.AbstractAnomalyDetector;
import com.security.anomaly.engine.EventTimestamps;
import com.security.anomaly.engine.SettingValues;
import com.security.anomaly.engine.geo.GeoLocationResolver;
import com.security.anomaly.engine.geo.GeoMath;
import com.security.anomaly.model.AccessEvent;
import com.security.anomaly.model.AnomalyEvent;
import com.security.anomaly.model.AnomalySeverity;
import com.security.anomaly.model.AnomalyType;
import com.security.anomaly.model.GeoLocation;
import com.security.anomaly.model.ResponseAction;
import com.security.anomaly.repository.DetectorModelRepository;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Flags logins from countries a user has never used and physically impossible travel.
 *
 * Logic: training builds a per-user country histogram. At detection time two
 * independent checks feed one anomaly:
 *   1. new country: the resolved country is absent from a profile with at
 *      least minDataPoints entries. MEDIUM, or HIGH with require_mfa when one
 *      country holds more than dominantCountryRatio of the history.
 *   2. impossible travel: the distance from the user's last known location
 *      exceeds minDistanceKm and the implied speed exceeds maxSpeedKmh within
 *      maxTravelWindowHours. Always CRITICAL with revoke_session.
 * The last known location is replaced by every event carrying coordinates,
 * including the event that raised the anomaly.
 */
@Component
@Order(2)
public class GeoLocationDetector extends AbstractAnomalyDetector<GeoLocationDetector.State> {

    public static final String NAME = "geo_location_detector";

    private static final Set<String> TUNABLES = Set.of(
            "minDataPoints", "dominantCountryRatio", "minDistanceKm", "maxSpeedKmh", "maxTravelWindowHours");

    private final AnomalyDetectionConfig.Geo config;
    private final GeoLocationResolver resolver;

    // userId -> countryCode -> access count
    private volatile Map<String, Map<String, Long>> userCountries = new ConcurrentHashMap<>();
    private volatile Map<String, LastKnownLocation> lastLocations = new ConcurrentHashMap<>();

    public GeoLocationDetector(AnomalyDetectionConfig config, GeoLocationResolver resolver,
                               DetectorModelRepository modelRepository, Clock clock) {
        super(NAME, AnomalyType.GEOGRAPHIC_LOCATION, config.getGeo().isEnabled(), modelRepository, clock);
        this.config = config.getGeo();
        this.resolver = resolver;
    }

    @Override
    protected boolean doTrain(List<AccessEvent> events) {
        if (events.isEmpty()) {
            log.warn("No events supplied for training {}", getName());
            return false;
        }

        Map<String, Map<String, Long>> profiles = new ConcurrentHashMap<>();
        int unresolved = 0;
        for (AccessEvent event : events) {
            if (!hasText(event.getUserId()) || !hasText(event.getIpAddress())) {
                continue;
            }
            Optional<GeoLocation> location = resolver.resolve(event.getIpAddress());
            if (location.isEmpty()) {
                unresolved++;
                continue;
            }
            profiles.computeIfAbsent(event.getUserId(), k -> new ConcurrentHashMap<>())
                    .merge(location.get().getCountryCode(), 1L, Long::sum);
        }

        userCountries = profiles;
        boolean baseline = profiles.values().stream()
                .anyMatch(countries -> total(countries) >= config.getMinDataPoints());
        setBaselineEstablished(baseline);
        log.info("Built geo profiles for {} users ({} events without a resolvable location)",
                profiles.size(), unresolved);
        return true;
    }

    @Override
    protected Optional<AnomalyEvent> doDetect(AccessEvent event) {
        if (!isBaselineEstablished() || !hasText(event.getUserId()) || !hasText(event.getIpAddress())) {
            return Optional.empty();
        }
        Optional<OffsetDateTime> time = EventTimestamps.parse(event.getTimestamp());
        if (time.isEmpty()) {
            return Optional.empty();
        }
        Optional<GeoLocation> resolved = resolver.resolve(event.getIpAddress());
        if (resolved.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Long> profile = userCountries.get(event.getUserId());
        if (profile == null) {
            return Optional.empty();
        }

        return keyLocks.withLocks(
                () -> evaluate(event, time.get(), resolved.get(), profile),
                "user:" + event.getUserId());
    }

    private Optional<AnomalyEvent> evaluate(AccessEvent event, OffsetDateTime time,
                                            GeoLocation location, Map<String, Long> profile) {
        String userId = event.getUserId();
        String country = location.getCountryCode();

        boolean detected = false;
        AnomalySeverity severity = AnomalySeverity.MEDIUM;
        List<ResponseAction> actions = new ArrayList<>(List.of(ResponseAction.LOG_ONLY, ResponseAction.NOTIFY_ADMIN));
        Map<String, Object> details = new LinkedHashMap<>();

        long profileTotal = total(profile);
        if (profileTotal >= config.getMinDataPoints() && profile.getOrDefault(country, 0L) == 0) {
            detected = true;
            details.put("detectionMethod", "new_country");
            details.put("country", country);
            details.put("knownCountries", profile.keySet().stream().sorted().toList());

            long dominant = profile.values().stream().mapToLong(Long::longValue).max().orElse(0L);
            if ((double) dominant / profileTotal > config.getDominantCountryRatio()) {
                severity = AnomalySeverity.HIGH;
                actions.add(ResponseAction.REQUIRE_MFA);
            }
        }

        LastKnownLocation previous = lastLocations.get(userId);
        if (previous != null && location.hasCoordinates()) {
            double hours = (time.toInstant().toEpochMilli() - previous.getEpochMillis()) / 3_600_000.0;
            if (hours > 0 && hours < config.getMaxTravelWindowHours()) {
                double distance = GeoMath.haversineKm(previous.getLatitude(), previous.getLongitude(),
                        location.getLatitude(), location.getLongitude());
                if (distance > config.getMinDistanceKm()) {
                    double speed = GeoMath.speedKmh(distance, hours);
                    if (speed > config.getMaxSpeedKmh()) {
                        detected = true;
                        details.put("detectionMethod", "impossible_travel");
                        details.put("distanceKm", GeoMath.round2(distance));
                        details.put("timeDiffHours", GeoMath.round2(hours));
                        details.put("speedKmh", GeoMath.round2(speed));
                        details.put("previousLocation", locationDetails(
                                previous.getCountry(), previous.getCity(), previous.getTimestamp()));
                        details.put("currentLocation", locationDetails(
                                country, location.getCity(), event.getTimestamp()));

                        severity = AnomalySeverity.CRITICAL;
                        actions = new ArrayList<>(List.of(ResponseAction.LOG_ONLY, ResponseAction.NOTIFY_ADMIN,
                                ResponseAction.REQUIRE_MFA, ResponseAction.REVOKE_SESSION));
                    }
                }
            }
        }

        if (location.hasCoordinates()) {
            lastLocations.put(userId, new LastKnownLocation(event.getTimestamp(), time.toInstant().toEpochMilli(),
                    country, location.getCity(), location.getLatitude(), location.getLongitude()));
        }

        if (!detected) {
            return Optional.empty();
        }
        return Optional.of(newAnomaly(event, time.toInstant())
                .severity(severity)
                .details(details)
                .responseActions(List.copyOf(actions))
                .build());
    }

    private static Map<String, Object> locationDetails(String country, String city, String timestamp) {
        Map<String, Object> location = new LinkedHashMap<>();
        location.put("country", country);
        location.put("city", city != null ? city : "Unknown");
        location.put("timestamp", timestamp);
        return location;
    }

    private static long total(Map<String, Long> profile) {
        return profile.values().stream().mapToLong(Long::longValue).sum();
    }

    @Override
    protected State snapshotState() {
        Map<String, Map<String, Long>> countries = new HashMap<>();
        userCountries.forEach((user, counts) -> countries.put(user, new HashMap<>(counts)));
        return new State(countries, new HashMap<>(lastLocations));
    }

    @Override
    protected void restoreState(State state) {
        Map<String, Map<String, Long>> countries = new ConcurrentHashMap<>();
        if (state.getUserCountries() != null) {
            state.getUserCountries().forEach((user, counts) -> countries.put(user, new ConcurrentHashMap<>(counts)));
        }
        userCountries = countries;
        lastLocations = state.getLastLocations() != null
                ? new ConcurrentHashMap<>(state.getLastLocations())
                : new ConcurrentHashMap<>();
    }

    @Override
    protected Class<State> stateType() {
        return State.class;
    }

    @Override
    public Map<String, Object> getSettings() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("minDataPoints", config.getMinDataPoints());
        settings.put("dominantCountryRatio", config.getDominantCountryRatio());
        settings.put("minDistanceKm", config.getMinDistanceKm());
        settings.put("maxSpeedKmh", config.getMaxSpeedKmh());
        settings.put("maxTravelWindowHours", config.getMaxTravelWindowHours());
        settings.put("profiledUsers", userCountries.size());
        settings.put("trackedLocations", lastLocations.size());
        return settings;
    }

    @Override
    protected Runnable prepareTunables(Map<String, Object> settings) {
        settings.remove("profiledUsers");
        settings.remove("trackedLocations");
        rejectUnknown(settings, TUNABLES);

        Integer minDataPoints = settings.containsKey("minDataPoints")
                ? SettingValues.toInt("minDataPoints", settings.get("minDataPoints")) : null;
        Double dominantRatio = settings.containsKey("dominantCountryRatio")
                ? SettingValues.toDouble("dominantCountryRatio", settings.get("dominantCountryRatio")) : null;
        Double minDistance = settings.containsKey("minDistanceKm")
                ? SettingValues.toDouble("minDistanceKm", settings.get("minDistanceKm")) : null;
        Double maxSpeed = settings.containsKey("maxSpeedKmh")
                ? SettingValues.toDouble("maxSpeedKmh", settings.get("maxSpeedKmh")) : null;
        Double travelWindow = settings.containsKey("maxTravelWindowHours")
                ? SettingValues.toDouble("maxTravelWindowHours", settings.get("maxTravelWindowHours")) : null;

        if (minDataPoints != null) SettingValues.requirePositive("minDataPoints", minDataPoints);
        if (dominantRatio != null) SettingValues.requireRange("dominantCountryRatio", dominantRatio, 0, 1);
        if (minDistance != null) SettingValues.requireRange("minDistanceKm", minDistance, 0, Double.MAX_VALUE);
        if (maxSpeed != null) SettingValues.requirePositive("maxSpeedKmh", maxSpeed);
        if (travelWindow != null) SettingValues.requirePositive("maxTravelWindowHours", travelWindow);

        return () -> {
            if (minDataPoints != null) config.setMinDataPoints(minDataPoints);
            if (dominantRatio != null) config.setDominantCountryRatio(dominantRatio);
            if (minDistance != null) config.setMinDistanceKm(minDistance);
            if (maxSpeed != null) config.setMaxSpeedKmh(maxSpeed);
            if (travelWindow != null) config.setMaxTravelWindowHours(travelWindow);
        };
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LastKnownLocation {
        private String timestamp;
        private long epochMillis;
        private String country;
        private String city;
        private double latitude;
        private double longitude;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class State {
        private Map<String, Map<String, Long>> userCountries;
        private Map<String, LastKnownLocation> lastLocations;
    }
}
