package com.security.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly")
public class AnomalyDetectionConfig {

    // Root directory for persisted detector models (<storageRoot>/models/<detector>.json)
    private String storageRoot = "data/anomalies";

    // Confidence threshold surfaced to downstream responders, in [0, 1]
    private double detectionThreshold = 0.8;

    // Hand detected anomalies to the AnomalyResponder
    private boolean enableResponses = true;

    // Anomalies whose event time is older than this are removed by cleanup
    private int storageRetentionDays = 30;

    // Hard cap on the number of anomalies a single query returns
    private int maxQueryLimit = 1000;

    // Upper bound for one model save/load before it is cancelled
    private int persistenceTimeoutSeconds = 30;

    // How often idle users/IPs/endpoints are dropped from detector windows
    private int evictionIntervalMinutes = 5;

    private Cleanup cleanup = new Cleanup();
    private AccessTime accessTime = new AccessTime();
    private Geo geo = new Geo();
    private RequestFrequency requestFrequency = new RequestFrequency();
    private AuthenticationFailure authenticationFailure = new AuthenticationFailure();

    @Data
    public static class Cleanup {
        private boolean enabled = true;
        private int intervalMinutes = 60;
    }

    @Data
    public static class AccessTime {
        private boolean enabled = true;
        private int minDataPoints = 20;
        private int minActiveHours = 6;
        // An hour seen less than this fraction of the busiest hour counts as rare
        private double rareHourRatio = 0.1;
        // Night hours [start, end] inclusive; start > end wraps past midnight
        private int nightStartHour = 23;
        private int nightEndHour = 5;
    }

    @Data
    public static class Geo {
        private boolean enabled = true;
        private int minDataPoints = 10;
        private double dominantCountryRatio = 0.9;
        private double minDistanceKm = 100.0;
        private double maxSpeedKmh = 800.0;
        private double maxTravelWindowHours = 24.0;
        // MaxMind GeoIP2/GeoLite2 City database; the static table is used when absent
        private String databasePath;
        private Map<String, StaticLocation> staticLocations = new LinkedHashMap<>();
    }

    @Data
    public static class StaticLocation {
        private String countryCode;
        private String countryName;
        private String city;
        private Double latitude;
        private Double longitude;
    }

    @Data
    public static class RequestFrequency {
        private boolean enabled = true;
        private int minTrainingEvents = 1000;
        // Requests arriving within this many millis of the last bucket are merged into it
        private long bucketMergeMillis = 1000;
        // Window length in seconds -> requests allowed per window
        private Map<Long, Integer> defaultThresholds = new TreeMap<>(Map.of(
                60L, 30,
                300L, 100,
                900L, 250,
                3600L, 600));
    }

    @Data
    public static class AuthenticationFailure {
        private boolean enabled = true;
        // Window length in seconds -> failures that trigger an anomaly
        private Map<Long, Integer> thresholds = new TreeMap<>(Map.of(
                300L, 5,
                900L, 10,
                3600L, 20,
                86400L, 50));
    }
}
