package com.security.anomaly.engine.geo;

import com.security.anomaly.config.AnomalyDetectionConfig;
import com.security.anomaly.model.GeoLocation;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed IP -> location table, used when no GeoIP database is configured
 * (local development, tests, private address ranges).
 */
public class StaticGeoLocationResolver implements GeoLocationResolver {

    private final Map<String, GeoLocation> locations = new ConcurrentHashMap<>();

    public StaticGeoLocationResolver(Map<String, AnomalyDetectionConfig.StaticLocation> entries) {
        entries.forEach((ip, entry) -> locations.put(ip.trim(), GeoLocation.builder()
                .countryCode(entry.getCountryCode())
                .countryName(entry.getCountryName())
                .city(entry.getCity())
                .latitude(entry.getLatitude())
                .longitude(entry.getLongitude())
                .build()));
    }

    public void put(String ipAddress, GeoLocation location) {
        locations.put(ipAddress, location);
    }

    @Override
    public Optional<GeoLocation> resolve(String ipAddress) {
        if (ipAddress == null || ipAddress.isBlank()) {
            return Optional.empty();
        }
        GeoLocation location = locations.get(ipAddress.trim());
        if (location == null || location.getCountryCode() == null) {
            return Optional.empty();
        }
        return Optional.of(location);
    }
}
