package com.security.anomaly.engine.geo;

import com.security.anomaly.model.GeoLocation;

import java.util.Optional;

/**
 * Resolves an IP address to a location. Implementations must not throw for
 * unknown or malformed addresses; they return empty instead.
 */
public interface GeoLocationResolver {

    Optional<GeoLocation> resolve(String ipAddress);
}
