package com.security.anomaly.config;

import com.security.anomaly.engine.geo.GeoLocationResolver;
import com.security.anomaly.engine.geo.MaxMindGeoLocationResolver;
import com.security.anomaly.engine.geo.StaticGeoLocationResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Uses the MaxMind City database when one is configured and readable,
     * otherwise the static IP table from anomaly.geo.static-locations.
     */
    @Bean
    public GeoLocationResolver geoLocationResolver(AnomalyDetectionConfig config) {
        String databasePath = config.getGeo().getDatabasePath();
        if (databasePath != null && !databasePath.isBlank()) {
            Path path = Path.of(databasePath);
            if (Files.isReadable(path)) {
                try {
                    return new MaxMindGeoLocationResolver(path);
                } catch (IOException e) {
                    log.error("Failed to open GeoIP database {}, falling back to static locations", path, e);
                }
            } else {
                log.warn("GeoIP database {} not readable, falling back to static locations", path);
            }
        }
        log.info("Using static geo-location table with {} entries", config.getGeo().getStaticLocations().size());
        return new StaticGeoLocationResolver(config.getGeo().getStaticLocations());
    }
}
