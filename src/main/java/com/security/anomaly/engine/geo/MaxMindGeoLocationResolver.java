package com.security.anomaly.engine.geo;

import com.maxmind.db.CHMCache;
import com.maxmind.geoip2.DatabaseReader;
import com.maxmind.geoip2.exception.GeoIp2Exception;
import com.maxmind.geoip2.model.CityResponse;
import com.security.anomaly.model.GeoLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Location lookups against a local MaxMind GeoIP2 / GeoLite2 City database.
 */
public class MaxMindGeoLocationResolver implements GeoLocationResolver, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(MaxMindGeoLocationResolver.class);

    private final DatabaseReader reader;

    public MaxMindGeoLocationResolver(Path databasePath) throws IOException {
        this.reader = new DatabaseReader.Builder(databasePath.toFile())
                .withCache(new CHMCache())
                .build();
        log.info("Loaded GeoIP database {} ({})", databasePath, reader.getMetadata().getDatabaseType());
    }

    @Override
    public Optional<GeoLocation> resolve(String ipAddress) {
        if (ipAddress == null || ipAddress.isBlank()) {
            return Optional.empty();
        }
        try {
            // Only literal addresses are accepted so that no DNS lookup is triggered
            if (!isIpLiteral(ipAddress.trim())) {
                return Optional.empty();
            }
            InetAddress address = InetAddress.getByName(ipAddress.trim());
            Optional<CityResponse> response = reader.tryCity(address);
            if (response.isEmpty() || response.get().getCountry().getIsoCode() == null) {
                return Optional.empty();
            }
            CityResponse city = response.get();
            return Optional.of(GeoLocation.builder()
                    .countryCode(city.getCountry().getIsoCode())
                    .countryName(city.getCountry().getName())
                    .city(city.getCity().getName())
                    .latitude(city.getLocation().getLatitude())
                    .longitude(city.getLocation().getLongitude())
                    .build());
        } catch (UnknownHostException e) {
            log.debug("Unparseable IP address {}", ipAddress);
            return Optional.empty();
        } catch (IOException | GeoIp2Exception e) {
            log.warn("GeoIP lookup failed for {}: {}", ipAddress, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean isIpLiteral(String value) {
        return value.contains(":") || value.matches("\\d{1,3}(\\.\\d{1,3}){3}");
    }

    @Override
    public void destroy() throws IOException {
        reader.close();
    }
}
