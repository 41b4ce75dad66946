package com.security.anomaly.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Parses event timestamps. ISO-8601 with or without an offset; values without
 * one are read as UTC. The offset is kept so callers can read the local hour.
 */
public final class EventTimestamps {

    private static final Logger log = LoggerFactory.getLogger(EventTimestamps.class);

    private EventTimestamps() {}

    public static Optional<OffsetDateTime> parse(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return Optional.empty();
        }
        String value = timestamp.trim();
        try {
            return Optional.of(OffsetDateTime.parse(value));
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(LocalDateTime.parse(value).atOffset(ZoneOffset.UTC));
            } catch (DateTimeParseException inner) {
                log.warn("Unparseable event timestamp '{}': {}", timestamp, inner.getMessage());
                return Optional.empty();
            }
        }
    }
}
