package ru.kfl.leasingsync.gateway.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import ru.kfl.leasingsync.gateway.config.SyncGatewayProperties;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * Lenient ISO-8601 parsing for timestamps sent by the bot. Values without an
 * offset are read in the configured zone; anything unparseable yields {@code null}.
 */
@Component
public class TimestampParser {

    private static final Logger log = LoggerFactory.getLogger(TimestampParser.class);

    private final ZoneId zone;

    public TimestampParser(SyncGatewayProperties properties) {
        this.zone = ZoneId.of(properties.getTimeZone());
    }

    public Instant parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.strip().replaceFirst(" ", "T");
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException noOffset) {
            try {
                return LocalDateTime.parse(value).atZone(zone).toInstant();
            } catch (DateTimeParseException unparseable) {
                log.debug("Ignoring unparseable timestamp '{}'", raw);
                return null;
            }
        }
    }
}
