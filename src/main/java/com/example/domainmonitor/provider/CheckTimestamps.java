package com.example.domainmonitor.provider;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Optional;

/**
 * Parses provider timestamps that arrive in more than one format.
 */
public final class CheckTimestamps {

    private CheckTimestamps() {
    }

    /**
     * Tries each format in order. Values without an offset are read in {@code localZone}.
     */
    public static Optional<Instant> parse(String value, List<DateTimeFormatter> formats, ZoneId localZone) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (DateTimeFormatter format : formats) {
            try {
                TemporalAccessor parsed = format.parse(value.trim());
                if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
                    return Optional.of(OffsetDateTime.from(parsed).toInstant());
                }
                return Optional.of(LocalDateTime.from(parsed).atZone(localZone).toInstant());
            } catch (DateTimeParseException e) {
                // next format
            }
        }
        return Optional.empty();
    }
}
