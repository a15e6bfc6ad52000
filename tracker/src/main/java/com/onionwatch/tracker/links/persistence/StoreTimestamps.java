package com.onionwatch.tracker.links.persistence;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Text encoding of instants in the SQLite tables. The width is fixed so that string comparison in
 * SQL orders values chronologically.
 */
public final class StoreTimestamps {
    private static final DateTimeFormatter FORMAT = DateTimeFormatter
        .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
        .withZone(ZoneOffset.UTC);

    private StoreTimestamps() {
    }

    public static String format(Instant instant) {
        return instant == null ? null : FORMAT.format(instant);
    }

    /**
     * Parses stored values. Besides the fixed-width form this accepts offset-style values such as
     * {@code 2024-05-01T10:00:00.123456+00:00} and zone-less values such as
     * {@code 2024-05-01T10:00:00.123456}, which are read as UTC.
     */
    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return OffsetDateTime.parse(trimmed).toInstant();
        } catch (DateTimeParseException offsetFailure) {
            try {
                return LocalDateTime.parse(trimmed).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Unreadable stored timestamp: " + value, e);
            }
        }
    }
}
