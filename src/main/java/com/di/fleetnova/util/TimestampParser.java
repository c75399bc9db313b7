package com.di.fleetnova.util;

import com.di.fleetnova.exception.MalformedTimestampException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;

/**
 * Parses signal timestamps as sent by the fleet API into {@link Instant}s.
 * Values without an offset are read as UTC.
 */
public final class TimestampParser {

    private static final List<DateTimeFormatter> LOCAL_PATTERNS = Arrays.asList(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,              // 2024-01-15T10:15:30
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"), // SQL style
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss")
    );

    private TimestampParser() {
    }

    /**
     * @throws MalformedTimestampException when no known format matches
     */
    public static Instant parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedTimestampException(raw, null);
        }
        String value = raw.trim();
        try {
            return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException ignored) {
            // no offset: try the local patterns
        }
        DateTimeParseException last = null;
        for (DateTimeFormatter formatter : LOCAL_PATTERNS) {
            try {
                return LocalDateTime.parse(value, formatter).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        throw new MalformedTimestampException(raw, last);
    }
}
