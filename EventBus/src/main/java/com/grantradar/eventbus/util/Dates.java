package com.grantradar.eventbus.util;

import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * ISO-8601 helpers for envelope timestamps.
 */
public final class Dates {

    private Dates() {
    }

    public static String formatIso(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    /**
     * Parses an ISO-8601 timestamp. Values without an offset are read as UTC.
     *
     * @return the instant, or null for a blank value
     * @throws DateTimeParseException when the value is not ISO-8601
     */
    public static Instant parseIso(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return OffsetDateTime.parse(trimmed).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(trimmed).toInstant(ZoneOffset.UTC);
        }
    }
}
