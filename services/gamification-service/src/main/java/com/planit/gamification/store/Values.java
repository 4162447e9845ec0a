package com.planit.gamification.store;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Date;

/**
 * Lenient conversions for field values, which arrive as whatever the backing store decoded.
 */
public final class Values {

    private Values() {
    }

    public static Instant toInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Number epochMillis) {
            return Instant.ofEpochMilli(epochMillis.longValue());
        }
        if (value instanceof String text) {
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }

    public static String toStringOrNull(Object value) {
        return value == null ? null : value.toString();
    }
}
