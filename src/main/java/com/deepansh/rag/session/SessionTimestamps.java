package com.deepansh.rag.session;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Single conversion point for session timestamps.
 *
 * Older session payloads stored lastAccessed/createdAt as epoch seconds
 * (possibly fractional). Everything inside the engine is an Instant, so legacy
 * values are converted here and nowhere else.
 */
public final class SessionTimestamps {

    private SessionTimestamps() {
    }

    /**
     * @param raw Instant, Number (epoch seconds), numeric String or ISO-8601 String
     * @param fallback used when raw is null
     */
    public static Instant toInstant(Object raw, Instant fallback) {
        if (raw == null) {
            return fallback;
        }
        if (raw instanceof Instant instant) {
            return instant;
        }
        if (raw instanceof Number number) {
            return fromEpochSeconds(new BigDecimal(number.toString()));
        }
        if (raw instanceof CharSequence text) {
            String value = text.toString().strip();
            if (value.isEmpty()) {
                return fallback;
            }
            try {
                return fromEpochSeconds(new BigDecimal(value));
            } catch (NumberFormatException notNumeric) {
                try {
                    return Instant.parse(value);
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("Unrecognised timestamp: " + value, e);
                }
            }
        }
        throw new IllegalArgumentException("Unsupported timestamp type: " + raw.getClass().getName());
    }

    private static Instant fromEpochSeconds(BigDecimal seconds) {
        long whole = seconds.longValue();
        long nanos = seconds.subtract(BigDecimal.valueOf(whole))
                .movePointRight(9)
                .longValue();
        return Instant.ofEpochSecond(whole, nanos);
    }
}
