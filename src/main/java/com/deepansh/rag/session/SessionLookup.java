package com.deepansh.rag.session;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of a session read. Not-found and expired are ordinary values so
 * callers can start a fresh session instead of handling an exception.
 *
 * @param record       present only when valid
 * @param remainingTtl time left before expiry; zero when invalid
 * @param reason       present only when invalid
 * @param idleTime     how long the session had been idle when it was read
 */
public record SessionLookup(
        SessionRecord record,
        Duration remainingTtl,
        InvalidReason reason,
        Duration idleTime
) {

    public static SessionLookup valid(SessionRecord record, Duration remainingTtl, Duration idleTime) {
        return new SessionLookup(record, remainingTtl, null, idleTime);
    }

    public static SessionLookup notFound() {
        return new SessionLookup(null, Duration.ZERO, InvalidReason.NOT_FOUND, Duration.ZERO);
    }

    public static SessionLookup expired(Duration idleTime) {
        return new SessionLookup(null, Duration.ZERO, InvalidReason.EXPIRED, idleTime);
    }

    public boolean isValid() {
        return reason == null;
    }

    public Optional<SessionRecord> session() {
        return Optional.ofNullable(record);
    }
}
