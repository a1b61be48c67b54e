package com.deepansh.rag.session;

import com.deepansh.rag.config.SessionProperties;
import com.deepansh.rag.persistence.DurableSink;
import com.deepansh.rag.resilience.DurableWriteExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Authoritative in-memory session table: create / read / expire / delete
 * plus aggregate statistics.
 *
 * Creation holds one global lock around the "ID free?" check and registration
 * so two requests carrying the same ID can never both claim it. The lock only
 * guards in-memory work: the durable write happens after it is released and
 * is best-effort: a slow or failing sink never fails session creation.
 *
 * Expiry is lazy (checked on every read) and swept periodically by
 * CleanupSweeper through {@link #sweepExpired()}.
 */
@Component
@Slf4j
public class SessionStore {

    private final ShardedSessionTable table = new ShardedSessionTable();
    private final ReentrantLock creationLock = new ReentrantLock();

    private final AtomicLong totalSessions = new AtomicLong();
    private final AtomicLong activeSessions = new AtomicLong();
    private final AtomicLong totalConversations = new AtomicLong();
    private final AtomicLong cleanupRuns = new AtomicLong();

    private final SessionProperties properties;
    private final DurableSink durableSink;
    private final DurableWriteExecutor writeExecutor;
    private final Clock clock;

    public SessionStore(SessionProperties properties,
                        DurableSink durableSink,
                        DurableWriteExecutor writeExecutor,
                        Clock clock) {
        this.properties = properties;
        this.durableSink = durableSink;
        this.writeExecutor = writeExecutor;
        this.clock = clock;
        log.info("SessionStore initialised [ttl={}, maxExchanges={}]",
                properties.getTtl(), properties.getMaxExchanges());
    }

    public SessionCreation create(String requestedId, Map<String, Object> metadata) {
        long lockStart = System.nanoTime();
        SessionRecord record;

        creationLock.lock();
        try {
            long lockWaitMs = (System.nanoTime() - lockStart) / 1_000_000;
            String sessionId = requestedId;
            if (sessionId == null || sessionId.isBlank()) {
                sessionId = newSessionId();
            } else if (table.contains(sessionId)) {
                log.warn("Requested session id already exists, substituting a new one [requested={}]",
                        sessionId);
                sessionId = newSessionId();
            }

            record = SessionRecord.fresh(sessionId, metadata, clock.instant());
            if (!table.putIfAbsent(record)) {
                // Only reachable for a generated UUID colliding with an existing key
                throw new IllegalStateException("Session id collision: " + sessionId);
            }
            totalSessions.incrementAndGet();
            activeSessions.incrementAndGet();

            log.debug("Session registered [sessionId={}, lockWaitMs={}]", sessionId, lockWaitMs);
        } finally {
            creationLock.unlock();
        }

        SessionRecord created = record;
        writeExecutor.bestEffort("save-session:" + created.getSessionId(),
                () -> durableSink.saveSession(created),
                properties.getPersistence().getCreationTimeout());

        log.info("Session created [sessionId={}, sessionsInMemory={}]",
                record.getSessionId(), table.size());
        return new SessionCreation(record.getSessionId(), Map.copyOf(record.getEnrichment()));
    }

    public SessionLookup get(String sessionId, Map<String, Object> context) {
        if (sessionId == null) {
            return SessionLookup.notFound();
        }
        Optional<SessionRecord> found = table.get(sessionId);
        if (found.isEmpty()) {
            log.debug("Session not found [sessionId={}]", sessionId);
            return SessionLookup.notFound();
        }

        SessionRecord session = found.get();
        Instant now = clock.instant();
        Duration ttl = properties.getTtl();
        Duration idle = session.idleTime(now);

        if (idle.compareTo(ttl) > 0) {
            log.debug("Session expired [sessionId={}, idle={}s, ttl={}s]",
                    sessionId, idle.toSeconds(), ttl.toSeconds());
            // Removes only if still expired: a concurrent touch wins
            if (table.removeIf(sessionId, s -> s.isExpired(now, ttl))) {
                decrementActive();
                return SessionLookup.expired(idle);
            }
            return table.get(sessionId)
                    .map(s -> renew(s, now, ttl, context))
                    .orElseGet(() -> SessionLookup.expired(idle));
        }

        return renew(session, now, ttl, context);
    }

    public SessionLookup get(String sessionId) {
        return get(sessionId, null);
    }

    private SessionLookup renew(SessionRecord session, Instant now, Duration ttl, Map<String, Object> context) {
        Duration idle = session.idleTime(now);
        session.touch(now);
        session.mergeMetadata(context);
        Duration remaining = ttl.minus(idle);
        log.debug("Session renewed [sessionId={}, remaining={}s]",
                session.getSessionId(), remaining.toSeconds());
        return SessionLookup.valid(session, remaining, idle);
    }

    /**
     * Idempotent: deleting an unknown ID does nothing.
     */
    public boolean delete(String sessionId) {
        if (sessionId == null) return false;
        boolean removed = table.remove(sessionId).isPresent();
        if (removed) {
            decrementActive();
            log.debug("Session deleted [sessionId={}]", sessionId);
        }
        return removed;
    }

    /**
     * Removes every session idle for longer than the TTL.
     *
     * @return IDs of the sessions removed by this call
     */
    public List<String> sweepExpired() {
        Instant now = clock.instant();
        Duration ttl = properties.getTtl();
        List<String> removed = new ArrayList<>();

        for (SessionRecord session : table.snapshot()) {
            String id = session.getSessionId();
            if (session.isExpired(now, ttl) && table.removeIf(id, s -> s.isExpired(now, ttl))) {
                decrementActive();
                removed.add(id);
            }
        }

        if (!removed.isEmpty()) {
            log.info("Expired sessions removed [count={}]", removed.size());
        } else {
            log.debug("No expired sessions to remove");
        }
        return removed;
    }

    public SessionStats stats() {
        Instant now = clock.instant();
        Duration ttl = properties.getTtl();
        List<SessionRecord> sessions = table.snapshot();

        long active = sessions.stream().filter(s -> !s.isExpired(now, ttl)).count();
        activeSessions.set(active);

        return SessionStats.builder()
                .totalSessions(totalSessions.get())
                .activeSessions(active)
                .totalConversations(totalConversations.get())
                .cleanupRuns(cleanupRuns.get())
                .sessionsInMemory(sessions.size())
                .ttlSeconds(ttl.toSeconds())
                .maxExchanges(properties.getMaxExchanges())
                .build();
    }

    /**
     * Best-effort aggregate counter update in the durable store after a turn,
     * bounded by the same budget as the creation write.
     */
    public void updateSessionStats(String sessionId, int tokens, double processingTime) {
        writeExecutor.bestEffort("update-stats:" + sessionId,
                () -> durableSink.updateSessionStats(sessionId, tokens, processingTime),
                properties.getPersistence().getCreationTimeout());
    }

    public void incrementConversationCount() {
        totalConversations.incrementAndGet();
    }

    public void incrementCleanupCount() {
        cleanupRuns.incrementAndGet();
    }

    public boolean contains(String sessionId) {
        return sessionId != null && table.contains(sessionId);
    }

    public int size() {
        return table.size();
    }

    public void clear() {
        table.clear();
        activeSessions.set(0);
    }

    private void decrementActive() {
        activeSessions.updateAndGet(n -> Math.max(0, n - 1));
    }

    private static String newSessionId() {
        return UUID.randomUUID().toString();
    }
}
