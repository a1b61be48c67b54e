package com.deepansh.rag.persistence;

import com.deepansh.rag.session.SessionRecord;

/**
 * Narrow write-only view of the external stores behind the session engine.
 *
 * Every method may throw; callers decide the policy (best-effort or
 * strict-with-retry) through DurableWriteExecutor.
 */
public interface DurableSink {

    /** One row per session: written once at creation */
    void saveSession(SessionRecord session);

    /**
     * One document per turn, keyed by (sessionId, messageId).
     * Implementations report an already-stored turn with DuplicateKeyException.
     */
    void saveTurn(TurnRecord turn);

    /** Increments the per-session aggregate counters */
    void updateSessionStats(String sessionId, int tokens, double processingTime);
}
