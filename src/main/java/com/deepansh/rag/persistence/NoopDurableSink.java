package com.deepansh.rag.persistence;

import com.deepansh.rag.session.SessionRecord;
import lombok.extern.slf4j.Slf4j;

/**
 * Used when rag.session.persistence.enabled=false: the in-memory view is all there is.
 */
@Slf4j
public class NoopDurableSink implements DurableSink {

    @Override
    public void saveSession(SessionRecord session) {
        log.trace("Persistence disabled, session not stored [sessionId={}]", session.getSessionId());
    }

    @Override
    public void saveTurn(TurnRecord turn) {
        log.trace("Persistence disabled, turn not stored [sessionId={}]", turn.sessionId());
    }

    @Override
    public void updateSessionStats(String sessionId, int tokens, double processingTime) {
        // nothing to update
    }
}
