package com.deepansh.rag.exception;

/**
 * A chat turn could not be persisted. The in-memory conversation has already
 * been rolled back, so the turn is recorded nowhere and the request can be retried.
 */
public class AppendPersistenceException extends RuntimeException {

    private final String sessionId;

    public AppendPersistenceException(String sessionId, Throwable cause) {
        super("Chat turn for session " + sessionId + " could not be persisted", cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
