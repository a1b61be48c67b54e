package com.deepansh.rag.exception;

import com.deepansh.rag.session.InvalidReason;

/**
 * A turn was added to a session that does not exist or has expired.
 */
public class InvalidSessionException extends RuntimeException {

    private final String sessionId;
    private final InvalidReason reason;

    public InvalidSessionException(String sessionId, InvalidReason reason) {
        super("Invalid session " + sessionId + ": " + reason);
        this.sessionId = sessionId;
        this.reason = reason;
    }

    public String getSessionId() {
        return sessionId;
    }

    public InvalidReason getReason() {
        return reason;
    }
}
