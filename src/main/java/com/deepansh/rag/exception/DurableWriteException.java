package com.deepansh.rag.exception;

/**
 * A strict durable write failed on every attempt.
 */
public class DurableWriteException extends RuntimeException {

    private final int attempts;

    public DurableWriteException(String operation, int attempts, Throwable cause) {
        super("Durable write '" + operation + "' failed after " + attempts + " attempt(s): "
                + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
