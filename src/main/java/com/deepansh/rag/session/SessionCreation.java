package com.deepansh.rag.session;

import java.util.Map;

/**
 * Result of creating a session. Callers must use {@code sessionId}: it differs
 * from the requested ID when that ID was already taken.
 */
public record SessionCreation(String sessionId, Map<String, Object> enrichment) {
}
