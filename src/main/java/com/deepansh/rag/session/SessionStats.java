package com.deepansh.rag.session;

import lombok.Builder;

/**
 * Aggregate counters for the session engine.
 */
@Builder
public record SessionStats(
        long totalSessions,
        long activeSessions,
        long totalConversations,
        long cleanupRuns,
        int sessionsInMemory,
        long ttlSeconds,
        int maxExchanges
) {
}
