package com.deepansh.rag.persistence;

import com.deepansh.rag.session.TurnMetadata;
import lombok.Builder;

import java.time.Instant;

/**
 * One user/assistant exchange as handed to the durable store.
 */
@Builder
public record TurnRecord(
        String sessionId,
        String messageId,
        String userMessage,
        String assistantResponse,
        TurnMetadata metadata,
        Instant timestamp
) {
}
