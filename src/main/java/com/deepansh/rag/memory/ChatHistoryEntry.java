package com.deepansh.rag.memory;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Structured view of one message for API consumers.
 * Token / timing / model fields are only set on assistant entries.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatHistoryEntry(
        String type,
        String content,
        Instant timestamp,
        String messageId,
        Integer tokensUsed,
        Double processingTime,
        Map<String, Object> modelInfo
) {
}
