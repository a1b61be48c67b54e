package com.deepansh.rag.persistence;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One persisted chat turn in MongoDB.
 *
 * Collection: chat_history
 *
 * The unique (sessionId, messageId) index makes a retried insert of the same
 * turn fail with a duplicate-key error, which the writer treats as "already
 * stored".
 */
@Document(collection = "chat_history")
@CompoundIndexes({
    @CompoundIndex(name = "uq_session_message", def = "{'sessionId': 1, 'messageId': 1}", unique = true),
    @CompoundIndex(name = "idx_session_time", def = "{'sessionId': 1, 'timestamp': -1}")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatHistoryDocument {

    @Id
    private String id;

    private String sessionId;
    private String messageId;
    private Instant timestamp;

    private String userMessage;
    private String aiResponse;

    private Meta metadata;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Meta {
        private int tokensUsed;
        private double processingTime;
        private List<String> sources;
        @Builder.Default
        private String topic = "general";
        private Map<String, Object> modelInfo;
    }
}
