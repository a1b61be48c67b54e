package com.deepansh.rag.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * Durable per-session row in PostgreSQL.
 *
 * Written once at session creation (best-effort) and incremented after every
 * turn. The in-memory SessionRecord stays authoritative; this row exists for
 * analytics and survives restarts.
 */
@Entity
@Table(
    name = "chat_sessions",
    indexes = {
        @Index(name = "idx_chat_session_created_at", columnList = "createdAt"),
        @Index(name = "idx_chat_session_last_accessed", columnList = "lastAccessedAt")
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatSessionEntity {

    @Id
    private String sessionId;

    @Column(length = 512)
    private String userAgent;

    /** Client metadata captured at creation, stored as JSONB */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> extraMetadata;

    @Builder.Default
    private int messageCount = 0;

    @Builder.Default
    private long totalTokens = 0;

    @Builder.Default
    private double totalProcessingTime = 0.0;

    private Instant lastAccessedAt;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;
}
