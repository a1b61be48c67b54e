package com.deepansh.rag.session;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory state of one conversation session.
 *
 * The collections are concurrent because reads (context building, history)
 * run without the per-session lock while turns are being appended.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionRecord {

    private String sessionId;

    @JsonDeserialize(using = LegacyInstantDeserializer.class)
    private Instant createdAt;

    @JsonDeserialize(using = LegacyInstantDeserializer.class)
    private volatile Instant updatedAt;

    @JsonDeserialize(using = LegacyInstantDeserializer.class)
    private volatile Instant lastAccessed;

    @Builder.Default
    private Map<String, Object> metadata = new ConcurrentHashMap<>();

    private volatile String userName;

    @Builder.Default
    private Map<String, Object> userInfo = new ConcurrentHashMap<>();

    @Builder.Default
    private List<String> topics = new CopyOnWriteArrayList<>();

    /** Remembered facts, e.g. name → "Alice" */
    @Builder.Default
    private Map<String, String> facts = new ConcurrentHashMap<>();

    /** Ordered per-turn stats, bounded to the conversation window */
    @Builder.Default
    private List<TurnMetadata> messagesMetadata = new CopyOnWriteArrayList<>();

    /** Client enrichment (geolocation): always empty while lookup is disabled */
    @Builder.Default
    private Map<String, Object> enrichment = new ConcurrentHashMap<>();

    static SessionRecord fresh(String sessionId, Map<String, Object> metadata, Instant now) {
        SessionRecord record = SessionRecord.builder()
                .sessionId(sessionId)
                .createdAt(now)
                .updatedAt(now)
                .lastAccessed(now)
                .build();
        record.mergeMetadata(metadata);
        return record;
    }

    /**
     * Renews lastAccessed without ever moving it backwards.
     */
    public synchronized void touch(Instant now) {
        if (lastAccessed == null || now.isAfter(lastAccessed)) {
            lastAccessed = now;
        }
    }

    public void markUpdated(Instant now) {
        updatedAt = now;
    }

    /** Null keys and values are dropped: the backing map is concurrent */
    public void mergeMetadata(Map<String, ?> context) {
        if (context == null) return;
        context.forEach((k, v) -> {
            if (k != null && v != null) metadata.put(k, v);
        });
    }

    public void addTopic(String topic) {
        if (topic == null || topic.isBlank()) return;
        synchronized (topics) {
            if (!topics.contains(topic)) {
                topics.add(topic);
            }
        }
    }

    public boolean isExpired(Instant now, Duration ttl) {
        return idleTime(now).compareTo(ttl) > 0;
    }

    public Duration idleTime(Instant now) {
        Instant accessed = Objects.requireNonNullElse(lastAccessed, now);
        return Duration.between(accessed, now);
    }
}
