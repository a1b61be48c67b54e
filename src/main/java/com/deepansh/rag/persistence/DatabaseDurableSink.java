package com.deepansh.rag.persistence;

import com.deepansh.rag.session.SessionRecord;
import com.deepansh.rag.session.TurnMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Durable sink over the two stores the backend already runs:
 * session rows in PostgreSQL (JPA) and chat turns in MongoDB.
 *
 * Exceptions are not caught here: the retry / best-effort
 * policy belongs to DurableWriteExecutor, and Spring's DuplicateKeyException
 * must reach it unchanged.
 */
@Slf4j
public class DatabaseDurableSink implements DurableSink {

    private final ChatSessionRepository sessionRepository;
    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public DatabaseDurableSink(ChatSessionRepository sessionRepository,
                               MongoTemplate mongoTemplate,
                               Clock clock) {
        this.sessionRepository = sessionRepository;
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    @Override
    public void saveSession(SessionRecord session) {
        Map<String, Object> metadata = new HashMap<>(session.getMetadata());
        Object userAgent = metadata.get("user_agent");

        ChatSessionEntity entity = ChatSessionEntity.builder()
                .sessionId(session.getSessionId())
                .userAgent(userAgent != null ? userAgent.toString() : null)
                .extraMetadata(metadata)
                .lastAccessedAt(session.getLastAccessed())
                .build();

        sessionRepository.save(entity);
        log.debug("Session row stored [sessionId={}]", session.getSessionId());
    }

    @Override
    public void saveTurn(TurnRecord turn) {
        TurnMetadata meta = Objects.requireNonNullElseGet(turn.metadata(), TurnMetadata::new);

        ChatHistoryDocument document = ChatHistoryDocument.builder()
                .sessionId(turn.sessionId())
                .messageId(turn.messageId())
                .timestamp(turn.timestamp())
                .userMessage(turn.userMessage())
                .aiResponse(turn.assistantResponse())
                .metadata(ChatHistoryDocument.Meta.builder()
                        .tokensUsed(meta.getTokensUsed())
                        .processingTime(meta.getProcessingTime())
                        .sources(meta.getSources())
                        .topic(meta.getTopic() != null ? meta.getTopic() : "general")
                        .modelInfo(meta.getModelInfo())
                        .build())
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();

        // insert (not save) so a replayed messageId hits the unique index
        mongoTemplate.insert(document);
        log.debug("Chat turn stored [sessionId={}, messageId={}]", turn.sessionId(), turn.messageId());
    }

    @Override
    public void updateSessionStats(String sessionId, int tokens, double processingTime) {
        int updated = sessionRepository.incrementStats(sessionId, tokens, processingTime, clock.instant());
        if (updated == 0) {
            log.debug("No session row to update [sessionId={}]", sessionId);
        }
    }
}
