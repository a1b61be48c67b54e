package com.deepansh.rag.core;

import com.deepansh.rag.cleanup.CleanupSweeper;
import com.deepansh.rag.exception.InvalidSessionException;
import com.deepansh.rag.memory.ChatHistory;
import com.deepansh.rag.memory.ConversationMemory;
import com.deepansh.rag.memory.Exchange;
import com.deepansh.rag.session.InvalidReason;
import com.deepansh.rag.session.SessionCreation;
import com.deepansh.rag.session.SessionLookup;
import com.deepansh.rag.session.SessionRecord;
import com.deepansh.rag.session.SessionStats;
import com.deepansh.rag.session.SessionStore;
import com.deepansh.rag.session.TurnMetadata;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the session engine for the API layer.
 *
 * Keeps SessionStore and ConversationMemory in step: a session and its
 * conversation window are created, expired and deleted together. Every change
 * that touches both runs under the session's lock in ConversationMemory.
 *
 * Flow of one chat turn:
 *   1. getSession()   → validate and renew (absent/expired → caller starts a new one)
 *   2. ...retrieval and generation happen elsewhere...
 *   3. addTurn()      → append to the window, persist, update counters and topics
 *   4. contextString() on the next request feeds the conversation back into the prompt
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionFacade {

    static final int DEFAULT_EXCHANGES = 5;

    private final SessionStore sessionStore;
    private final ConversationMemory memory;
    private final CleanupSweeper cleanupSweeper;

    @PostConstruct
    public void initialize() {
        cleanupSweeper.start();
        log.info("Session engine initialized");
    }

    @PreDestroy
    public void destroy() {
        try {
            cleanupSweeper.stop();
            sessionStore.clear();
            memory.clear();
            log.info("Session engine destroyed");
        } catch (Exception e) {
            log.error("Session engine shutdown error: {}", e.getMessage());
        }
    }

    // ─── Session lifecycle ───────────────────────────────────────────────────

    /**
     * @param sessionId requested ID, may be null. If it is already taken a new
     *                  ID is assigned, so always read the ID from the result.
     */
    public SessionCreation createSession(Map<String, Object> metadata, String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return register(null, metadata);
        }
        return memory.withSessionLock(sessionId, () -> register(sessionId, metadata));
    }

    private SessionCreation register(String sessionId, Map<String, Object> metadata) {
        SessionCreation created = sessionStore.create(sessionId, metadata);
        memory.create(created.sessionId());
        return created;
    }

    public SessionLookup getSession(String sessionId, Map<String, Object> context) {
        SessionLookup lookup = sessionStore.get(sessionId, context);
        if (lookup.reason() == InvalidReason.EXPIRED) {
            memory.deleteIfOrphaned(sessionId, sessionStore::contains);
        }
        return lookup;
    }

    public SessionLookup getSession(String sessionId) {
        return getSession(sessionId, null);
    }

    public void deleteSession(String sessionId) {
        if (sessionId == null) {
            return;
        }
        memory.withSessionLock(sessionId, () -> {
            sessionStore.delete(sessionId);
            memory.delete(sessionId);
        });
        log.info("Session deleted [sessionId={}]", sessionId);
    }

    public SessionStats stats() {
        return sessionStore.stats();
    }

    /**
     * Removes expired sessions, then any conversation memory whose session is gone.
     *
     * @return number of conversation windows freed
     */
    public int clearExpired() {
        List<String> expired = sessionStore.sweepExpired();
        expired.forEach(id -> memory.deleteIfOrphaned(id, sessionStore::contains));

        List<String> orphans = new ArrayList<>();
        for (String id : memory.ids()) {
            if (memory.deleteIfOrphaned(id, sessionStore::contains)) {
                orphans.add(id);
            }
        }

        int freed = expired.size() + orphans.size();
        if (freed > 0) {
            log.info("Expired sessions cleared [expired={}, orphanMemories={}]", expired.size(), orphans.size());
        }
        return freed;
    }

    // ─── Conversation ────────────────────────────────────────────────────────

    /**
     * Records one user/assistant exchange on a valid session.
     *
     * @return the stored turn metadata (messageId assigned when absent)
     * @throws InvalidSessionException                          if the session is absent or expired
     * @throws com.deepansh.rag.exception.AppendPersistenceException if the chat-history write failed;
     *                                                          the turn has been rolled back
     */
    public TurnMetadata addTurn(String sessionId, String userMessage, String assistantMessage, TurnMetadata metadata) {
        SessionLookup lookup = getSession(sessionId);
        if (!lookup.isValid()) {
            throw new InvalidSessionException(sessionId, lookup.reason());
        }
        SessionRecord session = lookup.record();

        TurnMetadata stored = memory.append(sessionId, session, userMessage, assistantMessage, metadata);
        sessionStore.incrementConversationCount();

        if (metadata != null) {
            sessionStore.updateSessionStats(sessionId, stored.getTokensUsed(), stored.getProcessingTime());
            session.addTopic(metadata.getTopic());
        }

        log.debug("Turn added [sessionId={}, messageId={}]", sessionId, stored.getMessageId());
        return stored;
    }

    public TurnMetadata addTurn(String sessionId, String userMessage, String assistantMessage) {
        return addTurn(sessionId, userMessage, assistantMessage, null);
    }

    /**
     * "" when the session is absent or expired.
     */
    public String contextString(String sessionId) {
        return getSession(sessionId).session()
                .map(session -> memory.contextString(sessionId, session))
                .orElse("");
    }

    public ChatHistory chatHistory(String sessionId) {
        if (!getSession(sessionId).isValid()) {
            return ChatHistory.empty();
        }
        return memory.chatHistory(sessionId);
    }

    public List<Exchange> recentExchanges(String sessionId, int n) {
        if (!getSession(sessionId).isValid()) {
            return List.of();
        }
        return memory.recentExchanges(sessionId, n);
    }

    public List<Exchange> recentExchanges(String sessionId) {
        return recentExchanges(sessionId, DEFAULT_EXCHANGES);
    }

    /**
     * Debug trace recorded with a turn, looked up by message ID among the
     * turns still in the session's window.
     */
    public Optional<Map<String, Object>> debugTrace(String sessionId, String messageId) {
        return getSession(sessionId).session()
                .flatMap(session -> session.getMessagesMetadata().stream()
                        .filter(meta -> Objects.equals(meta.getMessageId(), messageId))
                        .findFirst())
                .map(TurnMetadata::getDebugTrace);
    }
}
