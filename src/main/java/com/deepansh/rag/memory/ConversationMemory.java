package com.deepansh.rag.memory;

import com.deepansh.rag.config.SessionProperties;
import com.deepansh.rag.exception.AppendPersistenceException;
import com.deepansh.rag.exception.DurableWriteException;
import com.deepansh.rag.persistence.DurableSink;
import com.deepansh.rag.persistence.TurnRecord;
import com.deepansh.rag.resilience.DurableWriteExecutor;
import com.deepansh.rag.session.SessionRecord;
import com.deepansh.rag.session.TurnMetadata;
import com.deepansh.rag.session.lock.KeyedLockRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Per-session conversation windows: append, render as prompt context,
 * and expose as structured history.
 *
 * Write path (append) is serialized per session through KeyedLockRegistry and
 * holds the lock across the durable write, so what is in memory and what was
 * persisted never disagree about the order of turns. When the strict write
 * gives up, the window and the session's turn metadata are put back exactly as
 * they were before the append and AppendPersistenceException is raised. User
 * facts are extracted only from turns that were kept.
 *
 * Creating and freeing a window go through the same per-session lock
 * ({@link #withSessionLock}), so a session ID that is expired and then
 * registered again always gets a fresh window, and freeing the old one can
 * never remove the new one.
 *
 * Read paths (contextString, chatHistory, recentExchanges) take no lock. They
 * work on the immutable snapshot the window last published, which may be one
 * turn behind a concurrent append but is never half-written.
 */
@Component
@Slf4j
public class ConversationMemory {

    private final ConcurrentMap<String, ConversationWindow> windows = new ConcurrentHashMap<>();

    private final SessionProperties properties;
    private final KeyedLockRegistry locks;
    private final UserFactExtractor factExtractor;
    private final ConversationSummarizer summarizer;
    private final DurableSink durableSink;
    private final DurableWriteExecutor writeExecutor;
    private final Clock clock;

    public ConversationMemory(SessionProperties properties,
                              KeyedLockRegistry locks,
                              UserFactExtractor factExtractor,
                              ConversationSummarizer summarizer,
                              DurableSink durableSink,
                              DurableWriteExecutor writeExecutor,
                              Clock clock) {
        this.properties = properties;
        this.locks = locks;
        this.factExtractor = factExtractor;
        this.summarizer = summarizer;
        this.durableSink = durableSink;
        this.writeExecutor = writeExecutor;
        this.clock = clock;
    }

    /**
     * Installs an empty window, replacing whatever an earlier session with the
     * same ID left behind.
     */
    public void create(String sessionId) {
        windows.put(sessionId, new ConversationWindow());
        log.debug("Conversation memory allocated [sessionId={}]", sessionId);
    }

    public void delete(String sessionId) {
        if (windows.remove(sessionId) != null) {
            log.debug("Conversation memory freed [sessionId={}]", sessionId);
        }
    }

    /**
     * Frees the window of a session that left the session table, unless the ID
     * has been registered again in the meantime.
     *
     * @return true if a window was freed
     */
    public boolean deleteIfOrphaned(String sessionId, Predicate<String> sessionExists) {
        return withSessionLock(sessionId, () -> {
            if (sessionExists.test(sessionId) || windows.remove(sessionId) == null) {
                return false;
            }
            log.debug("Conversation memory freed [sessionId={}]", sessionId);
            return true;
        });
    }

    /**
     * Runs a session-table change together with the matching memory change,
     * excluding appends and other lifecycle changes for the same ID.
     */
    public <T> T withSessionLock(String sessionId, Supplier<T> action) {
        return locks.withLock(sessionId, action);
    }

    public void withSessionLock(String sessionId, Runnable action) {
        locks.withLock(sessionId, action);
    }

    public boolean contains(String sessionId) {
        return sessionId != null && windows.containsKey(sessionId);
    }

    public Set<String> ids() {
        return Set.copyOf(windows.keySet());
    }

    public int messageCount(String sessionId) {
        ConversationWindow window = windows.get(sessionId);
        return window != null ? window.size() : 0;
    }

    public void clear() {
        windows.clear();
        summarizer.invalidateAll();
    }

    /**
     * Records one user/assistant exchange.
     *
     * @return the metadata stored with the turn, with messageId and timestamp filled in
     * @throws IllegalStateException       if the session has no conversation memory
     * @throws AppendPersistenceException  if the chat-history write failed on every attempt;
     *                                     the turn has been rolled back
     */
    public TurnMetadata append(String sessionId,
                               SessionRecord session,
                               String userMessage,
                               String assistantMessage,
                               TurnMetadata metadata) {
        return locks.withLock(sessionId, () -> {
            ConversationWindow window = windows.get(sessionId);
            if (window == null) {
                throw new IllegalStateException("No conversation memory for session " + sessionId);
            }

            Instant now = clock.instant();
            TurnMetadata turnMetadata = completeMetadata(metadata, now);

            List<ConversationMessage> windowBefore = window.append(
                    ConversationMessage.user(userMessage, now),
                    ConversationMessage.assistant(assistantMessage, now, turnMetadata),
                    properties.maxMessages());
            List<TurnMetadata> metadataBefore = List.copyOf(session.getMessagesMetadata());
            recordMetadata(session, turnMetadata);
            session.markUpdated(now);

            if (properties.getPersistence().isSaveChatHistory()) {
                TurnRecord turn = TurnRecord.builder()
                        .sessionId(sessionId)
                        .messageId(turnMetadata.getMessageId())
                        .userMessage(userMessage)
                        .assistantResponse(assistantMessage)
                        .metadata(turnMetadata)
                        .timestamp(now)
                        .build();
                try {
                    writeExecutor.strict("save-turn:" + sessionId, () -> durableSink.saveTurn(turn));
                } catch (DurableWriteException e) {
                    window.restore(windowBefore);
                    restoreMetadata(session, metadataBefore);
                    log.error("Chat turn not persisted, rolled back [sessionId={}, messageId={}, messages={}]",
                            sessionId, turnMetadata.getMessageId(), window.size());
                    throw new AppendPersistenceException(sessionId, e);
                }
            }

            extractFacts(sessionId, session, userMessage);

            log.debug("Turn appended [sessionId={}, messageId={}, messages={}]",
                    sessionId, turnMetadata.getMessageId(), window.size());
            return turnMetadata;
        });
    }

    /**
     * Prompt-ready rendering of what is known about the user plus the conversation.
     * Returns "" when the session has no memory.
     */
    public String contextString(String sessionId, SessionRecord session) {
        ConversationWindow window = windows.get(sessionId);
        if (window == null) {
            return "";
        }

        List<String> parts = new ArrayList<>();

        if (session.getUserName() != null) {
            parts.add("User name: " + session.getUserName());
        }
        session.getUserInfo().forEach((key, value) -> parts.add("User " + key + ": " + value));
        if (!session.getTopics().isEmpty()) {
            parts.add("Topics: " + String.join(", ", session.getTopics()));
        }

        List<ConversationMessage> messages = window.messages();
        int turnCount = messages.size() / 2;
        SessionProperties.Summary summary = properties.getSummary();

        if (summary.isEnabled() && turnCount > summary.getTriggerCount()) {
            int recentSize = properties.recentMessages();
            int split = Math.max(0, messages.size() - recentSize);
            List<ConversationMessage> older = messages.subList(0, split);
            List<ConversationMessage> recent = messages.subList(split, messages.size());

            if (!older.isEmpty()) {
                log.debug("Summarizing older turns [sessionId={}, turns={}, older={}]",
                        sessionId, turnCount, older.size());
                parts.add("\n[Earlier conversation summary]\n" + summarizer.summaryFor(sessionId, turnCount, older));
            }
            if (!recent.isEmpty()) {
                parts.add("\n[Recent conversation]");
                appendLines(parts, recent);
            }
        } else if (!messages.isEmpty()) {
            parts.add("\nRecent conversation:");
            appendLines(parts, messages);
        }

        if (!session.getFacts().isEmpty()) {
            parts.add("\nRemembered facts:");
            session.getFacts().forEach((key, value) -> parts.add("- " + key + ": " + value));
        }

        return String.join("\n", parts);
    }

    public ChatHistory chatHistory(String sessionId) {
        ConversationWindow window = windows.get(sessionId);
        if (window == null) {
            return ChatHistory.empty();
        }

        List<ChatHistoryEntry> entries = new ArrayList<>();
        for (ConversationMessage message : window.messages()) {
            if (message.isUser()) {
                entries.add(new ChatHistoryEntry("user", message.content(), message.timestamp(),
                        null, null, null, null));
            } else {
                TurnMetadata meta = message.metadata();
                entries.add(new ChatHistoryEntry("assistant", message.content(), message.timestamp(),
                        meta != null ? meta.getMessageId() : null,
                        meta != null ? meta.getTokensUsed() : 0,
                        meta != null ? meta.getProcessingTime() : 0.0,
                        meta != null && meta.getModelInfo() != null ? meta.getModelInfo() : Map.of()));
            }
        }
        return new ChatHistory(List.copyOf(entries), entries.size());
    }

    /**
     * The last {@code n} complete user/assistant pairs, oldest first.
     */
    public List<Exchange> recentExchanges(String sessionId, int n) {
        ConversationWindow window = windows.get(sessionId);
        if (window == null || n <= 0) {
            return List.of();
        }

        List<ConversationMessage> messages = window.messages();
        List<Exchange> exchanges = new ArrayList<>();
        for (int i = 0; i + 1 < messages.size(); i += 2) {
            ConversationMessage user = messages.get(i);
            ConversationMessage assistant = messages.get(i + 1);
            if (user.isUser() && !assistant.isUser()) {
                exchanges.add(new Exchange(user.content(), assistant.content()));
            }
        }
        int from = Math.max(0, exchanges.size() - n);
        return List.copyOf(exchanges.subList(from, exchanges.size()));
    }

    private void extractFacts(String sessionId, SessionRecord session, String userMessage) {
        try {
            factExtractor.extractInto(session, userMessage);
        } catch (Exception e) {
            log.warn("Fact extraction failed, continuing [sessionId={}]: {}", sessionId, e.getMessage());
        }
    }

    private TurnMetadata completeMetadata(TurnMetadata metadata, Instant now) {
        TurnMetadata.TurnMetadataBuilder builder = metadata != null ? metadata.toBuilder() : TurnMetadata.builder();
        TurnMetadata draft = builder.build();
        if (draft.getMessageId() == null || draft.getMessageId().isBlank()) {
            builder.messageId("msg_" + UUID.randomUUID());
        }
        if (draft.getTimestamp() == null) {
            builder.timestamp(now);
        }
        return builder.build();
    }

    private void recordMetadata(SessionRecord session, TurnMetadata turnMetadata) {
        List<TurnMetadata> list = session.getMessagesMetadata();
        list.add(turnMetadata);
        while (list.size() > properties.getMaxExchanges()) {
            list.remove(0);
        }
    }

    private static void restoreMetadata(SessionRecord session, List<TurnMetadata> previous) {
        List<TurnMetadata> list = session.getMessagesMetadata();
        list.clear();
        list.addAll(previous);
    }

    private static void appendLines(List<String> parts, List<ConversationMessage> messages) {
        for (ConversationMessage message : messages) {
            parts.add((message.isUser() ? "User: " : "AI: ") + message.content());
        }
    }
}
