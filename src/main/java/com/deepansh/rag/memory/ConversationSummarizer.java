package com.deepansh.rag.memory;

import com.deepansh.rag.config.SessionProperties;
import com.deepansh.rag.llm.GenerationOptions;
import com.deepansh.rag.llm.LlmClient;
import com.deepansh.rag.llm.LlmResponse;
import com.deepansh.rag.session.lock.KeyedLockRegistry;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Condenses the older part of a long conversation into a few sentences.
 *
 * Summaries are cached per (sessionId, turnCount). A new turn changes the key,
 * so stale summaries are never served; old keys simply age out.
 *
 * A miss takes a lock for its key, checks the cache again and only then calls
 * the LLM, so concurrent context builds for the same key trigger a single
 * summarization and the rest wait for its result. The call runs outside the
 * cache's own compute, so a slow provider never holds up other keys. A failed
 * call stores nothing and the caller gets a heuristic line built from the first
 * user message instead.
 */
@Component
@Slf4j
public class ConversationSummarizer {

    static final int FALLBACK_PREVIEW_CHARS = 50;

    private final LlmClient llmClient;
    private final GenerationOptions options;
    private final Cache<String, String> cache;
    private final KeyedLockRegistry keyLocks = new KeyedLockRegistry();

    public ConversationSummarizer(SessionProperties properties, LlmClient llmClient) {
        SessionProperties.Summary summary = properties.getSummary();
        this.llmClient = llmClient;
        this.options = new GenerationOptions(summary.getModel(), summary.getTemperature(), summary.getMaxTokens());
        this.cache = Caffeine.newBuilder()
                .maximumSize(summary.getCacheSize())
                .expireAfterWrite(summary.getCacheTtl())
                .build();
    }

    /**
     * @param olderMessages the messages preceding the verbatim recent window, never empty
     */
    public String summaryFor(String sessionId, int turnCount, List<ConversationMessage> olderMessages) {
        String key = cacheKey(sessionId, turnCount);

        String cached = cache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }

        String summary = keyLocks.withLock(key, () -> {
            String again = cache.getIfPresent(key);
            if (again != null) {
                return again;
            }
            String generated = summarize(key, olderMessages);
            if (generated != null) {
                cache.put(key, generated);
            }
            return generated;
        });
        return summary != null ? summary : fallbackSummary(olderMessages);
    }

    /**
     * @return null when the LLM failed or returned nothing usable
     */
    private String summarize(String key, List<ConversationMessage> messages) {
        log.debug("Summary cache miss, calling LLM [key={}, messages={}]", key, messages.size());
        try {
            LlmResponse response = llmClient.generate(buildPrompt(messages), options);
            String content = response.getContent();
            if (content == null || content.isBlank()) {
                log.warn("LLM returned an empty summary, using fallback [key={}]", key);
                return null;
            }
            String summary = content.strip();
            log.info("Conversation summary generated [key={}, chars={}]", key, summary.length());
            return summary;
        } catch (Exception e) {
            log.error("Summary generation failed, using fallback [key={}]: {}", key, e.getMessage());
            return null;
        }
    }

    static String buildPrompt(List<ConversationMessage> messages) {
        StringBuilder conversation = new StringBuilder();
        for (ConversationMessage message : messages) {
            conversation.append(message.isUser() ? "User: " : "AI: ")
                    .append(message.content())
                    .append('\n');
        }
        return """
                Summarize the conversation below in 2-3 concise sentences.
                Focus on the main topics and what the user wanted to know.

                Conversation:
                %s
                Summary:""".formatted(conversation);
    }

    static String fallbackSummary(List<ConversationMessage> messages) {
        return messages.stream()
                .filter(ConversationMessage::isUser)
                .findFirst()
                .map(m -> "User asked about '" + preview(m.content()) + "...'")
                .orElse("Earlier conversation");
    }

    static String cacheKey(String sessionId, int turnCount) {
        return sessionId + "_" + turnCount;
    }

    long cachedSummaries() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    void invalidateAll() {
        cache.invalidateAll();
    }

    private static String preview(String content) {
        if (content == null) return "";
        return content.length() <= FALLBACK_PREVIEW_CHARS ? content : content.substring(0, FALLBACK_PREVIEW_CHARS);
    }
}
