package com.deepansh.rag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Strongly-typed configuration for the session engine.
 * Bound from application.yml under the "rag.session" prefix.
 */
@ConfigurationProperties(prefix = "rag.session")
@Data
public class SessionProperties {

    /** Idle time after which a session is considered expired */
    private Duration ttl = Duration.ofHours(2);

    /** One exchange = one user message + one assistant message */
    private int maxExchanges = 10;

    private Duration cleanupInterval = Duration.ofMinutes(10);

    private Summary summary = new Summary();
    private Persistence persistence = new Persistence();

    public int maxMessages() {
        return maxExchanges * 2;
    }

    public int recentMessages() {
        int recent = summary.getRecentExchanges();
        return (recent > 0 ? Math.min(recent, maxExchanges) : maxExchanges) * 2;
    }

    @Data
    public static class Summary {
        private boolean enabled = false;
        /** Summarize once the conversation holds more than this many exchanges */
        private int triggerCount = 10;
        private Duration cacheTtl = Duration.ofHours(1);
        private int cacheSize = 100;
        private String model = "gemini-2.0-flash-lite";
        private double temperature = 0.3;
        private int maxTokens = 200;
        /**
         * Exchanges kept verbatim after the summary; older ones are condensed.
         * 0 means max-exchanges.
         */
        private int recentExchanges = 0;
    }

    @Data
    public static class Persistence {
        /** Master switch: false wires the no-op sink */
        private boolean enabled = true;
        /** Strict chat-history write on every turn (rolls the turn back on failure) */
        private boolean saveChatHistory = false;
        private int saveRetry = 3;
        private Duration saveTimeout = Duration.ofSeconds(1);
        private Duration retryDelay = Duration.ofMillis(100);
        private Duration creationTimeout = Duration.ofSeconds(2);
    }
}
