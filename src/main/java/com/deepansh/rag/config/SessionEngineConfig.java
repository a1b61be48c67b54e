package com.deepansh.rag.config;

import com.deepansh.rag.persistence.ChatSessionRepository;
import com.deepansh.rag.persistence.DatabaseDurableSink;
import com.deepansh.rag.persistence.DurableSink;
import com.deepansh.rag.persistence.NoopDurableSink;
import com.deepansh.rag.resilience.DurableWriteExecutor;
import com.deepansh.rag.session.lock.KeyedLockRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wiring of the session engine's plain (non-annotated) collaborators.
 */
@Configuration
@Slf4j
public class SessionEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public KeyedLockRegistry sessionLockRegistry() {
        return new KeyedLockRegistry();
    }

    @Bean
    public DurableWriteExecutor durableWriteExecutor(SessionProperties properties,
                                                     @Qualifier("sessionTaskExecutor") Executor executor) {
        return new DurableWriteExecutor(properties, executor);
    }

    /**
     * PostgreSQL + MongoDB when persistence is enabled, otherwise a sink that
     * only logs. The in-memory state is authoritative either way.
     */
    @Bean
    public DurableSink durableSink(SessionProperties properties,
                                   ObjectProvider<ChatSessionRepository> sessionRepository,
                                   ObjectProvider<MongoTemplate> mongoTemplate,
                                   Clock clock) {
        SessionProperties.Persistence persistence = properties.getPersistence();
        if (!persistence.isEnabled()) {
            log.info("Session persistence disabled, using no-op sink");
            return new NoopDurableSink();
        }
        log.info("Session persistence enabled [saveChatHistory={}, saveRetry={}, saveTimeout={}ms]",
                persistence.isSaveChatHistory(), persistence.getSaveRetry(),
                persistence.getSaveTimeout().toMillis());
        return new DatabaseDurableSink(sessionRepository.getObject(), mongoTemplate.getObject(), clock);
    }
}
