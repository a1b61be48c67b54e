package com.deepansh.rag.cleanup;

import com.deepansh.rag.config.SessionProperties;
import com.deepansh.rag.memory.ConversationMemory;
import com.deepansh.rag.session.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodic removal of expired sessions and their conversation memory.
 *
 * Complements the lazy expiry in SessionStore.get(): sessions nobody reads
 * again would otherwise stay in memory forever. Runs with a fixed delay, so a
 * slow cycle never overlaps the next one. A failing cycle is logged and the
 * schedule keeps going.
 */
@Component
@Slf4j
public class CleanupSweeper {

    private final SessionStore sessionStore;
    private final ConversationMemory memory;
    private final TaskScheduler scheduler;
    private final SessionProperties properties;

    private ScheduledFuture<?> task;

    public CleanupSweeper(SessionStore sessionStore,
                          ConversationMemory memory,
                          @Qualifier("sessionCleanupScheduler") TaskScheduler scheduler,
                          SessionProperties properties) {
        this.sessionStore = sessionStore;
        this.memory = memory;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        task = scheduler.scheduleWithFixedDelay(this::runCycle, properties.getCleanupInterval());
        log.info("Cleanup sweeper started [interval={}s]", properties.getCleanupInterval().toSeconds());
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.info("Cleanup sweeper stopped");
        }
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isDone();
    }

    /**
     * One sweep. Never throws.
     *
     * @return number of sessions removed
     */
    public int runCycle() {
        try {
            List<String> expired = sessionStore.sweepExpired();
            expired.forEach(id -> memory.deleteIfOrphaned(id, sessionStore::contains));
            sessionStore.incrementCleanupCount();

            if (!expired.isEmpty()) {
                log.info("Cleanup cycle removed expired sessions [count={}, remaining={}]",
                        expired.size(), sessionStore.size());
            }
            return expired.size();
        } catch (Exception e) {
            log.error("Cleanup cycle failed: {}", e.getMessage(), e);
            return 0;
        }
    }
}
