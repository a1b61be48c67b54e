package com.deepansh.rag.cleanup;

import com.deepansh.rag.config.SessionProperties;
import com.deepansh.rag.memory.ConversationMemory;
import com.deepansh.rag.session.SessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CleanupSweeperTest {

    @Mock SessionStore sessionStore;
    @Mock ConversationMemory memory;
    @Mock TaskScheduler scheduler;
    @Mock ScheduledFuture<Object> scheduledTask;

    private SessionProperties properties;
    private CleanupSweeper sweeper;

    @BeforeEach
    void setUp() {
        properties = new SessionProperties();
        sweeper = new CleanupSweeper(sessionStore, memory, scheduler, properties);
    }

    @Test
    void runCycle_removesExpiredSessionsAndTheirMemory() {
        when(sessionStore.sweepExpired()).thenReturn(List.of("a", "b"));

        int removed = sweeper.runCycle();

        assertThat(removed).isEqualTo(2);
        verify(memory).deleteIfOrphaned(eq("a"), any());
        verify(memory).deleteIfOrphaned(eq("b"), any());
        verify(sessionStore).incrementCleanupCount();
    }

    @Test
    void runCycle_nothingExpired_onlyCountsTheRun() {
        when(sessionStore.sweepExpired()).thenReturn(List.of());

        assertThat(sweeper.runCycle()).isZero();
        verify(memory, never()).deleteIfOrphaned(any(), any());
        verify(sessionStore).incrementCleanupCount();
    }

    @Test
    void runCycle_failure_isLoggedNotThrown() {
        when(sessionStore.sweepExpired()).thenThrow(new IllegalStateException("boom"));

        assertThat(sweeper.runCycle()).isZero();
        verify(sessionStore, never()).incrementCleanupCount();
    }

    @Test
    void start_schedulesWithConfiguredDelayOnce() {
        doReturn(scheduledTask).when(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofMinutes(10)));

        sweeper.start();
        sweeper.start();

        assertThat(sweeper.isRunning()).isTrue();
        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofMinutes(10)));
    }

    @Test
    void stop_cancelsScheduledTask() {
        doReturn(scheduledTask).when(scheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
        sweeper.start();

        sweeper.stop();

        verify(scheduledTask).cancel(false);
        assertThat(sweeper.isRunning()).isFalse();
    }

    @Test
    void scheduledSweeper_keepsRunningAfterFailedCycle() {
        ThreadPoolTaskScheduler realScheduler = new ThreadPoolTaskScheduler();
        realScheduler.initialize();
        properties.setCleanupInterval(Duration.ofMillis(20));
        CleanupSweeper live = new CleanupSweeper(sessionStore, memory, realScheduler, properties);
        when(sessionStore.sweepExpired())
                .thenThrow(new IllegalStateException("first cycle fails"))
                .thenReturn(List.of());
        try {
            live.start();

            verify(sessionStore, timeout(2_000).atLeast(1)).incrementCleanupCount();
            verify(sessionStore, atLeast(2)).sweepExpired();
        } finally {
            live.stop();
            realScheduler.shutdown();
        }
    }
}
