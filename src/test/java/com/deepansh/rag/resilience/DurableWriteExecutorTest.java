package com.deepansh.rag.resilience;

import com.deepansh.rag.config.SessionProperties;
import com.deepansh.rag.exception.DurableWriteException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DurableWriteExecutorTest {

    private ExecutorService pool;
    private DurableWriteExecutor executor;

    @BeforeEach
    void setUp() {
        SessionProperties properties = new SessionProperties();
        properties.getPersistence().setSaveRetry(3);
        properties.getPersistence().setSaveTimeout(Duration.ofMillis(200));
        properties.getPersistence().setRetryDelay(Duration.ofMillis(10));
        pool = Executors.newCachedThreadPool();
        executor = new DurableWriteExecutor(properties, pool);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void strict_succeedsAfterTransientFailures() {
        AtomicInteger calls = new AtomicInteger();

        executor.strict("save-turn:s1", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("transient");
            }
        });

        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void strict_exhaustion_throwsAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.strict("save-turn:s1", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("db down");
        }))
                .isInstanceOf(DurableWriteException.class)
                .satisfies(e -> assertThat(((DurableWriteException) e).getAttempts()).isEqualTo(3));

        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void strict_duplicateKey_countsAsSuccess() {
        AtomicInteger calls = new AtomicInteger();

        assertThatCode(() -> executor.strict("save-turn:s1", () -> {
            calls.incrementAndGet();
            throw new DuplicateKeyException("E11000 duplicate key");
        })).doesNotThrowAnyException();

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void strict_slowAttempts_timeOutAndExhaust() {
        assertThatThrownBy(() -> executor.strict("save-turn:s1", () -> sleep(1_000)))
                .isInstanceOf(DurableWriteException.class);
    }

    @Test
    void bestEffort_failure_returnsFalse() {
        boolean stored = executor.bestEffort("save-session:s1", () -> {
            throw new IllegalStateException("db down");
        }, Duration.ofMillis(200));

        assertThat(stored).isFalse();
    }

    @Test
    void bestEffort_timeout_returnsWithinBudget() {
        long start = System.nanoTime();

        boolean stored = executor.bestEffort("save-session:s1", () -> sleep(2_000), Duration.ofMillis(100));

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertThat(stored).isFalse();
        assertThat(elapsedMs).isLessThan(1_000);
    }

    @Test
    void bestEffort_success_returnsTrue() {
        AtomicInteger calls = new AtomicInteger();

        assertThat(executor.bestEffort("save-session:s1", calls::incrementAndGet, Duration.ofMillis(200))).isTrue();
        assertThat(calls.get()).isEqualTo(1);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
