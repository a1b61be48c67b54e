package com.deepansh.rag.session.lock;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class KeyedLockRegistryTest {

    private final KeyedLockRegistry registry = new KeyedLockRegistry();

    @Test
    void withLock_serializesCriticalSections() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        int[] counter = {0};
        try {
            for (int i = 0; i < 1_000; i++) {
                pool.submit(() -> registry.withLock("s1", () -> {
                    counter[0]++;
                }));
            }
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(registry.withLock("s1", () -> counter[0])).isEqualTo(1_000);
    }

    @Test
    void withLock_entryDroppedWhenLastUserLeaves() {
        registry.withLock("s1", () -> {
            assertThat(registry.size()).isEqualTo(1);
        });

        assertThat(registry.size()).isZero();
    }

    @Test
    void withLock_isReentrant() {
        int value = registry.withLock("s1", () -> {
            return registry.withLock("s1", () -> 42);
        });

        assertThat(value).isEqualTo(42);
        assertThat(registry.size()).isZero();
    }

    @Test
    void waiter_keepsEntrySoLaterCallersShareTheSameLock() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(3);
        CountDownLatch holderIn = new CountDownLatch(1);
        CountDownLatch releaseHolder = new CountDownLatch(1);
        AtomicInteger inside = new AtomicInteger();
        AtomicBoolean overlapped = new AtomicBoolean();
        try {
            Future<?> holder = pool.submit(() -> registry.withLock("s1", () -> {
                holderIn.countDown();
                await(releaseHolder);
            }));
            assertThat(holderIn.await(5, TimeUnit.SECONDS)).isTrue();

            Runnable critical = () -> registry.withLock("s1", () -> {
                if (inside.incrementAndGet() > 1) {
                    overlapped.set(true);
                }
                sleep(20);
                inside.decrementAndGet();
            });
            Future<?> first = pool.submit(critical);
            Future<?> second = pool.submit(critical);
            Thread.sleep(50);
            assertThat(registry.size()).isEqualTo(1);

            releaseHolder.countDown();
            holder.get(5, TimeUnit.SECONDS);
            first.get(5, TimeUnit.SECONDS);
            second.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(overlapped).isFalse();
        assertThat(registry.size()).isZero();
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
