package com.deepansh.rag.session;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShardedSessionTableTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void putIfAbsent_rejectsSecondRecordForSameId() {
        ShardedSessionTable table = new ShardedSessionTable();

        assertThat(table.putIfAbsent(SessionRecord.fresh("a", null, NOW))).isTrue();
        assertThat(table.putIfAbsent(SessionRecord.fresh("a", null, NOW))).isFalse();
        assertThat(table.size()).isEqualTo(1);
    }

    @Test
    void removeIf_onlyRemovesWhenPredicateHolds() {
        ShardedSessionTable table = new ShardedSessionTable(4);
        table.putIfAbsent(SessionRecord.fresh("a", null, NOW));

        assertThat(table.removeIf("a", s -> false)).isFalse();
        assertThat(table.contains("a")).isTrue();
        assertThat(table.removeIf("a", s -> true)).isTrue();
        assertThat(table.contains("a")).isFalse();
        assertThat(table.removeIf("missing", s -> true)).isFalse();
    }

    @Test
    void snapshot_spansAllShards() {
        ShardedSessionTable table = new ShardedSessionTable(3);
        for (int i = 0; i < 30; i++) {
            table.putIfAbsent(SessionRecord.fresh("s" + i, null, NOW));
        }

        assertThat(table.snapshot()).hasSize(30);
        table.clear();
        assertThat(table.size()).isZero();
    }

    @Test
    void constructor_rejectsNonPositiveShardCount() {
        assertThatThrownBy(() -> new ShardedSessionTable(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentPutIfAbsent_sameId_singleWinner() throws Exception {
        ShardedSessionTable table = new ShardedSessionTable();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();

        for (int i = 0; i < 32; i++) {
            pool.submit(() -> {
                start.await();
                if (table.putIfAbsent(SessionRecord.fresh("same", null, NOW))) {
                    winners.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(winners.get()).isEqualTo(1);
    }
}
