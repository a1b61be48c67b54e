package com.deepansh.rag.session;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Session ID → record map split into independently locked shards.
 *
 * A shard is chosen by the hash of the session ID, so operations on different
 * sessions rarely contend, while all operations on one ID are serialized by
 * the same shard lock.
 */
class ShardedSessionTable {

    static final int DEFAULT_SHARDS = 16;

    private final Shard[] shards;

    ShardedSessionTable() {
        this(DEFAULT_SHARDS);
    }

    ShardedSessionTable(int shardCount) {
        if (shardCount < 1) {
            throw new IllegalArgumentException("shardCount must be positive");
        }
        this.shards = new Shard[shardCount];
        for (int i = 0; i < shardCount; i++) {
            shards[i] = new Shard();
        }
    }

    Optional<SessionRecord> get(String sessionId) {
        Shard shard = shardFor(sessionId);
        shard.lock.lock();
        try {
            return Optional.ofNullable(shard.records.get(sessionId));
        } finally {
            shard.lock.unlock();
        }
    }

    boolean contains(String sessionId) {
        return get(sessionId).isPresent();
    }

    /**
     * @return true if the record was stored, false if the ID was already taken
     */
    boolean putIfAbsent(SessionRecord record) {
        Shard shard = shardFor(record.getSessionId());
        shard.lock.lock();
        try {
            return shard.records.putIfAbsent(record.getSessionId(), record) == null;
        } finally {
            shard.lock.unlock();
        }
    }

    Optional<SessionRecord> remove(String sessionId) {
        Shard shard = shardFor(sessionId);
        shard.lock.lock();
        try {
            return Optional.ofNullable(shard.records.remove(sessionId));
        } finally {
            shard.lock.unlock();
        }
    }

    /**
     * Removes the record only if it is still present and still matches the predicate,
     * evaluated under the shard lock.
     */
    boolean removeIf(String sessionId, Predicate<SessionRecord> condition) {
        Shard shard = shardFor(sessionId);
        shard.lock.lock();
        try {
            SessionRecord current = shard.records.get(sessionId);
            if (current != null && condition.test(current)) {
                shard.records.remove(sessionId);
                return true;
            }
            return false;
        } finally {
            shard.lock.unlock();
        }
    }

    /** Point-in-time copy; safe to iterate while the table changes. */
    List<SessionRecord> snapshot() {
        List<SessionRecord> all = new ArrayList<>();
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                all.addAll(shard.records.values());
            } finally {
                shard.lock.unlock();
            }
        }
        return all;
    }

    int size() {
        int total = 0;
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                total += shard.records.size();
            } finally {
                shard.lock.unlock();
            }
        }
        return total;
    }

    void clear() {
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                shard.records.clear();
            } finally {
                shard.lock.unlock();
            }
        }
    }

    private Shard shardFor(String sessionId) {
        return shards[Math.floorMod(sessionId.hashCode(), shards.length)];
    }

    private static final class Shard {
        private final ReentrantLock lock = new ReentrantLock();
        private final Map<String, SessionRecord> records = new HashMap<>();
    }
}
