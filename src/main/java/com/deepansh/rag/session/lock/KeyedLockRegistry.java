package com.deepansh.rag.session.lock;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Mutual-exclusion lock per key (session ID), reference counted.
 *
 * An entry exists while at least one thread holds or waits for the key's lock.
 * The count is only changed inside compute for that key, so a thread that has
 * registered interest always ends up on the same lock as every other thread
 * using the key, and the entry is dropped by the last one out.
 */
public class KeyedLockRegistry {

    private final ConcurrentMap<String, Entry> locks = new ConcurrentHashMap<>();

    /**
     * Runs the action while holding the key's lock. Reentrant for the same thread.
     */
    public <T> T withLock(String key, Supplier<T> action) {
        Entry entry = locks.compute(key, (k, existing) -> {
            Entry next = existing != null ? existing : new Entry();
            next.users++;
            return next;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, existing) -> --existing.users == 0 ? null : existing);
        }
    }

    public void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    /** Keys with a holder or waiter right now */
    public int size() {
        return locks.size();
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
