package com.security.anomaly.engine;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per entity id ("user:alice", "ip:10.0.0.1", ...). Distinct keys
 * never share a lock. A key's lock exists only while some thread holds or
 * waits for it, so the table stays as small as the set of in-flight keys.
 * Multiple keys are locked in sorted order so concurrent callers cannot
 * deadlock.
 */
public final class KeyedLocks {

    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();

    public <T> T withLocks(Supplier<T> action, String... keys) {
        String[] order = Arrays.stream(keys)
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .toArray(String[]::new);

        int acquired = 0;
        try {
            for (String key : order) {
                acquire(key);
                acquired++;
            }
            return action.get();
        } finally {
            for (int i = acquired - 1; i >= 0; i--) {
                release(order[i]);
            }
        }
    }

    /** Number of keys currently held or awaited. */
    int activeKeys() {
        return locks.size();
    }

    private void acquire(String key) {
        LockEntry entry = locks.compute(key, (k, existing) -> {
            LockEntry e = existing != null ? existing : new LockEntry();
            e.users++;
            return e;
        });
        entry.lock.lock();
    }

    private void release(String key) {
        LockEntry entry = locks.get(key);
        entry.lock.unlock();
        locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
    }

    // users is only touched inside ConcurrentHashMap.compute for this key
    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
