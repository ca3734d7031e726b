package com.company.incidentrisk.util;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes work per key while letting different keys run in parallel.
 * A key's lock lives only while some thread holds or waits for it.
 */
public class KeyedLocks<K> {

    private final ConcurrentMap<K, CountedLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(K key, Supplier<T> action) {
        CountedLock entry = locks.compute(key, (k, existing) -> {
            CountedLock counted = existing != null ? existing : new CountedLock();
            counted.users++;
            return counted;
        });

        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, counted) -> --counted.users == 0 ? null : counted);
        }
    }

    /**
     * Number of keys currently locked or waited on.
     */
    public int size() {
        return locks.size();
    }

    private static final class CountedLock {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }
}
