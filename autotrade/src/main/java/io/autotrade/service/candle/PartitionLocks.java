package io.autotrade.service.candle;

import io.autotrade.domain.data.PartitionKey;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One mutual-exclusion scope per partition.
 *
 * Writers to different partitions never contend; writers to the same
 * partition are serialized. The lock is released on every exit path.
 */
public final class PartitionLocks {

    private final Map<PartitionKey, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(PartitionKey key, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hold every lock in {@code keys} while running {@code work}. Callers pass
     * the keys in one consistent order, so nested acquisition cannot deadlock.
     */
    public <T> T withLocks(List<PartitionKey> keys, Supplier<T> work) {
        return withLocks(keys, 0, work);
    }

    private <T> T withLocks(List<PartitionKey> keys, int from, Supplier<T> work) {
        if (from == keys.size()) {
            return work.get();
        }
        return withLock(keys.get(from), () -> withLocks(keys, from + 1, work));
    }

    /**
     * True while some thread holds the partition lock.
     */
    public boolean isLocked(PartitionKey key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isLocked();
    }

    public int size() {
        return locks.size();
    }
}
