package com.marketvault.data.download;

import com.marketvault.data.store.PartitionId;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per partition so at most one fetch-then-commit runs for it at a time.
 *
 * Entries are reference counted and removed once no thread holds or waits on
 * them, so the map only contains partitions currently being worked on.
 */
public class PartitionLocks {

    private final ConcurrentHashMap<PartitionId, Entry> locks = new ConcurrentHashMap<>();

    public void lockInterruptibly(PartitionId id) throws InterruptedException {
        Entry entry = locks.compute(id, (k, existing) -> {
            Entry held = existing != null ? existing : new Entry();
            held.users++;
            return held;
        });
        try {
            entry.lock.lockInterruptibly();
        } catch (InterruptedException e) {
            release(id);
            throw e;
        }
    }

    /**
     * @throws IllegalMonitorStateException if the current thread does not hold the lock
     */
    public void unlock(PartitionId id) {
        Entry entry = locks.get(id);
        if (entry == null) {
            throw new IllegalMonitorStateException("Partition " + id + " is not locked");
        }
        entry.lock.unlock();
        release(id);
    }

    private void release(PartitionId id) {
        locks.computeIfPresent(id, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    int size() {
        return locks.size();
    }

    // users is only touched inside compute/computeIfPresent for its key
    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }
}
