package com.clout.gameshow.store;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Read/write lock with a fixed rank. A thread may only acquire locks in ascending rank
 * order; asking for a lower rank while holding a higher one fails fast instead of
 * risking a deadlock.
 */
public final class OrderedLock {

    private static final int MAX_RANKS = 8;

    // per-thread hold count for every rank
    private static final ThreadLocal<int[]> HELD = ThreadLocal.withInitial(() -> new int[MAX_RANKS]);

    private final String name;
    private final int rank;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public OrderedLock(String name, int rank) {
        if (rank < 0 || rank >= MAX_RANKS) {
            throw new IllegalArgumentException("rank must be in [0, " + MAX_RANKS + ")");
        }
        this.name = name;
        this.rank = rank;
    }

    public Handle read() {
        checkOrder();
        return acquire(lock.readLock());
    }

    public Handle write() {
        checkOrder();
        if (lock.getReadHoldCount() > 0 && !lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("Cannot upgrade read lock '" + name + "' to write");
        }
        return acquire(lock.writeLock());
    }

    public boolean isHeldByCurrentThread() {
        return lock.getReadHoldCount() > 0 || lock.isWriteLockedByCurrentThread();
    }

    public boolean isWriteHeldByCurrentThread() {
        return lock.isWriteLockedByCurrentThread();
    }

    void requireHeld() {
        if (!isHeldByCurrentThread()) {
            throw new IllegalStateException("Lock '" + name + "' is not held");
        }
    }

    void requireWriteHeld() {
        if (!isWriteHeldByCurrentThread()) {
            throw new IllegalStateException("Write lock '" + name + "' is not held");
        }
    }

    public String getName() {
        return name;
    }

    private void checkOrder() {
        int[] held = HELD.get();
        for (int r = rank + 1; r < MAX_RANKS; r++) {
            if (held[r] > 0) {
                throw new IllegalStateException(
                        "Lock order violation: '" + name + "' requested while holding a lock of rank " + r);
            }
        }
    }

    private Handle acquire(Lock target) {
        target.lock();
        HELD.get()[rank]++;
        return new Handle(target);
    }

    /**
     * Releases the lock it was obtained from; meant for try-with-resources.
     */
    public final class Handle implements AutoCloseable {

        private final Lock target;
        private boolean released;

        private Handle(Lock target) {
            this.target = target;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            HELD.get()[rank]--;
            target.unlock();
        }
    }
}
