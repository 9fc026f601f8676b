package com.copyradar.aggregation.lock;

import com.copyradar.aggregation.AggregateKey;
import com.copyradar.aggregation.AggregateLockTimeoutException;
import com.copyradar.common.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One ReentrantLock per aggregate key. Keys of one call are locked in {@link AggregateKey#lockRank()} order,
 * each with a bounded tryLock retried under the RetryPolicy; on failure every lock taken so far is released.
 */
@Slf4j
public class KeyedLockManager {

    private final ConcurrentMap<AggregateKey, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final long tryLockTimeoutMs;
    private final RetryPolicy retryPolicy;

    public KeyedLockManager(long tryLockTimeoutMs, RetryPolicy retryPolicy) {
        this.tryLockTimeoutMs = tryLockTimeoutMs;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Acquire all keys or none.
     *
     * @throws AggregateLockTimeoutException when a key stays contended past the retry budget, or on interrupt
     */
    public LockHandle acquireAll(List<? extends AggregateKey> keys) {
        List<? extends AggregateKey> ordered = keys.stream()
                .sorted(Comparator.comparingInt(AggregateKey::lockRank))
                .toList();
        Deque<ReentrantLock> held = new ArrayDeque<>(ordered.size());
        try {
            for (AggregateKey key : ordered) {
                ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
                acquire(key, lock);
                held.push(lock);
            }
        } catch (RuntimeException e) {
            releaseAll(held);
            throw e;
        }
        return new LockHandle(held);
    }

    private void acquire(AggregateKey key, ReentrantLock lock) {
        int attempts = retryPolicy.getMaxAttempts();
        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                if (lock.tryLock(tryLockTimeoutMs, TimeUnit.MILLISECONDS)) {
                    return;
                }
                if (attempt + 1 < attempts) {
                    log.debug("Lock on {} contended (attempt {}/{}), backing off", key, attempt + 1, attempts);
                    retryPolicy.backoff(attempt);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AggregateLockTimeoutException(AggregateLockTimeoutException.LOCK_INTERRUPTED, key,
                        "Interrupted while waiting for lock on " + key, e);
            }
        }
        throw new AggregateLockTimeoutException(AggregateLockTimeoutException.LOCK_TIMEOUT, key,
                "Lock on " + key + " not acquired after " + attempts + " attempts");
    }

    /** Drops all lock objects. Only safe while no apply is in flight (engine reset). */
    public void clear() {
        locks.clear();
    }

    private static void releaseAll(Deque<ReentrantLock> held) {
        while (!held.isEmpty()) {
            held.pop().unlock();
        }
    }

    /**
     * Releases in reverse acquisition order.
     */
    public static final class LockHandle implements AutoCloseable {

        private final Deque<ReentrantLock> held;

        private LockHandle(Deque<ReentrantLock> held) {
            this.held = held;
        }

        @Override
        public void close() {
            releaseAll(held);
        }
    }
}
