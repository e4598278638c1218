package com.tracker.sync.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process lock per key, serializing target writes that touch the same issue.
 */
public class KeyedLock {
    private static final Logger log = LoggerFactory.getLogger(KeyedLock.class);

    private static final long DEFAULT_TIMEOUT_MS = 300_000;

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final long timeoutMs;

    public KeyedLock() {
        this(DEFAULT_TIMEOUT_MS);
    }

    public KeyedLock(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        this.timeoutMs = timeoutMs;
    }

    public void lock(String key) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        try {
            if (!lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new LockAcquisitionException(
                        "Failed to acquire lock for key '" + key + "' within " + timeoutMs + "ms");
            }
            log.trace("lock.acquired key={}", key);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for key: " + key, e);
        }
    }

    public void unlock(String key) {
        ReentrantLock lock = locks.get(key);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.trace("lock.released key={}", key);
        }
    }

    /**
     * Runs {@code work} while holding the lock for {@code key}.
     */
    public <T> T withLock(String key, Supplier<T> work) {
        lock(key);
        try {
            return work.get();
        } finally {
            unlock(key);
        }
    }

    public boolean isLocked(String key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isLocked();
    }
}
