package com.tracker.sync.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class KeyedLockTest {

    @Test
    @DisplayName("Should hold the lock only while the work runs")
    void testWithLock() {
        KeyedLock lock = new KeyedLock();

        String result = lock.withLock("acme/api#1", () -> {
            assertTrue(lock.isLocked("acme/api#1"));
            return "done";
        });

        assertEquals("done", result);
        assertFalse(lock.isLocked("acme/api#1"));
    }

    @Test
    @DisplayName("Should serialize work on the same key")
    void testSerializes() throws InterruptedException {
        KeyedLock lock = new KeyedLock();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        int threads = 8;
        CountDownLatch done = new CountDownLatch(threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                lock.withLock("acme/api#1", () -> {
                    maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    try {
                        Thread.sleep(5);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    inside.decrementAndGet();
                    return null;
                });
                done.countDown();
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();
        assertEquals(1, maxInside.get());
    }

    @Test
    @DisplayName("Should time out when another thread holds the key")
    void testTimeout() throws Exception {
        KeyedLock lock = new KeyedLock(50);
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> lock.withLock("k", () -> {
            held.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        holder.start();
        assertTrue(held.await(5, TimeUnit.SECONDS));

        assertThrows(LockAcquisitionException.class, () -> lock.lock("k"));

        release.countDown();
        holder.join();
    }

    @Test
    @DisplayName("Should reject a non-positive timeout")
    void testInvalidTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new KeyedLock(0));
    }
}
