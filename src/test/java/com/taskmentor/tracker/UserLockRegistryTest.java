package com.taskmentor.tracker;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class UserLockRegistryTest {

    private final UserLockRegistry registry = new UserLockRegistry();

    @Test
    void testSameUserWorkIsSerialized() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    registry.runLocked("alice", () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        sleepQuietly();
                        inside.decrementAndGet();
                    });
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, maxInside.get());
        assertEquals(0, registry.trackedUsers());
    }

    @Test
    void testLockIsReleasedAndDroppedAfterFailure() {
        assertThrows(IllegalStateException.class, () -> registry.withLock("alice", () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals(0, registry.trackedUsers());
        assertEquals("ok", registry.withLock("alice", () -> "ok"));
    }

    @Test
    void testNestedCallsKeepEntryUntilOutermostExits() {
        int seenInside = registry.withLock("alice", () -> registry.withLock("alice", registry::trackedUsers));

        assertEquals(1, seenInside);
        assertEquals(0, registry.trackedUsers());
    }

    private static void sleepQuietly() {
        try {
            Thread.sleep(5);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
