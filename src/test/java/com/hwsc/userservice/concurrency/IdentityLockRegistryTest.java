package com.hwsc.userservice.concurrency;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class IdentityLockRegistryTest {

    private IdentityLockRegistry registry;

    @BeforeEach
    void setup() {
        registry = new IdentityLockRegistry();
    }

    @Test
    void entryIsKeptAfterReleaseUntilEvicted() {
        try (IdentityLock lock = registry.acquireExclusive("a")) {
            assertTrue(registry.isTracked("a"));
        }
        assertTrue(registry.isTracked("a"), "released but not stale: entry stays");

        try (IdentityLock lock = registry.acquireExclusive("a")) {
            lock.evict();
            assertTrue(registry.isTracked("a"), "held entry must survive eviction");
        }
        assertFalse(registry.isTracked("a"));
        assertEquals(0, registry.size());
    }

    @Test
    void closeIsIdempotent() {
        IdentityLock lock = registry.acquireExclusive("a");
        lock.evict();
        lock.close();
        assertDoesNotThrow(lock::close);
        assertEquals(0, registry.size());
    }

    @Test
    void sharedHoldersDoNotBlockEachOther() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try (IdentityLock first = registry.acquireShared("a")) {
            Future<Boolean> second = pool.submit(() -> {
                try (IdentityLock lock = registry.acquireShared("a")) {
                    return true;
                }
            });
            assertTrue(second.get(2, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void exclusiveHolderBlocksSameIdButNotOthers() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Boolean> sameId;
            try (IdentityLock held = registry.acquireExclusive("a")) {
                sameId = pool.submit(() -> {
                    try (IdentityLock lock = registry.acquireShared("a")) {
                        return true;
                    }
                });
                Future<Boolean> otherId = pool.submit(() -> {
                    try (IdentityLock lock = registry.acquireExclusive("b")) {
                        return true;
                    }
                });

                assertTrue(otherId.get(2, TimeUnit.SECONDS));
                assertThrows(TimeoutException.class, () -> sameId.get(200, TimeUnit.MILLISECONDS));
            }
            assertTrue(sameId.get(2, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void waiterOnEvictedEntryKeepsSameLock() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        CountDownLatch waiterRetained = new CountDownLatch(1);
        try {
            Future<Boolean> waiter;
            IdentityLock held = registry.acquireExclusive("a");
            waiter = pool.submit(() -> {
                waiterRetained.countDown();
                try (IdentityLock lock = registry.acquireExclusive("a")) {
                    return registry.isTracked("a");
                }
            });
            assertTrue(waiterRetained.await(2, TimeUnit.SECONDS));
            // give the waiter time to register itself on the entry
            Thread.sleep(100);
            held.evict();
            held.close();

            assertTrue(waiter.get(2, TimeUnit.SECONDS), "waiter must acquire the entry it joined");
            assertFalse(registry.isTracked("a"));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void concurrentFirstAcquisitionsShareOneLock() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    try (IdentityLock lock = registry.acquireExclusive("new-id")) {
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        Thread.sleep(5);
                        inside.decrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, maxInside.get(), "exclusive sections on one id must never overlap");
        assertEquals(1, registry.size());
    }

    @Test
    void clearDropsOnlyIdleEntries() {
        try (IdentityLock ignored = registry.acquireShared("idle")) {
            assertTrue(registry.isTracked("idle"));
        }
        IdentityLock busy = registry.acquireShared("busy");

        registry.clear();

        assertFalse(registry.isTracked("idle"));
        assertTrue(registry.isTracked("busy"));
        busy.close();
    }

    @Test
    void nullIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.acquireExclusive(null));
    }
}
