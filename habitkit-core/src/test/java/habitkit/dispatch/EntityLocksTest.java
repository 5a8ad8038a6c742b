package habitkit.dispatch;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityLocksTest {

    @Test
    void releasedKeysAreEvicted() {
        EntityLocks locks = new EntityLocks();
        try (EntityLocks.Permit permit = locks.acquire("h1")) {
            assertEquals("h1", permit.key());
            assertEquals(1, locks.activeKeys());
        }
        assertEquals(0, locks.activeKeys());
    }

    @Test
    void closingTwiceIsHarmless() {
        EntityLocks locks = new EntityLocks();
        EntityLocks.Permit permit = locks.acquire("h1");
        permit.close();
        permit.close();
        assertEquals(0, locks.activeKeys());
    }

    @Test
    void sameKeyIsExclusive() throws Exception {
        EntityLocks locks = new EntityLocks();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 200; i++) {
                pool.submit(() -> {
                    try (EntityLocks.Permit ignored = locks.acquire("same")) {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        Thread.yield();
                        inside.decrementAndGet();
                    }
                });
            }
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }
        assertEquals(1, maxInside.get());
        assertEquals(0, locks.activeKeys());
    }

    @Test
    void differentKeysDoNotBlock() throws Exception {
        EntityLocks locks = new EntityLocks();
        ExecutorService pool = Executors.newSingleThreadExecutor();
        CountDownLatch acquired = new CountDownLatch(1);
        try (EntityLocks.Permit held = locks.acquire("h1")) {
            Future<?> other = pool.submit(() -> {
                try (EntityLocks.Permit ignored = locks.acquire("h2")) {
                    acquired.countDown();
                }
            });
            assertTrue(acquired.await(2, TimeUnit.SECONDS));
            other.get(2, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void waiterGetsLockAfterRelease() throws Exception {
        EntityLocks locks = new EntityLocks();
        ExecutorService pool = Executors.newSingleThreadExecutor();
        CountDownLatch acquired = new CountDownLatch(1);
        try {
            EntityLocks.Permit held = locks.acquire("h1");
            pool.submit(() -> {
                try (EntityLocks.Permit ignored = locks.acquire("h1")) {
                    acquired.countDown();
                }
            });
            assertFalse(acquired.await(200, TimeUnit.MILLISECONDS));
            held.close();
            assertTrue(acquired.await(2, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
    }
}
