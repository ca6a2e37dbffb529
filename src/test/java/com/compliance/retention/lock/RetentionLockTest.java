package com.compliance.retention.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RetentionLockTest {

    @Nested
    @DisplayName("LocalRetentionLock")
    class LocalLockTests {

        @Test
        @DisplayName("Acquires and releases the lock")
        void testAcquireRelease() {
            LocalRetentionLock lock = new LocalRetentionLock();
            assertTrue(lock.tryLock(RetentionLock.RUN_KEY));
            assertTrue(lock.isLocked(RetentionLock.RUN_KEY));
            lock.unlock(RetentionLock.RUN_KEY);
            assertFalse(lock.isLocked(RetentionLock.RUN_KEY));
        }

        @Test
        @DisplayName("The same thread may lock a key twice")
        void testReentrant() {
            LocalRetentionLock lock = new LocalRetentionLock();
            assertTrue(lock.tryLock(RetentionLock.RUN_KEY));
            assertTrue(lock.tryLock(RetentionLock.RUN_KEY));
            lock.unlock(RetentionLock.RUN_KEY);
            lock.unlock(RetentionLock.RUN_KEY);
            assertFalse(lock.isLocked(RetentionLock.RUN_KEY));
        }

        @Test
        @DisplayName("Run and manifest keys are independent")
        void testDifferentKeys() {
            LocalRetentionLock lock = new LocalRetentionLock();
            assertTrue(lock.tryLock(RetentionLock.RUN_KEY));
            assertTrue(lock.tryLock(RetentionLock.MANIFEST_KEY));
            lock.unlock(RetentionLock.MANIFEST_KEY);
            assertTrue(lock.isLocked(RetentionLock.RUN_KEY));
            lock.unlock(RetentionLock.RUN_KEY);
        }

        @Test
        @DisplayName("Times out while another thread holds the key")
        void testTimeout() throws Exception {
            LocalRetentionLock lock = new LocalRetentionLock(new LockConfig(50, 0, 10, 60));
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Thread holder = new Thread(() -> {
                lock.tryLock(RetentionLock.RUN_KEY);
                held.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    lock.unlock(RetentionLock.RUN_KEY);
                }
            });
            holder.start();
            assertTrue(held.await(5, TimeUnit.SECONDS));

            try {
                LockAcquisitionException ex = assertThrows(LockAcquisitionException.class,
                        () -> lock.tryLock(RetentionLock.RUN_KEY));
                assertTrue(ex.getMessage().contains("not acquired within 50ms"));
            } finally {
                release.countDown();
                holder.join(5000);
            }
        }

        @Test
        @DisplayName("Concurrent holders of one key are serialized")
        void testConcurrentBlocking() throws Exception {
            LocalRetentionLock lock = new LocalRetentionLock(new LockConfig(5000, 0, 100, 60));
            AtomicInteger concurrentCount = new AtomicInteger(0);
            AtomicInteger maxConcurrent = new AtomicInteger(0);

            int threadCount = 5;
            CountDownLatch startLatch = new CountDownLatch(1);
            CountDownLatch doneLatch = new CountDownLatch(threadCount);

            for (int i = 0; i < threadCount; i++) {
                new Thread(() -> {
                    try {
                        startLatch.await();
                        lock.withLock(RetentionLock.MANIFEST_KEY, () -> {
                            int current = concurrentCount.incrementAndGet();
                            maxConcurrent.updateAndGet(max -> Math.max(max, current));
                            sleepQuietly(20);
                            concurrentCount.decrementAndGet();
                            return null;
                        });
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        doneLatch.countDown();
                    }
                }).start();
            }

            startLatch.countDown();
            assertTrue(doneLatch.await(10, TimeUnit.SECONDS));
            assertEquals(1, maxConcurrent.get());
        }

        @Test
        @DisplayName("withLock releases the key when the action throws")
        void testWithLockReleasesOnFailure() {
            LocalRetentionLock lock = new LocalRetentionLock();

            assertThrows(IllegalStateException.class, () -> lock.withLock(RetentionLock.RUN_KEY, () -> {
                throw new IllegalStateException("boom");
            }));
            assertFalse(lock.isLocked(RetentionLock.RUN_KEY));
        }

        @Test
        @DisplayName("Unlock from a thread not holding the key is ignored")
        void testUnlockFromOtherThread() throws Exception {
            LocalRetentionLock lock = new LocalRetentionLock();
            lock.tryLock(RetentionLock.RUN_KEY);
            AtomicReference<Throwable> error = new AtomicReference<>();

            Thread other = new Thread(() -> {
                try {
                    lock.unlock(RetentionLock.RUN_KEY);
                } catch (Throwable t) {
                    error.set(t);
                }
            });
            other.start();
            other.join(5000);

            assertNull(error.get());
            assertTrue(lock.isLocked(RetentionLock.RUN_KEY));
            lock.unlock(RetentionLock.RUN_KEY);
        }

        @Test
        @DisplayName("Unlocking an unknown key does nothing")
        void testUnlockNonExistentKey() {
            LocalRetentionLock lock = new LocalRetentionLock();
            assertDoesNotThrow(() -> lock.unlock("non-existent"));
        }
    }

    @Nested
    @DisplayName("LockConfig")
    class LockConfigTests {

        @Test
        @DisplayName("Default config values")
        void testDefaults() {
            LockConfig config = LockConfig.defaults();
            assertEquals(5000, config.timeoutMs());
            assertEquals(3, config.maxRetries());
            assertEquals(100, config.retryDelayMs());
            assertEquals(6 * 3600, config.lockTtlSeconds());
        }

        @Test
        @DisplayName("Rejects invalid values")
        void testInvalid() {
            assertThrows(IllegalArgumentException.class, () -> new LockConfig(0, 3, 100, 30));
            assertThrows(IllegalArgumentException.class, () -> new LockConfig(5000, -1, 100, 30));
            assertThrows(IllegalArgumentException.class, () -> new LockConfig(5000, 3, 0, 30));
            assertThrows(IllegalArgumentException.class, () -> new LockConfig(5000, 3, 100, 0));
        }
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
