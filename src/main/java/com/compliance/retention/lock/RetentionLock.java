package com.compliance.retention.lock;

import java.util.function.Supplier;

/**
 * Advisory lock guarding retention writes.
 * The pipeline takes {@link #RUN_KEY} for the whole cycle and {@link #MANIFEST_KEY}
 * around each manifest write.
 */
public interface RetentionLock {

    String RUN_KEY = "retention:run";
    String MANIFEST_KEY = "retention:manifest";

    /**
     * Acquires the lock on the given key.
     *
     * @return true once acquired
     * @throws LockAcquisitionException if the lock is not obtained within the configured timeout
     */
    boolean tryLock(String key);

    /**
     * Releases the lock on the given key. Releasing a lock not held by the caller does nothing.
     */
    void unlock(String key);

    /**
     * Runs {@code action} while holding the lock on {@code key}.
     */
    default <T> T withLock(String key, Supplier<T> action) {
        tryLock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }
}
