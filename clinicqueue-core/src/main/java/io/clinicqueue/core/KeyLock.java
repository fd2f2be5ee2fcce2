package io.clinicqueue.core;

import java.time.Duration;

/**
 * Mutual exclusion per serialization key (one doctor/day).
 *
 * <p>Implementations must let at most one owner hold a key at a time and must never block
 * longer than the given wait.
 */
public interface KeyLock {

    /**
     * @return true if the lock was acquired within {@code maxWait}
     */
    boolean tryAcquire(String key, String owner, Duration maxWait) throws InterruptedException;

    void release(String key, String owner);
}
