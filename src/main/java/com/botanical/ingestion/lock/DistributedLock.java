package com.botanical.ingestion.lock;

/**
 * Lock guarding the resolve, merge and persist sequence so two ingestion jobs
 * never both create a record for the same plant.
 */
public interface DistributedLock {

    /**
     * Acquires the lock on {@code key}, waiting up to the configured timeout.
     *
     * @return true once the lock is held
     * @throws LockAcquisitionException if the lock cannot be acquired in time
     */
    boolean tryLock(String key);

    /**
     * Releases a lock held by the current thread; a no-op otherwise.
     */
    void unlock(String key);
}
