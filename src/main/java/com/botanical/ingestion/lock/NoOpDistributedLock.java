package com.botanical.ingestion.lock;

/**
 * Lock that always succeeds immediately. For callers that already serialize ingestion themselves.
 */
public class NoOpDistributedLock implements DistributedLock {

    @Override
    public boolean tryLock(String key) {
        return true;
    }

    @Override
    public void unlock(String key) {
        // nothing held
    }
}
