package com.glossary.mapping.assign;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One {@link ReentrantLock} per key, acquired with a timeout.
 *
 * <p>Locks are held with weak values: a lock stays mapped while any thread holds a
 * reference to it and is reclaimed once nobody does, so the key space can grow without
 * bound while memory does not.</p>
 */
public class KeyedLock {
    private static final Logger log = LoggerFactory.getLogger(KeyedLock.class);

    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantLock());

    /**
     * Acquires the lock for {@code key}. The caller must {@code unlock()} the returned lock.
     *
     * @throws LockAcquisitionException on timeout or interrupt
     */
    public ReentrantLock acquire(String key, Duration timeout) {
        ReentrantLock lock = locks.get(key);
        try {
            if (!lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new LockAcquisitionException(
                        "Failed to acquire lock for key '" + key + "' within " + timeout.toMillis() + "ms");
            }
            log.trace("lock.acquired key={}", key);
            return lock;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for key: " + key, e);
        }
    }
}
