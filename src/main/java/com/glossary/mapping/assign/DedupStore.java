package com.glossary.mapping.assign;

import com.glossary.mapping.core.model.MappingResult;

import java.util.Optional;

/**
 * Remembers recent results by idempotency key so a repeated request returns the stored
 * result instead of being recomputed.
 *
 * <p>Implementations must be thread-safe. Any failure to reach the backing store is
 * reported as {@link DedupStoreUnavailableException}; the coordinator then maps
 * without duplicate suppression.</p>
 */
public interface DedupStore {

    Optional<MappingResult> get(IdempotencyKey key);

    void put(IdempotencyKey key, MappingResult result);

    long estimatedSize();

    void clear();

    /**
     * Whether calls may block on I/O. Blocking stores are called under the coordinator
     * timeout on a separate thread; in-process stores are called inline.
     */
    default boolean isBlocking() {
        return true;
    }
}
