package com.glossary.mapping.assign;

import com.glossary.mapping.core.model.MappingResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Caffeine-backed {@link DedupStore}: bounded by size, entries expire a fixed time after
 * they are written. This is the default store.
 */
public class CaffeineDedupStore implements DedupStore {
    private static final Logger log = LoggerFactory.getLogger(CaffeineDedupStore.class);

    private final Cache<IdempotencyKey, MappingResult> cache;

    public CaffeineDedupStore(DedupConfig config) {
        this(config, Ticker.systemTicker());
    }

    /**
     * @param ticker time source for expiry, replaceable in tests
     */
    public CaffeineDedupStore(DedupConfig config, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(config.retention())
                .ticker(ticker)
                .recordStats()
                .build();
        log.info("dedup.store.initialized maxSize={} retention={}", config.maxSize(), config.retention());
    }

    @Override
    public Optional<MappingResult> get(IdempotencyKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(IdempotencyKey key, MappingResult result) {
        cache.put(key, result);
    }

    @Override
    public long estimatedSize() {
        return cache.estimatedSize();
    }

    @Override
    public void clear() {
        cache.invalidateAll();
    }

    @Override
    public boolean isBlocking() {
        return false;
    }

    public CacheStats stats() {
        return cache.stats();
    }
}
