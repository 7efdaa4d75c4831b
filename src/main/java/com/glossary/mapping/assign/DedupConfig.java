package com.glossary.mapping.assign;

import java.time.Duration;

/**
 * Configuration for the in-process dedup store.
 *
 * @param retention how long a result is remembered after it is written
 * @param maxSize   maximum number of remembered results
 */
public record DedupConfig(Duration retention, long maxSize) {

    public DedupConfig {
        if (retention == null || retention.isZero() || retention.isNegative()) {
            throw new IllegalArgumentException("retention must be positive");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    /**
     * 24 hours, 100,000 entries.
     */
    public static DedupConfig defaults() {
        return new DedupConfig(Duration.ofHours(24), 100_000);
    }
}
