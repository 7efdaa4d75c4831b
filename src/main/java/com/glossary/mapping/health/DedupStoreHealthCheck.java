package com.glossary.mapping.health;

import com.glossary.mapping.assign.DedupStore;
import com.glossary.mapping.assign.DedupStoreUnavailableException;

/**
 * DEGRADED when the dedup store cannot be reached: mapping continues, but without
 * duplicate suppression.
 */
public class DedupStoreHealthCheck implements HealthCheck {

    private final DedupStore store;

    public DedupStoreHealthCheck(DedupStore store) {
        this.store = store;
    }

    @Override
    public String getName() {
        return "dedup-store";
    }

    @Override
    public HealthStatus check() {
        try {
            long size = store.estimatedSize();
            return HealthStatus.up().withDetail("entries", size);
        } catch (DedupStoreUnavailableException e) {
            return HealthStatus.degraded("Dedup store unavailable: " + e.getMessage());
        }
    }
}
