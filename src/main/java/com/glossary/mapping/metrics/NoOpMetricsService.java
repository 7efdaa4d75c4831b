package com.glossary.mapping.metrics;

import com.glossary.mapping.core.model.MappingStatus;

import java.time.Duration;

/**
 * Discards every measurement.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMappingDuration(MappingStatus status, Duration duration) {
    }

    @Override
    public void recordConfidence(double confidence) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordDedupHit() {
    }

    @Override
    public void recordDedupMiss() {
    }

    @Override
    public void incrementDegraded() {
    }

    @Override
    public void incrementReload(boolean success) {
    }

    @Override
    public void recordGlossarySize(int size) {
    }
}
