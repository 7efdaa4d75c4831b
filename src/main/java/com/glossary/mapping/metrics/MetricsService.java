package com.glossary.mapping.metrics;

import com.glossary.mapping.core.model.MappingStatus;

import java.time.Duration;

/**
 * Records mapping engine metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine runs without any
 * metrics library on the classpath.
 */
public interface MetricsService {

    void recordMappingDuration(MappingStatus status, Duration duration);

    void recordConfidence(double confidence);

    void recordBatchSize(int size);

    void recordDedupHit();

    void recordDedupMiss();

    void incrementDegraded();

    void incrementReload(boolean success);

    void recordGlossarySize(int size);
}
