package com.glossary.mapping.metrics;

import com.glossary.mapping.core.model.MappingStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code glossary.mapping.duration}: Timer (tag: status)</li>
 *   <li>{@code glossary.mapping.confidence}: DistributionSummary of winning scores</li>
 *   <li>{@code glossary.mapping.batch.size}: DistributionSummary</li>
 *   <li>{@code glossary.mapping.dedup}: Counter (tag: outcome=hit|miss)</li>
 *   <li>{@code glossary.mapping.degraded}: Counter</li>
 *   <li>{@code glossary.reload}: Counter (tag: outcome=success|failure)</li>
 *   <li>{@code glossary.size}: Gauge of entities in the active snapshot</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Map<MappingStatus, Timer> timers = new EnumMap<>(MappingStatus.class);
    private final DistributionSummary confidenceSummary;
    private final DistributionSummary batchSizeSummary;
    private final Counter dedupHitCounter;
    private final Counter dedupMissCounter;
    private final Counter degradedCounter;
    private final Counter reloadSuccessCounter;
    private final Counter reloadFailureCounter;
    private final AtomicInteger glossarySize = new AtomicInteger();

    public MicrometerMetricsService(MeterRegistry registry) {
        for (MappingStatus status : MappingStatus.values()) {
            timers.put(status, Timer.builder("glossary.mapping.duration")
                    .description("Time to map one source record")
                    .tag("status", status.name())
                    .register(registry));
        }
        this.confidenceSummary = DistributionSummary.builder("glossary.mapping.confidence")
                .description("Confidence of resolved mappings")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("glossary.mapping.batch.size")
                .description("Records per mapped batch")
                .register(registry);
        this.dedupHitCounter = Counter.builder("glossary.mapping.dedup")
                .description("Idempotency store lookups")
                .tag("outcome", "hit")
                .register(registry);
        this.dedupMissCounter = Counter.builder("glossary.mapping.dedup")
                .description("Idempotency store lookups")
                .tag("outcome", "miss")
                .register(registry);
        this.degradedCounter = Counter.builder("glossary.mapping.degraded")
                .description("Results computed without duplicate suppression")
                .register(registry);
        this.reloadSuccessCounter = Counter.builder("glossary.reload")
                .description("Glossary reload attempts")
                .tag("outcome", "success")
                .register(registry);
        this.reloadFailureCounter = Counter.builder("glossary.reload")
                .description("Glossary reload attempts")
                .tag("outcome", "failure")
                .register(registry);
        Gauge.builder("glossary.size", glossarySize, AtomicInteger::get)
                .description("Entities in the active glossary snapshot")
                .register(registry);
    }

    @Override
    public void recordMappingDuration(MappingStatus status, Duration duration) {
        timers.get(status).record(duration);
    }

    @Override
    public void recordConfidence(double confidence) {
        confidenceSummary.record(confidence);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordDedupHit() {
        dedupHitCounter.increment();
    }

    @Override
    public void recordDedupMiss() {
        dedupMissCounter.increment();
    }

    @Override
    public void incrementDegraded() {
        degradedCounter.increment();
    }

    @Override
    public void incrementReload(boolean success) {
        (success ? reloadSuccessCounter : reloadFailureCounter).increment();
    }

    @Override
    public void recordGlossarySize(int size) {
        glossarySize.set(size);
    }
}
