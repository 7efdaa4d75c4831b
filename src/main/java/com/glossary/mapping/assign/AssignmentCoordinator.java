package com.glossary.mapping.assign;

import com.glossary.mapping.core.model.MappingResult;
import com.glossary.mapping.core.model.SourceRecord;
import com.glossary.mapping.metrics.MetricsService;
import com.glossary.mapping.metrics.NoOpMetricsService;
import com.glossary.mapping.normalize.RecordNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Makes mapping idempotent and single-writer per request.
 *
 * <p>For every record the coordinator derives an {@link IdempotencyKey}, takes the per-key lock
 * and consults the {@link DedupStore}. A stored result is returned without running the decider;
 * otherwise the decider computes the result, which is stored before the lock is released.
 * Concurrent submissions of the same request therefore compute once and observe the same result.</p>
 *
 * <p>Failure handling:</p>
 * <ul>
 *   <li>Lock wait or store call exceeding the timeout: {@code UNMATCHED}, reason
 *       {@value MappingResult#REASON_COORDINATOR_TIMEOUT}.</li>
 *   <li>Store unavailable or failing: the result is computed without suppression and flagged
 *       degraded.</li>
 *   <li>Exceptions thrown by the decider propagate to the caller and nothing is stored.</li>
 * </ul>
 */
public class AssignmentCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AssignmentCoordinator.class);

    private final DedupStore store;
    private final RecordNormalizer normalizer;
    private final Duration timeout;
    private final MetricsService metricsService;
    private final KeyedLock locks = new KeyedLock();
    private final ExecutorService storeExecutor;

    public AssignmentCoordinator(DedupStore store, RecordNormalizer normalizer, Duration timeout) {
        this(store, normalizer, timeout, new NoOpMetricsService());
    }

    public AssignmentCoordinator(DedupStore store, RecordNormalizer normalizer, Duration timeout,
                                 MetricsService metricsService) {
        this(store, normalizer, timeout, metricsService, Runtime.getRuntime().availableProcessors());
    }

    /**
     * @param ioThreads upper bound on threads calling a blocking store
     */
    public AssignmentCoordinator(DedupStore store, RecordNormalizer normalizer, Duration timeout,
                                 MetricsService metricsService, int ioThreads) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.timeout = Objects.requireNonNull(timeout, "timeout is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        if (ioThreads <= 0) {
            throw new IllegalArgumentException("ioThreads must be positive");
        }
        this.storeExecutor = store.isBlocking()
                ? Executors.newFixedThreadPool(ioThreads, r -> {
                    Thread t = new Thread(r, "dedup-store-io");
                    t.setDaemon(true);
                    return t;
                })
                : null;
    }

    public DedupStore getStore() {
        return store;
    }

    /**
     * Produces the result for {@code record} against {@code generationId}, running
     * {@code decider} at most once per idempotency key within the store's retention.
     */
    public MappingResult assign(SourceRecord record, long generationId, Supplier<MappingResult> decider) {
        String category = normalizer.categoryOf(record);
        IdempotencyKey key = IdempotencyKey.of(record.getSourceId(),
                normalizer.normalizeAttributes(record.getAttributes(), category), category, generationId);
        long deadline = System.nanoTime() + timeout.toNanos();

        ReentrantLock lock;
        try {
            lock = locks.acquire(key.asString(), timeout);
        } catch (LockAcquisitionException e) {
            log.warn("coordinator.timeout sourceId={} stage=lock error={}", record.getSourceId(), e.getMessage());
            return MappingResult.unmatched(record.getSourceId(), MappingResult.REASON_COORDINATOR_TIMEOUT, generationId);
        }

        try {
            Optional<MappingResult> cached;
            try {
                cached = callStore(() -> store.get(key), deadline);
            } catch (DedupStoreUnavailableException e) {
                return degraded(record, decider, e);
            }
            if (cached.isPresent()) {
                metricsService.recordDedupHit();
                log.debug("dedup.hit sourceId={} generation={}", record.getSourceId(), generationId);
                return cached.get();
            }
            metricsService.recordDedupMiss();

            MappingResult result = decider.get();
            try {
                callStore(() -> {
                    store.put(key, result);
                    return null;
                }, deadline);
            } catch (DedupStoreUnavailableException e) {
                log.warn("dedup.degraded sourceId={} stage=put error={}", record.getSourceId(), e.getMessage());
                metricsService.incrementDegraded();
                return result.asDegraded();
            }
            return result;
        } catch (TimeoutException e) {
            log.warn("coordinator.timeout sourceId={} stage=store timeoutMs={}", record.getSourceId(), timeout.toMillis());
            return MappingResult.unmatched(record.getSourceId(), MappingResult.REASON_COORDINATOR_TIMEOUT, generationId);
        } finally {
            lock.unlock();
        }
    }

    private MappingResult degraded(SourceRecord record, Supplier<MappingResult> decider, DedupStoreUnavailableException e) {
        log.warn("dedup.degraded sourceId={} stage=get error={}", record.getSourceId(), e.getMessage());
        metricsService.incrementDegraded();
        return decider.get().asDegraded();
    }

    /**
     * Runs a store call inline for in-process stores, or on the I/O pool bounded by the deadline.
     * A call still running at the deadline is interrupted. Any store failure surfaces as
     * {@link DedupStoreUnavailableException}.
     */
    private <T> T callStore(Supplier<T> call, long deadlineNanos) throws TimeoutException {
        if (storeExecutor == null) {
            try {
                return call.get();
            } catch (DedupStoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new DedupStoreUnavailableException("Dedup store call failed: " + e.getMessage(), e);
            }
        }
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            throw new TimeoutException("coordinator deadline passed");
        }
        Callable<T> task = call::get;
        Future<T> future = storeExecutor.submit(task);
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new DedupStoreUnavailableException("Interrupted while calling dedup store", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DedupStoreUnavailableException unavailable) {
                throw unavailable;
            }
            throw new DedupStoreUnavailableException("Dedup store call failed: " + cause.getMessage(), cause);
        }
    }

    @Override
    public void close() {
        if (storeExecutor != null) {
            storeExecutor.shutdownNow();
        }
    }
}
