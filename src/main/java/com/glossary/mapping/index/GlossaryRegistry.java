package com.glossary.mapping.index;

import com.glossary.mapping.core.model.ReferenceEntity;
import com.glossary.mapping.logging.LogContext;
import com.glossary.mapping.metrics.MetricsService;
import com.glossary.mapping.metrics.NoOpMetricsService;
import com.glossary.mapping.source.GlossarySource;
import com.glossary.mapping.tracing.NoOpTracingService;
import com.glossary.mapping.tracing.Span;
import com.glossary.mapping.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Owns the active {@link IndexSnapshot} and swaps it atomically on reload.
 *
 * <p>A reload builds the complete next generation off to the side and only then publishes it
 * with a single reference swap. Readers never block and never observe a partial index. When
 * a build fails the exception propagates to the caller and the previous snapshot stays
 * active. Concurrent reloads are serialized so generations are published in build order.</p>
 */
public class GlossaryRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(GlossaryRegistry.class);

    private final ReferenceIndex index;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final AtomicReference<IndexSnapshot> active = new AtomicReference<>();
    private final AtomicReference<Throwable> lastReloadFailure = new AtomicReference<>();
    private final List<Consumer<IndexSnapshot>> reloadListeners = new CopyOnWriteArrayList<>();
    private final Object reloadLock = new Object();

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> scheduledReload;

    public GlossaryRegistry(ReferenceIndex index) {
        this(index, new NoOpMetricsService(), new NoOpTracingService());
    }

    public GlossaryRegistry(ReferenceIndex index, MetricsService metricsService, TracingService tracingService) {
        this.index = Objects.requireNonNull(index, "index is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
    }

    /**
     * Loads the glossary from {@code source}, builds it and publishes it.
     *
     * @return the newly active snapshot
     */
    public IndexSnapshot reload(GlossarySource source) {
        Objects.requireNonNull(source, "source is required");
        try (LogContext ctx = LogContext.forReload(source.getName());
             Span span = tracingService.startSpan("glossary.reload")) {
            span.setAttribute("source", source.getName());
            try {
                IndexSnapshot snapshot = publish(source.loadGlossary());
                span.setAttribute("generation", snapshot.getGenerationId());
                span.setAttribute("entities", snapshot.size());
                span.setStatus(Span.SpanStatus.OK);
                return snapshot;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                onFailure(source.getName(), e);
                throw e;
            }
        }
    }

    /**
     * Builds and publishes a snapshot from entities already in hand.
     */
    public IndexSnapshot reload(List<ReferenceEntity> entities) {
        try {
            return publish(entities);
        } catch (RuntimeException e) {
            onFailure("direct", e);
            throw e;
        }
    }

    private IndexSnapshot publish(List<ReferenceEntity> entities) {
        synchronized (reloadLock) {
            IndexSnapshot snapshot = index.build(entities);
            IndexSnapshot previous = active.getAndSet(snapshot);
            lastReloadFailure.set(null);
            metricsService.incrementReload(true);
            metricsService.recordGlossarySize(snapshot.size());
            log.info("glossary.reloaded generation={} entities={} previousGeneration={}",
                    snapshot.getGenerationId(), snapshot.size(),
                    previous != null ? previous.getGenerationId() : -1);
            for (Consumer<IndexSnapshot> listener : reloadListeners) {
                try {
                    listener.accept(snapshot);
                } catch (RuntimeException e) {
                    log.warn("glossary.reload.listener.failed generation={} error={}",
                            snapshot.getGenerationId(), e.getMessage(), e);
                }
            }
            return snapshot;
        }
    }

    private void onFailure(String sourceName, RuntimeException e) {
        lastReloadFailure.set(e);
        metricsService.incrementReload(false);
        IndexSnapshot current = active.get();
        log.error("glossary.reload.failed source={} activeGeneration={} error={}",
                sourceName, current != null ? current.getGenerationId() : -1, e.getMessage());
    }

    /**
     * The active snapshot.
     *
     * @throws IllegalStateException if no glossary has been loaded yet
     */
    public IndexSnapshot current() {
        IndexSnapshot snapshot = active.get();
        if (snapshot == null) {
            throw new IllegalStateException("No glossary loaded");
        }
        return snapshot;
    }

    public Optional<IndexSnapshot> currentIfLoaded() {
        return Optional.ofNullable(active.get());
    }

    /**
     * The failure of the most recent reload, cleared by the next successful one.
     */
    public Optional<Throwable> getLastReloadFailure() {
        return Optional.ofNullable(lastReloadFailure.get());
    }

    /**
     * Registers a callback run after each successful swap, on the reloading thread.
     */
    public void addReloadListener(Consumer<IndexSnapshot> listener) {
        reloadListeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    /**
     * Reloads from {@code source} every {@code interval}, starting one interval from now.
     * Failures are logged and recorded; they never stop the schedule.
     */
    public synchronized void scheduleReloads(GlossarySource source, Duration interval) {
        Objects.requireNonNull(source, "source is required");
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Reload interval must be positive");
        }
        if (scheduledReload != null) {
            scheduledReload.cancel(false);
        }
        if (scheduler == null) {
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "glossary-reload");
                t.setDaemon(true);
                return t;
            });
        }
        long millis = interval.toMillis();
        scheduledReload = scheduler.scheduleWithFixedDelay(() -> {
            try {
                reload(source);
            } catch (RuntimeException e) {
                log.debug("glossary.reload.scheduled.failed source={}", source.getName(), e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
        log.info("glossary.reload.scheduled source={} intervalMs={}", source.getName(), millis);
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            scheduledReload = null;
        }
    }
}
