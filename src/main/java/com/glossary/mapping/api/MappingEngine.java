package com.glossary.mapping.api;

import com.glossary.mapping.assign.AssignmentCoordinator;
import com.glossary.mapping.assign.CaffeineDedupStore;
import com.glossary.mapping.assign.DedupConfig;
import com.glossary.mapping.assign.DedupStore;
import com.glossary.mapping.core.model.Candidate;
import com.glossary.mapping.core.model.MappingResult;
import com.glossary.mapping.core.model.ReferenceEntity;
import com.glossary.mapping.core.model.SourceRecord;
import com.glossary.mapping.event.LoggingMappingEventListener;
import com.glossary.mapping.event.MappingEvent;
import com.glossary.mapping.event.MappingEventListener;
import com.glossary.mapping.index.GlossaryRegistry;
import com.glossary.mapping.index.IndexSnapshot;
import com.glossary.mapping.index.ReferenceIndex;
import com.glossary.mapping.logging.LogContext;
import com.glossary.mapping.match.Matcher;
import com.glossary.mapping.metrics.MetricsService;
import com.glossary.mapping.metrics.NoOpMetricsService;
import com.glossary.mapping.normalize.DefaultNormalizationRules;
import com.glossary.mapping.normalize.InvalidAttributeException;
import com.glossary.mapping.normalize.NormalizerConfig;
import com.glossary.mapping.normalize.RecordNormalizer;
import com.glossary.mapping.rules.MappingRule;
import com.glossary.mapping.rules.RuleContext;
import com.glossary.mapping.rules.RulesEngine;
import com.glossary.mapping.similarity.SimilarityAlgorithm;
import com.glossary.mapping.similarity.SimilarityAlgorithms;
import com.glossary.mapping.sink.NoOpResultSink;
import com.glossary.mapping.sink.ResultSink;
import com.glossary.mapping.source.GlossarySource;
import com.glossary.mapping.tracing.NoOpTracingService;
import com.glossary.mapping.tracing.Span;
import com.glossary.mapping.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Entry point of the library: maps source records to glossary identifiers.
 *
 * <p>Each record flows through normalization, matching, the rule chain and the assignment
 * coordinator, then the batch is emitted to the {@link ResultSink}. A batch pins the glossary
 * generation active when it starts; a reload during the batch is only seen by later batches.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * try (MappingEngine engine = MappingEngine.builder()
 *         .options(MappingOptions.builder().fallbackId("company", "RDG-UNKNOWN-CO").build())
 *         .glossarySource(new JsonGlossarySource(Path.of("glossary.json")))
 *         .resultSink(sink)
 *         .build()) {
 *     engine.reload();
 *     BatchResult batch = engine.mapBatch(records);
 * }
 * </pre>
 *
 * <p>Records run in parallel on a fixed pool of {@code concurrencyLimit} workers, one record end
 * to end per worker. Batch calls never fail because of a single record: invalid input and
 * unexpected errors become {@code UNMATCHED} results.</p>
 */
public class MappingEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MappingEngine.class);

    private final MappingOptions options;
    private final RecordNormalizer normalizer;
    private final GlossaryRegistry registry;
    private final Matcher matcher;
    private final RulesEngine rulesEngine;
    private final AssignmentCoordinator coordinator;
    private final ResultSink resultSink;
    private final List<MappingEventListener> listeners;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final GlossarySource glossarySource;
    private final ExecutorService workers;
    private final ExecutorService sinkExecutor;
    // bounds scheduled-but-unfinished records so cancellation stops scheduling promptly
    private final Semaphore inFlight;

    private MappingEngine(Builder builder) {
        this.options = builder.options;
        this.normalizer = builder.normalizer;
        this.metricsService = builder.metricsService;
        this.tracingService = builder.tracingService;
        this.registry = new GlossaryRegistry(new ReferenceIndex(normalizer), metricsService, tracingService);
        this.matcher = builder.matcher != null
                ? builder.matcher
                : new Matcher(normalizer, builder.similarity, options);
        this.rulesEngine = builder.rules != null
                ? new RulesEngine(builder.rules)
                : RulesEngine.fromOptions(options);
        DedupStore store = builder.dedupStore != null
                ? builder.dedupStore
                : new CaffeineDedupStore(new DedupConfig(options.getDedupRetention(), options.getDedupMaxSize()));
        this.coordinator = new AssignmentCoordinator(store, normalizer, options.getCoordinatorTimeout(), metricsService,
                options.getConcurrencyLimit());
        this.resultSink = builder.resultSink;
        List<MappingEventListener> allListeners = new ArrayList<>();
        if (builder.defaultListener) {
            allListeners.add(new LoggingMappingEventListener());
        }
        allListeners.addAll(builder.listeners);
        this.listeners = List.copyOf(allListeners);
        this.glossarySource = builder.glossarySource;
        this.workers = Executors.newFixedThreadPool(options.getConcurrencyLimit(), namedDaemon("mapping-worker"));
        this.sinkExecutor = Executors.newFixedThreadPool(options.getConcurrencyLimit(), namedDaemon("result-sink"));
        this.inFlight = new Semaphore(options.getConcurrencyLimit());

        registry.addReloadListener(this::checkFallbackIds);
        if (glossarySource != null && options.getReloadInterval().isPresent()) {
            registry.scheduleReloads(glossarySource, options.getReloadInterval().get());
        }
        log.info("mapping.engine.created rules={} similarity={} options={}",
                rulesEngine.getRuleNames(), matcher.getSimilarity().getName(), options);
    }

    public static Builder builder() {
        return new Builder();
    }

    public MappingOptions getOptions() {
        return options;
    }

    public GlossaryRegistry getRegistry() {
        return registry;
    }

    public DedupStore getDedupStore() {
        return coordinator.getStore();
    }

    // --- Glossary ---

    /**
     * Reloads from the configured glossary source.
     *
     * @throws IllegalStateException if the engine was built without a glossary source
     */
    public IndexSnapshot reload() {
        if (glossarySource == null) {
            throw new IllegalStateException("No glossary source configured");
        }
        return registry.reload(glossarySource);
    }

    /**
     * Builds a new generation from {@code source} and swaps it in. On failure the exception
     * propagates and the previous generation stays active.
     */
    public IndexSnapshot reload(GlossarySource source) {
        return registry.reload(source);
    }

    public IndexSnapshot reload(List<ReferenceEntity> entities) {
        return registry.reload(entities);
    }

    // --- Mapping ---

    /**
     * Maps a single record as a batch of one.
     *
     * @throws IllegalStateException if no glossary has been loaded
     */
    public MappingResult mapRecord(SourceRecord record) {
        return mapBatch(List.of(record)).get(0);
    }

    public BatchResult mapBatch(List<SourceRecord> records) {
        return mapBatch(records, CancellationToken.create());
    }

    /**
     * Maps {@code records} in parallel and emits the results to the sink.
     *
     * @return one result per record, in input order; records not scheduled before cancellation
     * are reported {@code UNMATCHED} with reason {@value MappingResult#REASON_CANCELLED}
     * @throws IllegalStateException    if no glossary has been loaded
     * @throws IllegalArgumentException if the list contains null
     */
    public BatchResult mapBatch(List<SourceRecord> records, CancellationToken token) {
        Objects.requireNonNull(records, "records is required");
        Objects.requireNonNull(token, "token is required");
        if (records.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("records must not contain null");
        }
        IndexSnapshot snapshot = registry.current();
        long generation = snapshot.getGenerationId();
        String batchId = LogContext.generateBatchId();

        try (LogContext ctx = LogContext.forBatch(batchId, generation);
             Span span = tracingService.startSpan("mapping.batch", Map.of("batchId", batchId))) {
            span.setAttribute("generation", generation);
            span.setAttribute("size", records.size());
            metricsService.recordBatchSize(records.size());
            log.debug("batch.started batchId={} size={} generation={}", batchId, records.size(), generation);

            MappingResult[] slots = new MappingResult[records.size()];
            List<Future<?>> futures = new ArrayList<>(records.size());
            boolean cancelled = schedule(records, snapshot, batchId, token, slots, futures);
            awaitAll(futures);

            List<MappingResult> results = new ArrayList<>(slots.length);
            for (int i = 0; i < slots.length; i++) {
                results.add(slots[i] != null
                        ? slots[i]
                        : MappingResult.unmatched(records.get(i).getSourceId(), MappingResult.REASON_CANCELLED, generation));
            }

            SinkOutcome emitted = emit(batchId, results);
            BatchResult batch = new BatchResult(batchId, generation, emitted.results(),
                    BatchSummary.of(emitted.results()), emitted.stored(), cancelled);
            span.setStatus(emitted.stored() ? Span.SpanStatus.OK : Span.SpanStatus.ERROR);
            log.info("batch.completed batchId={} generation={} summary={} stored={} cancelled={}",
                    batchId, generation, batch.summary(), batch.stored(), cancelled);
            return batch;
        }
    }

    private boolean schedule(List<SourceRecord> records, IndexSnapshot snapshot, String batchId,
                             CancellationToken token, MappingResult[] slots, List<Future<?>> futures) {
        for (int i = 0; i < records.size(); i++) {
            if (token.isCancelled()) {
                log.info("batch.cancelled batchId={} scheduled={} total={}", batchId, i, records.size());
                return true;
            }
            try {
                inFlight.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("batch.interrupted batchId={} scheduled={} total={}", batchId, i, records.size());
                return true;
            }
            if (token.isCancelled()) {
                inFlight.release();
                log.info("batch.cancelled batchId={} scheduled={} total={}", batchId, i, records.size());
                return true;
            }
            int slot = i;
            SourceRecord record = records.get(i);
            futures.add(workers.submit(() -> {
                try {
                    slots[slot] = mapOne(record, snapshot, batchId);
                } finally {
                    inFlight.release();
                }
            }));
        }
        return false;
    }

    private void awaitAll(List<Future<?>> futures) {
        boolean interrupted = false;
        for (Future<?> future : futures) {
            while (true) {
                try {
                    future.get();
                    break;
                } catch (InterruptedException e) {
                    // in-flight records must still complete and be emitted
                    interrupted = true;
                } catch (ExecutionException e) {
                    log.error("batch.worker.failed error={}", e.getCause().getMessage(), e.getCause());
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private MappingResult mapOne(SourceRecord record, IndexSnapshot snapshot, String batchId) {
        long start = System.nanoTime();
        long generation = snapshot.getGenerationId();
        MappingResult result;
        try (LogContext ctx = LogContext.forRecord(batchId, record.getSourceId());
             Span span = tracingService.startSpan("mapping.record", Map.of("sourceId", record.getSourceId()))) {
            try {
                result = coordinator.assign(record, generation, () -> decide(record, snapshot));
            } catch (InvalidAttributeException e) {
                log.warn("mapping.invalid sourceId={} attribute={} error={}",
                        record.getSourceId(), e.getAttributeName(), e.getMessage());
                result = MappingResult.unmatched(record.getSourceId(), MappingResult.REASON_INVALID_INPUT, generation);
            } catch (RuntimeException e) {
                log.error("mapping.failed sourceId={} generation={}", record.getSourceId(), generation, e);
                span.recordException(e);
                result = MappingResult.unmatched(record.getSourceId(), MappingResult.REASON_INTERNAL_ERROR, generation);
            }
            span.setAttribute("status", result.status().name());
            span.setAttribute("confidence", result.confidence());
            span.setStatus(MappingResult.REASON_INTERNAL_ERROR.equals(result.reason())
                    ? Span.SpanStatus.ERROR : Span.SpanStatus.OK);
        }

        Duration latency = Duration.ofNanos(System.nanoTime() - start);
        metricsService.recordMappingDuration(result.status(), latency);
        if (result.isResolved()) {
            metricsService.recordConfidence(result.confidence());
        }
        publish(MappingEvent.of(result, latency));
        return result;
    }

    private MappingResult decide(SourceRecord record, IndexSnapshot snapshot) {
        List<Candidate> candidates;
        try (Stream<Candidate> stream = matcher.match(record, snapshot)) {
            candidates = stream.toList();
        }
        RuleContext context = new RuleContext(record.getSourceId(), normalizer.categoryOf(record),
                candidates, options, snapshot);
        return rulesEngine.decide(context).toResult(record.getSourceId(), snapshot.getGenerationId());
    }

    private void publish(MappingEvent event) {
        for (MappingEventListener listener : listeners) {
            try {
                listener.onMapping(event);
            } catch (RuntimeException e) {
                log.warn("event.listener.failed listener={} sourceId={} error={}",
                        listener.getClass().getSimpleName(), event.sourceId(), e.getMessage());
            }
        }
    }

    private SinkOutcome emit(String batchId, List<MappingResult> results) {
        Duration timeout = options.getSinkTimeout();
        Future<Boolean> future = sinkExecutor.submit(() -> resultSink.store(results));
        try {
            boolean stored = Boolean.TRUE.equals(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
            if (!stored) {
                log.error("sink.rejected batchId={} results={}", batchId, results.size());
            }
            return new SinkOutcome(results, stored);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("sink.timeout batchId={} results={} timeoutMs={}", batchId, results.size(), timeout.toMillis());
            return new SinkOutcome(
                    results.stream().map(r -> r.asUnmatched(MappingResult.REASON_SINK_TIMEOUT)).toList(), false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.error("sink.interrupted batchId={} results={}", batchId, results.size());
            return new SinkOutcome(results, false);
        } catch (ExecutionException e) {
            log.error("sink.failed batchId={} results={} error={}", batchId, results.size(),
                    e.getCause().getMessage(), e.getCause());
            return new SinkOutcome(results, false);
        }
    }

    private void checkFallbackIds(IndexSnapshot snapshot) {
        options.getFallbackIdsByCategory().forEach((category, id) -> {
            if (!snapshot.containsId(id)) {
                log.warn("fallback.unknown category={} fallbackId={} generation={}",
                        category, id, snapshot.getGenerationId());
            }
        });
        options.getDefaultFallbackId()
                .filter(id -> !snapshot.containsId(id))
                .ifPresent(id -> log.warn("fallback.unknown category=* fallbackId={} generation={}",
                        id, snapshot.getGenerationId()));
    }

    @Override
    public void close() {
        registry.close();
        workers.shutdown();
        sinkExecutor.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
            if (!sinkExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                sinkExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            sinkExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        coordinator.close();
        log.info("mapping.engine.closed");
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record SinkOutcome(List<MappingResult> results, boolean stored) {
    }

    public static class Builder {
        private MappingOptions options = MappingOptions.defaults();
        private RecordNormalizer normalizer;
        private SimilarityAlgorithm similarity = SimilarityAlgorithms.defaultAlgorithm();
        private Matcher matcher;
        private List<MappingRule> rules;
        private DedupStore dedupStore;
        private ResultSink resultSink = new NoOpResultSink();
        private final List<MappingEventListener> listeners = new ArrayList<>();
        private boolean defaultListener = true;
        private MetricsService metricsService = new NoOpMetricsService();
        private TracingService tracingService = new NoOpTracingService();
        private GlossarySource glossarySource;

        public Builder options(MappingOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        public Builder normalizer(RecordNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder similarity(SimilarityAlgorithm similarity) {
            this.similarity = Objects.requireNonNull(similarity, "similarity is required");
            return this;
        }

        /**
         * Replaces the matcher built from the normalizer, similarity and options.
         */
        public Builder matcher(Matcher matcher) {
            this.matcher = matcher;
            return this;
        }

        /**
         * Replaces the rule chain named by {@link MappingOptions#getRuleOrder()}.
         */
        public Builder rules(List<MappingRule> rules) {
            this.rules = rules != null ? List.copyOf(rules) : null;
            return this;
        }

        public Builder dedupStore(DedupStore dedupStore) {
            this.dedupStore = dedupStore;
            return this;
        }

        public Builder resultSink(ResultSink resultSink) {
            this.resultSink = Objects.requireNonNull(resultSink, "resultSink is required");
            return this;
        }

        public Builder listener(MappingEventListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener is required"));
            return this;
        }

        /**
         * Disables the logging listener registered by default.
         */
        public Builder withoutDefaultListener() {
            this.defaultListener = false;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
            return this;
        }

        public Builder glossarySource(GlossarySource glossarySource) {
            this.glossarySource = glossarySource;
            return this;
        }

        public MappingEngine build() {
            if (normalizer == null) {
                normalizer = DefaultNormalizationRules.createDefaultNormalizer(NormalizerConfig.defaults());
            }
            return new MappingEngine(this);
        }
    }
}
