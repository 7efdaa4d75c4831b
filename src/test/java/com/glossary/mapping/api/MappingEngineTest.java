package com.glossary.mapping.api;

import com.glossary.mapping.core.model.MappingResult;
import com.glossary.mapping.core.model.MappingStatus;
import com.glossary.mapping.core.model.ReferenceEntity;
import com.glossary.mapping.core.model.SourceRecord;
import com.glossary.mapping.event.MappingEvent;
import com.glossary.mapping.match.Matcher;
import com.glossary.mapping.metrics.MicrometerMetricsService;
import com.glossary.mapping.normalize.DefaultNormalizationRules;
import com.glossary.mapping.normalize.NormalizerConfig;
import com.glossary.mapping.normalize.RecordNormalizer;
import com.glossary.mapping.rules.MappingRule;
import com.glossary.mapping.similarity.JaroWinklerSimilarity;
import com.glossary.mapping.similarity.SimilarityAlgorithm;
import com.glossary.mapping.sink.InMemoryResultSink;
import com.glossary.mapping.sink.ResultSink;
import com.glossary.mapping.source.JsonGlossarySource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.glossary.mapping.GlossaryFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MappingEngineTest {

    private static final List<String> FUZZY_PATH = List.of("ExactAcceptRule", "AmbiguityRule", "FuzzyAcceptRule");
    private static final List<String> FULL_PATH = List.of(
            "ExactAcceptRule", "AmbiguityRule", "FuzzyAcceptRule", "FallbackIdRule", "RejectRule");

    private final List<MappingEngine> engines = new ArrayList<>();

    @AfterEach
    void tearDown() {
        engines.forEach(MappingEngine::close);
    }

    private MappingEngine track(MappingEngine engine) {
        engines.add(engine);
        return engine;
    }

    private MappingEngine loadedEngine(MappingOptions options) {
        MappingEngine engine = track(MappingEngine.builder().options(options).build());
        engine.reload(sampleGlossary());
        return engine;
    }

    private MappingEngine loadedEngine() {
        return loadedEngine(MappingOptions.defaults());
    }

    @Nested
    @DisplayName("Decisions")
    class Decisions {

        @Test
        @DisplayName("Should map an abbreviated name by fuzzy match")
        void testFuzzyMatch() {
            MappingResult result = loadedEngine().mapRecord(record("src-1", "ACME Corp."));

            assertEquals(MappingStatus.MATCHED, result.status());
            assertEquals(ACME, result.assignedId());
            assertEquals(0.9125, result.confidence(), 1e-9);
            assertEquals(FUZZY_PATH, result.decisionPath());
            assertEquals(1, result.generationId());
            assertFalse(result.degraded());
        }

        @Test
        @DisplayName("Should report records without a candidate as unmatched")
        void testNoMatch() {
            MappingResult result = loadedEngine().mapRecord(record("src-2", "Zzyzx Holdings"));

            assertEquals(MappingStatus.UNMATCHED, result.status());
            assertNull(result.assignedId());
            assertEquals(0.0, result.confidence());
            assertEquals(FULL_PATH, result.decisionPath());
            assertEquals("no candidate above threshold", result.reason());
        }

        @Test
        @DisplayName("Should assign the category fallback when nothing matches")
        void testFallback() {
            MappingEngine engine = loadedEngine(MappingOptions.builder()
                    .fallbackId("company", UNKNOWN_COMPANY)
                    .build());

            MappingResult result = engine.mapRecord(companyRecord("src-3", "Zzyzx Holdings"));

            assertEquals(MappingStatus.MATCHED_BY_FALLBACK, result.status());
            assertEquals(UNKNOWN_COMPANY, result.assignedId());
            assertEquals(List.of("ExactAcceptRule", "AmbiguityRule", "FuzzyAcceptRule", "FallbackIdRule"),
                    result.decisionPath());
            assertEquals("fallback for category company", result.reason());
        }

        @Test
        @DisplayName("Records outside the fallback category should stay unmatched")
        void testFallbackOtherCategory() {
            MappingEngine engine = loadedEngine(MappingOptions.builder()
                    .fallbackId("company", UNKNOWN_COMPANY)
                    .build());

            SourceRecord person = SourceRecord.builder()
                    .sourceId("src-4").attribute("name", "Zzyzx Holdings").category("person").build();

            assertEquals(MappingStatus.UNMATCHED, engine.mapRecord(person).status());
        }

        @Test
        @DisplayName("An exact key should win over near-identical entities")
        void testExactPrecedence() {
            MappingEngine engine = track(MappingEngine.builder().build());
            engine.reload(List.of(company("RDG-001", "Acme Corporation"), company("RDG-010", "Acme Corporations")));

            MappingResult result = engine.mapRecord(record("src-5", "ACME  corporation"));

            assertEquals(MappingStatus.MATCHED, result.status());
            assertEquals("RDG-001", result.assignedId());
            assertEquals(1.0, result.confidence());
            assertEquals(List.of("ExactAcceptRule"), result.decisionPath());
        }

        @Test
        @DisplayName("A typo above the exact threshold with a clear lead is accepted by the exact rule")
        void testTypoAboveExactThreshold() {
            MappingResult result = loadedEngine().mapRecord(record("src-6", "Acme Corporaton"));

            assertEquals(ACME, result.assignedId());
            assertEquals(0.9875, result.confidence(), 1e-9);
            assertEquals(List.of("ExactAcceptRule"), result.decisionPath());
        }

        @Test
        @DisplayName("Should report near-equal candidates as ambiguous")
        void testAmbiguous() {
            MappingResult result = loadedEngine().mapRecord(record("src-7", "Stark Industries"));

            assertEquals(MappingStatus.AMBIGUOUS, result.status());
            assertNull(result.assignedId());
            assertEquals(List.of(STARK_INDUSTRIAL, STARK_INDUSTRY), result.alternativeIds());
            assertEquals(0.95, result.confidence(), 1e-9);
            assertEquals(List.of("ExactAcceptRule", "AmbiguityRule"), result.decisionPath());
        }

        @Test
        @DisplayName("A score exactly at the fuzzy threshold is accepted, one ulp below is not")
        void testThresholdBoundary() {
            MappingEngine atThreshold = fixedScoreEngine(0.80);
            MappingEngine belowThreshold = fixedScoreEngine(Math.nextDown(0.80));

            MappingResult accepted = atThreshold.mapRecord(record("src-8", "Acme Corp"));
            MappingResult rejected = belowThreshold.mapRecord(record("src-8", "Acme Corp"));

            assertEquals(MappingStatus.MATCHED, accepted.status());
            assertEquals(0.80, accepted.confidence());
            assertEquals(MappingStatus.UNMATCHED, rejected.status());
        }

        private MappingEngine fixedScoreEngine(double score) {
            SimilarityAlgorithm fixed = mock(SimilarityAlgorithm.class);
            when(fixed.compute(anyString(), anyString())).thenReturn(score);
            when(fixed.getName()).thenReturn("fixed");
            MappingEngine engine = track(MappingEngine.builder().similarity(fixed).build());
            engine.reload(List.of(company(ACME, "Acme Corporation")));
            return engine;
        }

        @Test
        @DisplayName("Should load the glossary from JSON")
        void testJsonGlossary() throws Exception {
            Path file = Path.of(MappingEngineTest.class.getResource("/glossary/rdg-sample.json").toURI());
            MappingEngine engine = track(MappingEngine.builder()
                    .glossarySource(new JsonGlossarySource(file))
                    .build());

            assertEquals(6, engine.reload().size());
            assertEquals(INITECH, engine.mapRecord(record("src-9", "Initek")).assignedId());
        }
    }

    @Nested
    @DisplayName("Batches")
    class Batches {

        @Test
        @DisplayName("Should return results in input order with a summary")
        void testBatchOrder() {
            MappingEngine engine = loadedEngine(MappingOptions.builder().concurrencyLimit(4).build());
            List<SourceRecord> records = List.of(
                    record("r1", "ACME Corp."),
                    record("r2", "Zzyzx Holdings"),
                    record("r3", "Globex Corp"),
                    record("r4", "Stark Industries"),
                    record("r5", "Initek"),
                    record("r6", "Globex"));

            BatchResult batch = engine.mapBatch(records);

            assertEquals(List.of("r1", "r2", "r3", "r4", "r5", "r6"),
                    batch.results().stream().map(MappingResult::sourceId).toList());
            assertEquals(6, batch.summary().total());
            assertEquals(4, batch.summary().count(MappingStatus.MATCHED));
            assertEquals(1, batch.summary().count(MappingStatus.AMBIGUOUS));
            assertEquals(1, batch.summary().count(MappingStatus.UNMATCHED));
            assertTrue(batch.stored());
            assertFalse(batch.cancelled());
            assertEquals(1, batch.generationId());
        }

        @Test
        @DisplayName("Should map the same batch identically every time")
        void testDeterministic() {
            List<SourceRecord> records = List.of(
                    record("r1", "ACME Corp."), record("r2", "Stark Industries"), record("r3", "Initek"));

            List<MappingResult> first = loadedEngine().mapBatch(records).results();
            List<MappingResult> second = loadedEngine().mapBatch(records).results();

            assertEquals(first, second);
        }

        @Test
        @DisplayName("Invalid records should not fail the batch")
        void testInvalidInput() {
            MappingEngine engine = loadedEngine();
            SourceRecord invalid = SourceRecord.of("bad", Map.of("country", "US"));

            BatchResult batch = engine.mapBatch(List.of(record("good", "Globex"), invalid));

            assertEquals(MappingStatus.MATCHED, batch.get(0).status());
            assertEquals(MappingStatus.UNMATCHED, batch.get(1).status());
            assertEquals(MappingResult.REASON_INVALID_INPUT, batch.get(1).reason());
            assertTrue(batch.get(1).decisionPath().isEmpty());
        }

        @Test
        @DisplayName("An unexpected failure should only affect its record")
        void testInternalError() {
            MappingRule failing = mock(MappingRule.class);
            when(failing.name()).thenReturn("FailingRule");
            when(failing.evaluate(any())).thenThrow(new IllegalStateException("rule bug"));
            MappingEngine engine = track(MappingEngine.builder().rules(List.of(failing)).build());
            engine.reload(sampleGlossary());

            MappingResult result = engine.mapRecord(record("src-1", "ACME Corp."));

            assertEquals(MappingStatus.UNMATCHED, result.status());
            assertEquals(MappingResult.REASON_INTERNAL_ERROR, result.reason());
        }

        @Test
        void testNullRecord() {
            MappingEngine engine = loadedEngine();
            List<SourceRecord> records = new ArrayList<>();
            records.add(null);

            assertThrows(IllegalArgumentException.class, () -> engine.mapBatch(records));
        }

        @Test
        @DisplayName("Should fail fast before any glossary is loaded")
        void testNoGlossary() {
            MappingEngine engine = track(MappingEngine.builder().build());

            assertThrows(IllegalStateException.class, () -> engine.mapRecord(record("src-1", "Globex")));
            assertThrows(IllegalStateException.class, engine::reload);
        }
    }

    @Nested
    @DisplayName("Idempotence")
    class Idempotence {

        @Test
        @DisplayName("A repeated record should be decided once")
        void testRepeatedRecord() {
            RecordNormalizer normalizer = DefaultNormalizationRules.createDefaultNormalizer(NormalizerConfig.defaults());
            Matcher matcher = spy(new Matcher(normalizer, new JaroWinklerSimilarity(), MappingOptions.defaults()));
            MappingEngine engine = track(MappingEngine.builder().normalizer(normalizer).matcher(matcher).build());
            engine.reload(sampleGlossary());

            MappingResult first = engine.mapRecord(record("src-1", "ACME Corp."));
            MappingResult second = engine.mapRecord(record("src-1", "acme  corp"));

            assertEquals(first, second);
            verify(matcher, times(1)).match(any(), any());
        }

        @Test
        @DisplayName("Identical records in one concurrent batch should be decided once")
        void testConcurrentDuplicates() {
            RecordNormalizer normalizer = DefaultNormalizationRules.createDefaultNormalizer(NormalizerConfig.defaults());
            Matcher matcher = spy(new Matcher(normalizer, new JaroWinklerSimilarity(), MappingOptions.defaults()));
            MappingEngine engine = track(MappingEngine.builder()
                    .options(MappingOptions.builder().concurrencyLimit(8).build())
                    .normalizer(normalizer)
                    .matcher(matcher)
                    .build());
            engine.reload(sampleGlossary());
            List<SourceRecord> records = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                records.add(record("src-1", "ACME Corp."));
            }

            BatchResult batch = engine.mapBatch(records);

            assertEquals(1, batch.results().stream().distinct().count());
            verify(matcher, times(1)).match(any(), any());
        }

        @Test
        @DisplayName("A reload should start a new idempotency scope")
        void testNewGeneration() {
            MappingEngine engine = loadedEngine();
            MappingResult before = engine.mapRecord(record("src-1", "ACME Corp."));

            engine.reload(sampleGlossary());
            MappingResult after = engine.mapRecord(record("src-1", "ACME Corp."));

            assertEquals(1, before.generationId());
            assertEquals(2, after.generationId());
            assertEquals(before.assignedId(), after.assignedId());
        }
    }

    @Nested
    @DisplayName("Reload")
    class Reload {

        @Test
        @DisplayName("A batch should keep its generation when a reload lands mid-batch")
        void testReloadIsolation() {
            AtomicBoolean reloaded = new AtomicBoolean();
            List<MappingEngine> holder = new ArrayList<>();
            MappingEngine engine = track(MappingEngine.builder()
                    .options(MappingOptions.builder().concurrencyLimit(1).build())
                    .listener(event -> {
                        if (reloaded.compareAndSet(false, true)) {
                            holder.get(0).reload(List.of(company("RDG-100", "Globex Renamed")));
                        }
                    })
                    .build());
            holder.add(engine);
            engine.reload(sampleGlossary());

            BatchResult batch = engine.mapBatch(List.of(
                    record("r1", "ACME Corp."), record("r2", "Globex"), record("r3", "Initech")));

            assertTrue(reloaded.get());
            assertEquals(1, batch.generationId());
            assertEquals(List.of(ACME, GLOBEX, INITECH),
                    batch.results().stream().map(MappingResult::assignedId).toList());
            assertTrue(batch.results().stream().allMatch(r -> r.generationId() == 1));
            assertEquals(2, engine.getRegistry().current().getGenerationId());
            assertEquals("RDG-100", engine.mapRecord(record("r4", "Globex Renamed")).assignedId());
        }

        @Test
        @DisplayName("A failed reload should leave the active glossary serving")
        void testFailedReload() {
            MappingEngine engine = loadedEngine();

            assertThrows(RuntimeException.class, () -> engine.reload(List.of()));

            assertEquals(ACME, engine.mapRecord(record("src-1", "ACME Corp.")).assignedId());
            assertTrue(engine.getRegistry().getLastReloadFailure().isPresent());
        }
    }

    @Nested
    @DisplayName("Result sink")
    class Sink {

        @Test
        @DisplayName("Should emit each batch once, in order")
        void testEmit() {
            InMemoryResultSink sink = new InMemoryResultSink();
            MappingEngine engine = track(MappingEngine.builder().resultSink(sink).build());
            engine.reload(sampleGlossary());

            BatchResult batch = engine.mapBatch(List.of(record("r1", "Globex"), record("r2", "Initech")));

            assertEquals(1, sink.getBatchCount());
            assertEquals(batch.results(), sink.getResults());
        }

        @Test
        @DisplayName("A sink slower than the timeout should turn the batch unmatched")
        void testSinkTimeout() throws InterruptedException {
            CountDownLatch interrupted = new CountDownLatch(1);
            List<MappingResult> stored = new CopyOnWriteArrayList<>();
            ResultSink slow = results -> {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                    return false;
                }
                stored.addAll(results);
                return true;
            };
            MappingEngine engine = track(MappingEngine.builder()
                    .options(MappingOptions.builder().sinkTimeout(Duration.ofMillis(100)).build())
                    .resultSink(slow)
                    .build());
            engine.reload(sampleGlossary());

            BatchResult batch = engine.mapBatch(List.of(record("r1", "Globex"), record("r2", "ACME Corp.")));

            assertFalse(batch.stored());
            for (MappingResult result : batch.results()) {
                assertEquals(MappingStatus.UNMATCHED, result.status());
                assertEquals(MappingResult.REASON_SINK_TIMEOUT, result.reason());
                assertNull(result.assignedId());
            }
            assertEquals(FUZZY_PATH, batch.get(1).decisionPath());
            assertTrue(interrupted.await(1, TimeUnit.SECONDS), "sink should be interrupted on timeout");
            assertTrue(stored.isEmpty());
        }

        @Test
        @DisplayName("A sink refusing or failing should be reported, not thrown")
        void testSinkFailure() {
            ResultSink refusing = mock(ResultSink.class);
            when(refusing.store(any())).thenReturn(false);
            ResultSink failing = mock(ResultSink.class);
            when(failing.store(any())).thenThrow(new IllegalStateException("disk full"));

            for (ResultSink sink : List.of(refusing, failing)) {
                MappingEngine engine = track(MappingEngine.builder().resultSink(sink).build());
                engine.reload(sampleGlossary());

                BatchResult batch = engine.mapBatch(List.of(record("r1", "Globex")));

                assertFalse(batch.stored());
                assertEquals(MappingStatus.MATCHED, batch.get(0).status());
            }
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("A batch cancelled up front should map nothing")
        void testCancelledBeforeStart() {
            MappingEngine engine = loadedEngine();
            CancellationToken token = CancellationToken.create();
            token.cancel();

            BatchResult batch = engine.mapBatch(List.of(record("r1", "Globex"), record("r2", "Initech")), token);

            assertTrue(batch.cancelled());
            assertTrue(batch.results().stream().allMatch(r -> MappingResult.REASON_CANCELLED.equals(r.reason())));
            assertEquals(2, batch.summary().count(MappingStatus.UNMATCHED));
        }

        @Test
        @DisplayName("Records in flight should complete and the rest be reported cancelled")
        void testCancelledMidBatch() {
            CancellationToken token = CancellationToken.create();
            MappingEngine engine = track(MappingEngine.builder()
                    .options(MappingOptions.builder().concurrencyLimit(1).build())
                    .listener(event -> token.cancel())
                    .build());
            engine.reload(sampleGlossary());

            BatchResult batch = engine.mapBatch(List.of(
                    record("r1", "Globex"), record("r2", "Initech"), record("r3", "ACME Corp.")), token);

            assertTrue(batch.cancelled());
            assertEquals(GLOBEX, batch.get(0).assignedId());
            assertEquals(MappingResult.REASON_CANCELLED, batch.get(1).reason());
            assertEquals(MappingResult.REASON_CANCELLED, batch.get(2).reason());
            assertEquals(3, batch.size());
        }
    }

    @Nested
    @DisplayName("Observability")
    class Observability {

        @Test
        @DisplayName("Should publish one event per record")
        void testEvents() {
            List<MappingEvent> events = new CopyOnWriteArrayList<>();
            MappingEngine engine = track(MappingEngine.builder()
                    .withoutDefaultListener()
                    .listener(events::add)
                    .build());
            engine.reload(sampleGlossary());

            engine.mapBatch(List.of(record("r1", "Globex"), record("r2", "Zzyzx Holdings")));

            assertEquals(2, events.size());
            assertTrue(events.stream().anyMatch(e -> e.sourceId().equals("r2") && e.status() == MappingStatus.UNMATCHED));
        }

        @Test
        @DisplayName("A failing listener should not affect the result")
        void testFailingListener() {
            MappingEngine engine = track(MappingEngine.builder()
                    .listener(event -> {
                        throw new IllegalStateException("listener bug");
                    })
                    .build());
            engine.reload(sampleGlossary());

            assertEquals(GLOBEX, engine.mapRecord(record("r1", "Globex")).assignedId());
        }

        @Test
        @DisplayName("Should record timings and reloads")
        void testMetrics() {
            SimpleMeterRegistry meters = new SimpleMeterRegistry();
            MappingEngine engine = track(MappingEngine.builder()
                    .metricsService(new MicrometerMetricsService(meters))
                    .build());
            engine.reload(sampleGlossary());

            engine.mapBatch(List.of(record("r1", "Globex"), record("r2", "Zzyzx Holdings")));

            assertEquals(1, meters.find("glossary.mapping.duration").tag("status", "MATCHED").timer().count());
            assertEquals(1, meters.find("glossary.mapping.duration").tag("status", "UNMATCHED").timer().count());
            assertEquals(1.0, meters.find("glossary.reload").tag("outcome", "success").counter().count());
            assertEquals(6.0, meters.find("glossary.size").gauge().value());
        }
    }
}
