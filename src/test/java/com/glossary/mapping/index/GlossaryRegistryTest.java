package com.glossary.mapping.index;

import com.glossary.mapping.core.model.ReferenceEntity;
import com.glossary.mapping.metrics.MetricsService;
import com.glossary.mapping.normalize.DefaultNormalizationRules;
import com.glossary.mapping.normalize.NormalizerConfig;
import com.glossary.mapping.source.GlossaryLoadException;
import com.glossary.mapping.source.GlossarySource;
import com.glossary.mapping.source.InMemoryGlossarySource;
import com.glossary.mapping.tracing.NoOpTracingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.glossary.mapping.GlossaryFixtures.company;
import static com.glossary.mapping.GlossaryFixtures.sampleGlossary;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class GlossaryRegistryTest {

    private MetricsService metrics;
    private GlossaryRegistry registry;

    @BeforeEach
    void setUp() {
        metrics = mock(MetricsService.class);
        ReferenceIndex index = new ReferenceIndex(
                DefaultNormalizationRules.createDefaultNormalizer(NormalizerConfig.defaults()));
        registry = new GlossaryRegistry(index, metrics, new NoOpTracingService());
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    @DisplayName("Should fail fast before the first load")
    void testNoGlossary() {
        IllegalStateException e = assertThrows(IllegalStateException.class, registry::current);
        assertEquals("No glossary loaded", e.getMessage());
        assertTrue(registry.currentIfLoaded().isEmpty());
    }

    @Test
    @DisplayName("Should publish the loaded snapshot")
    void testReload() {
        IndexSnapshot snapshot = registry.reload(new InMemoryGlossarySource(sampleGlossary()));

        assertSame(snapshot, registry.current());
        assertEquals(6, snapshot.size());
        verify(metrics).incrementReload(true);
        verify(metrics).recordGlossarySize(6);
    }

    @Test
    @DisplayName("Snapshots already handed out should not change after a reload")
    void testSnapshotIsolation() {
        InMemoryGlossarySource source = new InMemoryGlossarySource(sampleGlossary());
        IndexSnapshot first = registry.reload(source);

        source.replace(List.of(company("RDG-100", "Wayne Enterprises")));
        IndexSnapshot second = registry.reload(source);

        assertEquals(2, second.getGenerationId());
        assertTrue(first.containsId("RDG-001"));
        assertFalse(first.containsId("RDG-100"));
        assertFalse(second.containsId("RDG-001"));
        assertSame(second, registry.current());
    }

    @Nested
    @DisplayName("Failed reloads")
    class FailedReloads {

        @Test
        @DisplayName("Should keep the previous snapshot and record the failure")
        void testFailureKeepsPrevious() {
            IndexSnapshot first = registry.reload(new InMemoryGlossarySource(sampleGlossary()));
            GlossarySource broken = () -> {
                throw new GlossaryLoadException("file vanished");
            };

            assertThrows(GlossaryLoadException.class, () -> registry.reload(broken));

            assertSame(first, registry.current());
            assertEquals("file vanished", registry.getLastReloadFailure().orElseThrow().getMessage());
            verify(metrics).incrementReload(false);
        }

        @Test
        @DisplayName("Should reject duplicate ids without publishing")
        void testDuplicateIds() {
            List<ReferenceEntity> duplicated = new ArrayList<>(sampleGlossary());
            duplicated.add(company("RDG-002", "Globex Again"));

            assertThrows(DuplicateIdException.class, () -> registry.reload(duplicated));
            assertTrue(registry.currentIfLoaded().isEmpty());
        }

        @Test
        @DisplayName("A successful reload should clear the recorded failure")
        void testFailureCleared() {
            assertThrows(EmptyGlossaryException.class, () -> registry.reload(List.of()));
            assertTrue(registry.getLastReloadFailure().isPresent());

            registry.reload(sampleGlossary());

            assertTrue(registry.getLastReloadFailure().isEmpty());
        }
    }

    @Test
    @DisplayName("Should notify listeners after each swap")
    void testReloadListener() {
        List<Long> generations = new CopyOnWriteArrayList<>();
        registry.addReloadListener(snapshot -> generations.add(snapshot.getGenerationId()));

        registry.reload(sampleGlossary());
        registry.reload(sampleGlossary());

        assertEquals(List.of(1L, 2L), generations);
    }

    @Test
    @DisplayName("A failing listener should not fail a reload that already swapped")
    void testFailingListener() {
        List<Long> generations = new CopyOnWriteArrayList<>();
        registry.addReloadListener(snapshot -> {
            throw new IllegalStateException("listener broke");
        });
        registry.addReloadListener(snapshot -> generations.add(snapshot.getGenerationId()));

        IndexSnapshot snapshot = registry.reload(sampleGlossary());

        assertEquals(1, snapshot.getGenerationId());
        assertSame(snapshot, registry.current());
        assertTrue(registry.getLastReloadFailure().isEmpty());
        assertEquals(List.of(1L), generations);
        verify(metrics).incrementReload(true);
        verify(metrics, never()).incrementReload(false);
    }

    @Test
    @DisplayName("Should reload on a schedule")
    void testScheduledReload() throws InterruptedException {
        InMemoryGlossarySource source = new InMemoryGlossarySource(sampleGlossary());
        registry.reload(source);
        source.replace(List.of(company("RDG-100", "Wayne Enterprises")));

        CountDownLatch reloaded = new CountDownLatch(1);
        registry.addReloadListener(snapshot -> reloaded.countDown());
        registry.scheduleReloads(source, Duration.ofMillis(50));

        assertTrue(reloaded.await(5, TimeUnit.SECONDS));
        assertTrue(registry.current().containsId("RDG-100"));
    }

    @Test
    void testScheduleRejectsBadInterval() {
        InMemoryGlossarySource source = new InMemoryGlossarySource(sampleGlossary());
        assertThrows(IllegalArgumentException.class, () -> registry.scheduleReloads(source, Duration.ZERO));
    }
}
