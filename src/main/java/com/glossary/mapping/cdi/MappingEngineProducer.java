package com.glossary.mapping.cdi;

import com.glossary.mapping.api.MappingEngine;
import com.glossary.mapping.api.MappingOptions;
import com.glossary.mapping.health.DedupStoreHealthCheck;
import com.glossary.mapping.health.GlossaryHealthCheck;
import com.glossary.mapping.health.HealthCheckRegistry;
import com.glossary.mapping.normalize.DefaultNormalizationRules;
import com.glossary.mapping.normalize.NormalizerConfig;
import com.glossary.mapping.normalize.RecordNormalizer;
import com.glossary.mapping.similarity.SimilarityAlgorithms;
import com.glossary.mapping.sink.NoOpResultSink;
import com.glossary.mapping.sink.ResultSink;
import com.glossary.mapping.source.JsonGlossarySource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CDI producer that wires the mapping engine from MicroProfile Config properties.
 *
 * <h2>Configuration</h2>
 * <pre>
 * glossary-mapping:
 *   glossary:
 *     file: /data/rdg/glossary.json
 *     reload-interval-seconds: 900
 *   matching:
 *     exact-threshold: 0.98
 *     fuzzy-threshold: 0.80
 *     min-gap: 0.05
 *     similarity: jaro-winkler
 *   fallback:
 *     ids: company=RDG-UNKNOWN-CO,person=RDG-UNKNOWN-PER
 *     default-id: RDG-UNKNOWN
 * </pre>
 *
 * <p>A {@link ResultSink} bean, when one exists, receives every batch; otherwise results
 * are only returned to the caller. When a glossary file is configured it is loaded while
 * producing the engine, so a missing or broken file fails startup.</p>
 */
@ApplicationScoped
public class MappingEngineProducer {

    private static final Logger log = LoggerFactory.getLogger(MappingEngineProducer.class);

    // ── Glossary ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "glossary-mapping.glossary.file")
    Optional<String> glossaryFile;

    @Inject
    @ConfigProperty(name = "glossary-mapping.glossary.reload-interval-seconds", defaultValue = "0")
    long reloadIntervalSeconds;

    @Inject
    @ConfigProperty(name = "glossary-mapping.normalizer.key-attributes", defaultValue = "name")
    List<String> keyAttributes;

    @Inject
    @ConfigProperty(name = "glossary-mapping.normalizer.company-suffixes", defaultValue = "false")
    boolean companySuffixes;

    // ── Matching ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "glossary-mapping.matching.exact-threshold", defaultValue = "0.98")
    double exactThreshold;

    @Inject
    @ConfigProperty(name = "glossary-mapping.matching.fuzzy-threshold", defaultValue = "0.80")
    double fuzzyThreshold;

    @Inject
    @ConfigProperty(name = "glossary-mapping.matching.min-gap", defaultValue = "0.05")
    double minGap;

    @Inject
    @ConfigProperty(name = "glossary-mapping.matching.min-score", defaultValue = "0.50")
    double minScore;

    @Inject
    @ConfigProperty(name = "glossary-mapping.matching.candidate-limit", defaultValue = "20")
    int candidateLimit;

    @Inject
    @ConfigProperty(name = "glossary-mapping.matching.similarity", defaultValue = "jaro-winkler")
    String similarity;

    // ── Fallback ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "glossary-mapping.fallback.ids")
    Optional<List<String>> fallbackIds;

    @Inject
    @ConfigProperty(name = "glossary-mapping.fallback.default-id")
    Optional<String> defaultFallbackId;

    // ── Dedup & Concurrency ───────────────────────────────────

    @Inject
    @ConfigProperty(name = "glossary-mapping.dedup.retention-hours", defaultValue = "24")
    long dedupRetentionHours;

    @Inject
    @ConfigProperty(name = "glossary-mapping.dedup.max-size", defaultValue = "100000")
    long dedupMaxSize;

    @Inject
    @ConfigProperty(name = "glossary-mapping.concurrency.limit", defaultValue = "0")
    int concurrencyLimit;

    @Inject
    @ConfigProperty(name = "glossary-mapping.timeout.coordinator-millis", defaultValue = "5000")
    long coordinatorTimeoutMillis;

    @Inject
    @ConfigProperty(name = "glossary-mapping.timeout.sink-millis", defaultValue = "30000")
    long sinkTimeoutMillis;

    @Inject
    Instance<ResultSink> resultSinks;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public MappingEngine mappingEngine() {
        MappingOptions options = buildOptions();
        NormalizerConfig normalizerConfig = NormalizerConfig.forKeyAttributes(keyAttributes.toArray(new String[0]));
        RecordNormalizer normalizer = companySuffixes
                ? DefaultNormalizationRules.createCompanyNormalizer(normalizerConfig)
                : DefaultNormalizationRules.createDefaultNormalizer(normalizerConfig);
        ResultSink sink = resultSinks.isResolvable() ? resultSinks.get() : new NoOpResultSink();

        MappingEngine.Builder builder = MappingEngine.builder()
                .options(options)
                .normalizer(normalizer)
                .similarity(SimilarityAlgorithms.byName(similarity))
                .resultSink(sink);
        glossaryFile.ifPresent(file -> builder.glossarySource(new JsonGlossarySource(Path.of(file))));

        MappingEngine engine = builder.build();
        log.info("Producing MappingEngine: glossary={} keyAttributes={} sink={}",
                glossaryFile.orElse("<none>"), keyAttributes, sink.getClass().getSimpleName());
        if (glossaryFile.isPresent()) {
            engine.reload();
        }
        return engine;
    }

    public void closeEngine(@Disposes MappingEngine engine) {
        log.info("Closing MappingEngine");
        engine.close();
    }

    @Produces
    @ApplicationScoped
    public HealthCheckRegistry healthCheckRegistry(MappingEngine engine) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(new GlossaryHealthCheck(engine.getRegistry()));
        registry.register(new DedupStoreHealthCheck(engine.getDedupStore()));
        return registry;
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    MappingOptions buildOptions() {
        MappingOptions.Builder builder = MappingOptions.builder()
                .exactThreshold(exactThreshold)
                .fuzzyThreshold(fuzzyThreshold)
                .minGap(minGap)
                .minScore(minScore)
                .candidateLimit(candidateLimit)
                .dedupRetention(Duration.ofHours(dedupRetentionHours))
                .dedupMaxSize(dedupMaxSize)
                .coordinatorTimeout(Duration.ofMillis(coordinatorTimeoutMillis))
                .sinkTimeout(Duration.ofMillis(sinkTimeoutMillis))
                .fallbackIdsByCategory(parseFallbackIds(fallbackIds.orElse(List.of())));
        defaultFallbackId.ifPresent(builder::defaultFallbackId);
        if (concurrencyLimit > 0) {
            builder.concurrencyLimit(concurrencyLimit);
        }
        if (reloadIntervalSeconds > 0) {
            builder.reloadInterval(Duration.ofSeconds(reloadIntervalSeconds));
        }
        return builder.build();
    }

    /**
     * Parses {@code category=id} entries.
     */
    static Map<String, String> parseFallbackIds(List<String> entries) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String entry : entries) {
            int eq = entry.indexOf('=');
            if (eq <= 0 || eq == entry.length() - 1) {
                throw new IllegalArgumentException("Fallback id entry must be category=id, got: " + entry);
            }
            result.put(entry.substring(0, eq).trim(), entry.substring(eq + 1).trim());
        }
        return result;
    }
}
