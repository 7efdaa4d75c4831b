package com.glossary.mapping.api;

import com.glossary.mapping.rules.DefaultMappingRules;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Options for the mapping engine: decision thresholds, candidate limits, duplicate
 * suppression, concurrency, timeouts and fallback identifiers.
 */
public class MappingOptions {

    private static final double DEFAULT_EXACT_THRESHOLD = 0.98;
    private static final double DEFAULT_FUZZY_THRESHOLD = 0.80;
    private static final double DEFAULT_MIN_GAP = 0.05;
    private static final double DEFAULT_MIN_SCORE = 0.50;
    private static final int DEFAULT_CANDIDATE_LIMIT = 20;
    private static final Duration DEFAULT_DEDUP_RETENTION = Duration.ofHours(24);
    private static final long DEFAULT_DEDUP_MAX_SIZE = 100_000;
    private static final Duration DEFAULT_COORDINATOR_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_SINK_TIMEOUT = Duration.ofSeconds(30);

    private final double exactThreshold;
    private final double fuzzyThreshold;
    private final double minGap;
    private final double minScore;
    private final int candidateLimit;
    private final Duration dedupRetention;
    private final long dedupMaxSize;
    private final int concurrencyLimit;
    private final Map<String, String> fallbackIdsByCategory;
    private final String defaultFallbackId;
    private final Duration coordinatorTimeout;
    private final Duration sinkTimeout;
    private final List<String> ruleOrder;
    private final Duration reloadInterval;
    private final Map<String, Double> attributeWeights;

    private MappingOptions(Builder builder) {
        this.exactThreshold = builder.exactThreshold;
        this.fuzzyThreshold = builder.fuzzyThreshold;
        this.minGap = builder.minGap;
        this.minScore = builder.minScore;
        this.candidateLimit = builder.candidateLimit;
        this.dedupRetention = builder.dedupRetention;
        this.dedupMaxSize = builder.dedupMaxSize;
        this.concurrencyLimit = builder.concurrencyLimit;
        this.fallbackIdsByCategory = Map.copyOf(builder.fallbackIdsByCategory);
        this.defaultFallbackId = builder.defaultFallbackId;
        this.coordinatorTimeout = builder.coordinatorTimeout;
        this.sinkTimeout = builder.sinkTimeout;
        this.ruleOrder = List.copyOf(builder.ruleOrder);
        this.reloadInterval = builder.reloadInterval;
        this.attributeWeights = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributeWeights));
    }

    public double getExactThreshold() {
        return exactThreshold;
    }

    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    public double getMinGap() {
        return minGap;
    }

    public double getMinScore() {
        return minScore;
    }

    public int getCandidateLimit() {
        return candidateLimit;
    }

    public Duration getDedupRetention() {
        return dedupRetention;
    }

    public long getDedupMaxSize() {
        return dedupMaxSize;
    }

    public int getConcurrencyLimit() {
        return concurrencyLimit;
    }

    public Map<String, String> getFallbackIdsByCategory() {
        return fallbackIdsByCategory;
    }

    public Optional<String> getDefaultFallbackId() {
        return Optional.ofNullable(defaultFallbackId);
    }

    /**
     * The fallback id for {@code category}, else the default fallback id.
     */
    public Optional<String> fallbackIdFor(String category) {
        if (category != null) {
            String byCategory = fallbackIdsByCategory.get(category);
            if (byCategory != null) {
                return Optional.of(byCategory);
            }
        }
        return getDefaultFallbackId();
    }

    public Duration getCoordinatorTimeout() {
        return coordinatorTimeout;
    }

    public Duration getSinkTimeout() {
        return sinkTimeout;
    }

    /**
     * Rule names in evaluation order. The terminal reject rule is implied.
     */
    public List<String> getRuleOrder() {
        return ruleOrder;
    }

    public Optional<Duration> getReloadInterval() {
        return Optional.ofNullable(reloadInterval);
    }

    /**
     * Per-attribute weights for fuzzy scoring, in insertion order; empty means whole-key scoring.
     */
    public Map<String, Double> getAttributeWeights() {
        return attributeWeights;
    }

    public static MappingOptions defaults() {
        return builder().build();
    }

    /**
     * Higher thresholds and a wider gap; more records end up unmatched or ambiguous.
     */
    public static MappingOptions strict() {
        return builder()
                .exactThreshold(0.99)
                .fuzzyThreshold(0.90)
                .minGap(0.10)
                .minScore(0.70)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.exactThreshold = exactThreshold;
        b.fuzzyThreshold = fuzzyThreshold;
        b.minGap = minGap;
        b.minScore = minScore;
        b.candidateLimit = candidateLimit;
        b.dedupRetention = dedupRetention;
        b.dedupMaxSize = dedupMaxSize;
        b.concurrencyLimit = concurrencyLimit;
        b.fallbackIdsByCategory.putAll(fallbackIdsByCategory);
        b.defaultFallbackId = defaultFallbackId;
        b.coordinatorTimeout = coordinatorTimeout;
        b.sinkTimeout = sinkTimeout;
        b.ruleOrder = ruleOrder;
        b.reloadInterval = reloadInterval;
        b.attributeWeights.putAll(attributeWeights);
        return b;
    }

    public static class Builder {
        private double exactThreshold = DEFAULT_EXACT_THRESHOLD;
        private double fuzzyThreshold = DEFAULT_FUZZY_THRESHOLD;
        private double minGap = DEFAULT_MIN_GAP;
        private double minScore = DEFAULT_MIN_SCORE;
        private int candidateLimit = DEFAULT_CANDIDATE_LIMIT;
        private Duration dedupRetention = DEFAULT_DEDUP_RETENTION;
        private long dedupMaxSize = DEFAULT_DEDUP_MAX_SIZE;
        private int concurrencyLimit = Runtime.getRuntime().availableProcessors();
        private final Map<String, String> fallbackIdsByCategory = new LinkedHashMap<>();
        private String defaultFallbackId;
        private Duration coordinatorTimeout = DEFAULT_COORDINATOR_TIMEOUT;
        private Duration sinkTimeout = DEFAULT_SINK_TIMEOUT;
        private List<String> ruleOrder = DefaultMappingRules.DEFAULT_ORDER;
        private Duration reloadInterval;
        private final Map<String, Double> attributeWeights = new LinkedHashMap<>();

        public Builder exactThreshold(double exactThreshold) {
            validateUnit(exactThreshold, "exactThreshold");
            this.exactThreshold = exactThreshold;
            return this;
        }

        public Builder fuzzyThreshold(double fuzzyThreshold) {
            validateUnit(fuzzyThreshold, "fuzzyThreshold");
            this.fuzzyThreshold = fuzzyThreshold;
            return this;
        }

        public Builder minGap(double minGap) {
            validateUnit(minGap, "minGap");
            this.minGap = minGap;
            return this;
        }

        public Builder minScore(double minScore) {
            validateUnit(minScore, "minScore");
            this.minScore = minScore;
            return this;
        }

        public Builder candidateLimit(int candidateLimit) {
            if (candidateLimit <= 0) {
                throw new IllegalArgumentException("candidateLimit must be positive");
            }
            this.candidateLimit = candidateLimit;
            return this;
        }

        public Builder dedupRetention(Duration dedupRetention) {
            this.dedupRetention = requirePositive(dedupRetention, "dedupRetention");
            return this;
        }

        public Builder dedupMaxSize(long dedupMaxSize) {
            if (dedupMaxSize <= 0) {
                throw new IllegalArgumentException("dedupMaxSize must be positive");
            }
            this.dedupMaxSize = dedupMaxSize;
            return this;
        }

        public Builder concurrencyLimit(int concurrencyLimit) {
            if (concurrencyLimit <= 0) {
                throw new IllegalArgumentException("concurrencyLimit must be positive");
            }
            this.concurrencyLimit = concurrencyLimit;
            return this;
        }

        public Builder fallbackId(String category, String fallbackId) {
            if (category == null || category.isBlank() || fallbackId == null || fallbackId.isBlank()) {
                throw new IllegalArgumentException("category and fallbackId must be non-blank");
            }
            this.fallbackIdsByCategory.put(category, fallbackId);
            return this;
        }

        public Builder fallbackIdsByCategory(Map<String, String> fallbackIds) {
            this.fallbackIdsByCategory.clear();
            if (fallbackIds != null) {
                fallbackIds.forEach(this::fallbackId);
            }
            return this;
        }

        public Builder defaultFallbackId(String defaultFallbackId) {
            this.defaultFallbackId = defaultFallbackId == null || defaultFallbackId.isBlank() ? null : defaultFallbackId;
            return this;
        }

        public Builder coordinatorTimeout(Duration coordinatorTimeout) {
            this.coordinatorTimeout = requirePositive(coordinatorTimeout, "coordinatorTimeout");
            return this;
        }

        public Builder sinkTimeout(Duration sinkTimeout) {
            this.sinkTimeout = requirePositive(sinkTimeout, "sinkTimeout");
            return this;
        }

        public Builder ruleOrder(List<String> ruleOrder) {
            if (ruleOrder == null || ruleOrder.isEmpty()) {
                throw new IllegalArgumentException("ruleOrder must not be empty");
            }
            this.ruleOrder = List.copyOf(ruleOrder);
            return this;
        }

        /**
         * Reload cadence; null disables scheduled reloads.
         */
        public Builder reloadInterval(Duration reloadInterval) {
            this.reloadInterval = reloadInterval == null ? null : requirePositive(reloadInterval, "reloadInterval");
            return this;
        }

        public Builder attributeWeight(String attribute, double weight) {
            if (attribute == null || attribute.isBlank()) {
                throw new IllegalArgumentException("attribute must be non-blank");
            }
            if (weight <= 0.0 || Double.isNaN(weight) || Double.isInfinite(weight)) {
                throw new IllegalArgumentException("weight for '" + attribute + "' must be positive");
            }
            this.attributeWeights.put(attribute, weight);
            return this;
        }

        public MappingOptions build() {
            if (exactThreshold < fuzzyThreshold) {
                throw new IllegalArgumentException("exactThreshold must be >= fuzzyThreshold");
            }
            if (fuzzyThreshold < minScore) {
                throw new IllegalArgumentException("fuzzyThreshold must be >= minScore");
            }
            return new MappingOptions(this);
        }

        private static void validateUnit(double value, String name) {
            if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }

        private static Duration requirePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be a positive duration");
            }
            return value;
        }
    }

    @Override
    public String toString() {
        return "MappingOptions{" +
                "exactThreshold=" + exactThreshold +
                ", fuzzyThreshold=" + fuzzyThreshold +
                ", minGap=" + minGap +
                ", minScore=" + minScore +
                ", candidateLimit=" + candidateLimit +
                ", dedupRetention=" + dedupRetention +
                ", dedupMaxSize=" + dedupMaxSize +
                ", concurrencyLimit=" + concurrencyLimit +
                ", fallbackIdsByCategory=" + fallbackIdsByCategory +
                ", defaultFallbackId='" + defaultFallbackId + '\'' +
                ", coordinatorTimeout=" + coordinatorTimeout +
                ", sinkTimeout=" + sinkTimeout +
                ", ruleOrder=" + ruleOrder +
                ", reloadInterval=" + reloadInterval +
                '}';
    }
}
