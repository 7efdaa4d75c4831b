package com.glossary.mapping.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Weighted blend of several algorithms: {@code score = sum(w_i * s_i)}.
 * Weights must be non-negative and sum to 1.
 */
public class WeightedSimilarity implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(WeightedSimilarity.class);

    public static final String NAME = "composite";

    private final List<Component> components;

    public WeightedSimilarity(List<Component> components) {
        Objects.requireNonNull(components, "components are required");
        if (components.isEmpty()) {
            throw new IllegalArgumentException("At least one component is required");
        }
        double sum = components.stream().mapToDouble(Component::weight).sum();
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
        this.components = List.copyOf(components);
    }

    /**
     * Jaro-Winkler 0.5, token-set 0.3, Levenshtein 0.2.
     */
    public static WeightedSimilarity defaultBlend() {
        return new WeightedSimilarity(List.of(
                new Component(new JaroWinklerSimilarity(), 0.5),
                new Component(new TokenSetSimilarity(), 0.3),
                new Component(new LevenshteinSimilarity(), 0.2)));
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2) && !s1.isEmpty()) {
            return 1.0;
        }
        double total = 0.0;
        for (Component component : components) {
            total += component.weight() * component.algorithm().compute(s1, s2);
        }
        // Guard against accumulated rounding pushing past 1.0
        double score = Math.min(1.0, total);
        if (log.isTraceEnabled()) {
            log.trace("Composite score for '{}' vs '{}' = {}", s1, s2, score);
        }
        return score;
    }

    @Override
    public String getName() {
        return NAME;
    }

    public List<Component> getComponents() {
        return components;
    }

    @Override
    public String toString() {
        return components.stream()
                .map(c -> c.algorithm().getName() + "=" + c.weight())
                .collect(Collectors.joining(", ", "WeightedSimilarity{", "}"));
    }

    /**
     * One weighted algorithm of the blend.
     */
    public record Component(SimilarityAlgorithm algorithm, double weight) {
        public Component {
            Objects.requireNonNull(algorithm, "algorithm is required");
            if (weight < 0) {
                throw new IllegalArgumentException("Weights must be non-negative");
            }
        }
    }
}
