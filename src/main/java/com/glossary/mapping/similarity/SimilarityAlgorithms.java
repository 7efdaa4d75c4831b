package com.glossary.mapping.similarity;

import java.util.Locale;

/**
 * Resolves similarity algorithms from configuration names.
 */
public final class SimilarityAlgorithms {

    private SimilarityAlgorithms() {
        // Utility class
    }

    /**
     * The default fuzzy scorer: Jaro-Winkler over the whole normalized key.
     */
    public static SimilarityAlgorithm defaultAlgorithm() {
        return new JaroWinklerSimilarity();
    }

    /**
     * @param name one of {@code jaro-winkler}, {@code jaro}, {@code levenshtein},
     *             {@code token-set}, {@code composite}
     * @throws IllegalArgumentException for unknown names
     */
    public static SimilarityAlgorithm byName(String name) {
        if (name == null || name.isBlank()) {
            return defaultAlgorithm();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case JaroWinklerSimilarity.NAME -> new JaroWinklerSimilarity();
            case "jaro" -> new JaroWinklerSimilarity(0.0);
            case LevenshteinSimilarity.NAME -> new LevenshteinSimilarity();
            case TokenSetSimilarity.NAME, "jaccard" -> new TokenSetSimilarity();
            case WeightedSimilarity.NAME -> WeightedSimilarity.defaultBlend();
            default -> throw new IllegalArgumentException("Unknown similarity algorithm: " + name);
        };
    }
}
