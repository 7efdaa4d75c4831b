package com.glossary.mapping.similarity;

/**
 * Pluggable string similarity used by the fuzzy matching pass.
 * Implementations must be pure, thread-safe and return a score in [0, 1],
 * where 1 means identical.
 */
public interface SimilarityAlgorithm {

    /**
     * Scores two canonical strings.
     *
     * @return similarity between 0.0 and 1.0; 0.0 if either side is null or empty
     */
    double compute(String s1, String s2);

    /**
     * Name used in configuration and logs.
     */
    String getName();
}
