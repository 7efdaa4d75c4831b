package com.glossary.mapping.similarity;

import java.util.HashSet;
import java.util.Set;

/**
 * Jaccard overlap of whitespace-separated word sets. Insensitive to word order,
 * so "corp acme" and "acme corp" score 1.0.
 */
public class TokenSetSimilarity implements SimilarityAlgorithm {

    public static final String NAME = "token-set";

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isBlank() || s2.isBlank()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        Set<String> left = tokens(s1);
        Set<String> right = tokens(s2);

        int shared = 0;
        for (String token : left) {
            if (right.contains(token)) {
                shared++;
            }
        }
        int union = left.size() + right.size() - shared;
        return union == 0 ? 0.0 : (double) shared / union;
    }

    @Override
    public String getName() {
        return NAME;
    }

    static Set<String> tokens(String s) {
        Set<String> tokens = new HashSet<>();
        for (String token : s.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
