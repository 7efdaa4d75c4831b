package com.glossary.mapping.similarity;

/**
 * Edit-distance similarity: {@code 1 - distance / longerLength}.
 * Good at absorbing typos in short codes and identifiers.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    public static final String NAME = "levenshtein";

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        int longer = Math.max(s1.length(), s2.length());
        return 1.0 - (double) distance(s1, s2) / longer;
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * Two-row dynamic programming over the shorter string.
     */
    static int distance(String s1, String s2) {
        String row = s1.length() <= s2.length() ? s1 : s2;
        String col = row == s1 ? s2 : s1;

        int[] prev = new int[row.length() + 1];
        int[] curr = new int[row.length() + 1];
        for (int i = 0; i < prev.length; i++) {
            prev[i] = i;
        }

        for (int j = 1; j <= col.length(); j++) {
            curr[0] = j;
            char c = col.charAt(j - 1);
            for (int i = 1; i <= row.length(); i++) {
                int substitution = prev[i - 1] + (row.charAt(i - 1) == c ? 0 : 1);
                int insertion = curr[i - 1] + 1;
                int deletion = prev[i] + 1;
                curr[i] = Math.min(substitution, Math.min(insertion, deletion));
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        return prev[row.length()];
    }
}
