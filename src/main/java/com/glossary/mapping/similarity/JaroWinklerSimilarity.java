package com.glossary.mapping.similarity;

/**
 * Jaro-Winkler similarity. Rewards a shared prefix of up to four characters,
 * which suits glossary names whose distinguishing words come first
 * ("acme corp" against "acme corporation").
 */
public class JaroWinklerSimilarity implements SimilarityAlgorithm {

    public static final String NAME = "jaro-winkler";

    private static final double DEFAULT_PREFIX_SCALE = 0.1;
    private static final int PREFIX_CAP = 4;

    private final double prefixScale;

    public JaroWinklerSimilarity() {
        this(DEFAULT_PREFIX_SCALE);
    }

    /**
     * @param prefixScale weight of the common prefix; 0 gives plain Jaro similarity
     */
    public JaroWinklerSimilarity(double prefixScale) {
        if (prefixScale < 0 || prefixScale > 0.25) {
            throw new IllegalArgumentException("prefixScale must be between 0 and 0.25");
        }
        this.prefixScale = prefixScale;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        double jaro = jaro(s1.toCharArray(), s2.toCharArray());
        int prefix = commonPrefix(s1, s2);
        return jaro + prefix * prefixScale * (1.0 - jaro);
    }

    @Override
    public String getName() {
        return prefixScale == 0 ? "jaro" : NAME;
    }

    static double jaro(char[] a, char[] b) {
        int window = Math.max(0, Math.max(a.length, b.length) / 2 - 1);
        boolean[] takenB = new boolean[b.length];
        char[] matchedA = new char[Math.min(a.length, b.length)];
        int matches = 0;

        for (int i = 0; i < a.length; i++) {
            int from = Math.max(0, i - window);
            int to = Math.min(b.length - 1, i + window);
            for (int j = from; j <= to; j++) {
                if (!takenB[j] && a[i] == b[j]) {
                    takenB[j] = true;
                    matchedA[matches++] = a[i];
                    break;
                }
            }
        }
        if (matches == 0) {
            return 0.0;
        }

        // Walk b's matched characters in order against a's to count half-transpositions
        int halfTranspositions = 0;
        int k = 0;
        for (int j = 0; j < b.length; j++) {
            if (takenB[j]) {
                if (b[j] != matchedA[k]) {
                    halfTranspositions++;
                }
                k++;
            }
        }

        double m = matches;
        double t = halfTranspositions / 2.0;
        return (m / a.length + m / b.length + (m - t) / m) / 3.0;
    }

    private static int commonPrefix(String s1, String s2) {
        int limit = Math.min(PREFIX_CAP, Math.min(s1.length(), s2.length()));
        int n = 0;
        while (n < limit && s1.charAt(n) == s2.charAt(n)) {
            n++;
        }
        return n;
    }
}
