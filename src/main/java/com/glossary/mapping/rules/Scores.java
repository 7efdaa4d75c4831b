package com.glossary.mapping.rules;

/**
 * Score comparisons tolerant of floating-point subtraction error.
 */
final class Scores {

    static final double EPSILON = 1e-9;

    private Scores() {
    }

    /**
     * {@code value >= bound}, treating values within {@link #EPSILON} below the bound as equal.
     * Used for gaps, which are differences of two scores.
     */
    static boolean atLeast(double value, double bound) {
        return value >= bound - EPSILON;
    }
}
