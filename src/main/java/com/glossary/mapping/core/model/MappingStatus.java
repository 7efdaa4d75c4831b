package com.glossary.mapping.core.model;

/**
 * Final status of a mapped record.
 */
public enum MappingStatus {
    /** Resolved to a glossary entity by exact or fuzzy match. */
    MATCHED,

    /** No confident match; a configured catch-all glossary ID was assigned. */
    MATCHED_BY_FALLBACK,

    /** Unresolved: rejected, invalid input, timeout, or cancelled. */
    UNMATCHED,

    /** Two or more candidates are indistinguishable and need manual adjudication. */
    AMBIGUOUS;

    public boolean hasAssignment() {
        return this == MATCHED || this == MATCHED_BY_FALLBACK;
    }
}
