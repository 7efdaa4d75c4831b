package com.glossary.mapping.core.model;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A scored pairing of a source record with a reference entity.
 * The entity is borrowed from the index snapshot that produced it.
 */
public record Candidate(
        ReferenceEntity entity,
        double score,
        List<String> matchedOn
) {
    /**
     * Descending score, ties broken by ascending entity id.
     */
    public static final Comparator<Candidate> RANKING = Comparator
            .comparingDouble(Candidate::score).reversed()
            .thenComparing(c -> c.entity().getId());

    public Candidate {
        Objects.requireNonNull(entity, "entity is required");
        if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0, got " + score);
        }
        matchedOn = matchedOn != null ? List.copyOf(matchedOn) : List.of();
    }

    public static Candidate exact(ReferenceEntity entity, List<String> matchedOn) {
        return new Candidate(entity, 1.0, matchedOn);
    }

    public String entityId() {
        return entity.getId();
    }

    public boolean isExact() {
        return score == 1.0;
    }
}
