package com.glossary.mapping.rules;

import com.glossary.mapping.api.MappingOptions;
import com.glossary.mapping.core.model.Candidate;
import com.glossary.mapping.index.IndexSnapshot;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a rule may look at: the ranked candidates, the record's category, the
 * thresholds and the snapshot the candidates came from.
 *
 * @param sourceId   record being decided, for logging only
 * @param category   record category, may be null
 * @param candidates candidates ordered by {@link Candidate#RANKING}
 * @param options    thresholds and fallback configuration
 * @param snapshot   the generation the candidates belong to
 */
public record RuleContext(
        String sourceId,
        String category,
        List<Candidate> candidates,
        MappingOptions options,
        IndexSnapshot snapshot
) {
    public RuleContext {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        Objects.requireNonNull(options, "options is required");
        Objects.requireNonNull(snapshot, "snapshot is required");
    }

    public Optional<Candidate> top() {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    /**
     * Score gap between the first and second candidate; infinite when there is no second.
     */
    public double gapToSecond() {
        if (candidates.size() < 2) {
            return Double.POSITIVE_INFINITY;
        }
        return candidates.get(0).score() - candidates.get(1).score();
    }
}
