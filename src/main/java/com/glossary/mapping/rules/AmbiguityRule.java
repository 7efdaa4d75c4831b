package com.glossary.mapping.rules;

import com.glossary.mapping.core.model.Candidate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reports a tie when two or more candidates at or above {@code fuzzyThreshold} sit within
 * {@code minGap} of the top score. The tied set is every such candidate.
 */
public class AmbiguityRule implements MappingRule {

    public static final String NAME = "AmbiguityRule";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Decision> evaluate(RuleContext context) {
        List<Candidate> candidates = context.candidates();
        if (candidates.size() < 2) {
            return Optional.empty();
        }
        double fuzzyThreshold = context.options().getFuzzyThreshold();
        double minGap = context.options().getMinGap();
        double topScore = candidates.get(0).score();

        List<Candidate> tied = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (candidate.score() < fuzzyThreshold || Scores.atLeast(topScore - candidate.score(), minGap)) {
                break;
            }
            tied.add(candidate);
        }
        return tied.size() >= 2 ? Optional.of(new Decision.Ambiguous(tied)) : Optional.empty();
    }
}
