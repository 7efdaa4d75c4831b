package com.glossary.mapping.rules;

import java.util.Optional;

/**
 * Accepts the top candidate when it reaches {@code fuzzyThreshold}. Placed after
 * {@link AmbiguityRule}, so a tie has already been reported when this runs.
 */
public class FuzzyAcceptRule implements MappingRule {

    public static final String NAME = "FuzzyAcceptRule";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Decision> evaluate(RuleContext context) {
        return context.top()
                .filter(top -> top.score() >= context.options().getFuzzyThreshold())
                .map(Decision.Accept::new);
    }
}
