package com.glossary.mapping.rules;

import com.glossary.mapping.core.model.Candidate;

import java.util.Optional;

/**
 * Accepts the top candidate when it reaches {@code exactThreshold} and leads the runner-up
 * by at least {@code minGap}.
 */
public class ExactAcceptRule implements MappingRule {

    public static final String NAME = "ExactAcceptRule";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Decision> evaluate(RuleContext context) {
        Optional<Candidate> top = context.top();
        if (top.isEmpty() || top.get().score() < context.options().getExactThreshold()) {
            return Optional.empty();
        }
        if (!Scores.atLeast(context.gapToSecond(), context.options().getMinGap())) {
            return Optional.empty();
        }
        return Optional.of(new Decision.Accept(top.get()));
    }
}
