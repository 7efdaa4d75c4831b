package com.glossary.mapping.rules;

import java.util.Optional;

/**
 * Terminal rule; always fires.
 */
public class RejectRule implements MappingRule {

    public static final String NAME = "RejectRule";
    public static final String REASON = "no candidate above threshold";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Decision> evaluate(RuleContext context) {
        return Optional.of(new Decision.Reject(REASON));
    }
}
