package com.glossary.mapping.rules;

import java.util.Optional;

/**
 * One link of the decision chain. Implementations are pure functions of the context:
 * they hold no mutable state and return empty when their precondition does not hold.
 */
public interface MappingRule {

    /**
     * Name recorded in the decision path and used in the configured rule order.
     */
    String name();

    Optional<Decision> evaluate(RuleContext context);
}
