package com.glossary.mapping.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * The built-in rule set and the default evaluation order.
 */
public final class DefaultMappingRules {

    /**
     * Exact accept, ambiguity, fuzzy accept, fallback. The reject rule is always appended.
     */
    public static final List<String> DEFAULT_ORDER = List.of(
            ExactAcceptRule.NAME,
            AmbiguityRule.NAME,
            FuzzyAcceptRule.NAME,
            FallbackIdRule.NAME);

    private static final Map<String, Supplier<MappingRule>> BUILT_IN = Map.of(
            ExactAcceptRule.NAME, ExactAcceptRule::new,
            AmbiguityRule.NAME, AmbiguityRule::new,
            FuzzyAcceptRule.NAME, FuzzyAcceptRule::new,
            FallbackIdRule.NAME, FallbackIdRule::new,
            RejectRule.NAME, RejectRule::new);

    private DefaultMappingRules() {
        // Utility class
    }

    public static List<MappingRule> defaultChain() {
        return chain(DEFAULT_ORDER);
    }

    /**
     * Instantiates built-in rules in the given order.
     *
     * @throws IllegalArgumentException for an unknown or repeated rule name
     */
    public static List<MappingRule> chain(List<String> order) {
        List<MappingRule> rules = new ArrayList<>(order.size());
        for (String name : order) {
            if (rules.stream().anyMatch(r -> r.name().equals(name))) {
                throw new IllegalArgumentException("Rule listed twice: " + name);
            }
            rules.add(byName(name));
        }
        return rules;
    }

    public static MappingRule byName(String name) {
        Supplier<MappingRule> supplier = BUILT_IN.get(name);
        if (supplier == null) {
            throw new IllegalArgumentException("Unknown mapping rule: " + name
                    + " (known: " + BUILT_IN.keySet() + ")");
        }
        return supplier.get();
    }
}
