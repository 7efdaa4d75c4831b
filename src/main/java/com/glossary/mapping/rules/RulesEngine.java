package com.glossary.mapping.rules;

import com.glossary.mapping.api.MappingOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates an ordered, short-circuiting chain of {@link MappingRule}s.
 *
 * <p>Rules run in configured order and the first non-empty result wins. Each evaluated rule
 * is appended to the decision path, so the path always ends with the rule that decided.
 * A {@link RejectRule} is appended when the configured chain does not end with one, which
 * guarantees a decision for every input.</p>
 */
public class RulesEngine {
    private static final Logger log = LoggerFactory.getLogger(RulesEngine.class);

    private final List<MappingRule> rules;

    public RulesEngine(List<MappingRule> rules) {
        List<MappingRule> chain = new ArrayList<>(rules);
        if (chain.isEmpty() || !(chain.get(chain.size() - 1) instanceof RejectRule)) {
            chain.removeIf(rule -> rule instanceof RejectRule);
            chain.add(new RejectRule());
        }
        this.rules = List.copyOf(chain);
    }

    public static RulesEngine fromOptions(MappingOptions options) {
        return new RulesEngine(DefaultMappingRules.chain(options.getRuleOrder()));
    }

    public List<String> getRuleNames() {
        return rules.stream().map(MappingRule::name).toList();
    }

    public DecisionTrace decide(RuleContext context) {
        List<String> path = new ArrayList<>(rules.size());
        for (MappingRule rule : rules) {
            path.add(rule.name());
            Optional<Decision> decision = rule.evaluate(context);
            if (decision.isPresent()) {
                log.debug("rules.decided sourceId={} rule={} status={} candidates={}",
                        context.sourceId(), rule.name(), decision.get().status(), context.candidates().size());
                return new DecisionTrace(decision.get(), path);
            }
        }
        // unreachable: the chain always ends with RejectRule
        throw new IllegalStateException("Rule chain produced no decision");
    }
}
