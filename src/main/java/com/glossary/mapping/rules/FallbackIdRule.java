package com.glossary.mapping.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Assigns the catch-all id configured for the record's category, or the default fallback id.
 * An id that is not part of the current glossary is never assigned.
 */
public class FallbackIdRule implements MappingRule {
    private static final Logger log = LoggerFactory.getLogger(FallbackIdRule.class);

    public static final String NAME = "FallbackIdRule";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Decision> evaluate(RuleContext context) {
        Optional<String> fallbackId = context.options().fallbackIdFor(context.category());
        if (fallbackId.isEmpty()) {
            return Optional.empty();
        }
        if (!context.snapshot().containsId(fallbackId.get())) {
            log.warn("fallback.missing sourceId={} category={} fallbackId={} generation={}",
                    context.sourceId(), context.category(), fallbackId.get(),
                    context.snapshot().getGenerationId());
            return Optional.empty();
        }
        String reason = context.category() != null
                ? "fallback for category " + context.category()
                : "default fallback";
        return Optional.of(new Decision.AcceptFallback(fallbackId.get(), reason));
    }
}
