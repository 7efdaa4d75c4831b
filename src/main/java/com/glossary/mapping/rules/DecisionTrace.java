package com.glossary.mapping.rules;

import com.glossary.mapping.core.model.Candidate;
import com.glossary.mapping.core.model.MappingResult;

import java.util.List;
import java.util.Objects;

/**
 * A decision together with the names of every rule evaluated to reach it.
 * The last entry of {@code decisionPath} is the rule that fired.
 */
public record DecisionTrace(Decision decision, List<String> decisionPath) {

    public DecisionTrace {
        Objects.requireNonNull(decision, "decision is required");
        decisionPath = List.copyOf(decisionPath);
    }

    /**
     * Converts the decision into the result reported for {@code sourceId}.
     */
    public MappingResult toResult(String sourceId, long generationId) {
        MappingResult.Builder builder = MappingResult.builder()
                .sourceId(sourceId)
                .status(decision.status())
                .decisionPath(decisionPath)
                .generationId(generationId);

        if (decision instanceof Decision.Accept accept) {
            builder.assignedId(accept.candidate().entityId())
                    .confidence(accept.candidate().score());
        } else if (decision instanceof Decision.AcceptFallback fallback) {
            builder.assignedId(fallback.fallbackId())
                    .reason(fallback.reason());
        } else if (decision instanceof Decision.Reject reject) {
            builder.reason(reject.reason());
        } else if (decision instanceof Decision.Ambiguous ambiguous) {
            List<Candidate> tied = ambiguous.topCandidates();
            builder.confidence(tied.get(0).score())
                    .alternativeIds(tied.stream().map(Candidate::entityId).toList())
                    .reason(tied.size() + " candidates within minimum gap");
        }
        return builder.build();
    }
}
