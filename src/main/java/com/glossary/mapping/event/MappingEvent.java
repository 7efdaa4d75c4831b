package com.glossary.mapping.event;

import com.glossary.mapping.core.model.MappingResult;
import com.glossary.mapping.core.model.MappingStatus;

import java.time.Duration;
import java.util.List;

/**
 * Emitted once per mapped record.
 *
 * @param sourceId     record id
 * @param status       final status
 * @param confidence   winning score, 0 when unresolved
 * @param decisionPath rules evaluated
 * @param latency      wall time spent on the record
 * @param generationId glossary generation used
 * @param degraded     whether duplicate suppression was bypassed
 */
public record MappingEvent(
        String sourceId,
        MappingStatus status,
        double confidence,
        List<String> decisionPath,
        Duration latency,
        long generationId,
        boolean degraded
) {
    public MappingEvent {
        decisionPath = decisionPath != null ? List.copyOf(decisionPath) : List.of();
    }

    public static MappingEvent of(MappingResult result, Duration latency) {
        return new MappingEvent(result.sourceId(), result.status(), result.confidence(),
                result.decisionPath(), latency, result.generationId(), result.degraded());
    }
}
