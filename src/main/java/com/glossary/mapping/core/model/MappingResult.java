package com.glossary.mapping.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The engine's output for one source record.
 *
 * <p>{@code assignedId} is non-null exactly when the status carries an assignment
 * ({@link MappingStatus#MATCHED} or {@link MappingStatus#MATCHED_BY_FALLBACK}).
 * {@code alternativeIds} holds the tied entity ids of an {@link MappingStatus#AMBIGUOUS}
 * result so downstream reviewers can adjudicate.</p>
 *
 * @param sourceId       feed-local record identifier
 * @param assignedId     glossary id, or null when unresolved
 * @param confidence     score of the winning candidate, 0 when unresolved
 * @param decisionPath   rule names evaluated, in order; the last one decided
 * @param status         final status
 * @param reason         cause for unresolved and fallback results, null otherwise
 * @param degraded       true when duplicate suppression was bypassed
 * @param generationId   glossary generation the result was computed against, -1 if none
 * @param alternativeIds tied candidate ids for ambiguous results
 */
public record MappingResult(
        String sourceId,
        String assignedId,
        double confidence,
        List<String> decisionPath,
        MappingStatus status,
        String reason,
        boolean degraded,
        long generationId,
        List<String> alternativeIds
) {
    public static final String REASON_INVALID_INPUT = "invalid input";
    public static final String REASON_COORDINATOR_TIMEOUT = "coordinator timeout";
    public static final String REASON_SINK_TIMEOUT = "sink timeout";
    public static final String REASON_CANCELLED = "cancelled";
    public static final String REASON_INTERNAL_ERROR = "internal error";

    public MappingResult {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(status, "status is required");
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got " + confidence);
        }
        if (status.hasAssignment() && assignedId == null) {
            throw new IllegalArgumentException(status + " requires an assignedId");
        }
        if (!status.hasAssignment() && assignedId != null) {
            throw new IllegalArgumentException(status + " must not carry an assignedId");
        }
        decisionPath = decisionPath != null ? List.copyOf(decisionPath) : List.of();
        alternativeIds = alternativeIds != null ? List.copyOf(alternativeIds) : List.of();
    }

    /**
     * An unresolved result that never reached the rules engine.
     */
    public static MappingResult unmatched(String sourceId, String reason, long generationId) {
        return new MappingResult(sourceId, null, 0.0, List.of(), MappingStatus.UNMATCHED,
                reason, false, generationId, List.of());
    }

    public boolean isResolved() {
        return assignedId != null;
    }

    /**
     * Returns a copy flagged as computed without duplicate suppression.
     */
    public MappingResult asDegraded() {
        return new MappingResult(sourceId, assignedId, confidence, decisionPath, status,
                reason, true, generationId, alternativeIds);
    }

    /**
     * Returns an unresolved copy that keeps the decision path for auditability.
     */
    public MappingResult asUnmatched(String newReason) {
        return new MappingResult(sourceId, null, 0.0, decisionPath, MappingStatus.UNMATCHED,
                newReason, degraded, generationId, List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String sourceId;
        private String assignedId;
        private double confidence;
        private final List<String> decisionPath = new ArrayList<>();
        private MappingStatus status;
        private String reason;
        private boolean degraded;
        private long generationId = -1;
        private final List<String> alternativeIds = new ArrayList<>();

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder assignedId(String assignedId) {
            this.assignedId = assignedId;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder decisionPath(List<String> path) {
            this.decisionPath.clear();
            if (path != null) {
                this.decisionPath.addAll(path);
            }
            return this;
        }

        public Builder status(MappingStatus status) {
            this.status = status;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder degraded(boolean degraded) {
            this.degraded = degraded;
            return this;
        }

        public Builder generationId(long generationId) {
            this.generationId = generationId;
            return this;
        }

        public Builder alternativeIds(List<String> ids) {
            this.alternativeIds.clear();
            if (ids != null) {
                this.alternativeIds.addAll(ids);
            }
            return this;
        }

        public MappingResult build() {
            return new MappingResult(sourceId, assignedId, confidence, decisionPath, status,
                    reason, degraded, generationId, alternativeIds);
        }
    }
}
