package com.glossary.mapping.rules;

import com.glossary.mapping.core.model.Candidate;
import com.glossary.mapping.core.model.MappingStatus;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of the rule chain for one record.
 */
public interface Decision {

    MappingStatus status();

    /**
     * Assign the candidate's entity.
     */
    record Accept(Candidate candidate) implements Decision {
        public Accept {
            Objects.requireNonNull(candidate, "candidate is required");
        }

        @Override
        public MappingStatus status() {
            return MappingStatus.MATCHED;
        }
    }

    /**
     * Assign a configured catch-all id because no candidate was good enough.
     */
    record AcceptFallback(String fallbackId, String reason) implements Decision {
        public AcceptFallback {
            Objects.requireNonNull(fallbackId, "fallbackId is required");
        }

        @Override
        public MappingStatus status() {
            return MappingStatus.MATCHED_BY_FALLBACK;
        }
    }

    record Reject(String reason) implements Decision {
        @Override
        public MappingStatus status() {
            return MappingStatus.UNMATCHED;
        }
    }

    /**
     * Several candidates are too close to call; they are reported for manual resolution.
     */
    record Ambiguous(List<Candidate> topCandidates) implements Decision {
        public Ambiguous {
            if (topCandidates == null || topCandidates.size() < 2) {
                throw new IllegalArgumentException("Ambiguous decision needs at least two candidates");
            }
            topCandidates = List.copyOf(topCandidates);
        }

        @Override
        public MappingStatus status() {
            return MappingStatus.AMBIGUOUS;
        }
    }
}
