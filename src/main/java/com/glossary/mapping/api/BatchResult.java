package com.glossary.mapping.api;

import com.glossary.mapping.core.model.MappingResult;

import java.util.List;

/**
 * Outcome of a batch: one result per input record, in input order.
 *
 * @param batchId      id used in logs and traces
 * @param generationId glossary generation pinned for the whole batch
 * @param results      per-record results
 * @param summary      counts by status
 * @param stored       whether the result sink confirmed storage
 * @param cancelled    whether the batch was cancelled before every record was scheduled
 */
public record BatchResult(
        String batchId,
        long generationId,
        List<MappingResult> results,
        BatchSummary summary,
        boolean stored,
        boolean cancelled
) {
    public BatchResult {
        results = results != null ? List.copyOf(results) : List.of();
        summary = summary != null ? summary : BatchSummary.of(results);
    }

    public int size() {
        return results.size();
    }

    public MappingResult get(int index) {
        return results.get(index);
    }

    @Override
    public String toString() {
        return "BatchResult{" +
                "batchId='" + batchId + '\'' +
                ", generation=" + generationId +
                ", " + summary +
                ", stored=" + stored +
                ", cancelled=" + cancelled +
                '}';
    }
}
