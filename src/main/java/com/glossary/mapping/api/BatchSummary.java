package com.glossary.mapping.api;

import com.glossary.mapping.core.model.MappingResult;
import com.glossary.mapping.core.model.MappingStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Counts of a batch's results by status.
 *
 * @param total          number of results
 * @param countsByStatus results per status, every status present
 * @param degraded       results computed without duplicate suppression
 */
public record BatchSummary(int total, Map<MappingStatus, Integer> countsByStatus, int degraded) {

    public BatchSummary {
        Map<MappingStatus, Integer> counts = new EnumMap<>(MappingStatus.class);
        for (MappingStatus status : MappingStatus.values()) {
            counts.put(status, countsByStatus != null ? countsByStatus.getOrDefault(status, 0) : 0);
        }
        countsByStatus = Collections.unmodifiableMap(counts);
    }

    public static BatchSummary of(List<MappingResult> results) {
        Map<MappingStatus, Integer> counts = new EnumMap<>(MappingStatus.class);
        int degraded = 0;
        for (MappingResult result : results) {
            counts.merge(result.status(), 1, Integer::sum);
            if (result.degraded()) {
                degraded++;
            }
        }
        return new BatchSummary(results.size(), counts, degraded);
    }

    public int count(MappingStatus status) {
        return countsByStatus.get(status);
    }

    public int resolved() {
        return count(MappingStatus.MATCHED) + count(MappingStatus.MATCHED_BY_FALLBACK);
    }

    @Override
    public String toString() {
        return "BatchSummary{" +
                "total=" + total +
                ", matched=" + count(MappingStatus.MATCHED) +
                ", fallback=" + count(MappingStatus.MATCHED_BY_FALLBACK) +
                ", ambiguous=" + count(MappingStatus.AMBIGUOUS) +
                ", unmatched=" + count(MappingStatus.UNMATCHED) +
                ", degraded=" + degraded +
                '}';
    }
}
