package com.glossary.mapping.index;

import com.glossary.mapping.core.model.ReferenceEntity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One immutable generation of the glossary, queryable by exact key and by blocking keys.
 *
 * <p>Instances are built by {@link ReferenceIndex} and never change afterwards, so any number
 * of threads may read one while the next generation is being built. Every list handed out
 * is unmodifiable and in a deterministic order.</p>
 */
public final class IndexSnapshot {

    private static final Comparator<ApproximateHit> HIT_ORDER = Comparator
            .comparingDouble(ApproximateHit::approxScore).reversed()
            .thenComparing(hit -> hit.entity().getId());

    private final long generationId;
    private final Instant loadedAt;
    private final Map<String, ReferenceEntity> entitiesById;
    private final Map<String, List<ReferenceEntity>> exactIndex;
    private final Map<String, List<ReferenceEntity>> blockingIndex;
    private final Map<String, Integer> blockingKeyCounts;
    private final BlockingKeyStrategy blockingStrategy;

    IndexSnapshot(long generationId,
                  Instant loadedAt,
                  Map<String, ReferenceEntity> entitiesById,
                  Map<String, List<ReferenceEntity>> exactIndex,
                  Map<String, List<ReferenceEntity>> blockingIndex,
                  Map<String, Integer> blockingKeyCounts,
                  BlockingKeyStrategy blockingStrategy) {
        this.generationId = generationId;
        this.loadedAt = loadedAt;
        this.entitiesById = entitiesById;
        this.exactIndex = exactIndex;
        this.blockingIndex = blockingIndex;
        this.blockingKeyCounts = blockingKeyCounts;
        this.blockingStrategy = blockingStrategy;
    }

    public long getGenerationId() {
        return generationId;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    public int size() {
        return entitiesById.size();
    }

    public boolean isEmpty() {
        return entitiesById.isEmpty();
    }

    public boolean containsId(String id) {
        return id != null && entitiesById.containsKey(id);
    }

    public Optional<ReferenceEntity> getEntity(String id) {
        return Optional.ofNullable(id == null ? null : entitiesById.get(id));
    }

    /**
     * All entities, ordered by id.
     */
    public Collection<ReferenceEntity> entities() {
        return entitiesById.values();
    }

    /**
     * The entity whose normalized key equals {@code normalizedKey}; the lowest id wins
     * when several entities share the key.
     */
    public Optional<ReferenceEntity> lookupExact(String normalizedKey) {
        List<ReferenceEntity> all = lookupAllExact(normalizedKey);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    /**
     * Every entity whose normalized key equals {@code normalizedKey}, ordered by id.
     */
    public List<ReferenceEntity> lookupAllExact(String normalizedKey) {
        if (normalizedKey == null || normalizedKey.isEmpty()) {
            return List.of();
        }
        return exactIndex.getOrDefault(normalizedKey, List.of());
    }

    /**
     * Entities sharing at least one blocking key with {@code normalizedKey}.
     *
     * <p>The approximate score is the Jaccard overlap of the two blocking-key sets.
     * At most {@code limit} hits are returned, by descending score then ascending id.</p>
     */
    public List<ApproximateHit> lookupCandidates(String normalizedKey, int limit) {
        if (limit <= 0 || normalizedKey == null || normalizedKey.isEmpty()) {
            return List.of();
        }
        Set<String> queryKeys = blockingStrategy.generateKeys(normalizedKey);
        Map<ReferenceEntity, Integer> shared = new HashMap<>();
        for (String key : queryKeys) {
            for (ReferenceEntity entity : blockingIndex.getOrDefault(key, List.of())) {
                shared.merge(entity, 1, Integer::sum);
            }
        }
        if (shared.isEmpty()) {
            return List.of();
        }

        List<ApproximateHit> hits = new ArrayList<>(shared.size());
        for (Map.Entry<ReferenceEntity, Integer> entry : shared.entrySet()) {
            int common = entry.getValue();
            int union = queryKeys.size() + blockingKeyCounts.get(entry.getKey().getId()) - common;
            hits.add(new ApproximateHit(entry.getKey(), (double) common / union));
        }
        hits.sort(HIT_ORDER);
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : List.copyOf(hits);
    }

    @Override
    public String toString() {
        return "IndexSnapshot{generation=" + generationId + ", size=" + size() + ", loadedAt=" + loadedAt + "}";
    }
}
