package com.glossary.mapping.index;

import com.glossary.mapping.core.model.ReferenceEntity;
import com.glossary.mapping.normalize.InvalidAttributeException;
import com.glossary.mapping.normalize.RecordNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds {@link IndexSnapshot}s from raw glossary entities.
 *
 * <p>Each successful build receives the next generation id from a counter owned by this
 * index, so generation ids are strictly increasing across the lifetime of the instance.
 * A failed build consumes no generation.</p>
 */
public class ReferenceIndex {
    private static final Logger log = LoggerFactory.getLogger(ReferenceIndex.class);

    private final RecordNormalizer normalizer;
    private final BlockingKeyStrategy blockingStrategy;
    private final Clock clock;
    private final AtomicLong generations = new AtomicLong();

    public ReferenceIndex(RecordNormalizer normalizer) {
        this(normalizer, new GlossaryBlockingKeyStrategy(), Clock.systemUTC());
    }

    public ReferenceIndex(RecordNormalizer normalizer, BlockingKeyStrategy blockingStrategy, Clock clock) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.blockingStrategy = Objects.requireNonNull(blockingStrategy, "blockingStrategy is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public RecordNormalizer getNormalizer() {
        return normalizer;
    }

    /**
     * Normalizes and indexes {@code entities} into a new snapshot.
     *
     * @throws EmptyGlossaryException    if there are no entities
     * @throws DuplicateIdException      if two entities share an id
     * @throws InvalidAttributeException if an entity lacks a key attribute
     */
    public IndexSnapshot build(Collection<ReferenceEntity> entities) {
        if (entities == null || entities.isEmpty()) {
            throw new EmptyGlossaryException("Glossary contains no entities");
        }

        Map<String, ReferenceEntity> byId = new TreeMap<>();
        for (ReferenceEntity raw : entities) {
            if (byId.containsKey(raw.getId())) {
                throw new DuplicateIdException(raw.getId());
            }
            byId.put(raw.getId(), normalize(raw));
        }

        Map<String, List<ReferenceEntity>> exact = new HashMap<>();
        Map<String, List<ReferenceEntity>> blocking = new HashMap<>();
        Map<String, Integer> keyCounts = new HashMap<>();
        // byId iterates in id order, so every posting list is already sorted by id
        for (ReferenceEntity entity : byId.values()) {
            String key = entity.getNormalizedKey();
            if (key.isEmpty()) {
                continue;
            }
            exact.computeIfAbsent(key, k -> new ArrayList<>()).add(entity);
            Set<String> blockingKeys = blockingStrategy.generateKeys(key);
            keyCounts.put(entity.getId(), blockingKeys.size());
            for (String blockingKey : blockingKeys) {
                blocking.computeIfAbsent(blockingKey, k -> new ArrayList<>()).add(entity);
            }
        }

        long generation = generations.incrementAndGet();
        IndexSnapshot snapshot = new IndexSnapshot(
                generation,
                clock.instant(),
                Collections.unmodifiableMap(byId),
                freeze(exact),
                freeze(blocking),
                Map.copyOf(keyCounts),
                blockingStrategy);
        log.debug("index.built generation={} entities={} exactKeys={} blockingKeys={}",
                generation, byId.size(), exact.size(), blocking.size());
        return snapshot;
    }

    private ReferenceEntity normalize(ReferenceEntity raw) {
        try {
            return normalizer.normalize(raw);
        } catch (InvalidAttributeException e) {
            throw new InvalidAttributeException(e.getAttributeName(),
                    "Glossary entity '" + raw.getId() + "': " + e.getMessage(), e);
        }
    }

    private static Map<String, List<ReferenceEntity>> freeze(Map<String, List<ReferenceEntity>> postings) {
        Map<String, List<ReferenceEntity>> frozen = new HashMap<>(postings.size() * 2);
        postings.forEach((key, list) -> frozen.put(key, List.copyOf(list)));
        return Collections.unmodifiableMap(frozen);
    }
}
