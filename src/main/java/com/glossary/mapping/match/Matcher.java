package com.glossary.mapping.match;

import com.glossary.mapping.api.MappingOptions;
import com.glossary.mapping.core.model.Candidate;
import com.glossary.mapping.core.model.ReferenceEntity;
import com.glossary.mapping.core.model.SourceRecord;
import com.glossary.mapping.index.ApproximateHit;
import com.glossary.mapping.index.IndexSnapshot;
import com.glossary.mapping.normalize.InvalidAttributeException;
import com.glossary.mapping.normalize.RecordNormalizer;
import com.glossary.mapping.similarity.SimilarityAlgorithm;
import com.google.common.base.Suppliers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Produces scored candidates for a source record against one glossary snapshot.
 *
 * <p>Two passes:</p>
 * <ol>
 *   <li><b>Exact</b>: every entity whose normalized key equals the record's key is emitted
 *       with score 1.0 and the fuzzy pass is skipped.</li>
 *   <li><b>Fuzzy</b>: the blocking index proposes up to {@code candidateLimit} entities, each
 *       is rescored with the configured {@link SimilarityAlgorithm} and those below
 *       {@code minScore} are dropped.</li>
 * </ol>
 *
 * <p>Fuzzy rescoring compares whole normalized keys unless attribute weights are configured,
 * in which case each weighted attribute present on both sides is scored separately and the
 * weighted mean is used. The returned stream is lazy: no scoring happens until it is
 * consumed. It is ordered by descending score, ties by ascending entity id, and it can be
 * consumed once. "No match" is an empty stream, never an exception.</p>
 */
public class Matcher {
    private static final Logger log = LoggerFactory.getLogger(Matcher.class);

    private final RecordNormalizer normalizer;
    private final SimilarityAlgorithm similarity;
    private final int candidateLimit;
    private final double minScore;
    private final Map<String, Double> attributeWeights;

    public Matcher(RecordNormalizer normalizer, SimilarityAlgorithm similarity, MappingOptions options) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.similarity = Objects.requireNonNull(similarity, "similarity is required");
        this.candidateLimit = options.getCandidateLimit();
        this.minScore = options.getMinScore();
        this.attributeWeights = options.getAttributeWeights();
    }

    public SimilarityAlgorithm getSimilarity() {
        return similarity;
    }

    /**
     * Matches {@code record} against {@code snapshot}.
     *
     * @throws InvalidAttributeException if the record lacks a key attribute
     */
    public Stream<Candidate> match(SourceRecord record, IndexSnapshot snapshot) {
        String key = normalizer.normalize(record);
        if (key.isEmpty() || snapshot.isEmpty()) {
            return Stream.empty();
        }

        List<ReferenceEntity> exact = snapshot.lookupAllExact(key);
        if (!exact.isEmpty()) {
            List<String> keyAttributes = normalizer.getKeyAttributes();
            return exact.stream().map(entity -> Candidate.exact(entity, keyAttributes));
        }

        Supplier<Map<String, String>> recordValues = Suppliers.memoize(
                () -> normalizer.normalizeAttributes(record.getAttributes(), normalizer.categoryOf(record)));
        return Stream.of(key)
                .flatMap(k -> snapshot.lookupCandidates(k, candidateLimit).stream())
                .map(hit -> rescore(recordValues, key, hit))
                .filter(candidate -> candidate.score() >= minScore)
                .sorted(Candidate.RANKING)
                .peek(candidate -> log.trace("match.candidate sourceId={} entityId={} score={}",
                        record.getSourceId(), candidate.entityId(), candidate.score()));
    }

    private Candidate rescore(Supplier<Map<String, String>> recordAttributes, String key, ApproximateHit hit) {
        ReferenceEntity entity = hit.entity();
        if (attributeWeights.isEmpty()) {
            return new Candidate(entity, clamp(similarity.compute(key, entity.getNormalizedKey())),
                    normalizer.getKeyAttributes());
        }

        Map<String, String> recordValues = recordAttributes.get();
        Map<String, String> entityValues = entity.getNormalizedAttributes();
        double weighted = 0.0;
        double totalWeight = 0.0;
        List<String> matchedOn = new ArrayList<>();
        for (Map.Entry<String, Double> weight : attributeWeights.entrySet()) {
            String left = recordValues.get(weight.getKey());
            String right = entityValues.get(weight.getKey());
            if (left == null || right == null || left.isEmpty() || right.isEmpty()) {
                continue;
            }
            weighted += weight.getValue() * similarity.compute(left, right);
            totalWeight += weight.getValue();
            matchedOn.add(weight.getKey());
        }
        if (totalWeight == 0.0) {
            // no weighted attribute on both sides
            return new Candidate(entity, clamp(similarity.compute(key, entity.getNormalizedKey())),
                    normalizer.getKeyAttributes());
        }
        return new Candidate(entity, clamp(weighted / totalWeight), matchedOn);
    }

    private static double clamp(double score) {
        if (Double.isNaN(score) || score < 0.0) {
            return 0.0;
        }
        return Math.min(score, 1.0);
    }
}
