package com.glossary.mapping.index;

import com.glossary.mapping.core.model.ReferenceEntity;

/**
 * A coarse candidate from the blocking-key index, before similarity rescoring.
 *
 * @param entity      the glossary entity
 * @param approxScore share of blocking keys in common with the query, in [0, 1]
 */
public record ApproximateHit(ReferenceEntity entity, double approxScore) {
}
