package com.glossary.mapping.index;

import java.util.Set;

/**
 * Generates blocking keys for the approximate-match index.
 *
 * <p>Two normalized keys that share at least one blocking key are potential fuzzy
 * candidates for each other. Keys should be coarse enough to keep likely matches
 * together and fine enough to keep the candidate lists short.</p>
 */
public interface BlockingKeyStrategy {

    /**
     * @param normalizedKey canonical key produced by the normalizer
     * @return blocking keys, never null, empty for a blank key
     */
    Set<String> generateKeys(String normalizedKey);
}
