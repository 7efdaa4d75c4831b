package com.glossary.mapping.index;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Blocking keys combining word-level and character-level signals:
 * <ul>
 *   <li><b>Prefix</b>: first 3 characters ({@code pfx:acm})</li>
 *   <li><b>Bigram</b>: first 2 characters ({@code bg:ac})</li>
 *   <li><b>Sorted token pair</b>: two alphabetically first words ({@code tok:acme|corp})</li>
 *   <li><b>Word</b>: every word of the key ({@code w:acme})</li>
 *   <li><b>Trigram</b>: character trigrams of the padded key ({@code tri:_ac})</li>
 * </ul>
 *
 * <p>Word keys give recall across reordered or abbreviated names; trigrams give recall
 * across typos. The share of common keys is used as the approximate score.</p>
 */
public class GlossaryBlockingKeyStrategy implements BlockingKeyStrategy {

    private static final int PREFIX_LENGTH = 3;
    private static final int GRAM = 3;

    @Override
    public Set<String> generateKeys(String normalizedKey) {
        Set<String> keys = new LinkedHashSet<>();
        if (normalizedKey == null || normalizedKey.isBlank()) {
            return keys;
        }
        String key = normalizedKey.trim();

        keys.add("pfx:" + key.substring(0, Math.min(PREFIX_LENGTH, key.length())));
        keys.add("bg:" + key.substring(0, Math.min(2, key.length())));

        String[] words = key.split("\\s+");
        if (words.length >= 2) {
            String[] sorted = Arrays.copyOf(words, words.length);
            Arrays.sort(sorted);
            keys.add("tok:" + sorted[0] + "|" + sorted[1]);
        }
        for (String word : words) {
            keys.add("w:" + word);
        }

        String padded = "_" + key.replace(' ', '_') + "_";
        for (int i = 0; i + GRAM <= padded.length(); i++) {
            keys.add("tri:" + padded.substring(i, i + GRAM));
        }
        return keys;
    }
}
