package com.glossary.mapping.normalize;

import java.util.List;
import java.util.Objects;

/**
 * Canonicalization settings shared by glossary indexing and record matching.
 *
 * @param keyAttributes     attributes concatenated, in order, into the normalized key; all required
 * @param punctuation       characters replaced by whitespace before collapsing
 * @param sortTokens        sort the words of each value so word order does not matter
 * @param categoryAttribute attribute holding the category when none is given explicitly
 */
public record NormalizerConfig(
        List<String> keyAttributes,
        String punctuation,
        boolean sortTokens,
        String categoryAttribute
) {
    public static final String DEFAULT_PUNCTUATION = ".,;:!?'\"`()[]{}<>/\\|-_#*@+~^=";

    public NormalizerConfig {
        Objects.requireNonNull(keyAttributes, "keyAttributes is required");
        if (keyAttributes.isEmpty()) {
            throw new IllegalArgumentException("At least one key attribute is required");
        }
        keyAttributes = List.copyOf(keyAttributes);
        punctuation = punctuation != null ? punctuation : "";
        categoryAttribute = categoryAttribute != null ? categoryAttribute : "category";
    }

    /**
     * Single {@code name} key attribute, default punctuation, word order preserved.
     */
    public static NormalizerConfig defaults() {
        return forKeyAttributes("name");
    }

    public static NormalizerConfig forKeyAttributes(String... keyAttributes) {
        return new NormalizerConfig(List.of(keyAttributes), DEFAULT_PUNCTUATION, false, "category");
    }

    public NormalizerConfig withSortTokens(boolean sort) {
        return new NormalizerConfig(keyAttributes, punctuation, sort, categoryAttribute);
    }

    public NormalizerConfig withPunctuation(String chars) {
        return new NormalizerConfig(keyAttributes, chars, sortTokens, categoryAttribute);
    }
}
