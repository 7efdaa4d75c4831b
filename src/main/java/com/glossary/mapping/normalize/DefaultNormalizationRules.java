package com.glossary.mapping.normalize;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in normalization rule sets.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Normalizer with the common rules only. Legal suffixes are kept, so
     * "Acme Corp" and "Acme Corporation" stay distinct keys and meet in the fuzzy pass.
     */
    public static RecordNormalizer createDefaultNormalizer(NormalizerConfig config) {
        return new RecordNormalizer(new NormalizationEngine(getCommonRules(), config), config);
    }

    /**
     * Normalizer that also strips company legal suffixes and a leading "The"
     * for records in the {@code company} category.
     */
    public static RecordNormalizer createCompanyNormalizer(NormalizerConfig config) {
        List<NormalizationRule> rules = new ArrayList<>(getCommonRules());
        rules.addAll(getLegalSuffixRules());
        return new RecordNormalizer(new NormalizationEngine(rules, config), config);
    }

    /**
     * Rules applied to every value regardless of category.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("common-ampersand")
                        .pattern("\\s*&\\s*")
                        .replacement(" and ")
                        .priority(50)
                        .build(),

                // Curly quotes and dashes would otherwise survive punctuation stripping
                NormalizationRule.builder()
                        .name("common-typographic-punctuation")
                        .pattern("[\\u2018\\u2019\\u201C\\u201D\\u2013\\u2014]")
                        .replacement(" ")
                        .priority(60)
                        .build()
        );
    }

    /**
     * Company legal-form suffixes, scoped to the {@code company} category.
     */
    public static List<NormalizationRule> getLegalSuffixRules() {
        return List.of(
                suffix("company-inc", "(Inc\\.?|Incorporated)"),
                suffix("company-corp", "(Corp\\.?|Corporation)"),
                suffix("company-ltd", "(Ltd\\.?|Limited)"),
                suffix("company-llc", "(LLC|L\\.L\\.C\\.)"),
                suffix("company-plc", "(PLC|P\\.L\\.C\\.)"),
                suffix("company-gmbh", "GmbH"),
                suffix("company-ag", "AG"),
                suffix("company-sa", "S\\.?A\\.?"),
                suffix("company-nv", "N\\.?V\\.?"),
                NormalizationRule.builder()
                        .name("company-the")
                        .pattern("^The\\s+")
                        .replacement("")
                        .categories("company")
                        .priority(20)
                        .build()
        );
    }

    private static NormalizationRule suffix(String name, String form) {
        return NormalizationRule.builder()
                .name(name)
                .pattern(",?\\s+" + form + "$")
                .replacement("")
                .categories("company")
                .priority(10)
                .build();
    }
}
