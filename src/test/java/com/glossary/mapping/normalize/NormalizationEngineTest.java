package com.glossary.mapping.normalize;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;
    private NormalizationEngine companyEngine;

    @BeforeEach
    void setUp() {
        NormalizerConfig config = NormalizerConfig.defaults();
        engine = new NormalizationEngine(DefaultNormalizationRules.getCommonRules(), config);
        companyEngine = new NormalizationEngine(companyRules(), config);
    }

    private static List<NormalizationRule> companyRules() {
        List<NormalizationRule> rules = new ArrayList<>(DefaultNormalizationRules.getCommonRules());
        rules.addAll(DefaultNormalizationRules.getLegalSuffixRules());
        return rules;
    }

    @Test
    @DisplayName("Should handle null and blank inputs")
    void testNullAndBlankInputs() {
        assertEquals("", engine.canonicalize(null, null));
        assertEquals("", engine.canonicalize("", null));
        assertEquals("", engine.canonicalize("   ", "company"));
    }

    @ParameterizedTest
    @DisplayName("Should lowercase, strip punctuation and collapse whitespace")
    @CsvSource({
            "ACME Corp.,acme corp",
            "'  Acme   Corporation ',acme corporation",
            "O'Brien-Smith,o brien smith",
            "A.C.M.E.,a c m e",
            "Globex (Holdings),globex holdings",
            "'Initech\tSystems',initech systems"
    })
    void testCanonicalCleanup(String input, String expected) {
        assertEquals(expected, engine.canonicalize(input, null));
    }

    @Test
    @DisplayName("Should rewrite ampersand to 'and'")
    void testAmpersand() {
        assertEquals("procter and gamble", engine.canonicalize("Procter & Gamble", null));
        assertEquals("procter and gamble", engine.canonicalize("Procter&Gamble", null));
    }

    @Test
    @DisplayName("Should treat typographic quotes and dashes as separators")
    void testTypographicPunctuation() {
        assertEquals("acme widgets", engine.canonicalize("Acme\u2014Widgets", null));
        assertEquals("acme s", engine.canonicalize("Acme’s", null));
    }

    @ParameterizedTest
    @DisplayName("Should strip legal suffixes for the company category")
    @CsvSource({
            "Acme Corp.,acme",
            "Acme Corporation,acme",
            "'Initech, Inc.',initech",
            "Globex LLC,globex",
            "Siemens AG,siemens",
            "Renault S.A.,renault",
            "Umbrella Ltd,umbrella"
    })
    void testCompanySuffixes(String input, String expected) {
        assertEquals(expected, companyEngine.canonicalize(input, "company"));
    }

    @Test
    @DisplayName("Should apply category-scoped rules only to their category")
    void testCategoryScope() {
        assertEquals("acme corp", companyEngine.canonicalize("Acme Corp.", null));
        assertEquals("acme corp", companyEngine.canonicalize("Acme Corp.", "person"));
        assertEquals("acme", companyEngine.canonicalize("Acme Corp.", "COMPANY"));
    }

    @Test
    @DisplayName("Should remove leading 'The' after suffix removal")
    void testThePrefix() {
        assertEquals("globex", companyEngine.canonicalize("The Globex Corporation", "company"));
    }

    @Test
    @DisplayName("Should run rules in priority order")
    void testPriorityOrder() {
        NormalizationRule late = NormalizationRule.builder()
                .name("late").pattern("beta").replacement("gamma").priority(200).build();
        NormalizationRule early = NormalizationRule.builder()
                .name("early").pattern("alpha").replacement("beta").priority(1).build();
        NormalizationEngine ordered = new NormalizationEngine(List.of(late, early), NormalizerConfig.defaults());

        assertEquals("gamma", ordered.canonicalize("alpha", null));
        assertEquals("early", ordered.getRules().get(0).getName());
    }

    @Test
    @DisplayName("Should sort tokens when configured")
    void testSortTokens() {
        NormalizationEngine sorting = new NormalizationEngine(List.of(),
                NormalizerConfig.defaults().withSortTokens(true));

        assertEquals("industries stark", sorting.canonicalize("Stark Industries", null));
        assertEquals("industries stark", sorting.canonicalize("Industries, Stark", null));
    }

    @Test
    @DisplayName("Should be idempotent")
    void testIdempotent() {
        String once = companyEngine.canonicalize("The  ACME & Sons, Inc.", "company");
        assertEquals(once, companyEngine.canonicalize(once, "company"));
    }
}
