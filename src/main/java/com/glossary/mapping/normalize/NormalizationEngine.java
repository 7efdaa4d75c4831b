package com.glossary.mapping.normalize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes single attribute values.
 *
 * <p>Rules run in priority order (lower number first), then the value is lowercased,
 * configured punctuation is replaced by whitespace, whitespace is collapsed and the
 * result trimmed. With token sorting enabled the words are finally sorted.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<NormalizationRule> rules;
    private final Pattern punctuation;
    private final boolean sortTokens;

    public NormalizationEngine(List<NormalizationRule> rules, NormalizerConfig config) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        this.rules = List.copyOf(sorted);
        this.punctuation = compilePunctuation(config.punctuation());
        this.sortTokens = config.sortTokens();
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Canonicalizes one value. Blank input yields the empty string.
     */
    public String canonicalize(String value, String category) {
        if (value == null || value.isBlank()) {
            return "";
        }

        String result = value;
        for (NormalizationRule rule : rules) {
            if (rule.appliesTo(category)) {
                String before = result;
                result = rule.apply(result);
                if (!before.equals(result)) {
                    log.trace("Rule '{}' rewrote '{}' -> '{}'", rule.getName(), before, result);
                }
            }
        }

        result = result.toLowerCase(Locale.ROOT);
        if (punctuation != null) {
            result = punctuation.matcher(result).replaceAll(" ");
        }
        result = WHITESPACE.matcher(result.trim()).replaceAll(" ");

        if (sortTokens && result.indexOf(' ') > 0) {
            String[] tokens = result.split(" ");
            Arrays.sort(tokens);
            result = String.join(" ", tokens);
        }
        return result;
    }

    private static Pattern compilePunctuation(String chars) {
        if (chars == null || chars.isEmpty()) {
            return null;
        }
        StringBuilder cls = new StringBuilder("[");
        chars.codePoints().forEach(cp -> {
            if (!Character.isLetterOrDigit(cp)) {
                cls.append('\\');
            }
            cls.appendCodePoint(cp);
        });
        cls.append(']');
        return Pattern.compile(cls.toString());
    }
}
