package com.glossary.mapping.normalize;

import com.glossary.mapping.core.model.ReferenceEntity;
import com.glossary.mapping.core.model.SourceRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns attribute maps into comparable canonical forms.
 *
 * <p>The normalized key is the canonical values of the configured key attributes,
 * joined by a single space in configuration order. Multi-valued attributes are
 * canonicalized element-wise and sorted before joining, so element order in the
 * source never changes the key. The same instance normalizes both glossary entities
 * and incoming records, which keeps both sides comparable.</p>
 *
 * <p>Pure and thread-safe.</p>
 */
public class RecordNormalizer {

    private final NormalizationEngine engine;
    private final NormalizerConfig config;

    public RecordNormalizer(NormalizationEngine engine, NormalizerConfig config) {
        this.engine = Objects.requireNonNull(engine, "engine is required");
        this.config = Objects.requireNonNull(config, "config is required");
    }

    public NormalizerConfig getConfig() {
        return config;
    }

    public List<String> getKeyAttributes() {
        return config.keyAttributes();
    }

    /**
     * Computes the normalized key of an attribute map.
     *
     * @throws InvalidAttributeException if a key attribute is absent or blank
     */
    public String normalize(Map<String, ?> attributes, String category) {
        Map<String, ?> attrs = attributes != null ? attributes : Map.of();
        List<String> parts = new ArrayList<>(config.keyAttributes().size());
        for (String name : config.keyAttributes()) {
            Object raw = attrs.get(name);
            if (isBlank(raw)) {
                throw new InvalidAttributeException(name, "Required attribute '" + name + "' is missing or blank");
            }
            String canonical = canonicalValue(raw, category);
            if (!canonical.isEmpty()) {
                parts.add(canonical);
            }
        }
        return String.join(" ", parts);
    }

    /**
     * Computes and caches the normalized key of a source record.
     */
    public String normalize(SourceRecord record) {
        return record.getNormalizedKey().orElseGet(() -> {
            String key = normalize(record.getAttributes(), categoryOf(record));
            record.cacheNormalizedKey(key);
            return key;
        });
    }

    /**
     * Canonicalizes every non-blank attribute, keeping attribute order.
     */
    public Map<String, String> normalizeAttributes(Map<String, ?> attributes, String category) {
        Map<String, String> result = new LinkedHashMap<>();
        if (attributes == null) {
            return result;
        }
        for (Map.Entry<String, ?> entry : attributes.entrySet()) {
            if (!isBlank(entry.getValue())) {
                result.put(entry.getKey(), canonicalValue(entry.getValue(), category));
            }
        }
        return result;
    }

    /**
     * Attaches the normalized key and per-attribute canonical values to a glossary entity.
     *
     * @throws InvalidAttributeException if the entity lacks a key attribute
     */
    public ReferenceEntity normalize(ReferenceEntity entity) {
        String category = stringOrNull(entity.getAttribute(config.categoryAttribute()));
        String key = normalize(entity.getAttributes(), category);
        return entity.withNormalization(key, normalizeAttributes(entity.getAttributes(), category));
    }

    /**
     * The explicit record category, else the value of the configured category attribute.
     */
    public String categoryOf(SourceRecord record) {
        if (record.getCategory() != null) {
            return record.getCategory();
        }
        return stringOrNull(record.getAttributes().get(config.categoryAttribute()));
    }

    private String canonicalValue(Object raw, String category) {
        if (raw instanceof Collection<?> values) {
            List<String> canonical = new ArrayList<>(values.size());
            for (Object value : values) {
                if (!isBlank(value)) {
                    String c = engine.canonicalize(String.valueOf(value), category);
                    if (!c.isEmpty()) {
                        canonical.add(c);
                    }
                }
            }
            canonical.sort(null);
            return String.join(" ", canonical);
        }
        return engine.canonicalize(String.valueOf(raw), category);
    }

    private static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Collection<?> values) {
            return values.stream().allMatch(RecordNormalizer::isBlank);
        }
        return String.valueOf(value).isBlank();
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
