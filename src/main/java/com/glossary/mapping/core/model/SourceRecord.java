package com.glossary.mapping.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A record from a source feed, already preprocessed by the ingestion layer.
 *
 * <p>The {@code sourceId} is feed-local and not assumed to be globally unique.
 * Attribute values are strings, scalars, or collections of scalars for multi-valued
 * attributes. The optional category selects fallback identifiers and category-scoped
 * normalization rules.</p>
 */
public final class SourceRecord {
    private final String sourceId;
    private final Map<String, Object> attributes;
    private final String category;
    private volatile String normalizedKey;

    private SourceRecord(Builder builder) {
        this.sourceId = builder.sourceId;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.category = builder.category;
    }

    public String getSourceId() {
        return sourceId;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public String getCategory() {
        return category;
    }

    /**
     * Returns the cached normalized key, if it has been computed.
     */
    public Optional<String> getNormalizedKey() {
        return Optional.ofNullable(normalizedKey);
    }

    /**
     * Caches the normalized key. The first computed key wins.
     */
    public void cacheNormalizedKey(String key) {
        if (normalizedKey == null) {
            normalizedKey = key;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceRecord that = (SourceRecord) o;
        return sourceId.equals(that.sourceId)
                && attributes.equals(that.attributes)
                && Objects.equals(category, that.category);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, attributes, category);
    }

    @Override
    public String toString() {
        return "SourceRecord{" +
                "sourceId='" + sourceId + '\'' +
                ", category='" + category + '\'' +
                ", attributes=" + attributes +
                '}';
    }

    public static SourceRecord of(String sourceId, Map<String, ?> attributes) {
        return builder().sourceId(sourceId).attributes(attributes).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String sourceId;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private String category;

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder attribute(String name, Object value) {
            this.attributes.put(name, value);
            return this;
        }

        public Builder attributes(Map<String, ?> attributes) {
            if (attributes != null) {
                this.attributes.putAll(attributes);
            }
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public SourceRecord build() {
            Objects.requireNonNull(sourceId, "sourceId is required");
            return new SourceRecord(this);
        }
    }
}
