package com.glossary.mapping.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row of the Reference Data Glossary.
 *
 * <p>Entities are created during a glossary reload and are immutable within the
 * generation that loaded them. The normalized key and per-attribute normalized values
 * are derived by the index build and attached through {@link #withNormalization}.</p>
 */
public final class ReferenceEntity {
    private final String id;
    private final Map<String, Object> attributes;
    private final String normalizedKey;
    private final Map<String, String> normalizedAttributes;

    private ReferenceEntity(Builder builder) {
        this.id = builder.id;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.normalizedKey = builder.normalizedKey;
        this.normalizedAttributes = builder.normalizedAttributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.normalizedAttributes))
                : Map.of();
    }

    public String getId() {
        return id;
    }

    /**
     * Raw attribute values in glossary order.
     */
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object getAttribute(String name) {
        return attributes.get(name);
    }

    /**
     * The canonical key used for exact lookup, or {@code null} before indexing.
     */
    public String getNormalizedKey() {
        return normalizedKey;
    }

    public Map<String, String> getNormalizedAttributes() {
        return normalizedAttributes;
    }

    public boolean isNormalized() {
        return normalizedKey != null;
    }

    /**
     * Returns a copy of this entity carrying the given canonical forms.
     */
    public ReferenceEntity withNormalization(String key, Map<String, String> normalizedValues) {
        return builder()
                .id(id)
                .attributes(attributes)
                .normalizedKey(key)
                .normalizedAttributes(normalizedValues)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReferenceEntity that = (ReferenceEntity) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ReferenceEntity{" +
                "id='" + id + '\'' +
                ", normalizedKey='" + normalizedKey + '\'' +
                ", attributes=" + attributes +
                '}';
    }

    public static ReferenceEntity of(String id, Map<String, ?> attributes) {
        return builder().id(id).attributes(attributes).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private String normalizedKey;
        private Map<String, String> normalizedAttributes;

        public Builder id(String id) {
            this.id = id;
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

        public Builder normalizedKey(String normalizedKey) {
            this.normalizedKey = normalizedKey;
            return this;
        }

        public Builder normalizedAttributes(Map<String, String> normalizedAttributes) {
            this.normalizedAttributes = normalizedAttributes;
            return this;
        }

        public ReferenceEntity build() {
            Objects.requireNonNull(id, "id is required");
            if (id.isBlank()) {
                throw new IllegalArgumentException("id must not be blank");
            }
            return new ReferenceEntity(this);
        }
    }
}
