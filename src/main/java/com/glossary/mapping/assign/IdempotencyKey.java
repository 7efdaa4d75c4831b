package com.glossary.mapping.assign;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Identifies one logical mapping request: the same record content, from the same source id,
 * against the same glossary generation.
 *
 * @param sourceId     feed-local record id
 * @param contentHash  hex SHA-256 of the canonical attributes and category
 * @param generationId glossary generation
 */
public record IdempotencyKey(String sourceId, String contentHash, long generationId) {

    public IdempotencyKey {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(contentHash, "contentHash is required");
    }

    /**
     * Derives a key from canonical attribute values. Attribute order never affects the hash.
     */
    public static IdempotencyKey of(String sourceId, Map<String, String> normalizedAttributes,
                                    String category, long generationId) {
        Hasher hasher = Hashing.sha256().newHasher();
        new TreeMap<>(normalizedAttributes).forEach((name, value) -> {
            hasher.putString(name, StandardCharsets.UTF_8).putByte((byte) 0x1f);
            hasher.putString(value, StandardCharsets.UTF_8).putByte((byte) 0x1e);
        });
        hasher.putByte((byte) 0x1d);
        if (category != null) {
            hasher.putString(category, StandardCharsets.UTF_8);
        }
        return new IdempotencyKey(sourceId, hasher.hash().toString(), generationId);
    }

    /**
     * Flat form used as lock key.
     */
    public String asString() {
        return sourceId + '|' + contentHash + '|' + generationId;
    }
}
