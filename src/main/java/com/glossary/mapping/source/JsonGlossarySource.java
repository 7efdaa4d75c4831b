package com.glossary.mapping.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.glossary.mapping.core.model.ReferenceEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the glossary from a JSON file, re-read on every load.
 *
 * <p>Expected format:</p>
 * <pre>
 * [
 *   {"id": "RDG-001", "attributes": {"name": "Acme Corporation", "category": "company"}},
 *   {"id": "RDG-002", "attributes": {"name": "Globex", "aliases": ["Globex Corp", "GBX"]}}
 * ]
 * </pre>
 *
 * <p>Unknown top-level fields are ignored. Attribute values may be strings, numbers,
 * booleans or arrays of those.</p>
 */
public class JsonGlossarySource implements GlossarySource {
    private static final Logger log = LoggerFactory.getLogger(JsonGlossarySource.class);
    private static final TypeReference<List<GlossaryEntry>> ENTRIES = new TypeReference<>() {
    };

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonGlossarySource(Path path) {
        this(path, new ObjectMapper());
    }

    public JsonGlossarySource(Path path, ObjectMapper objectMapper) {
        this.path = Objects.requireNonNull(path, "path is required");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    }

    @Override
    public List<ReferenceEntity> loadGlossary() {
        try (InputStream in = Files.newInputStream(path)) {
            List<ReferenceEntity> entities = read(in);
            log.debug("glossary.read path={} entities={}", path, entities.size());
            return entities;
        } catch (JacksonException e) {
            throw new GlossaryLoadException("Malformed glossary JSON in " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new GlossaryLoadException("Cannot read glossary file " + path, e);
        }
    }

    /**
     * Parses a glossary document from a stream.
     */
    public List<ReferenceEntity> read(InputStream in) throws IOException {
        List<GlossaryEntry> entries = objectMapper.readValue(in, ENTRIES);
        if (entries == null) {
            throw new GlossaryLoadException("Glossary document is null");
        }
        List<ReferenceEntity> entities = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            GlossaryEntry entry = entries.get(i);
            if (entry == null || entry.id() == null || entry.id().isBlank()) {
                throw new GlossaryLoadException("Glossary entry " + i + " has no id");
            }
            entities.add(ReferenceEntity.of(entry.id(), entry.attributes() != null ? entry.attributes() : Map.of()));
        }
        return entities;
    }

    @Override
    public String getName() {
        return "json:" + path.getFileName();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GlossaryEntry(String id, Map<String, Object> attributes) {
    }
}
