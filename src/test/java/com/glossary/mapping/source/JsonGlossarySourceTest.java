package com.glossary.mapping.source;

import com.glossary.mapping.core.model.ReferenceEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.glossary.mapping.GlossaryFixtures.company;
import static org.junit.jupiter.api.Assertions.*;

class JsonGlossarySourceTest {

    @TempDir
    Path tempDir;

    private Path write(String json) throws IOException {
        Path file = tempDir.resolve("glossary.json");
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    @DisplayName("Should read the bundled sample glossary")
    void readSample() throws IOException {
        JsonGlossarySource source = new JsonGlossarySource(tempDir.resolve("unused.json"));
        try (InputStream in = getClass().getResourceAsStream("/glossary/rdg-sample.json")) {
            assertNotNull(in);
            List<ReferenceEntity> entities = source.read(in);

            assertEquals(6, entities.size());
            ReferenceEntity globex = entities.get(1);
            assertEquals("RDG-002", globex.getId());
            assertEquals(List.of("Globex Corp", "GBX"), globex.getAttribute("aliases"));
            assertEquals("company", entities.get(5).getAttribute("category"));
        }
    }

    @Test
    @DisplayName("Should load entries from a file and ignore unknown fields")
    void loadFromFile() throws IOException {
        Path file = write("""
                [
                  {"id": "RDG-1", "attributes": {"name": "Acme Corporation", "category": "company"}, "owner": "ops"},
                  {"id": "RDG-2"}
                ]
                """);

        List<ReferenceEntity> entities = new JsonGlossarySource(file).loadGlossary();

        assertEquals(2, entities.size());
        assertEquals(company("RDG-1", "Acme Corporation").getAttributes(), entities.get(0).getAttributes());
        assertTrue(entities.get(1).getAttributes().isEmpty());
    }

    @Test
    @DisplayName("Should re-read the file on every load")
    void rereadOnLoad() throws IOException {
        Path file = write("[{\"id\": \"RDG-1\", \"attributes\": {\"name\": \"Acme\"}}]");
        JsonGlossarySource source = new JsonGlossarySource(file);
        assertEquals(1, source.loadGlossary().size());

        write("[{\"id\": \"RDG-1\", \"attributes\": {\"name\": \"Acme\"}},"
                + " {\"id\": \"RDG-2\", \"attributes\": {\"name\": \"Globex\"}}]");

        assertEquals(2, source.loadGlossary().size());
    }

    @Test
    @DisplayName("Malformed JSON should raise GlossaryLoadException")
    void malformedJson() throws IOException {
        Path file = write("[{\"id\": \"RDG-1\", ");

        GlossaryLoadException e = assertThrows(GlossaryLoadException.class,
                () -> new JsonGlossarySource(file).loadGlossary());
        assertTrue(e.getMessage().startsWith("Malformed glossary JSON"));
        assertNotNull(e.getCause());
    }

    @Test
    @DisplayName("An entry without an id should be rejected")
    void missingId() throws IOException {
        Path file = write("[{\"id\": \"RDG-1\"}, {\"attributes\": {\"name\": \"Nameless\"}}]");

        GlossaryLoadException e = assertThrows(GlossaryLoadException.class,
                () -> new JsonGlossarySource(file).loadGlossary());
        assertEquals("Glossary entry 1 has no id", e.getMessage());
    }

    @Test
    @DisplayName("A null document should be rejected")
    void nullDocument() throws IOException {
        Path file = write("null");

        GlossaryLoadException e = assertThrows(GlossaryLoadException.class,
                () -> new JsonGlossarySource(file).loadGlossary());
        assertEquals("Glossary document is null", e.getMessage());
    }

    @Test
    @DisplayName("A missing file should raise GlossaryLoadException")
    void missingFile() {
        Path missing = tempDir.resolve("absent.json");

        GlossaryLoadException e = assertThrows(GlossaryLoadException.class,
                () -> new JsonGlossarySource(missing).loadGlossary());
        assertTrue(e.getMessage().startsWith("Cannot read glossary file"));
    }

    @Test
    @DisplayName("Name should identify the file")
    void name() {
        assertEquals("json:glossary.json", new JsonGlossarySource(tempDir.resolve("glossary.json")).getName());
    }

    @Test
    @DisplayName("In-memory source should serve replaced entities")
    void inMemorySource() {
        InMemoryGlossarySource source = new InMemoryGlossarySource(List.of(company("RDG-1", "Acme")));
        assertEquals(1, source.loadGlossary().size());

        source.replace(List.of(company("RDG-1", "Acme"), company("RDG-2", "Globex")));

        assertEquals(2, source.loadGlossary().size());
        assertEquals("in-memory", source.getName());
    }
}
