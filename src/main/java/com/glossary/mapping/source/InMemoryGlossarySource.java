package com.glossary.mapping.source;

import com.glossary.mapping.core.model.ReferenceEntity;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the glossary in memory. {@link #replace(List)} swaps the content returned by
 * the next load, which is how embedding applications and tests stage a reload.
 */
public class InMemoryGlossarySource implements GlossarySource {

    private final AtomicReference<List<ReferenceEntity>> entities;

    public InMemoryGlossarySource(List<ReferenceEntity> entities) {
        this.entities = new AtomicReference<>(List.copyOf(entities));
    }

    public void replace(List<ReferenceEntity> newEntities) {
        entities.set(List.copyOf(newEntities));
    }

    @Override
    public List<ReferenceEntity> loadGlossary() {
        return entities.get();
    }

    @Override
    public String getName() {
        return "in-memory";
    }
}
