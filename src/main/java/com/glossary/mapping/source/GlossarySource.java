package com.glossary.mapping.source;

import com.glossary.mapping.core.model.ReferenceEntity;

import java.util.List;

/**
 * Supplies the complete glossary. Every call returns a full snapshot, never a delta.
 */
public interface GlossarySource {

    /**
     * @return all reference entities, un-normalized
     * @throws GlossaryLoadException if the glossary cannot be read
     */
    List<ReferenceEntity> loadGlossary();

    /**
     * Short name used in logs and traces.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
