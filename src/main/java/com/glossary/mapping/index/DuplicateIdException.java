package com.glossary.mapping.index;

/**
 * Thrown when a glossary contains two entities with the same id.
 * Fatal to the reload attempt; the previously active snapshot stays in place.
 */
public class DuplicateIdException extends RuntimeException {

    private final String duplicateId;

    public DuplicateIdException(String duplicateId) {
        super("Duplicate glossary id: " + duplicateId);
        this.duplicateId = duplicateId;
    }

    public String getDuplicateId() {
        return duplicateId;
    }
}
