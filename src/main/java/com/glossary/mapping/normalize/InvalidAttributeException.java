package com.glossary.mapping.normalize;

/**
 * Thrown when a required attribute is absent or blank.
 * Fatal to the record being mapped, or to the whole reload when raised by a glossary entity.
 */
public class InvalidAttributeException extends RuntimeException {

    private final String attributeName;

    public InvalidAttributeException(String attributeName, String message) {
        super(message);
        this.attributeName = attributeName;
    }

    public InvalidAttributeException(String attributeName, String message, Throwable cause) {
        super(message, cause);
        this.attributeName = attributeName;
    }

    public String getAttributeName() {
        return attributeName;
    }
}
