package com.glossary.mapping.source;

/**
 * Thrown when a {@link GlossarySource} cannot produce its entities.
 */
public class GlossaryLoadException extends RuntimeException {

    public GlossaryLoadException(String message) {
        super(message);
    }

    public GlossaryLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
