package com.glossary.mapping.index;

/**
 * Thrown when an index build is given zero entities.
 * Fatal to the reload attempt; the previously active snapshot stays in place.
 */
public class EmptyGlossaryException extends RuntimeException {

    public EmptyGlossaryException(String message) {
        super(message);
    }
}
