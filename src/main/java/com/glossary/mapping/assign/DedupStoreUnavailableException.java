package com.glossary.mapping.assign;

/**
 * The duplicate-suppression store cannot be reached. Never fatal: affected records are
 * mapped anyway and flagged as degraded.
 */
public class DedupStoreUnavailableException extends RuntimeException {

    public DedupStoreUnavailableException(String message) {
        super(message);
    }

    public DedupStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
