package com.glossary.mapping.event;

/**
 * Receives one {@link MappingEvent} per record, on the worker thread that mapped it.
 * Implementations must be thread-safe and should return quickly.
 */
@FunctionalInterface
public interface MappingEventListener {

    void onMapping(MappingEvent event);
}
