package com.glossary.mapping.api;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for a batch. Once cancelled the engine schedules no further
 * records; records already in flight complete and are emitted.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
