package com.glossary.mapping.sink;

import com.glossary.mapping.core.model.MappingResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects every stored result in memory, in emission order.
 * Intended for embedding and tests.
 */
public class InMemoryResultSink implements ResultSink {

    private final List<MappingResult> results = new ArrayList<>();
    private int batches;

    @Override
    public synchronized boolean store(List<MappingResult> batch) {
        results.addAll(batch);
        batches++;
        return true;
    }

    public synchronized List<MappingResult> getResults() {
        return List.copyOf(results);
    }

    public synchronized int getBatchCount() {
        return batches;
    }

    public synchronized void clear() {
        results.clear();
        batches = 0;
    }
}
