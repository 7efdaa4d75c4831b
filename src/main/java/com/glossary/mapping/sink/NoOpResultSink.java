package com.glossary.mapping.sink;

import com.glossary.mapping.core.model.MappingResult;

import java.util.List;

/**
 * Accepts and discards results. Default sink when the caller consumes
 * {@code BatchResult} directly.
 */
public class NoOpResultSink implements ResultSink {

    @Override
    public boolean store(List<MappingResult> results) {
        return true;
    }
}
