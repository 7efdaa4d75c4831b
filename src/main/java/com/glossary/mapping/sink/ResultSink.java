package com.glossary.mapping.sink;

import com.glossary.mapping.core.model.MappingResult;

import java.util.List;

/**
 * Durable destination for mapping results. The engine emits each batch's results once,
 * in input order, under the configured sink timeout.
 *
 * <p>When the timeout expires the calling thread is interrupted and the batch is reported
 * unmatched. Implementations must stop and store nothing once interrupted; a sink that
 * ignores the interrupt may still store the original results after the engine has
 * reported them unmatched.</p>
 */
public interface ResultSink {

    /**
     * @return true if the results were durably stored
     */
    boolean store(List<MappingResult> results);
}
