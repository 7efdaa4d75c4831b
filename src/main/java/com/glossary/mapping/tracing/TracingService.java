package com.glossary.mapping.tracing;

import java.util.Map;

/**
 * Tracing seam. The engine opens {@code glossary.reload}, {@code mapping.batch} and
 * {@code mapping.record} spans through it; {@link NoOpTracingService} is the default.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
