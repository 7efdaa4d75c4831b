package com.glossary.mapping.tracing;

/**
 * A unit of work in a trace. Ends when closed, so it is used with try-with-resources:
 * <pre>
 * try (Span span = tracingService.startSpan("mapping.record")) {
 *     span.setAttribute("sourceId", record.getSourceId());
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
