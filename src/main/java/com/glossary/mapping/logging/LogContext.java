package com.glossary.mapping.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * MDC scope for structured logging. Entries are added on creation and removed on close:
 * <pre>
 * try (LogContext ctx = LogContext.forRecord(batchId, record.getSourceId())) {
 *     log.debug("mapping.record status={}", result.status());
 * }
 * </pre>
 *
 * <p>Worker threads open their own record scope, so the batch id is passed in explicitly
 * rather than inherited from the submitting thread.</p>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forBatch(String batchId, long generationId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("generation", Long.toString(generationId));
        ctx.put("operation", "map-batch");
        return ctx;
    }

    public static LogContext forRecord(String batchId, String sourceId) {
        LogContext ctx = new LogContext();
        if (batchId != null) {
            ctx.put("batchId", batchId);
        }
        ctx.put("sourceId", sourceId);
        ctx.put("operation", "map-record");
        return ctx;
    }

    public static LogContext forReload(String sourceName) {
        LogContext ctx = new LogContext();
        ctx.put("glossarySource", sourceName);
        ctx.put("operation", "reload");
        return ctx;
    }

    public static String generateBatchId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
