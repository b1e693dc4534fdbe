package com.source.deblend.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and, on close, restores whatever value each key
 * held before, so a nested context never strips keys owned by an enclosing one.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forSource(runId, source.getId())) {
 *     log.debug("Parent {}: deblending {} peaks", source.getId(), peakCount);
 * } // MDC entries are cleared here
 * </pre>
 */
public class LogContext implements AutoCloseable {

    // key -> value before this context wrote it (null if absent)
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context spanning one deblend run over a catalog.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "deblend");
        return ctx;
    }

    /**
     * Creates a log context for the processing of one parent source.
     * Carries the run id as well, since worker threads do not inherit MDC.
     */
    public static LogContext forSource(String runId, long sourceId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("sourceId", Long.toString(sourceId));
        return ctx;
    }

    /**
     * Generates a unique run id.
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (Map.Entry<String, String> entry : previous.entrySet()) {
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
        previous.clear();
    }
}
