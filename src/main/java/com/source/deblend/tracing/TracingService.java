package com.source.deblend.tracing;

/**
 * Interface for distributed tracing integration.
 * The default {@link NoOpTracingService} does nothing, so the library works
 * without any tracing dependencies on the classpath.
 */
public interface TracingService {

    /**
     * Starts the span covering one pass over a catalog.
     */
    Span startRunSpan(String runId, int sourceCount);

    /**
     * Starts the span covering the deblend of one parent source.
     */
    Span startSourceSpan(long sourceId, int peakCount);
}
