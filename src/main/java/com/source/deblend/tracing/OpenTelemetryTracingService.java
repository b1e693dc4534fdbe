package com.source.deblend.tracing;

import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * OpenTelemetry-based implementation of {@link TracingService}.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 *
 * <p>Run spans are named {@code deblend.run}, per-source spans {@code deblend.source}.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String RUN_SPAN = "deblend.run";
    static final String SOURCE_SPAN = "deblend.source";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startRunSpan(String runId, int sourceCount) {
        io.opentelemetry.api.trace.Span otelSpan = tracer.spanBuilder(RUN_SPAN)
                .setAttribute("runId", runId)
                .setAttribute("sources", (long) sourceCount)
                .startSpan();
        return new OTelSpanAdapter(otelSpan);
    }

    @Override
    public Span startSourceSpan(long sourceId, int peakCount) {
        io.opentelemetry.api.trace.Span otelSpan = tracer.spanBuilder(SOURCE_SPAN)
                .setAttribute("sourceId", sourceId)
                .setAttribute("peaks", (long) peakCount)
                .startSpan();
        return new OTelSpanAdapter(otelSpan);
    }

    private static class OTelSpanAdapter implements Span {

        private final io.opentelemetry.api.trace.Span otelSpan;

        OTelSpanAdapter(io.opentelemetry.api.trace.Span otelSpan) {
            this.otelSpan = otelSpan;
        }

        @Override
        public void setAttribute(String key, long value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void markSucceeded() {
            otelSpan.setStatus(StatusCode.OK);
        }

        @Override
        public void markFailed(Throwable cause) {
            otelSpan.setStatus(StatusCode.ERROR);
            otelSpan.recordException(cause);
        }

        @Override
        public void close() {
            otelSpan.end();
        }
    }
}
