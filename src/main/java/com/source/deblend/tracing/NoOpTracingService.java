package com.source.deblend.tracing;

/**
 * No-op implementation of {@link TracingService}; every span is a shared do-nothing instance.
 */
public class NoOpTracingService implements TracingService {

    private static final Span NO_OP_SPAN = new NoOpSpan();

    @Override
    public Span startRunSpan(String runId, int sourceCount) {
        return NO_OP_SPAN;
    }

    @Override
    public Span startSourceSpan(long sourceId, int peakCount) {
        return NO_OP_SPAN;
    }

    private static class NoOpSpan implements Span {
        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void markSucceeded() {
        }

        @Override
        public void markFailed(Throwable cause) {
        }

        @Override
        public void close() {
        }
    }
}
