package com.source.deblend.tracing;

/**
 * A traced unit of deblending work: a whole run or one parent source.
 * Closing the span ends it, so spans fit try-with-resources blocks.
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, long value);

    /**
     * Ends the unit with an OK status.
     */
    void markSucceeded();

    /**
     * Ends the unit with an ERROR status and attaches {@code cause}.
     */
    void markFailed(Throwable cause);

    @Override
    void close();
}
