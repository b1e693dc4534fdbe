package com.source.deblend.deblender;

/**
 * Runtime exception thrown by a {@link Deblender} that cannot split a footprint.
 */
public class DeblendException extends RuntimeException {

    public DeblendException(String message) {
        super(message);
    }

    public DeblendException(String message, Throwable cause) {
        super(message, cause);
    }
}
