package io.ringbag.core.error;

/**
 * Root of every failure reported by the bag session engine.
 */
public class BagException extends RuntimeException {

    public BagException(final String message) {
        super(message);
    }

    public BagException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
