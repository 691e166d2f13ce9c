package io.ringbag.core.error;

/**
 * Operation invoked while the session is not in the state it needs, e.g. write before open.
 */
public class SessionStateException extends BagException {

    public SessionStateException(final String message) {
        super(message);
    }
}
