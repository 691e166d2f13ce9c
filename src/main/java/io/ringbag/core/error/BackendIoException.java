package io.ringbag.core.error;

import java.io.IOException;

/**
 * Storage failure while a backend was writing, reading or closing.
 */
public class BackendIoException extends BagException {

    public BackendIoException(final String message, final IOException cause) {
        super(message, cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
