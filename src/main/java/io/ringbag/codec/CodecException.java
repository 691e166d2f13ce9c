package io.ringbag.codec;

import io.ringbag.core.error.BagException;

/**
 * A message could not be turned into bytes or back.
 */
public class CodecException extends BagException {

    public CodecException(final String message) {
        super(message);
    }

    public CodecException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
