package io.ringbag.core.error;

public class EndOfBagException extends BagException {

    public EndOfBagException(final String location) {
        super("No more messages in bag " + location);
    }
}
