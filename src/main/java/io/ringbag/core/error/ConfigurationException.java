package io.ringbag.core.error;

/**
 * Unknown backend identifier, bad option value, or a location that cannot be opened in the requested mode.
 */
public class ConfigurationException extends BagException {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
