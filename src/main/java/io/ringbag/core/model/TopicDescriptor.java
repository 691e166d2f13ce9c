package io.ringbag.core.model;

import java.util.Objects;

/**
 * Binding of a topic name to the type and serialization format of every message recorded on it.
 */
public record TopicDescriptor(String name, String typeIdentifier, String serializationFormat) {

    public TopicDescriptor {
        requireText(name, "name");
        requireText(typeIdentifier, "typeIdentifier");
        requireText(serializationFormat, "serializationFormat");
    }

    /**
     * True when this descriptor declares the given type and format.
     */
    public boolean declares(final String type, final String format) {
        return typeIdentifier.equals(type) && serializationFormat.equals(format);
    }

    private static void requireText(final String value, final String field) {
        Objects.requireNonNull(value, field);
        if (value.isBlank()) throw new IllegalArgumentException(field + " must not be blank");
    }
}
