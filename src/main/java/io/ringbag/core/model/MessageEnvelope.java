package io.ringbag.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * The framing unit recorded per message: topic, type, format, receive time and an opaque payload.
 * <p>
 * The payload is copied on the way in and on the way out, so an envelope handed to a writer can never
 * be changed through the caller's buffer.
 */
public final class MessageEnvelope {
    private final String topicName;
    private final String typeIdentifier;
    private final String serializationFormat;
    private final byte[] payload;
    private final long receiveTimestamp;

    public MessageEnvelope(final String topicName,
                           final String typeIdentifier,
                           final String serializationFormat,
                           final byte[] payload,
                           final long receiveTimestamp) {
        this.topicName = Objects.requireNonNull(topicName, "topicName");
        this.typeIdentifier = Objects.requireNonNull(typeIdentifier, "typeIdentifier");
        this.serializationFormat = Objects.requireNonNull(serializationFormat, "serializationFormat");
        this.payload = Objects.requireNonNull(payload, "payload").clone();
        this.receiveTimestamp = receiveTimestamp;
    }

    public static MessageEnvelope of(final TopicDescriptor topic, final byte[] payload, final long receiveTimestamp) {
        return new MessageEnvelope(topic.name(), topic.typeIdentifier(), topic.serializationFormat(),
                payload, receiveTimestamp);
    }

    public String topicName() {
        return topicName;
    }

    public String typeIdentifier() {
        return typeIdentifier;
    }

    public String serializationFormat() {
        return serializationFormat;
    }

    /**
     * @return a copy of the payload bytes
     */
    public byte[] payload() {
        return payload.clone();
    }

    public long receiveTimestamp() {
        return receiveTimestamp;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageEnvelope other)) return false;
        return receiveTimestamp == other.receiveTimestamp
                && topicName.equals(other.topicName)
                && typeIdentifier.equals(other.typeIdentifier)
                && serializationFormat.equals(other.serializationFormat)
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(topicName, typeIdentifier, serializationFormat, receiveTimestamp);
        return 31 * h + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "MessageEnvelope{" +
                "topic=" + topicName +
                ", type=" + typeIdentifier +
                ", format=" + serializationFormat +
                ", payloadBytes=" + payload.length +
                ", receiveTimestamp=" + receiveTimestamp +
                '}';
    }
}
