package io.ringbag.codec;

/**
 * Turns domain messages into the opaque payload bytes a bag records, and back.
 *
 * @param <T> domain message type
 */
public interface MessageCodec<T> {

    /**
     * Format tag stored with every envelope this codec produces, e.g. {@code proto3}.
     */
    String serializationFormat();

    /**
     * Type identifier of a message, as recorded in the topic descriptor.
     */
    String typeIdentifier(T message);

    byte[] serialize(T message);

    /**
     * @throws CodecException if the bytes are not a valid message of the given type
     */
    T deserialize(byte[] data, String typeIdentifier);
}
