package io.ringbag.codec;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import lombok.NonNull;

import java.util.HashMap;
import java.util.Map;

/**
 * Codec for Protobuf messages. Type identifiers are full descriptor names such as
 * {@code google.protobuf.DoubleValue}; decoding needs a registered prototype for the type.
 */
public final class ProtobufCodec implements MessageCodec<Message> {
    public static final String FORMAT = "proto3";

    private final Map<String, Message> prototypes;

    private ProtobufCodec(final Map<String, Message> prototypes) {
        this.prototypes = Map.copyOf(prototypes);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String serializationFormat() {
        return FORMAT;
    }

    @Override
    public String typeIdentifier(@NonNull final Message message) {
        return message.getDescriptorForType().getFullName();
    }

    @Override
    public byte[] serialize(@NonNull final Message message) {
        return message.toByteArray();
    }

    @Override
    public Message deserialize(@NonNull final byte[] data, @NonNull final String typeIdentifier) {
        final Message prototype = prototypes.get(typeIdentifier);
        if (prototype == null) throw new CodecException("No Protobuf prototype registered for " + typeIdentifier);

        try {
            return prototype.getParserForType().parseFrom(data);
        } catch (final InvalidProtocolBufferException e) {
            throw new CodecException("Payload is not a valid " + typeIdentifier, e);
        }
    }

    /**
     * Typed variant of {@link #deserialize(byte[], String)}.
     */
    public <M extends Message> M deserialize(final byte[] data, final String typeIdentifier, final Class<M> type) {
        final Message decoded = deserialize(data, typeIdentifier);
        if (!type.isInstance(decoded)) {
            throw new CodecException(typeIdentifier + " decodes to " + decoded.getClass().getName() + ", not " + type.getName());
        }
        return type.cast(decoded);
    }

    public static final class Builder {
        private final Map<String, Message> map = new HashMap<>();

        public Builder register(final Message prototype) {
            map.put(prototype.getDescriptorForType().getFullName(), prototype.getDefaultInstanceForType());
            return this;
        }

        public ProtobufCodec build() {
            return new ProtobufCodec(map);
        }
    }
}
