package io.ringbag.storage.frame;

import io.ringbag.core.model.MessageEnvelope;
import io.ringbag.core.model.TopicDescriptor;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Binary layout of the records file backends store. All integers little-endian.
 * <pre>
 * topic   : [kind:byte=1][nLen:int][name][tLen:int][type][fLen:int][format]
 * message : [kind:byte=2][nLen:int][topic][tLen:int][type][fLen:int][format][timestamp:long][pLen:int][payload]
 * </pre>
 */
public final class FrameCodec {

    private FrameCodec() {
    }

    public static byte[] encode(final TopicDescriptor topic) {
        final byte[] name = utf8(topic.name());
        final byte[] type = utf8(topic.typeIdentifier());
        final byte[] format = utf8(topic.serializationFormat());

        final ByteBuffer buf = allocate(1 + 3 * Integer.BYTES + name.length + type.length + format.length);
        buf.put(FrameKind.TOPIC.tag());
        putBytes(buf, name);
        putBytes(buf, type);
        putBytes(buf, format);
        return buf.array();
    }

    public static byte[] encode(final MessageEnvelope envelope) {
        final byte[] topic = utf8(envelope.topicName());
        final byte[] type = utf8(envelope.typeIdentifier());
        final byte[] format = utf8(envelope.serializationFormat());
        final byte[] payload = envelope.payload();

        final int size = 1
                + 4 * Integer.BYTES + Long.BYTES
                + topic.length + type.length + format.length + payload.length;

        final ByteBuffer buf = allocate(size);
        buf.put(FrameKind.MESSAGE.tag());
        putBytes(buf, topic);
        putBytes(buf, type);
        putBytes(buf, format);
        buf.putLong(envelope.receiveTimestamp());
        putBytes(buf, payload);
        return buf.array();
    }

    /**
     * Peeks the kind of the frame starting at the buffer's position without consuming it.
     */
    public static FrameKind kindOf(final ByteBuffer frame) {
        return FrameKind.fromTag(frame.get(frame.position()));
    }

    public static TopicDescriptor decodeTopic(final ByteBuffer frame) {
        final ByteBuffer buf = frame.slice().order(ByteOrder.LITTLE_ENDIAN);
        expect(buf, FrameKind.TOPIC);
        try {
            return new TopicDescriptor(getString(buf), getString(buf), getString(buf));
        } catch (final BufferUnderflowException e) {
            throw new IllegalArgumentException("Truncated topic frame", e);
        }
    }

    public static MessageEnvelope decodeMessage(final ByteBuffer frame) {
        final ByteBuffer buf = frame.slice().order(ByteOrder.LITTLE_ENDIAN);
        expect(buf, FrameKind.MESSAGE);
        try {
            final String topic = getString(buf);
            final String type = getString(buf);
            final String format = getString(buf);
            final long timestamp = buf.getLong();
            final byte[] payload = getBytes(buf);
            return new MessageEnvelope(topic, type, format, payload, timestamp);
        } catch (final BufferUnderflowException e) {
            throw new IllegalArgumentException("Truncated message frame", e);
        }
    }

    private static void expect(final ByteBuffer buf, final FrameKind kind) {
        final FrameKind actual = FrameKind.fromTag(buf.get());
        if (actual != kind) throw new IllegalArgumentException("Expected " + kind + " frame but found " + actual);
    }

    private static ByteBuffer allocate(final int size) {
        return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    }

    private static byte[] utf8(final String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static void putBytes(final ByteBuffer buf, final byte[] bytes) {
        buf.putInt(bytes.length);
        buf.put(bytes);
    }

    private static byte[] getBytes(final ByteBuffer buf) {
        final int len = buf.getInt();
        if (len < 0 || len > buf.remaining()) {
            throw new IllegalArgumentException("Bad field length " + len + " with " + buf.remaining() + " bytes left");
        }
        final byte[] out = new byte[len];
        buf.get(out);
        return out;
    }

    private static String getString(final ByteBuffer buf) {
        return new String(getBytes(buf), StandardCharsets.UTF_8);
    }
}
