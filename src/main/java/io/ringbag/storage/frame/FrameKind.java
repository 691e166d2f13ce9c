package io.ringbag.storage.frame;

/**
 * First byte of every frame.
 */
public enum FrameKind {
    TOPIC((byte) 1),
    MESSAGE((byte) 2);

    private final byte tag;

    FrameKind(final byte tag) {
        this.tag = tag;
    }

    public byte tag() {
        return tag;
    }

    public static FrameKind fromTag(final byte tag) {
        for (final FrameKind k : values()) {
            if (k.tag == tag) return k;
        }
        throw new IllegalArgumentException("Unknown frame tag " + tag);
    }
}
