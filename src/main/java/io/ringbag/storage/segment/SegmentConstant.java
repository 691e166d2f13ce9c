package io.ringbag.storage.segment;

/**
 * Shared constants for bag segment files.
 */
public final class SegmentConstant {
    /**
     * File extension for segment files.
     */
    public static final String SEGMENT_EXT = ".seg";

    /**
     * 0x52424753 == 'R' 'B' 'G' 'S'
     */
    public static final int MAGIC = 0x5242_4753;
    public static final short VERSION = 1;

    public static final String SEGMENT_BYTES = "segmentBytes";
    public static final String FORCE_ON_WRITE = "forceOnWrite";

    public static final int DEFAULT_SEGMENT_BYTES = 8 * 1024 * 1024;

    private SegmentConstant() {
        // Prevent instantiation
    }
}
