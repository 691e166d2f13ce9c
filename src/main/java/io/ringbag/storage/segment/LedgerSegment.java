package io.ringbag.storage.segment;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import sun.misc.Unsafe;

import java.io.IOException;
import java.lang.reflect.Field;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.zip.CRC32C;

/**
 * One memory-mapped segment file: a CRC-protected header followed by length-prefixed, CRC32C-checked records.
 * <pre>
 * header : [magic:int][version:short][headerCrc:int][firstIndex:long][lastIndex:long]
 * record : [len:int][crc:int][frame:len bytes]
 * </pre>
 * A zero length marks the end of the written region. Indices count records across the whole bag,
 * so a segment knows where it sits in the sequence.
 */
@Slf4j
public final class LedgerSegment implements AutoCloseable {
    private static final int MAGIC_POS = 0;
    private static final int VERSION_POS = MAGIC_POS + Integer.BYTES;
    private static final int CRC_POS = VERSION_POS + Short.BYTES;
    private static final int FIRST_INDEX_POS = CRC_POS + Integer.BYTES;
    private static final int LAST_INDEX_POS = FIRST_INDEX_POS + Long.BYTES;
    public static final int HEADER_SIZE = LAST_INDEX_POS + Long.BYTES;

    public static final int RECORD_OVERHEAD = Integer.BYTES + Integer.BYTES; // Len + CRC
    private static final int MIN_RECORD_SIZE = RECORD_OVERHEAD + 1;

    /**
     * Sentinel meaning "no first index yet" (empty segment). 0 is a valid index.
     */
    private static final long FIRST_INDEX_UNSET = Long.MIN_VALUE;

    private static final Unsafe UNSAFE = initUnsafe();

    @Getter private final Path file;
    @Getter private final int capacity;
    private final MappedByteBuffer buf;
    private final boolean writable;

    private final CRC32C recordCrc = new CRC32C();
    private final CRC32C headerCrc = new CRC32C();
    private final ByteBuffer headerScratch = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);

    @Getter private int recordCount;
    @Getter private long firstIndex;
    @Getter private long lastIndex;
    private boolean closed;

    private LedgerSegment(final Path file, final int capacity, final MappedByteBuffer buf, final boolean writable) {
        this.file = file;
        this.capacity = capacity;
        this.buf = buf;
        this.writable = writable;
    }

    private static Unsafe initUnsafe() {
        try {
            final Field f = Unsafe.class.getDeclaredField("theUnsafe");
            f.setAccessible(true);
            return (Unsafe) f.get(null);
        } catch (final Exception e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    /**
     * Creates an empty segment whose lastIndex starts at baseLastIndex.
     * For the first segment of a bag, baseLastIndex should be -1 so the first record index is 0.
     */
    public static LedgerSegment create(final Path file, final int capacity, final long baseLastIndex) throws IOException {
        if (capacity < HEADER_SIZE + MIN_RECORD_SIZE) throw new IllegalArgumentException("Capacity too small");

        try (final FileChannel ch = FileChannel.open(file,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            ch.truncate(capacity);
            final MappedByteBuffer map = ch.map(FileChannel.MapMode.READ_WRITE, 0, capacity);
            map.order(ByteOrder.LITTLE_ENDIAN);

            map.putInt(MAGIC_POS, SegmentConstant.MAGIC);
            map.putShort(VERSION_POS, SegmentConstant.VERSION);

            final LedgerSegment seg = new LedgerSegment(file, capacity, map, true);
            seg.firstIndex = FIRST_INDEX_UNSET;
            seg.lastIndex = baseLastIndex;
            seg.updateHeader();
            map.position(HEADER_SIZE);
            return seg;
        }
    }

    /**
     * Maps an existing segment read-only and walks its records up to the first empty, torn or corrupt one.
     */
    public static LedgerSegment openForRead(final Path file) throws IOException {
        try (final FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            final long size = ch.size();
            if (size < HEADER_SIZE) throw new IOException("Segment too small: " + file);
            if (size > Integer.MAX_VALUE) throw new IOException("Segment too large: " + file);

            final MappedByteBuffer map = ch.map(FileChannel.MapMode.READ_ONLY, 0, size);
            map.order(ByteOrder.LITTLE_ENDIAN);

            final LedgerSegment seg = new LedgerSegment(file, (int) size, map, false);
            seg.readAndVerifyHeader();
            seg.scanRecords();
            return seg;
        }
    }

    private void readAndVerifyHeader() throws IOException {
        final int magic = buf.getInt(MAGIC_POS);
        final short ver = buf.getShort(VERSION_POS);
        if (magic != SegmentConstant.MAGIC || ver != SegmentConstant.VERSION)
            throw new IOException("Bad magic/version in " + file);

        final int storedCrc = buf.getInt(CRC_POS);
        final long fi = buf.getLong(FIRST_INDEX_POS);
        final long li = buf.getLong(LAST_INDEX_POS);

        if (headerCrc(fi, li) != storedCrc)
            throw new IOException("Header CRC mismatch in " + file);

        this.firstIndex = fi;
        this.lastIndex = li;
    }

    private void scanRecords() {
        int pos = HEADER_SIZE;
        final int maxPos = capacity - RECORD_OVERHEAD;
        int count = 0;

        while (pos <= maxPos) {
            final int len = buf.getInt(pos);
            if (len == 0) break;

            if (len < 0) {
                log.warn("Corrupt negative length {} at {} in {}", len, pos, file);
                break;
            }

            final int next = pos + RECORD_OVERHEAD + len;
            if (next > capacity || next < 0) {
                log.warn("Record length {} exceeds capacity at {} in {}", len, pos, file);
                break;
            }

            final int storedCrc = buf.getInt(pos + Integer.BYTES);
            if (storedCrc != 0 && storedCrc != crcOf(pos + RECORD_OVERHEAD, len)) {
                log.warn("CRC32C mismatch at {} in {}, ignoring the rest of the segment", pos, file);
                break;
            }

            count++;
            pos = next;
        }

        buf.position(pos);
        this.recordCount = count;

        final long expected = (firstIndex == FIRST_INDEX_UNSET) ? 0 : lastIndex - firstIndex + 1;
        if (expected != count) {
            log.warn("Header of {} claims {} records but {} are readable", file, expected, count);
        }
    }

    private int crcOf(final int pos, final int len) {
        final ByteBuffer view = buf.duplicate();
        view.limit(pos + len).position(pos);
        recordCrc.reset();
        recordCrc.update(view);
        return (int) recordCrc.getValue();
    }

    public boolean isEmpty() {
        return recordCount == 0;
    }

    public boolean hasSpaceFor(final int frameBytes) {
        return (capacity - buf.position()) >= (frameBytes + RECORD_OVERHEAD);
    }

    /**
     * Space a frame of the given size takes in a segment, header excluded.
     */
    public static int recordSize(final int frameBytes) {
        return frameBytes + RECORD_OVERHEAD;
    }

    /**
     * Appends one frame. Nothing is written when the frame does not fit.
     *
     * @return the bag-wide index of the record
     */
    public long append(final byte[] frame, final boolean force) throws IOException {
        if (!writable) throw new IOException("Segment opened read-only: " + file);
        if (!hasSpaceFor(frame.length)) throw new IOException("Segment full: " + file);

        final int start = buf.position();
        buf.putInt(frame.length);

        recordCrc.reset();
        recordCrc.update(frame, 0, frame.length);
        buf.putInt((int) recordCrc.getValue());
        buf.put(frame);

        final long index = lastIndex + 1;
        if (firstIndex == FIRST_INDEX_UNSET) firstIndex = index;
        lastIndex = index;
        recordCount++;

        updateHeader();
        if (force) buf.force();

        log.trace("Appended record {} ({} bytes) at {} in {}", index, frame.length, start, file);
        return index;
    }

    private void updateHeader() {
        buf.putLong(FIRST_INDEX_POS, firstIndex);
        buf.putLong(LAST_INDEX_POS, lastIndex);
        buf.putInt(CRC_POS, headerCrc(firstIndex, lastIndex));
    }

    private int headerCrc(final long fi, final long li) {
        headerScratch.clear();
        headerScratch.putInt(SegmentConstant.MAGIC).putShort(SegmentConstant.VERSION).putInt(0)
                .putLong(fi).putLong(li).flip();
        headerCrc.reset();
        headerCrc.update(headerScratch);
        return (int) headerCrc.getValue();
    }

    /**
     * Position of the first record.
     */
    public int firstPosition() {
        return HEADER_SIZE;
    }

    /**
     * Position just past the last readable record.
     */
    public int endPosition() {
        return buf.position();
    }

    /**
     * Read-only view of the frame of the record at pos.
     */
    public ByteBuffer frameAt(final int pos) {
        final int len = buf.getInt(pos);
        final ByteBuffer view = buf.duplicate();
        view.limit(pos + RECORD_OVERHEAD + len).position(pos + RECORD_OVERHEAD);
        return view.slice().asReadOnlyBuffer();
    }

    public int nextPosition(final int pos) {
        return pos + RECORD_OVERHEAD + buf.getInt(pos);
    }

    /**
     * Flushes, unmaps and, for a segment that was written, trims the file to the bytes in use.
     */
    @Override
    public void close() throws IOException {
        if (closed) return;
        closed = true;

        final int used = buf.position();
        IOException failure = null;

        if (writable) {
            try {
                buf.force();
            } catch (final RuntimeException e) {
                failure = new IOException("Failed to force " + file, e);
            }
        }

        try {
            UNSAFE.invokeCleaner(buf);
        } catch (final RuntimeException e) {
            log.warn("Failed to unmap {}: {}", file, e.toString());
        }

        if (writable) {
            try (final FileChannel ch = FileChannel.open(file, StandardOpenOption.WRITE)) {
                ch.truncate(used);
                ch.force(true);
            } catch (final IOException e) {
                if (failure == null) failure = e;
                else failure.addSuppressed(e);
            }
        }

        if (failure != null) throw failure;
    }

    @Override
    public String toString() {
        return "LedgerSegment{" +
                "file=" + file +
                ", capacity=" + capacity +
                ", firstIndex=" + firstIndex +
                ", lastIndex=" + lastIndex +
                ", records=" + recordCount +
                '}';
    }
}
