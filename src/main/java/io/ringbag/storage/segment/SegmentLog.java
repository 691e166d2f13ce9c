package io.ringbag.storage.segment;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Ordered sequence of {@link LedgerSegment}s in one bag directory.
 * <p>
 * Writers append to the tail segment and roll to a new one when a frame does not fit. Readers walk every
 * segment in file-name order through a {@link Cursor}.
 */
@Slf4j
public final class SegmentLog implements AutoCloseable {

    private final Path directory;
    @Getter
    private final int segmentCapacity;
    private final boolean forceOnWrite;
    private final List<LedgerSegment> segments;

    private LedgerSegment active;
    private int nextSegmentNumber;

    private SegmentLog(final Path directory,
                       final int segmentCapacity,
                       final boolean forceOnWrite,
                       final List<LedgerSegment> segments) {
        this.directory = directory;
        this.segmentCapacity = segmentCapacity;
        this.forceOnWrite = forceOnWrite;
        this.segments = segments;
        this.nextSegmentNumber = segments.size();
    }

    /**
     * Starts a new log in a directory that holds no segments yet.
     */
    public static SegmentLog create(@NonNull final Path directory,
                                    final int segmentCapacity,
                                    final boolean forceOnWrite) throws IOException {
        Files.createDirectories(directory);
        if (!listSegmentFiles(directory).isEmpty()) {
            throw new IOException("Directory already holds a bag: " + directory);
        }

        final SegmentLog log = new SegmentLog(directory, segmentCapacity, forceOnWrite, new ArrayList<>());
        log.active = log.createNewSegment(-1L, segmentCapacity);
        return log;
    }

    /**
     * Opens every segment of an existing log read-only.
     */
    public static SegmentLog openForRead(@NonNull final Path directory) throws IOException {
        if (!Files.isDirectory(directory)) throw new IOException("No bag directory at " + directory);

        final List<Path> files = listSegmentFiles(directory);
        if (files.isEmpty()) throw new IOException("No segments in " + directory);

        final List<LedgerSegment> opened = new ArrayList<>(files.size());
        try {
            for (final Path file : files) {
                opened.add(LedgerSegment.openForRead(file));
            }
        } catch (final IOException e) {
            closeAll(opened, e);
            throw e;
        }

        long expectedFirst = 0;
        for (final LedgerSegment s : opened) {
            if (!s.isEmpty() && s.getFirstIndex() != expectedFirst) {
                log.warn("Segment {} starts at record {} but {} was expected", s.getFile(), s.getFirstIndex(), expectedFirst);
            }
            expectedFirst += s.getRecordCount();
        }

        return new SegmentLog(directory, 0, false, opened);
    }

    private static List<Path> listSegmentFiles(final Path directory) throws IOException {
        try (final Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(SegmentConstant.SEGMENT_EXT))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        }
    }

    /**
     * Appends one frame, rolling to a fresh segment first when the active one cannot hold it.
     */
    public long append(final byte[] frame) throws IOException {
        if (active == null) throw new IOException("Segment log is not writable: " + directory);
        return writable(frame.length).append(frame, forceOnWrite);
    }

    private LedgerSegment writable(final int frameBytes) throws IOException {
        if (active.hasSpaceFor(frameBytes)) return active;

        log.debug("Rolling segment (capacity full for frame of {} bytes)", frameBytes);
        final int needed = LedgerSegment.HEADER_SIZE + LedgerSegment.recordSize(frameBytes);
        active = createNewSegment(active.getLastIndex(), Math.max(segmentCapacity, needed));
        return active;
    }

    private LedgerSegment createNewSegment(final long previousLastIndex, final int capacity) throws IOException {
        final Path segmentPath = directory.resolve(String.format("%06d%s", nextSegmentNumber, SegmentConstant.SEGMENT_EXT));
        log.info("Creating segment: {}", segmentPath);

        final LedgerSegment seg = LedgerSegment.create(segmentPath, capacity, previousLastIndex);
        segments.add(seg);
        nextSegmentNumber++;
        return seg;
    }

    public int segmentCount() {
        return segments.size();
    }

    public long recordCount() {
        long n = 0;
        for (final LedgerSegment s : segments) n += s.getRecordCount();
        return n;
    }

    public Cursor cursor() {
        return new Cursor();
    }

    /**
     * Forward-only position over every record of every segment. Each cursor is independent.
     */
    public final class Cursor {
        private int segment;
        private int position = -1;

        /**
         * @return the next frame, or null when the log is exhausted
         */
        public ByteBuffer next() {
            while (segment < segments.size()) {
                final LedgerSegment s = segments.get(segment);
                if (position < 0) position = s.firstPosition();

                if (position < s.endPosition()) {
                    final ByteBuffer frame = s.frameAt(position);
                    position = s.nextPosition(position);
                    return frame;
                }

                segment++;
                position = -1;
            }
            return null;
        }
    }

    /**
     * Closes every segment. All segments are released even if some fail; the first failure is rethrown.
     */
    @Override
    public void close() throws IOException {
        active = null;
        closeAll(segments, null);
    }

    private static void closeAll(final List<LedgerSegment> toClose, final IOException primary) throws IOException {
        IOException failure = primary;
        for (final LedgerSegment s : toClose) {
            try {
                s.close();
            } catch (final IOException e) {
                if (failure == null) failure = e;
                else failure.addSuppressed(e);
            }
        }
        if (failure != null && failure != primary) throw failure;
    }
}
