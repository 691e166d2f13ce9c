package io.ringbag.storage.segment;

import io.ringbag.storage.AbstractFileBackend;
import io.ringbag.storage.BackendConfig;
import io.ringbag.storage.BackendId;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Bag stored as rolling memory-mapped segment files.
 * <p>
 * Options: {@code segmentBytes} (capacity of each segment), {@code forceOnWrite} (msync after every record).
 */
@Slf4j
public final class SegmentBackend extends AbstractFileBackend {
    private SegmentLog segmentLog;

    @Override
    public BackendId id() {
        return BackendId.SEGMENT;
    }

    @Override
    protected void openForWrite(final Path directory, final BackendConfig config) throws IOException {
        final int segmentBytes = config.intValue(SegmentConstant.SEGMENT_BYTES, SegmentConstant.DEFAULT_SEGMENT_BYTES);
        final boolean force = config.booleanValue(SegmentConstant.FORCE_ON_WRITE, false);
        if (segmentBytes <= LedgerSegment.HEADER_SIZE + LedgerSegment.RECORD_OVERHEAD) {
            throw new IOException("segmentBytes too small: " + segmentBytes);
        }
        segmentLog = SegmentLog.create(directory, segmentBytes, force);
    }

    @Override
    protected void openForRead(final Path directory) throws IOException {
        segmentLog = SegmentLog.openForRead(directory);
        log.debug("Opened {} segments with {} records in {}", segmentLog.segmentCount(), segmentLog.recordCount(), directory);
    }

    @Override
    protected void appendFrame(final byte[] frame) throws IOException {
        segmentLog.append(frame);
    }

    @Override
    protected FrameCursor newCursor() {
        return segmentLog.cursor()::next;
    }

    @Override
    protected void release() throws IOException {
        final SegmentLog toClose = segmentLog;
        segmentLog = null;
        if (toClose != null) toClose.close();
    }
}
