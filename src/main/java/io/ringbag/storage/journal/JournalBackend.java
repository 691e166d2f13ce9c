package io.ringbag.storage.journal;

import io.ringbag.storage.AbstractFileBackend;
import io.ringbag.storage.BackendConfig;
import io.ringbag.storage.BackendId;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.zip.CRC32C;

/**
 * Bag stored as a single append-only {@code bag.journal} file written through a {@link FileChannel}.
 * <pre>
 * file   : [magic:int][version:short] record*
 * record : [len:int][crc:int][frame:len bytes]
 * </pre>
 * Option: {@code syncOnWrite} forces the channel after every record.
 */
@Slf4j
public final class JournalBackend extends AbstractFileBackend {
    public static final String FILE_NAME = "bag.journal";
    public static final String SYNC_ON_WRITE = "syncOnWrite";

    /**
     * 0x52424A4C == 'R' 'B' 'J' 'L'
     */
    static final int MAGIC = 0x5242_4A4C;
    static final short VERSION = 1;
    static final int HEADER_SIZE = Integer.BYTES + Short.BYTES;
    private static final int RECORD_OVERHEAD = Integer.BYTES + Integer.BYTES;

    private final CRC32C crc = new CRC32C();
    private final ChannelOpener opener;

    private FileChannel channel;
    private boolean syncOnWrite;
    private boolean writing;

    /**
     * How the journal file is opened. Tests substitute channels that fail on demand.
     */
    @FunctionalInterface
    interface ChannelOpener {
        FileChannel open(Path file, OpenOption... options) throws IOException;
    }

    public JournalBackend() {
        this(FileChannel::open);
    }

    JournalBackend(final ChannelOpener opener) {
        this.opener = opener;
    }

    @Override
    public BackendId id() {
        return BackendId.JOURNAL;
    }

    @Override
    protected void openForWrite(final Path directory, final BackendConfig config) throws IOException {
        syncOnWrite = config.booleanValue(SYNC_ON_WRITE, false);
        Files.createDirectories(directory);

        channel = opener.open(directory.resolve(FILE_NAME), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        writing = true;

        final ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        header.putInt(MAGIC).putShort(VERSION).flip();
        writeFully(header);
    }

    @Override
    protected void openForRead(final Path directory) throws IOException {
        final Path file = directory.resolve(FILE_NAME);
        if (!Files.isRegularFile(file)) throw new IOException("No journal at " + file);

        channel = opener.open(file, StandardOpenOption.READ);
        writing = false;

        final ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        if (channel.read(header, 0) < HEADER_SIZE) throw new IOException("Journal too small: " + file);
        header.flip();
        if (header.getInt() != MAGIC || header.getShort() != VERSION) {
            throw new IOException("Bad magic/version in " + file);
        }
    }

    /**
     * Writes the whole record or, on failure, truncates back to where it started.
     */
    @Override
    protected void appendFrame(final byte[] frame) throws IOException {
        final ByteBuffer record = ByteBuffer.allocate(RECORD_OVERHEAD + frame.length).order(ByteOrder.LITTLE_ENDIAN);
        crc.reset();
        crc.update(frame, 0, frame.length);
        record.putInt(frame.length).putInt((int) crc.getValue()).put(frame).flip();

        final long start = channel.position();
        try {
            writeFully(record);
            if (syncOnWrite) channel.force(false);
        } catch (final IOException e) {
            try {
                channel.truncate(start);
                channel.position(start);
            } catch (final IOException rollback) {
                e.addSuppressed(rollback);
            }
            throw e;
        }
    }

    private void writeFully(final ByteBuffer buf) throws IOException {
        while (buf.hasRemaining()) channel.write(buf);
    }

    @Override
    protected FrameCursor newCursor() {
        return new JournalCursor(channel);
    }

    @Override
    protected void release() throws IOException {
        final FileChannel ch = channel;
        channel = null;
        if (ch == null) return;

        try {
            if (writing) ch.force(true);
        } finally {
            ch.close();
        }
    }

    /**
     * Positional reader; cursors over the same channel do not disturb each other.
     */
    private final class JournalCursor implements FrameCursor {
        private final FileChannel ch;
        private final ByteBuffer recordHeader = ByteBuffer.allocate(RECORD_OVERHEAD).order(ByteOrder.LITTLE_ENDIAN);
        private final CRC32C validator = new CRC32C();
        private long position = HEADER_SIZE;
        private boolean exhausted;

        JournalCursor(final FileChannel ch) {
            this.ch = ch;
        }

        @Override
        public ByteBuffer next() throws IOException {
            if (exhausted) return null;

            final long size = ch.size();
            recordHeader.clear();
            readFully(recordHeader, position);

            if (recordHeader.hasRemaining()) {
                if (recordHeader.position() > 0) log.warn("Partial record header at {} in {}", position, directory());
                return end();
            }

            recordHeader.flip();
            final int len = recordHeader.getInt();
            final int storedCrc = recordHeader.getInt();

            if (len <= 0 || len > size - position - RECORD_OVERHEAD) {
                log.warn("Invalid or torn record of length {} at {} in {}", len, position, directory());
                return end();
            }

            final ByteBuffer frame = ByteBuffer.allocate(len);
            readFully(frame, position + RECORD_OVERHEAD);
            if (frame.hasRemaining()) {
                log.warn("Torn record payload at {} in {}", position, directory());
                return end();
            }
            frame.flip();

            validator.reset();
            validator.update(frame.duplicate());
            if ((int) validator.getValue() != storedCrc) {
                log.warn("CRC32C mismatch at {} in {}, ignoring the rest of the journal", position, directory());
                return end();
            }

            position += RECORD_OVERHEAD + len;
            return frame;
        }

        private void readFully(final ByteBuffer dst, final long from) throws IOException {
            long at = from;
            while (dst.hasRemaining()) {
                final int n = ch.read(dst, at);
                if (n < 0) return;
                at += n;
            }
        }

        private ByteBuffer end() {
            exhausted = true;
            return null;
        }
    }
}
