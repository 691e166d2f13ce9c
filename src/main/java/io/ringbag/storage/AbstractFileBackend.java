package io.ringbag.storage;

import io.ringbag.core.model.MessageEnvelope;
import io.ringbag.core.model.TopicDescriptor;
import io.ringbag.metadata.BagMetadata;
import io.ringbag.metadata.BagMetadataIo;
import io.ringbag.storage.frame.FrameCodec;
import io.ringbag.storage.frame.FrameKind;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Base for backends that keep a bag as {@link FrameCodec} frames inside a directory.
 * <p>
 * Subclasses only append frames and hand back frame cursors; topic bookkeeping, message decoding and
 * {@code metadata.yaml} handling live here.
 */
public abstract class AbstractFileBackend implements StorageBackend {

    /**
     * Forward-only source of raw frames.
     */
    protected interface FrameCursor {
        /**
         * @return the next frame, or null at the end of the bag
         */
        ByteBuffer next() throws IOException;
    }

    private Path directory;
    private OpenMode mode;
    private FrameCursor cursor;
    private MessageEnvelope peeked;
    private List<TopicDescriptor> topics = List.of();

    @Override
    public final void open(final String location, final OpenMode mode, final BackendConfig config) throws IOException {
        if (this.mode != null) throw new IllegalStateException(id() + " backend already opened");
        final Path dir = toPath(location);

        this.directory = dir;
        try {
            if (mode == OpenMode.WRITE) {
                if (Files.exists(BagMetadataIo.pathIn(dir))) {
                    throw new IOException("Location already holds a finished bag: " + dir);
                }
                openForWrite(dir, config);
            } else {
                openForRead(dir);
                this.topics = scanTopics(newCursor());
                this.cursor = newCursor();
            }
        } catch (final IOException | RuntimeException e) {
            try {
                release();
            } catch (final IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
        this.mode = mode;
    }

    private static Path toPath(final String location) throws IOException {
        try {
            return Paths.get(location);
        } catch (final InvalidPathException e) {
            throw new IOException("Invalid bag location: " + location, e);
        }
    }

    protected abstract void openForWrite(Path directory, BackendConfig config) throws IOException;

    protected abstract void openForRead(Path directory) throws IOException;

    protected abstract void appendFrame(byte[] frame) throws IOException;

    protected abstract FrameCursor newCursor() throws IOException;

    /**
     * Releases the files opened by {@link #openForWrite} or {@link #openForRead}.
     */
    protected abstract void release() throws IOException;

    private List<TopicDescriptor> scanTopics(final FrameCursor frames) throws IOException {
        final List<TopicDescriptor> found = new ArrayList<>();
        ByteBuffer frame;
        while ((frame = frames.next()) != null) {
            if (kind(frame) == FrameKind.TOPIC) found.add(decodeTopic(frame));
        }
        return List.copyOf(found);
    }

    @Override
    public void writeTopic(final TopicDescriptor descriptor) throws IOException {
        requireMode(OpenMode.WRITE);
        appendFrame(FrameCodec.encode(descriptor));
    }

    @Override
    public void writeEnvelope(final MessageEnvelope envelope) throws IOException {
        requireMode(OpenMode.WRITE);
        appendFrame(FrameCodec.encode(envelope));
    }

    @Override
    public void writeMetadata(final BagMetadata metadata) throws IOException {
        requireMode(OpenMode.WRITE);
        BagMetadataIo.write(directory, metadata);
    }

    @Override
    public boolean hasNext() throws IOException {
        requireMode(OpenMode.READ);
        while (peeked == null) {
            final ByteBuffer frame = cursor.next();
            if (frame == null) return false;
            if (kind(frame) == FrameKind.MESSAGE) peeked = decodeMessage(frame);
        }
        return true;
    }

    @Override
    public MessageEnvelope readNext() throws IOException {
        if (!hasNext()) throw new NoSuchElementException("End of bag " + directory);
        final MessageEnvelope next = peeked;
        peeked = null;
        return next;
    }

    @Override
    public List<TopicDescriptor> topics() {
        return topics;
    }

    @Override
    public Optional<BagMetadata> readMetadata() throws IOException {
        requireMode(OpenMode.READ);
        return BagMetadataIo.read(directory);
    }

    protected Path directory() {
        return directory;
    }

    @Override
    public void close() throws IOException {
        if (mode == null) return;
        mode = null;
        cursor = null;
        peeked = null;
        release();
    }

    private void requireMode(final OpenMode required) {
        if (mode != required) {
            throw new IllegalStateException(id() + " backend is " + (mode == null ? "not open" : "open for " + mode)
                    + ", operation needs " + required);
        }
    }

    private FrameKind kind(final ByteBuffer frame) throws IOException {
        try {
            return FrameCodec.kindOf(frame);
        } catch (final IllegalArgumentException e) {
            throw new IOException("Corrupt frame in " + directory, e);
        }
    }

    private TopicDescriptor decodeTopic(final ByteBuffer frame) throws IOException {
        try {
            return FrameCodec.decodeTopic(frame);
        } catch (final IllegalArgumentException e) {
            throw new IOException("Corrupt topic frame in " + directory, e);
        }
    }

    private MessageEnvelope decodeMessage(final ByteBuffer frame) throws IOException {
        try {
            return FrameCodec.decodeMessage(frame);
        } catch (final IllegalArgumentException e) {
            throw new IOException("Corrupt message frame in " + directory, e);
        }
    }
}
