package io.ringbag.reader;

import io.ringbag.codec.MessageCodec;
import io.ringbag.config.impl.StorageOptions;
import io.ringbag.core.error.BackendIoException;
import io.ringbag.core.error.ConfigurationException;
import io.ringbag.core.error.EndOfBagException;
import io.ringbag.core.error.SessionStateException;
import io.ringbag.core.model.MessageEnvelope;
import io.ringbag.core.model.TopicDescriptor;
import io.ringbag.metadata.BagMetadata;
import io.ringbag.metadata.BagMetadataIo;
import io.ringbag.session.BagSession;
import io.ringbag.session.RoleState;
import io.ringbag.storage.BackendFactory;
import io.ringbag.storage.OpenMode;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * Replays a bag once, front to back, in the order its messages were written.
 * <p>
 * Every reader has its own cursor; any number of readers may replay the same finished bag.
 */
@Slf4j
public final class Reader implements AutoCloseable {
    private final BagSession session;

    @Getter
    private RoleState state = RoleState.NOT_OPEN;

    public Reader() {
        this(BackendFactory.defaults());
    }

    public Reader(@NonNull final BackendFactory factory) {
        this.session = new BagSession(factory);
    }

    /**
     * Opens a file-backed bag, taking the backend from its {@code metadata.yaml}.
     * <p>
     * The location is always resolved as a directory, so {@code memory} bags need
     * {@link #open(StorageOptions)} with an explicit storage id, even when they were written with
     * {@link io.ringbag.writer.Writer#open(String)}.
     *
     * @throws ConfigurationException if the location has no readable metadata
     */
    public void open(@NonNull final String location) {
        final Optional<BagMetadata> metadata;
        try {
            metadata = BagMetadataIo.read(Paths.get(location));
        } catch (final IOException | InvalidPathException e) {
            throw new ConfigurationException("Cannot read bag metadata at " + location, e);
        }

        final String storageId = metadata
                .map(BagMetadata::storageIdentifier)
                .orElseThrow(() -> new ConfigurationException("No " + BagMetadataIo.FILE_NAME + " at " + location
                        + "; open with explicit storage options"));

        open(StorageOptions.of(location, storageId));
    }

    /**
     * Opens a bag. A bag that is already open is closed first.
     */
    public void open(@NonNull final StorageOptions options) {
        if (state == RoleState.OPEN) close();

        session.open(options, OpenMode.READ);
        try {
            session.backend().topics().forEach(session.registry()::register);
        } catch (final RuntimeException e) {
            try {
                session.close();
            } catch (final RuntimeException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        state = RoleState.OPEN;
    }

    public boolean isOpen() {
        return state == RoleState.OPEN;
    }

    /**
     * True while at least one message is left. Does not consume it.
     */
    public boolean hasNext() {
        requireOpen("hasNext");
        try {
            return session.backend().hasNext();
        } catch (final IOException e) {
            throw new BackendIoException("Failed to read bag " + session.location(), e);
        }
    }

    /**
     * @throws EndOfBagException if every message has been read
     */
    public MessageEnvelope readNext() {
        if (!hasNext()) throw new EndOfBagException(session.location());
        try {
            return session.backend().readNext();
        } catch (final IOException e) {
            throw new BackendIoException("Failed to read bag " + session.location(), e);
        }
    }

    /**
     * Reads the next message and decodes its payload with the envelope's type identifier.
     */
    public <T> T readNext(@NonNull final MessageCodec<T> codec) {
        final MessageEnvelope envelope = readNext();
        return codec.deserialize(envelope.payload(), envelope.typeIdentifier());
    }

    /**
     * Topics recorded in the bag, in creation order.
     */
    public List<TopicDescriptor> topics() {
        requireOpen("topics");
        return session.registry().descriptors();
    }

    /**
     * Summary stored when the bag was closed; empty for a bag whose writer never closed.
     */
    public Optional<BagMetadata> metadata() {
        requireOpen("metadata");
        try {
            return session.backend().readMetadata();
        } catch (final IOException e) {
            throw new BackendIoException("Failed to read metadata of " + session.location(), e);
        }
    }

    @Override
    public void close() {
        if (state != RoleState.OPEN) return;
        state = RoleState.CLOSED;
        session.close();
    }

    private void requireOpen(final String operation) {
        if (state != RoleState.OPEN) {
            throw new SessionStateException("Cannot " + operation + ": reader is " + state);
        }
    }
}
