package io.ringbag.session;

import io.ringbag.config.impl.StorageOptions;
import io.ringbag.core.error.BackendIoException;
import io.ringbag.core.error.ConfigurationException;
import io.ringbag.core.error.SessionStateException;
import io.ringbag.registry.TopicRegistry;
import io.ringbag.storage.BackendFactory;
import io.ringbag.storage.OpenMode;
import io.ringbag.storage.StorageBackend;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Exclusive owner of one open backend and the topic registry that goes with it.
 * <p>
 * {@code CLOSED -> open -> OPEN -> close -> CLOSED}. The backend is created on open and released on close,
 * including when the close itself fails. Not thread-safe.
 */
@Slf4j
public final class BagSession {
    private final BackendFactory factory;

    @Getter
    private SessionState state = SessionState.CLOSED;
    private StorageBackend backend;
    private TopicRegistry registry;
    @Getter
    private StorageOptions options;
    @Getter
    private OpenMode mode;

    public BagSession(@NonNull final BackendFactory factory) {
        this.factory = factory;
    }

    /**
     * @throws SessionStateException  if the session is already open
     * @throws ConfigurationException if the storage id is unknown or the location cannot be opened
     */
    public void open(@NonNull final StorageOptions options, @NonNull final OpenMode mode) {
        if (state == SessionState.OPEN) {
            throw new SessionStateException("Session already open on " + this.options.getUri());
        }

        final StorageBackend created = factory.create(options.getStorageId());
        try {
            created.open(options.getUri(), mode, options.backend());
        } catch (final IOException e) {
            final ConfigurationException failure =
                    new ConfigurationException("Cannot open " + options.getUri() + " for " + mode + " with "
                            + options.getStorageId() + ": " + e.getMessage(), e);
            releaseAfterFailure(created, failure);
            throw failure;
        } catch (final RuntimeException e) {
            releaseAfterFailure(created, e);
            throw e;
        }

        this.backend = created;
        this.registry = new TopicRegistry();
        this.options = options;
        this.mode = mode;
        this.state = SessionState.OPEN;
        log.info("Opened {} bag {} for {}", created.id(), options.getUri(), mode);
    }

    private static void releaseAfterFailure(final StorageBackend backend, final RuntimeException failure) {
        try {
            backend.close();
        } catch (final IOException | RuntimeException e) {
            failure.addSuppressed(e);
        }
    }

    public boolean isOpen() {
        return state == SessionState.OPEN;
    }

    public StorageBackend backend() {
        requireOpen();
        return backend;
    }

    public TopicRegistry registry() {
        requireOpen();
        return registry;
    }

    public String location() {
        requireOpen();
        return options.getUri();
    }

    /**
     * Closes the backend. The session is CLOSED and the backend released whether or not this throws.
     *
     * @throws BackendIoException if the backend failed to flush or release
     */
    public void close() {
        if (state == SessionState.CLOSED) return;

        final StorageBackend toClose = backend;
        final String location = options.getUri();
        backend = null;
        registry = null;
        state = SessionState.CLOSED;

        try {
            toClose.close();
        } catch (final IOException e) {
            throw new BackendIoException("Failed to close bag " + location, e);
        }
        log.info("Closed bag {}", location);
    }

    private void requireOpen() {
        if (state != SessionState.OPEN) throw new SessionStateException("Session is not open");
    }
}
