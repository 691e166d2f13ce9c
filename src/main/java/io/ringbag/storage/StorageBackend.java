package io.ringbag.storage;

import io.ringbag.core.model.MessageEnvelope;
import io.ringbag.core.model.TopicDescriptor;
import io.ringbag.metadata.BagMetadata;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Persists and replays the records of one bag.
 * <p>
 * A backend that accepted {@code e1 .. en} in that order must hand back exactly {@code e1 .. en} when read
 * sequentially from the start, whatever its internal layout. Instances are single-use: opened once, closed once.
 */
public interface StorageBackend extends AutoCloseable {

    /**
     * @throws IOException if the location cannot be used in the requested mode
     */
    void open(String location, OpenMode mode, BackendConfig config) throws IOException;

    void writeTopic(TopicDescriptor descriptor) throws IOException;

    void writeEnvelope(MessageEnvelope envelope) throws IOException;

    /**
     * Stores the summary of the bag, called once just before a writer closes the backend.
     */
    void writeMetadata(BagMetadata metadata) throws IOException;

    boolean hasNext() throws IOException;

    /**
     * @throws java.util.NoSuchElementException if {@link #hasNext()} is false
     */
    MessageEnvelope readNext() throws IOException;

    /**
     * Topics recorded in the bag, in the order they were written. Only meaningful in {@link OpenMode#READ}.
     */
    List<TopicDescriptor> topics();

    Optional<BagMetadata> readMetadata() throws IOException;

    BackendId id();

    /**
     * Flushes and releases every handle the backend holds. Must release even when it fails.
     */
    @Override
    void close() throws IOException;
}
