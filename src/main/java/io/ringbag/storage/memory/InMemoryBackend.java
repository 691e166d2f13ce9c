package io.ringbag.storage.memory;

import io.ringbag.core.model.MessageEnvelope;
import io.ringbag.core.model.TopicDescriptor;
import io.ringbag.metadata.BagMetadata;
import io.ringbag.storage.BackendConfig;
import io.ringbag.storage.BackendId;
import io.ringbag.storage.OpenMode;
import io.ringbag.storage.StorageBackend;

import java.io.IOException;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Keeps a bag in the {@link InMemoryBagStore}. Envelopes are immutable, so records are shared rather than
 * serialized; each reader iterates its own snapshot.
 */
public final class InMemoryBackend implements StorageBackend {
    private final InMemoryBagStore store;

    private InMemoryBagStore.StoredBag bag;
    private OpenMode mode;
    private List<MessageEnvelope> messages = List.of();
    private List<TopicDescriptor> topics = List.of();
    private int cursor;

    public InMemoryBackend() {
        this(InMemoryBagStore.instance());
    }

    public InMemoryBackend(final InMemoryBagStore store) {
        this.store = store;
    }

    @Override
    public BackendId id() {
        return BackendId.MEMORY;
    }

    @Override
    public void open(final String location, final OpenMode mode, final BackendConfig config) throws IOException {
        if (this.mode != null) throw new IllegalStateException("memory backend already opened");
        if (location == null || location.isBlank()) throw new IOException("Blank location");

        if (mode == OpenMode.WRITE) {
            bag = store.create(location);
        } else {
            bag = store.get(location);
            final List<Object> records = bag.snapshot();
            messages = records.stream()
                    .filter(MessageEnvelope.class::isInstance)
                    .map(MessageEnvelope.class::cast)
                    .toList();
            topics = records.stream()
                    .filter(TopicDescriptor.class::isInstance)
                    .map(TopicDescriptor.class::cast)
                    .toList();
        }
        this.mode = mode;
    }

    @Override
    public void writeTopic(final TopicDescriptor descriptor) {
        requireMode(OpenMode.WRITE);
        bag.append(descriptor);
    }

    @Override
    public void writeEnvelope(final MessageEnvelope envelope) {
        requireMode(OpenMode.WRITE);
        bag.append(envelope);
    }

    @Override
    public void writeMetadata(final BagMetadata metadata) {
        requireMode(OpenMode.WRITE);
        bag.metadata(metadata);
    }

    @Override
    public boolean hasNext() {
        requireMode(OpenMode.READ);
        return cursor < messages.size();
    }

    @Override
    public MessageEnvelope readNext() {
        if (!hasNext()) throw new NoSuchElementException("End of in-memory bag");
        return messages.get(cursor++);
    }

    @Override
    public List<TopicDescriptor> topics() {
        return topics;
    }

    @Override
    public Optional<BagMetadata> readMetadata() {
        requireMode(OpenMode.READ);
        return Optional.ofNullable(bag.metadata());
    }

    @Override
    public void close() {
        mode = null;
        bag = null;
        messages = List.of();
    }

    private void requireMode(final OpenMode required) {
        if (mode != required) {
            throw new IllegalStateException("memory backend is " + (mode == null ? "not open" : "open for " + mode)
                    + ", operation needs " + required);
        }
    }
}
