package io.ringbag.storage.memory;

import io.ringbag.core.model.MessageEnvelope;
import io.ringbag.core.model.TopicDescriptor;
import io.ringbag.metadata.BagMetadata;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide home of the bags written by the {@code memory} backend, keyed by location.
 * <p>
 * Bags stay until {@link #delete} or {@link #clear} removes them; a location is writable again only after that.
 */
public final class InMemoryBagStore {
    private static final InMemoryBagStore INSTANCE = new InMemoryBagStore();

    private final ConcurrentMap<String, StoredBag> bags = new ConcurrentHashMap<>();

    public static InMemoryBagStore instance() {
        return INSTANCE;
    }

    /**
     * @throws IOException if a bag already exists at the location
     */
    StoredBag create(final String location) throws IOException {
        final StoredBag fresh = new StoredBag();
        if (bags.putIfAbsent(location, fresh) != null) {
            throw new IOException("Location already holds a bag: " + location);
        }
        return fresh;
    }

    StoredBag get(final String location) throws IOException {
        final StoredBag bag = bags.get(location);
        if (bag == null) throw new IOException("No bag at " + location);
        return bag;
    }

    public boolean contains(final String location) {
        return bags.containsKey(location);
    }

    /**
     * @return true if a bag was stored at the location
     */
    public boolean delete(final String location) {
        return bags.remove(location) != null;
    }

    public void clear() {
        bags.clear();
    }

    /**
     * Records of one bag: topic descriptors and envelopes interleaved in write order.
     */
    static final class StoredBag {
        private final List<Object> records = new ArrayList<>();
        private BagMetadata metadata;

        synchronized void append(final TopicDescriptor topic) {
            records.add(topic);
        }

        synchronized void append(final MessageEnvelope envelope) {
            records.add(envelope);
        }

        synchronized void metadata(final BagMetadata m) {
            this.metadata = m;
        }

        synchronized BagMetadata metadata() {
            return metadata;
        }

        synchronized List<Object> snapshot() {
            return List.copyOf(records);
        }
    }
}
