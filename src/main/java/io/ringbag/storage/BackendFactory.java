package io.ringbag.storage;

import io.ringbag.storage.journal.JournalBackend;
import io.ringbag.storage.memory.InMemoryBackend;
import io.ringbag.storage.segment.SegmentBackend;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Resolves a storage identifier to a fresh backend instance.
 */
public final class BackendFactory {
    private static final BackendFactory DEFAULTS = builder().build();

    private final Map<BackendId, Supplier<? extends StorageBackend>> constructors;

    private BackendFactory(final Map<BackendId, Supplier<? extends StorageBackend>> constructors) {
        this.constructors = new EnumMap<>(constructors);
    }

    public static BackendFactory defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws io.ringbag.core.error.ConfigurationException if the identifier names no backend
     */
    public StorageBackend create(final String identifier) {
        return create(BackendId.fromIdentifier(identifier));
    }

    public StorageBackend create(final BackendId id) {
        return constructors.get(id).get();
    }

    public static final class Builder {
        private final Map<BackendId, Supplier<? extends StorageBackend>> map = new EnumMap<>(BackendId.class);

        private Builder() {
            map.put(BackendId.SEGMENT, SegmentBackend::new);
            map.put(BackendId.JOURNAL, JournalBackend::new);
            map.put(BackendId.MEMORY, InMemoryBackend::new);
        }

        /**
         * Replaces the constructor used for one of the known backends.
         */
        public Builder backend(final BackendId id, final Supplier<? extends StorageBackend> constructor) {
            map.put(id, constructor);
            return this;
        }

        public BackendFactory build() {
            return new BackendFactory(map);
        }
    }
}
