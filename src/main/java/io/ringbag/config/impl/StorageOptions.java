package io.ringbag.config.impl;

import io.ringbag.core.model.TopicDescriptor;
import io.ringbag.storage.BackendConfig;
import io.ringbag.storage.BackendId;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

import java.util.List;
import java.util.Map;

/**
 * Where a bag lives and which backend stores it.
 */
@Getter
@Builder(toBuilder = true)
public final class StorageOptions {

    /** Bag location: a directory for file backends, a key for the memory backend. */
    @NonNull
    private final String uri;

    @NonNull
    @Builder.Default
    private final String storageId = BackendId.DEFAULT.getIdentifier();

    @Singular("backendOption")
    private final Map<String, Object> backendConfig;

    /** Topics created on open, writer only. */
    @Singular
    private final List<TopicDescriptor> topics;

    public static StorageOptions of(final String uri, final String storageId) {
        return builder().uri(uri).storageId(storageId).build();
    }

    public BackendConfig backend() {
        return BackendConfig.of(backendConfig);
    }

    /**
     * Same backend and backend settings at a different location, without the topic list.
     */
    public StorageOptions withUri(final String newUri) {
        return toBuilder().uri(newUri).clearTopics().build();
    }
}
