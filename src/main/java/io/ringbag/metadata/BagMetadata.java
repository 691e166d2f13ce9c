package io.ringbag.metadata;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Summary of a finished bag: which backend wrote it, how many messages it holds, the time span they
 * cover and the per-topic message counts in registration order.
 */
public record BagMetadata(int version,
                          String storageIdentifier,
                          long messageCount,
                          long startingTimeNanos,
                          long durationNanos,
                          List<TopicInformation> topics) {

    public static final int CURRENT_VERSION = 1;

    public BagMetadata {
        Objects.requireNonNull(storageIdentifier, "storageIdentifier");
        topics = List.copyOf(topics);
    }

    public Optional<TopicInformation> topic(final String name) {
        return topics.stream().filter(t -> t.topic().name().equals(name)).findFirst();
    }
}
