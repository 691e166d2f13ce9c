package io.ringbag.metadata;

import io.ringbag.core.model.MessageEnvelope;
import io.ringbag.core.model.TopicDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Running counters a writer keeps for the bag it is currently recording.
 */
public final class BagMetadataCollector {
    private final Map<String, TopicDescriptor> topics = new LinkedHashMap<>();
    private final Map<String, Long> counts = new LinkedHashMap<>();

    private long messageCount;
    private long earliest = Long.MAX_VALUE;
    private long latest = Long.MIN_VALUE;

    public void topic(final TopicDescriptor descriptor) {
        topics.putIfAbsent(descriptor.name(), descriptor);
        counts.putIfAbsent(descriptor.name(), 0L);
    }

    public void message(final MessageEnvelope envelope) {
        counts.merge(envelope.topicName(), 1L, Long::sum);
        messageCount++;
        earliest = Math.min(earliest, envelope.receiveTimestamp());
        latest = Math.max(latest, envelope.receiveTimestamp());
    }

    public long messageCount() {
        return messageCount;
    }

    public BagMetadata snapshot(final String storageIdentifier) {
        final List<TopicInformation> info = new ArrayList<>(topics.size());
        for (final TopicDescriptor d : topics.values()) {
            info.add(new TopicInformation(d, counts.getOrDefault(d.name(), 0L)));
        }
        final long start = messageCount == 0 ? 0L : earliest;
        final long duration = messageCount == 0 ? 0L : latest - earliest;
        return new BagMetadata(BagMetadata.CURRENT_VERSION, storageIdentifier, messageCount, start, duration, info);
    }
}
