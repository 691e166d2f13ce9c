package io.ringbag.registry;

import io.ringbag.core.error.TopicConflictException;
import io.ringbag.core.model.TopicDescriptor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the topics of one open session and the descriptor each name is bound to.
 * <p>
 * Not thread-safe; a registry lives and dies with its session.
 */
@Slf4j
public final class TopicRegistry {
    private final Map<String, TopicDescriptor> topics;

    public TopicRegistry() {
        this.topics = new LinkedHashMap<>();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(final String topic) {
        return topics.containsKey(topic);
    }

    public List<TopicDescriptor> descriptors() {
        return List.copyOf(topics.values());
    }

    /**
     * Binds the descriptor's name to its type and format.
     *
     * @return true if the name was new, false if the identical descriptor was already registered
     * @throws TopicConflictException if the name is bound to a different type or format
     */
    public boolean register(@NonNull final TopicDescriptor descriptor) {
        final TopicDescriptor existing = topics.get(descriptor.name());
        if (existing == null) {
            topics.put(descriptor.name(), descriptor);
            log.debug("Registered topic {} as {}/{}", descriptor.name(),
                    descriptor.typeIdentifier(), descriptor.serializationFormat());
            return true;
        }
        if (existing.equals(descriptor)) return false;
        throw TopicConflictException.contradicts(existing, descriptor);
    }

    /**
     * Fails like {@link #register} would, without changing the registry.
     */
    public void verifyCompatible(@NonNull final TopicDescriptor descriptor) {
        final TopicDescriptor existing = topics.get(descriptor.name());
        if (existing != null && !existing.equals(descriptor)) {
            throw TopicConflictException.contradicts(existing, descriptor);
        }
    }

    /**
     * Compares declared metadata against the registered descriptor.
     *
     * @return the registered descriptor when it differs from the declaration, empty when they agree
     * @throws TopicConflictException if the topic is not registered
     */
    public Optional<TopicDescriptor> mismatch(final String topic, final String type, final String format) {
        final TopicDescriptor existing = topics.get(topic);
        if (existing == null) throw TopicConflictException.unregistered(topic);
        return existing.declares(type, format) ? Optional.empty() : Optional.of(existing);
    }

    public static final class Builder {
        private final List<TopicDescriptor> pending = new ArrayList<>();

        public Builder topics(final List<TopicDescriptor> descriptors) {
            pending.addAll(descriptors);
            return this;
        }

        /**
         * @throws TopicConflictException if two pending descriptors bind one name differently
         */
        public TopicRegistry build() {
            final TopicRegistry registry = new TopicRegistry();
            pending.forEach(registry::register);
            return registry;
        }
    }
}
