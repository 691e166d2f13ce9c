package io.ringbag.writer;

import io.ringbag.clock.BagClock;
import io.ringbag.codec.MessageCodec;
import io.ringbag.config.impl.StorageOptions;
import io.ringbag.core.error.BackendIoException;
import io.ringbag.core.error.SessionStateException;
import io.ringbag.core.error.TopicConflictException;
import io.ringbag.core.model.MessageEnvelope;
import io.ringbag.core.model.TopicDescriptor;
import io.ringbag.metadata.BagMetadataCollector;
import io.ringbag.registry.TopicRegistry;
import io.ringbag.session.BagSession;
import io.ringbag.session.RoleState;
import io.ringbag.storage.BackendFactory;
import io.ringbag.storage.OpenMode;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Records envelopes into a bag.
 * <p>
 * Every write is validated against the topic registry of the open bag and is handed to the backend before
 * the call returns, so messages are stored in call order. Opening while a bag is open closes it first and
 * starts a new bag at the new location with an empty registry ("split").
 */
@Slf4j
public final class Writer implements AutoCloseable {
    private final BagSession session;
    private final BagClock clock;

    @Getter
    private RoleState state = RoleState.NOT_OPEN;
    private StorageOptions lastOptions;
    private BagMetadataCollector stats;
    private long sequence;

    public Writer() {
        this(BackendFactory.defaults(), BagClock.system());
    }

    public Writer(@NonNull final BackendFactory factory, @NonNull final BagClock clock) {
        this.session = new BagSession(factory);
        this.clock = clock;
    }

    /**
     * Opens a bag at the location with the backend and backend settings of the previous open, or the default
     * backend. Topics configured on the previous options are not created again; register them on the new bag.
     */
    public void open(@NonNull final String location) {
        open(lastOptions == null ? StorageOptions.builder().uri(location).build() : lastOptions.withUri(location));
    }

    /**
     * Opens a bag and creates the topics listed in the options. An open bag is closed first.
     *
     * @throws TopicConflictException if the options bind one topic name twice with different types or formats;
     *                                nothing is opened or closed in that case
     */
    public void open(@NonNull final StorageOptions options) {
        final TopicRegistry configured = TopicRegistry.builder().topics(options.getTopics()).build();

        if (state == RoleState.OPEN) {
            log.info("Splitting bag {} -> {}", session.location(), options.getUri());
            close();
        }

        session.open(options, OpenMode.WRITE);
        stats = new BagMetadataCollector();
        sequence = 0;
        lastOptions = options;
        state = RoleState.OPEN;

        try {
            configured.descriptors().forEach(this::createTopic);
        } catch (final RuntimeException e) {
            try {
                close();
            } catch (final RuntimeException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    public boolean isOpen() {
        return state == RoleState.OPEN;
    }

    public String location() {
        requireOpen("location");
        return session.location();
    }

    /**
     * Topics created in the open bag, in creation order.
     */
    public List<TopicDescriptor> topics() {
        requireOpen("topics");
        return session.registry().descriptors();
    }

    public long messageCount() {
        requireOpen("messageCount");
        return stats.messageCount();
    }

    /**
     * Registers and records a topic. Re-creating an identical topic does nothing.
     *
     * @throws TopicConflictException if the name is already bound to another type or format
     */
    public void createTopic(@NonNull final TopicDescriptor descriptor) {
        requireOpen("createTopic");
        final TopicRegistry registry = session.registry();

        registry.verifyCompatible(descriptor);
        if (registry.contains(descriptor.name())) return;

        try {
            session.backend().writeTopic(descriptor);
        } catch (final IOException e) {
            throw new BackendIoException("Failed to record topic " + descriptor.name(), e);
        }
        registry.register(descriptor);
        stats.topic(descriptor);
    }

    /**
     * Records an envelope on an existing topic.
     *
     * @return {@link WriteResult.TypeMismatch} if the envelope's type or format differ from the topic's
     * @throws TopicConflictException if the topic was never created
     */
    public WriteResult write(@NonNull final MessageEnvelope envelope) {
        requireOpen("write");

        final Optional<TopicDescriptor> registered = session.registry()
                .mismatch(envelope.topicName(), envelope.typeIdentifier(), envelope.serializationFormat());
        if (registered.isPresent()) return rejected(registered.get(), envelope);

        return persist(envelope);
    }

    /**
     * Records an envelope, creating its topic from the descriptor if it does not exist yet.
     * Nothing is created when the envelope does not match the descriptor.
     *
     * @throws IllegalArgumentException if the descriptor names another topic
     * @throws TopicConflictException   if the topic exists with another type or format
     */
    public WriteResult write(@NonNull final MessageEnvelope envelope, @NonNull final TopicDescriptor descriptor) {
        requireOpen("write");
        if (!descriptor.name().equals(envelope.topicName())) {
            throw new IllegalArgumentException("Descriptor for " + descriptor.name()
                    + " supplied with an envelope for " + envelope.topicName());
        }

        session.registry().verifyCompatible(descriptor);
        if (!descriptor.declares(envelope.typeIdentifier(), envelope.serializationFormat())) {
            return rejected(descriptor, envelope);
        }

        createTopic(descriptor);
        return persist(envelope);
    }

    /**
     * Records already-serialized bytes. An unknown topic is created from the given metadata.
     */
    public WriteResult write(@NonNull final byte[] serialized,
                             @NonNull final String topic,
                             @NonNull final String type,
                             @NonNull final String format,
                             final long timestamp) {
        requireOpen("write");
        final MessageEnvelope envelope = new MessageEnvelope(topic, type, format, serialized, timestamp);
        return session.registry().contains(topic)
                ? write(envelope)
                : write(envelope, new TopicDescriptor(topic, type, format));
    }

    /**
     * Serializes the message with the codec and records it under the given type.
     */
    public <T> WriteResult write(@NonNull final T message,
                                 @NonNull final MessageCodec<? super T> codec,
                                 @NonNull final String topic,
                                 @NonNull final String type,
                                 final long timestamp) {
        return write(codec.serialize(message), topic, type, codec.serializationFormat(), timestamp);
    }

    /**
     * Serializes the message with the codec and records it under the type the codec reports.
     */
    public <T> WriteResult write(@NonNull final T message,
                                 @NonNull final MessageCodec<? super T> codec,
                                 @NonNull final String topic,
                                 final long timestamp) {
        return write(message, codec, topic, codec.typeIdentifier(message), timestamp);
    }

    /**
     * As {@link #write(Object, MessageCodec, String, long)}, stamped with the writer's clock.
     */
    public <T> WriteResult write(@NonNull final T message,
                                 @NonNull final MessageCodec<? super T> codec,
                                 @NonNull final String topic) {
        return write(message, codec, topic, clock.now());
    }

    private WriteResult rejected(final TopicDescriptor registered, final MessageEnvelope envelope) {
        log.debug("Rejected message on {}: declared {}/{}, registered {}/{}", envelope.topicName(),
                envelope.typeIdentifier(), envelope.serializationFormat(),
                registered.typeIdentifier(), registered.serializationFormat());
        return WriteResult.typeMismatch(registered, envelope.typeIdentifier(), envelope.serializationFormat());
    }

    private WriteResult persist(final MessageEnvelope envelope) {
        try {
            session.backend().writeEnvelope(envelope);
        } catch (final IOException e) {
            throw new BackendIoException("Failed to record message on " + envelope.topicName(), e);
        }
        stats.message(envelope);
        return WriteResult.accepted(sequence++);
    }

    /**
     * Stores the bag metadata and closes the bag. The backend is released even if storing the metadata fails;
     * the first failure is thrown with later ones suppressed. Does nothing if no bag is open.
     */
    @Override
    public void close() {
        if (state != RoleState.OPEN) return;
        state = RoleState.CLOSED;

        final String location = session.location();
        final long messages = stats.messageCount();
        RuntimeException failure = null;

        try {
            session.backend().writeMetadata(stats.snapshot(session.getOptions().getStorageId()));
        } catch (final IOException e) {
            failure = new BackendIoException("Failed to write metadata for " + location, e);
        } catch (final RuntimeException e) {
            failure = e;
        }

        try {
            session.close();
        } catch (final RuntimeException e) {
            if (failure == null) failure = e;
            else failure.addSuppressed(e);
        }

        stats = null;
        if (failure != null) throw failure;
        log.info("Finished bag {} with {} messages", location, messages);
    }

    private void requireOpen(final String operation) {
        if (state != RoleState.OPEN) {
            throw new SessionStateException("Cannot " + operation + ": writer is " + state);
        }
    }
}
