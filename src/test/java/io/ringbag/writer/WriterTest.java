package io.ringbag.writer;

import io.ringbag.config.impl.StorageOptions;
import io.ringbag.core.error.BackendIoException;
import io.ringbag.core.error.ConfigurationException;
import io.ringbag.core.error.SessionStateException;
import io.ringbag.core.error.TopicConflictException;
import io.ringbag.core.error.TopicTypeMismatchException;
import io.ringbag.core.model.MessageEnvelope;
import io.ringbag.core.model.TopicDescriptor;
import io.ringbag.metadata.BagMetadata;
import io.ringbag.reader.Reader;
import io.ringbag.session.RoleState;
import io.ringbag.storage.BackendFactory;
import io.ringbag.storage.BackendId;
import io.ringbag.storage.FaultyBackend;
import io.ringbag.storage.memory.InMemoryBackend;
import io.ringbag.storage.memory.InMemoryBagStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class WriterTest {

    private static final TopicDescriptor POSE = new TopicDescriptor("/pose", "geometry_msgs/Pose", "proto3");

    private InMemoryBagStore store;
    private BackendFactory factory;
    private final AtomicLong ticks = new AtomicLong(100);

    @BeforeEach
    void setUp() {
        store = new InMemoryBagStore();
        factory = BackendFactory.builder().backend(BackendId.MEMORY, () -> new InMemoryBackend(store)).build();
    }

    private Writer newWriter() {
        return new Writer(factory, ticks::incrementAndGet);
    }

    @Test
    void operationsBeforeOpenAreRejected() {
        final Writer writer = newWriter();
        assertEquals(RoleState.NOT_OPEN, writer.getState());

        assertThrows(SessionStateException.class, () -> writer.createTopic(POSE));
        assertThrows(SessionStateException.class, () -> writer.write(MessageEnvelope.of(POSE, new byte[1], 1L)));
        writer.close();
        assertEquals(RoleState.NOT_OPEN, writer.getState(), "closing a writer that never opened does nothing");
    }

    @Test
    void typeMismatchIsReturnedAndNothingIsRecorded() {
        try (final Writer writer = newWriter()) {
            writer.open(StorageOptions.of("bag", "memory"));
            writer.createTopic(POSE);
            assertTrue(writer.write(MessageEnvelope.of(POSE, new byte[]{1}, 1L)).isAccepted());

            final WriteResult result = writer.write(
                    new MessageEnvelope("/pose", "geometry_msgs/Twist", "proto3", new byte[]{2}, 2L));

            final WriteResult.TypeMismatch mismatch = assertInstanceOf(WriteResult.TypeMismatch.class, result);
            assertEquals(POSE, mismatch.registered());
            assertEquals("geometry_msgs/Twist", mismatch.declaredType());
            assertThrows(TopicTypeMismatchException.class, result::orThrow);
            assertEquals(1L, writer.messageCount());

            final WriteResult formatMismatch = writer.write(new byte[]{3}, "/pose", "geometry_msgs/Pose", "cdr", 3L);
            assertFalse(formatMismatch.isAccepted());
            assertEquals(1L, writer.messageCount());
        }
        assertEquals(1, readAll("bag").size());
    }

    @Test
    void writeToUnknownTopicWithoutDescriptorConflicts() {
        try (final Writer writer = newWriter()) {
            writer.open(StorageOptions.of("bag", "memory"));
            assertThrows(TopicConflictException.class, () -> writer.write(MessageEnvelope.of(POSE, new byte[1], 1L)));
            assertEquals(0L, writer.messageCount());
        }
    }

    @Test
    void envelopeWithDescriptorRegistersTopic() {
        try (final Writer writer = newWriter()) {
            writer.open(StorageOptions.of("bag", "memory"));

            assertEquals(new WriteResult.Accepted(0), writer.write(MessageEnvelope.of(POSE, new byte[1], 1L), POSE));
            assertEquals(List.of(POSE), writer.topics());

            final TopicDescriptor otherType = new TopicDescriptor("/pose", "geometry_msgs/Twist", "proto3");
            assertThrows(TopicConflictException.class,
                    () -> writer.write(MessageEnvelope.of(otherType, new byte[1], 2L), otherType));
            assertThrows(IllegalArgumentException.class,
                    () -> writer.write(MessageEnvelope.of(POSE, new byte[1], 3L), new TopicDescriptor("/x", "t", "f")));
        }
    }

    @Test
    void envelopeContradictingItsOwnDescriptorRegistersNothing() {
        try (final Writer writer = newWriter()) {
            writer.open(StorageOptions.of("bag", "memory"));

            final MessageEnvelope twist = new MessageEnvelope("/pose", "geometry_msgs/Twist", "proto3", new byte[1], 1L);
            assertFalse(writer.write(twist, POSE).isAccepted());
            assertTrue(writer.topics().isEmpty());
        }
    }

    @Test
    void createTopicIsIdempotent() {
        try (final Writer writer = newWriter()) {
            writer.open(StorageOptions.of("bag", "memory"));
            writer.createTopic(POSE);
            writer.createTopic(new TopicDescriptor("/pose", "geometry_msgs/Pose", "proto3"));
            assertEquals(List.of(POSE), writer.topics());

            assertThrows(TopicConflictException.class,
                    () -> writer.createTopic(new TopicDescriptor("/pose", "geometry_msgs/Pose", "cdr")));
        }

        try (final Reader reader = new Reader(factory)) {
            reader.open(StorageOptions.of("bag", "memory"));
            assertEquals(List.of(POSE), reader.topics(), "the topic is recorded once");
        }
    }

    @Test
    void configuredTopicsAreCreatedOnOpen() {
        try (final Writer writer = newWriter()) {
            writer.open(StorageOptions.builder().uri("bag").storageId("memory").topic(POSE).build());
            assertEquals(List.of(POSE), writer.topics());
            assertTrue(writer.write(MessageEnvelope.of(POSE, new byte[1], 1L)).isAccepted());
        }
    }

    @Test
    void splitByLocationDoesNotRecreateConfiguredTopics() {
        try (final Writer writer = newWriter()) {
            writer.open(StorageOptions.builder().uri("first").storageId("memory").topic(POSE).build());
            assertEquals(List.of(POSE), writer.topics());

            writer.open("second");
            assertTrue(writer.topics().isEmpty());
        }

        try (final Reader reader = new Reader(factory)) {
            reader.open(StorageOptions.of("second", "memory"));
            assertTrue(reader.topics().isEmpty());
        }
    }

    @Test
    void contradictoryConfiguredTopicsOpenNothing() {
        final StorageOptions contradictory = StorageOptions.builder()
                .uri("bag")
                .storageId("memory")
                .topic(POSE)
                .topic(new TopicDescriptor("/pose", "geometry_msgs/PoseStamped", "proto3"))
                .build();

        try (final Writer writer = newWriter()) {
            writer.open(StorageOptions.of("current", "memory"));

            assertThrows(TopicConflictException.class, () -> writer.open(contradictory));
            assertEquals("current", writer.location(), "the open bag is kept");
            assertFalse(store.contains("bag"));

            writer.open(StorageOptions.builder().uri("bag").storageId("memory").topic(POSE).build());
            assertEquals(List.of(POSE), writer.topics());
        }
    }

    @Test
    void reopeningSplitsIntoIndependentBags() {
        try (final Writer writer = newWriter()) {
            writer.open(StorageOptions.of("first", "memory"));
            writer.createTopic(POSE);
            writer.write(MessageEnvelope.of(POSE, new byte[]{1}, 1L));
            writer.write(MessageEnvelope.of(POSE, new byte[]{2}, 2L));

            writer.open("second");
            assertEquals("second", writer.location());
            assertTrue(writer.topics().isEmpty(), "topics do not carry over a split");
            assertThrows(TopicConflictException.class, () -> writer.write(MessageEnvelope.of(POSE, new byte[]{3}, 3L)));

            assertEquals(new WriteResult.Accepted(0), writer.write(new byte[]{3}, "/pose", "geometry_msgs/Pose", "proto3", 3L));
        }

        assertEquals(2, readAll("first").size());
        assertEquals(1, readAll("second").size());
        assertTrue(store.contains("first"));
    }

    @Test
    void closeStoresMetadata() {
        try (final Writer writer = newWriter()) {
            writer.open(StorageOptions.of("bag", "memory"));
            writer.createTopic(POSE);
            writer.createTopic(new TopicDescriptor("/idle", "std_msgs/Empty", "proto3"));
            writer.write(MessageEnvelope.of(POSE, new byte[1], 10L));
            writer.write(MessageEnvelope.of(POSE, new byte[1], 25L));
        }

        try (final Reader reader = new Reader(factory)) {
            reader.open(StorageOptions.of("bag", "memory"));
            final BagMetadata metadata = reader.metadata().orElseThrow();

            assertEquals("memory", metadata.storageIdentifier());
            assertEquals(2L, metadata.messageCount());
            assertEquals(10L, metadata.startingTimeNanos());
            assertEquals(15L, metadata.durationNanos());
            assertEquals(2L, metadata.topic("/pose").orElseThrow().messageCount());
            assertEquals(0L, metadata.topic("/idle").orElseThrow().messageCount());
        }
    }

    @Test
    void clockStampsCodecWrites() {
        final io.ringbag.codec.MessageCodec<String> text = new io.ringbag.codec.MessageCodec<>() {
            @Override
            public String serializationFormat() {
                return "utf8";
            }

            @Override
            public String typeIdentifier(final String message) {
                return "std_msgs/String";
            }

            @Override
            public byte[] serialize(final String message) {
                return message.getBytes(java.nio.charset.StandardCharsets.UTF_8);
            }

            @Override
            public String deserialize(final byte[] data, final String typeIdentifier) {
                return new String(data, java.nio.charset.StandardCharsets.UTF_8);
            }
        };

        try (final Writer writer = newWriter()) {
            writer.open(StorageOptions.of("bag", "memory"));
            writer.write("hello", text, "/chatter");
            writer.write("world", text, "/chatter");
        }

        final List<MessageEnvelope> envelopes = readAll("bag");
        assertEquals(List.of(101L, 102L), envelopes.stream().map(MessageEnvelope::receiveTimestamp).toList());
        assertEquals("utf8", envelopes.get(0).serializationFormat());
    }

    @Test
    void failedWriteSurfacesAsBackendError() {
        final FaultyBackend faulty = new FaultyBackend(store);
        final Writer writer = new Writer(BackendFactory.builder().backend(BackendId.MEMORY, () -> faulty).build(), () -> 0L);
        writer.open(StorageOptions.of("bag", "memory"));
        writer.createTopic(POSE);

        faulty.failWrite = true;
        assertThrows(BackendIoException.class, () -> writer.write(MessageEnvelope.of(POSE, new byte[1], 1L)));
        assertEquals(0L, writer.messageCount());

        faulty.failWrite = false;
        assertEquals(new WriteResult.Accepted(0), writer.write(MessageEnvelope.of(POSE, new byte[1], 2L)));
        writer.close();
    }

    @Test
    void failedMetadataStillReleasesBackend() {
        final FaultyBackend faulty = new FaultyBackend(store);
        final Writer writer = new Writer(BackendFactory.builder().backend(BackendId.MEMORY, () -> faulty).build(), () -> 0L);
        writer.open(StorageOptions.of("bag", "memory"));

        faulty.failMetadata = true;
        faulty.failClose = true;
        final BackendIoException e = assertThrows(BackendIoException.class, writer::close);

        assertTrue(e.getMessage().contains("metadata"));
        assertEquals(1, e.getSuppressed().length, "the close failure is attached to the metadata failure");
        assertEquals(1, faulty.closeCalls);
        assertEquals(RoleState.CLOSED, writer.getState());
    }

    @Test
    void openOnUnknownBackendFails() {
        final Writer writer = newWriter();
        assertThrows(ConfigurationException.class, () -> writer.open(StorageOptions.of("bag", "bogus")));
        assertFalse(writer.isOpen());
    }

    private List<MessageEnvelope> readAll(final String location) {
        final List<MessageEnvelope> out = new ArrayList<>();
        try (final Reader reader = new Reader(factory)) {
            reader.open(StorageOptions.of(location, "memory"));
            while (reader.hasNext()) out.add(reader.readNext());
        }
        return out;
    }
}
