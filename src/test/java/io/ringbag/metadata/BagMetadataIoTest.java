package io.ringbag.metadata;

import io.ringbag.core.model.MessageEnvelope;
import io.ringbag.core.model.TopicDescriptor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class BagMetadataIoTest {

    private static final TopicDescriptor IMU = new TopicDescriptor("/imu", "sensor_msgs/Imu", "proto3");
    private static final TopicDescriptor CMD = new TopicDescriptor("/cmd_vel", "geometry_msgs/Twist", "proto3");

    @TempDir
    Path dir;

    @Test
    void collectorSummarisesWhatWasWritten() {
        final BagMetadataCollector collector = new BagMetadataCollector();
        collector.topic(IMU);
        collector.topic(CMD);
        collector.message(MessageEnvelope.of(IMU, new byte[1], 5_000_000_000L));
        collector.message(MessageEnvelope.of(IMU, new byte[1], 4_000_000_000L));
        collector.message(MessageEnvelope.of(IMU, new byte[1], 9_000_000_000L));

        final BagMetadata metadata = collector.snapshot("segment");

        assertEquals(3L, metadata.messageCount());
        assertEquals(4_000_000_000L, metadata.startingTimeNanos());
        assertEquals(5_000_000_000L, metadata.durationNanos());
        assertEquals(List.of(new TopicInformation(IMU, 3), new TopicInformation(CMD, 0)), metadata.topics());
    }

    @Test
    void emptyBagHasZeroSpan() {
        final BagMetadata metadata = new BagMetadataCollector().snapshot("journal");
        assertEquals(0L, metadata.startingTimeNanos());
        assertEquals(0L, metadata.durationNanos());
        assertTrue(metadata.topics().isEmpty());
    }

    @Test
    void writtenMetadataReadsBackEqual() throws IOException {
        final BagMetadata metadata = new BagMetadata(BagMetadata.CURRENT_VERSION, "segment", 12L,
                1_700_000_000_123_456_789L, 42L,
                List.of(new TopicInformation(IMU, 10), new TopicInformation(CMD, 2)));

        BagMetadataIo.write(dir, metadata);

        assertTrue(Files.isRegularFile(BagMetadataIo.pathIn(dir)));
        assertFalse(Files.exists(dir.resolve(BagMetadataIo.FILE_NAME + ".tmp")));
        assertEquals(Optional.of(metadata), BagMetadataIo.read(dir));

        final String text = Files.readString(BagMetadataIo.pathIn(dir));
        assertTrue(text.contains("storageIdentifier: segment"));
        assertTrue(text.contains("name: /cmd_vel"));
    }

    @Test
    void missingFileIsEmpty() throws IOException {
        assertEquals(Optional.empty(), BagMetadataIo.read(dir));
    }

    @Test
    void malformedFileIsAnIoError() throws IOException {
        Files.writeString(BagMetadataIo.pathIn(dir), "version: one\nstorageIdentifier: segment\n");
        assertThrows(IOException.class, () -> BagMetadataIo.read(dir));

        Files.writeString(BagMetadataIo.pathIn(dir), "");
        assertThrows(IOException.class, () -> BagMetadataIo.read(dir));
    }

    @Test
    void topicLookupByName() {
        final BagMetadata metadata = new BagMetadata(1, "memory", 1, 0, 0, List.of(new TopicInformation(IMU, 1)));
        assertEquals(1L, metadata.topic("/imu").orElseThrow().messageCount());
        assertTrue(metadata.topic("/gps").isEmpty());
    }
}
