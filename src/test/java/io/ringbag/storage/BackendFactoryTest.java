package io.ringbag.storage;

import io.ringbag.core.error.ConfigurationException;
import io.ringbag.storage.journal.JournalBackend;
import io.ringbag.storage.memory.InMemoryBackend;
import io.ringbag.storage.segment.SegmentBackend;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class BackendFactoryTest {

    @Test
    void resolvesEveryKnownIdentifier() {
        final BackendFactory factory = BackendFactory.defaults();

        assertInstanceOf(SegmentBackend.class, factory.create("segment"));
        assertInstanceOf(JournalBackend.class, factory.create("journal"));
        assertInstanceOf(InMemoryBackend.class, factory.create("memory"));
    }

    @Test
    void unknownIdentifierIsAConfigurationError() {
        final ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> BackendFactory.defaults().create("sqlite3"));
        assertTrue(e.getMessage().contains("sqlite3"));
        assertThrows(ConfigurationException.class, () -> BackendFactory.defaults().create((String) null));
        assertThrows(ConfigurationException.class, () -> BackendId.fromIdentifier("SEGMENT"));
    }

    @Test
    void eachCallCreatesAFreshInstance() {
        final BackendFactory factory = BackendFactory.defaults();
        assertNotSame(factory.create(BackendId.MEMORY), factory.create(BackendId.MEMORY));
    }

    @Test
    void builderReplacesOneConstructor() {
        final StorageBackend stub = new InMemoryBackend();
        final BackendFactory factory = BackendFactory.builder().backend(BackendId.JOURNAL, () -> stub).build();

        assertSame(stub, factory.create("journal"));
        assertInstanceOf(SegmentBackend.class, factory.create("segment"));
    }

    @Test
    void backendConfigParsesTypedValues() {
        final BackendConfig config = BackendConfig.of(Map.of("a", 5, "b", "12", "c", "true", "d", "maybe"));

        assertEquals(5, config.intValue("a", 0));
        assertEquals(12, config.intValue("b", 0));
        assertEquals(3, config.intValue("missing", 3));
        assertTrue(config.booleanValue("c", false));
        assertThrows(ConfigurationException.class, () -> config.booleanValue("d", false));
        assertThrows(ConfigurationException.class, () -> config.intValue("c", 0));
    }

    @Test
    void backendConfigRejectsIntegersOutsideIntRange() {
        final BackendConfig config = BackendConfig.of(Map.of(
                "wrapsToSmall", 4_294_971_392L,
                "fitsInLong", 8_388_608L,
                "huge", new java.math.BigInteger("18446744073709555712"),
                "text", "4294971392",
                "fraction", 1.5));

        assertEquals(8_388_608, config.intValue("fitsInLong", 0));
        assertThrows(ConfigurationException.class, () -> config.intValue("wrapsToSmall", 0));
        assertThrows(ConfigurationException.class, () -> config.intValue("huge", 0));
        assertThrows(ConfigurationException.class, () -> config.intValue("text", 0));
        assertThrows(ConfigurationException.class, () -> config.intValue("fraction", 0));
    }
}
