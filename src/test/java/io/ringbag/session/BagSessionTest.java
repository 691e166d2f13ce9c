package io.ringbag.session;

import io.ringbag.config.impl.StorageOptions;
import io.ringbag.core.error.BackendIoException;
import io.ringbag.core.error.ConfigurationException;
import io.ringbag.core.error.SessionStateException;
import io.ringbag.storage.BackendFactory;
import io.ringbag.storage.BackendId;
import io.ringbag.storage.FaultyBackend;
import io.ringbag.storage.OpenMode;
import io.ringbag.storage.memory.InMemoryBagStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class BagSessionTest {

    private InMemoryBagStore store;
    private FaultyBackend backend;
    private BagSession session;

    @BeforeEach
    void setUp() {
        store = new InMemoryBagStore();
        backend = new FaultyBackend(store);
        session = new BagSession(BackendFactory.builder().backend(BackendId.MEMORY, () -> backend).build());
    }

    @Test
    void startsClosedAndOpensOnce() {
        assertEquals(SessionState.CLOSED, session.getState());
        assertThrows(SessionStateException.class, session::backend);

        session.open(StorageOptions.of("bag", "memory"), OpenMode.WRITE);
        assertEquals(SessionState.OPEN, session.getState());
        assertSame(backend, session.backend());
        assertEquals("bag", session.location());
        assertTrue(session.registry().descriptors().isEmpty());

        assertThrows(SessionStateException.class,
                () -> session.open(StorageOptions.of("other", "memory"), OpenMode.WRITE));
        assertEquals("bag", session.location(), "a rejected open leaves the session untouched");
    }

    @Test
    void unknownStorageIdLeavesSessionClosed() {
        assertThrows(ConfigurationException.class,
                () -> session.open(StorageOptions.of("bag", "rosbag_v2"), OpenMode.WRITE));
        assertFalse(session.isOpen());
    }

    @Test
    void backendThatCannotOpenIsReleased() {
        backend.failOpen = true;

        final ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> session.open(StorageOptions.of("bag", "memory"), OpenMode.WRITE));
        assertNotNull(e.getCause());
        assertEquals(1, backend.closeCalls);
        assertFalse(session.isOpen());
    }

    @Test
    void failedCloseStillReleasesAndCloses() {
        session.open(StorageOptions.of("bag", "memory"), OpenMode.WRITE);
        backend.failClose = true;

        assertThrows(BackendIoException.class, session::close);
        assertEquals(1, backend.closeCalls);
        assertEquals(SessionState.CLOSED, session.getState());

        session.close();
        assertEquals(1, backend.closeCalls, "closing a closed session is a no-op");
    }

    @Test
    void reopenAfterCloseGetsFreshRegistry() {
        final BagSession real = new BagSession(BackendFactory.builder()
                .backend(BackendId.MEMORY, () -> new io.ringbag.storage.memory.InMemoryBackend(store)).build());

        real.open(StorageOptions.of("first", "memory"), OpenMode.WRITE);
        real.registry().register(new io.ringbag.core.model.TopicDescriptor("/a", "t", "f"));
        real.close();

        real.open(StorageOptions.of("second", "memory"), OpenMode.WRITE);
        assertTrue(real.registry().descriptors().isEmpty());
        real.close();
    }
}
