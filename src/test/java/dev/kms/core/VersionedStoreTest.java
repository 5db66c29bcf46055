package dev.kms.core;

import dev.kms.core.model.StoreSnapshot;
import dev.kms.core.model.VersionedKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

public class VersionedStoreTest {

    private VersionedStore<Long> store;

    @BeforeEach
    void setUp() {
        store = new VersionedStore<>();
    }

    static VersionedStore<Long> createStore() throws KMSException {
        final var local = new VersionedStore<Long>();
        for (long v : new long[]{0, 1, 2, 4, 5, 9, 11, 12, 16, 17, 22, 26}) {
            local.update(v);
        }
        return local;
    }

    @Test
    void emptyStore() throws KMSException {
        assertEquals(0, store.count());
        assertEquals(Optional.empty(), store.get(1));
        assertEquals(Optional.empty(), store.latest());
        assertEquals(Optional.empty(), store.latestWithVersion());
    }

    @Test
    void updateAssignsSequentialVersions() throws KMSException {
        assertEquals(1, store.update(10L));
        assertEquals(2, store.update(1L));
        assertEquals(3, store.update(2L));
        assertEquals(4, store.update(4L));

        assertEquals(4, store.count());
        assertEquals(Optional.of(10L), store.get(1));
        assertEquals(Optional.of(4L), store.get(4));
        assertEquals(Optional.of(new VersionedKey<>(2, 1L)), store.getWithVersion(2));
    }

    @Test
    @DisplayName("drop не трогает счётчик и версия больше не выдаётся")
    void dropKeepsCounterAndRetiresVersion() throws KMSException {
        store.update(10L);
        store.update(20L);

        assertEquals(Optional.of(20L), store.drop(2));
        assertEquals(Optional.empty(), store.get(2));
        assertEquals(2, store.count());

        assertEquals(Optional.empty(), store.drop(2));
        assertEquals(3, store.update(30L));
        assertEquals(Optional.empty(), store.get(2));
    }

    @Test
    void latestIsMaxPresentVersion() throws KMSException {
        store.update(10L);
        store.update(20L);
        store.update(30L);

        assertEquals(Optional.of(new VersionedKey<>(3, 30L)), store.latestWithVersion());

        store.drop(3);
        final var latest = store.latestWithVersion().orElseThrow();
        assertEquals(2, latest.version());
        assertEquals(store.get(latest.version()), store.latest());
        assertEquals(3, store.count());
    }

    @Test
    void dropEverythingLeavesCounter() throws KMSException {
        final var local = createStore();
        for (long v = 1; v <= 12; v++) {
            assertTrue(local.drop(v).isPresent());
        }
        assertEquals(Optional.empty(), local.latest());
        assertEquals(12, local.count());
        assertEquals(13, local.update(99L));
    }

    @Test
    void readsReturnCopies() throws KMSException {
        final var bytes = new VersionedStore<byte[]>(byte[]::clone);
        final byte[] original = {1, 2, 3};
        bytes.update(original);

        original[0] = 42;
        final byte[] read = bytes.get(1).orElseThrow();
        assertEquals(1, read[0]);

        read[1] = 42;
        assertEquals(2, bytes.get(1).orElseThrow()[1]);
        assertEquals(3, bytes.latest().orElseThrow()[2]);
    }

    @Test
    void storeReaderSeesAllEntries() throws KMSException {
        final var local = createStore();
        local.drop(5);

        try (StoreReader<Long> reader = local.storeReader()) {
            assertEquals(11, reader.size());
            assertEquals(List.of(1L, 2L, 3L, 4L, 6L, 7L, 8L, 9L, 10L, 11L, 12L),
                    List.copyOf(reader.entries().keySet()));
            assertEquals(26L, reader.entries().get(12L));
            assertThrows(UnsupportedOperationException.class, () -> reader.entries().remove(1L));
        }
    }

    @Test
    void storeReaderReleasesLockOnClose() throws KMSException {
        store.update(1L);
        final StoreReader<Long> reader = store.storeReader();
        reader.close();
        reader.close();

        assertThrows(IllegalStateException.class, reader::entries);
        // писатель не заблокирован
        assertEquals(2, store.update(2L));
    }

    @Test
    void snapshotRoundTrip() throws KMSException {
        final var local = createStore();
        local.drop(12);

        final StoreSnapshot<Long> snapshot = local.snapshot();
        assertEquals(12, snapshot.counter());
        assertEquals(11, snapshot.entries().size());

        final var restored = VersionedStore.fromSnapshot(snapshot, java.util.function.UnaryOperator.identity());
        assertEquals(12, restored.count());
        assertEquals(snapshot, restored.snapshot());
        assertEquals(13, restored.update(7L));
    }

    @Test
    void snapshotRejectsVersionAboveCounter() {
        final var entries = new TreeMap<Long, Long>();
        entries.put(5L, 1L);
        assertThrows(IllegalArgumentException.class, () -> new StoreSnapshot<>(4, entries));
    }

    @Test
    void managerContractDelegates() throws KMSException {
        final KeyManager<Long> manager = store;
        assertEquals(1, manager.create(5L));
        assertEquals(Optional.of(5L), manager.latest());
        assertEquals(Optional.of(5L), manager.delete(1));
        assertEquals(Optional.empty(), manager.get(1));
    }

    @Test
    void versionSpaceExhausted() throws KMSException {
        final var full = VersionedStore.fromSnapshot(
                new StoreSnapshot<Long>(Long.MAX_VALUE, new TreeMap<>()),
                java.util.function.UnaryOperator.identity());

        assertThrows(VersionExhaustedException.class, () -> full.update(1L));
        assertEquals(Long.MAX_VALUE, full.count());
        assertFalse(full.isPoisoned());
    }

    @Test
    @DisplayName("исключение внутри записи портит хранилище")
    void failedInsertPoisonsStore() throws KMSException {
        final var local = new VersionedStore<String>(s -> {
            if (s.equals("boom")) {
                throw new IllegalStateException("copy failed");
            }
            return s;
        });
        local.update("ok");

        final var thrown = assertThrows(IllegalStateException.class, () -> local.update("boom"));
        assertEquals("copy failed", thrown.getMessage());
        assertTrue(local.isPoisoned());

        final var poisoned = assertThrows(StorePoisonedException.class, local::count);
        assertSame(thrown, poisoned.getCause());
        assertThrows(StorePoisonedException.class, () -> local.get(1));
        assertThrows(StorePoisonedException.class, local::latest);
        assertThrows(StorePoisonedException.class, () -> local.drop(1));
        assertThrows(StorePoisonedException.class, () -> local.update("again"));
        assertThrows(StorePoisonedException.class, local::storeReader);
        assertThrows(StorePoisonedException.class, local::snapshot);
    }

    @Test
    void updateRejectsNull() {
        assertThrows(NullPointerException.class, () -> store.update(null));
    }
}
