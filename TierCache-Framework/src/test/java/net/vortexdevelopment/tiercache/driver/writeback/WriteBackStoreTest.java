package net.vortexdevelopment.tiercache.driver.writeback;

import net.vortexdevelopment.tiercache.driver.EntryKey;
import net.vortexdevelopment.tiercache.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WriteBackStoreTest {

    private RecordingStore backend;
    private MutableClock clock;
    private WriteBackStore store;

    @BeforeEach
    void setUp() {
        backend = new RecordingStore();
        clock = new MutableClock();
        store = new WriteBackStore(backend, clock);
    }

    @Test
    void storesAreBufferedUntilFlush() {
        // Act
        store.store("a", "1", "cot", 0);

        // Assert
        assertThat(backend.entries).isEmpty();
        assertThat(store.get("a", "cot")).contains("1");
        assertThat(store.exists("a", "cot")).isTrue();
        assertThat(store.pendingCount()).isEqualTo(1);
    }

    @Test
    void flushWritesOneBatchOfStores() {
        store.store("a", "1", "cot", 0);
        store.store("b", "2", "cot", 0);

        int written = store.flush();

        assertThat(written).isEqualTo(2);
        assertThat(backend.storeBatches).hasSize(1);
        assertThat(backend.storeBatches.get(0)).extracting(PendingStore::getKey)
                .containsExactly(EntryKey.of("a", "cot"), EntryKey.of("b", "cot"));
        assertThat(backend.directStores).isZero();
        assertThat(store.pendingCount()).isZero();
    }

    @Test
    void laterRemoveWinsOverEarlierStore() {
        // Arrange
        backend.entries.put(EntryKey.of("k", "cot"), "old");
        store.store("k", "new", "cot", 0);

        // Act
        boolean discarded = store.remove("k", "cot");
        store.close();

        // Assert
        assertThat(discarded).isTrue();
        assertThat(backend.entries).doesNotContainKey(EntryKey.of("k", "cot"));
        assertThat(backend.storeBatches).isEmpty();
        assertThat(backend.removalBatches).containsExactly(List.of(EntryKey.of("k", "cot")));
    }

    @Test
    void storeAfterRemoveSurvivesFlush() {
        backend.entries.put(EntryKey.of("k", "cot"), "old");

        store.remove("k", "cot");
        store.store("k", "new", "cot", 0);
        store.close();

        assertThat(backend.entries).containsEntry(EntryKey.of("k", "cot"), "new");
        assertThat(backend.removalBatches).isEmpty();
    }

    @Test
    void removeReportsVisibilityBeforeTheCall() {
        backend.entries.put(EntryKey.of("durable", "cot"), "old");
        store.store("buffered", "new", "cot", 0);

        assertThat(store.remove("durable", "cot")).isTrue();
        assertThat(store.remove("buffered", "cot")).isTrue();
        assertThat(store.remove("durable", "cot")).isFalse();
        assertThat(store.remove("absent", "cot")).isFalse();
    }

    @Test
    void expiredBufferedStoreIsFlushedAsRemoval() {
        // Arrange
        backend.entries.put(EntryKey.of("k", "cot"), "old");
        store.store("k", "new", "cot", 1);
        clock.advanceSeconds(5);

        // Act
        store.flush();

        // Assert
        assertThat(backend.entries).doesNotContainKey(EntryKey.of("k", "cot"));
        assertThat(backend.removalBatches).containsExactly(List.of(EntryKey.of("k", "cot")));
        assertThat(backend.storeBatches).isEmpty();
    }

    @Test
    void pendingRemovalHidesDurableEntry() {
        backend.entries.put(EntryKey.of("k", "cot"), "old");

        store.remove("k", "cot");

        assertThat(store.exists("k", "cot")).isFalse();
        assertThat(store.get("k", "cot")).isEmpty();
    }

    @Test
    void closeFlushesExactlyOnce() {
        store.store("a", "1", "cot", 0);

        store.close();
        store.close();

        assertThat(store.isClosed()).isTrue();
        assertThat(backend.storeBatches).hasSize(1);
    }

    @Test
    void writesAfterCloseGoStraightToTheBackend() {
        store.close();

        store.store("late", "value", "cot", 0);

        assertThat(backend.entries).containsEntry(EntryKey.of("late", "cot"), "value");
        assertThat(store.pendingCount()).isZero();
    }

    @Test
    void bufferedEntryExpiresWithTheClock() {
        store.store("short", "value", "cot", 10);

        clock.advanceSeconds(11);

        assertThat(store.get("short", "cot")).isEmpty();
        assertThat(store.exists("short", "cot")).isFalse();
    }

    @Test
    void expiredBufferedEntriesAreNotWritten() {
        store.store("short", "value", "cot", 10);
        store.store("long", "value", "cot", 0);
        clock.advanceSeconds(60);

        store.flush();

        assertThat(backend.entries).containsOnlyKeys(EntryKey.of("long", "cot"));
    }

    @Test
    void clearRealmDropsOnlyItsPendingOperations() {
        store.store("x", "a", "A", 0);
        store.store("x", "b", "B", 0);

        store.clear("A");
        store.flush();

        assertThat(backend.entries).containsOnlyKeys(EntryKey.of("x", "B"));
    }

    @Test
    void counterIsServedFromTheBuffer() {
        store.inc("hits", "cot", 5);
        long value = store.dec("hits", "cot", 2);

        assertThat(value).isEqualTo(3);
        assertThat(store.get("hits", "cot")).contains(3L);
    }

    @Test
    void storeNowBypassesTheBuffer() {
        store.store("k", "buffered", "cot", 0);

        store.storeNow("k", "direct", "cot", 0);
        store.flush();

        assertThat(backend.entries).containsEntry(EntryKey.of("k", "cot"), "direct");
        assertThat(backend.storeBatches).isEmpty();
    }
}
