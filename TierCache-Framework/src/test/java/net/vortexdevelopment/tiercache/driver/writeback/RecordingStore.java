package net.vortexdevelopment.tiercache.driver.writeback;

import net.vortexdevelopment.tiercache.driver.DynamicStore;
import net.vortexdevelopment.tiercache.driver.EntryKey;
import org.jetbrains.annotations.NotNull;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Map backed store that records the batches it receives.
 */
class RecordingStore implements DynamicStore, BatchWriter {

    final Map<EntryKey, Serializable> entries = new HashMap<>();
    final Map<EntryKey, Long> ttls = new HashMap<>();
    final List<List<EntryKey>> removalBatches = new ArrayList<>();
    final List<List<PendingStore>> storeBatches = new ArrayList<>();
    int directStores;

    @Override
    public boolean clear(@NotNull String realm) {
        entries.keySet().removeIf(key -> realm.isEmpty() || key.realm().equals(realm));
        return true;
    }

    @Override
    public boolean exists(@NotNull String id, @NotNull String realm) {
        return entries.containsKey(EntryKey.of(id, realm));
    }

    @Override
    public Optional<Object> get(@NotNull String id, @NotNull String realm) {
        return Optional.ofNullable(entries.get(EntryKey.of(id, realm)));
    }

    @Override
    public boolean remove(@NotNull String id, @NotNull String realm) {
        return entries.remove(EntryKey.of(id, realm)) != null;
    }

    @Override
    public boolean store(@NotNull String id, @NotNull Serializable data, @NotNull String realm, long ttlSeconds) {
        directStores++;
        entries.put(EntryKey.of(id, realm), data);
        ttls.put(EntryKey.of(id, realm), ttlSeconds);
        return true;
    }

    @Override
    public int removeAll(List<EntryKey> keys) {
        removalBatches.add(List.copyOf(keys));
        int removed = 0;
        for (EntryKey key : keys) {
            if (entries.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int storeAll(List<PendingStore> pending) {
        storeBatches.add(List.copyOf(pending));
        for (PendingStore entry : pending) {
            entries.put(entry.getKey(), entry.getData());
            ttls.put(entry.getKey(), entry.getTtlSeconds());
        }
        return pending.size();
    }
}
