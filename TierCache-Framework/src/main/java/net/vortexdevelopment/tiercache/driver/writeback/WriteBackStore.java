package net.vortexdevelopment.tiercache.driver.writeback;

import net.vortexdevelopment.tiercache.debug.DebugLogger;
import net.vortexdevelopment.tiercache.driver.DynamicStore;
import net.vortexdevelopment.tiercache.driver.EntryKey;
import net.vortexdevelopment.tiercache.driver.MemoryUsage;
import net.vortexdevelopment.tiercache.exception.TierCacheException;
import org.jetbrains.annotations.NotNull;

import java.io.Closeable;
import java.io.Serializable;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Buffers {@link #store} and {@link #remove} of a {@link DynamicStore} in memory and writes them
 * back in two batches when the store is flushed or closed.
 *
 * <p>Pending operations are coalesced in program order: a later remove of a key discards its
 * pending store and a later store discards its pending remove, so each key appears in at most one
 * batch. Reads look at the buffer before the delegate, which makes buffered writes visible to this
 * process immediately. Other processes see them only after the flush.
 *
 * <p>{@link #close()} flushes exactly once. Writes after closing go straight to the delegate.
 */
public class WriteBackStore implements DynamicStore, Closeable {

    private final DynamicStore delegate;
    protected final Clock clock;

    private final Map<EntryKey, PendingStore> pendingStores = new LinkedHashMap<>();
    private final Set<EntryKey> pendingRemovals = new LinkedHashSet<>();
    private boolean closed;

    public WriteBackStore(@NotNull DynamicStore delegate, @NotNull Clock clock) {
        this.delegate = delegate;
        this.clock = clock;
    }

    @Override
    public synchronized boolean store(@NotNull String id, @NotNull Serializable data, @NotNull String realm, long ttlSeconds) {
        if (closed) {
            DebugLogger.log("Store of %s/%s after close, writing through", realm, id);
            return delegate.store(id, data, realm, ttlSeconds);
        }
        EntryKey key = EntryKey.of(id, realm);
        pendingRemovals.remove(key);
        // re-insert so the batch keeps the order of the last write
        pendingStores.remove(key);
        pendingStores.put(key, new PendingStore(key, data, ttlSeconds, now()));
        return true;
    }

    /**
     * Writes the entry to the delegate immediately, bypassing the buffer.
     */
    public synchronized boolean storeNow(@NotNull String id, @NotNull Serializable data, @NotNull String realm, long ttlSeconds) {
        discardPending(EntryKey.of(id, realm));
        return delegate.store(id, data, realm, ttlSeconds);
    }

    /**
     * Queues the removal of an entry.
     *
     * @return whether the entry was visible before the call, from the buffer or the delegate
     */
    @Override
    public synchronized boolean remove(@NotNull String id, @NotNull String realm) {
        if (closed) {
            return delegate.remove(id, realm);
        }
        boolean visible = exists(id, realm);
        EntryKey key = EntryKey.of(id, realm);
        pendingStores.remove(key);
        pendingRemovals.add(key);
        return visible;
    }

    /**
     * Removes the entry from the delegate immediately, bypassing the buffer.
     */
    public synchronized boolean removeNow(@NotNull String id, @NotNull String realm) {
        discardPending(EntryKey.of(id, realm));
        return delegate.remove(id, realm);
    }

    @Override
    public synchronized boolean exists(@NotNull String id, @NotNull String realm) {
        EntryKey key = EntryKey.of(id, realm);
        if (pendingRemovals.contains(key)) {
            return false;
        }
        PendingStore pending = pendingStores.get(key);
        if (pending != null) {
            return !pending.isExpired(now());
        }
        return delegate.exists(id, realm);
    }

    @Override
    public synchronized Optional<Object> get(@NotNull String id, @NotNull String realm) {
        EntryKey key = EntryKey.of(id, realm);
        if (pendingRemovals.contains(key)) {
            return Optional.empty();
        }
        PendingStore pending = pendingStores.get(key);
        if (pending != null) {
            return pending.isExpired(now()) ? Optional.empty() : Optional.of(pending.getData());
        }
        return delegate.get(id, realm);
    }

    @Override
    public synchronized boolean clear(@NotNull String realm) {
        if (realm.isEmpty()) {
            pendingStores.clear();
            pendingRemovals.clear();
        } else {
            pendingStores.keySet().removeIf(key -> key.realm().equals(realm));
            pendingRemovals.removeIf(key -> key.realm().equals(realm));
        }
        return delegate.clear(realm);
    }

    @Override
    public MemoryUsage getInfo() {
        return delegate.getInfo();
    }

    /**
     * Number of operations waiting to be flushed.
     */
    public synchronized int pendingCount() {
        return pendingStores.size() + pendingRemovals.size();
    }

    /**
     * Applies all pending removals as one batch, then all pending stores as one batch. A store
     * that expired while buffered is applied as a removal.
     * The buffer is emptied even if the delegate fails, there is no retry.
     *
     * @return number of operations written
     */
    public synchronized int flush() {
        if (pendingStores.isEmpty() && pendingRemovals.isEmpty()) {
            return 0;
        }
        long now = now();
        List<EntryKey> removals = new ArrayList<>(pendingRemovals);
        List<PendingStore> stores = new ArrayList<>(pendingStores.size());
        for (PendingStore pending : pendingStores.values()) {
            // an expired store still replaces the durable row, so the row has to go
            if (pending.isExpired(now)) {
                removals.add(pending.getKey());
            } else {
                stores.add(pending);
            }
        }
        pendingRemovals.clear();
        pendingStores.clear();

        if (delegate instanceof BatchWriter writer) {
            if (!removals.isEmpty()) {
                writer.removeAll(removals);
            }
            if (!stores.isEmpty()) {
                writer.storeAll(stores);
            }
        } else {
            for (EntryKey key : removals) {
                delegate.remove(key.id(), key.realm());
            }
            for (PendingStore pending : stores) {
                EntryKey key = pending.getKey();
                delegate.store(key.id(), pending.getData(), key.realm(), pending.remainingTtl(now));
            }
        }
        DebugLogger.log(WriteBackStore.class, "Flushed %d removals and %d stores", removals.size(), stores.size());
        return removals.size() + stores.size();
    }

    /**
     * Flushes the buffer once. Later calls do nothing.
     *
     * @throws TierCacheException if the delegate failed to persist the batch
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            flush();
        } catch (TierCacheException e) {
            DebugLogger.error(WriteBackStore.class, "Write-back flush failed, buffered entries are lost", e);
            throw e;
        }
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    protected long now() {
        return clock.instant().getEpochSecond();
    }

    private void discardPending(EntryKey key) {
        pendingStores.remove(key);
        pendingRemovals.remove(key);
    }
}
