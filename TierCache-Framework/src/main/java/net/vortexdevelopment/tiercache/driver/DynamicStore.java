package net.vortexdevelopment.tiercache.driver;

import org.jetbrains.annotations.NotNull;

import java.io.Serializable;
import java.util.Optional;

/**
 * Store for small, frequently modified entries with a time to live.
 *
 * <p>Counters default to a read-modify-write over {@link #get} and {@link #store}, which is not
 * atomic across processes. Backends with a native counter override {@link #inc} and {@link #dec}.
 */
public interface DynamicStore extends CacheDriver, AtomicCounter, UsageReporter {

    /**
     * Time to live in seconds used when the caller does not give one.
     */
    long DEFAULT_TTL = 3600;

    /**
     * Stores a value.
     *
     * @param ttlSeconds time to live in seconds, 0 for unlimited
     */
    boolean store(@NotNull String id, @NotNull Serializable data, @NotNull String realm, long ttlSeconds);

    default boolean store(@NotNull String id, @NotNull Serializable data, @NotNull String realm) {
        return store(id, data, realm, DEFAULT_TTL);
    }

    @Override
    default long inc(@NotNull String id, @NotNull String realm, long delta) {
        return addAndStore(this, id, realm, delta);
    }

    @Override
    default long dec(@NotNull String id, @NotNull String realm, long delta) {
        return inc(id, realm, -delta);
    }

    @Override
    default MemoryUsage getInfo() {
        return MemoryUsage.unknown();
    }

    /**
     * Read-modify-write counter update shared by drivers without a native counter.
     */
    static long addAndStore(DynamicStore store, String id, String realm, long delta) {
        long value = toCount(store.get(id, realm), id, realm) + delta;
        store.store(id, value, realm);
        return value;
    }

    /**
     * Interprets a stored value as a counter.
     *
     * @throws IllegalStateException if a non-numeric value is stored under the key
     */
    static long toCount(Optional<Object> stored, String id, String realm) {
        if (stored.isEmpty()) {
            return 0;
        }
        Object value = stored.get();
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        throw new IllegalStateException("Entry " + realm + "/" + id + " is not a counter: " + value.getClass().getName());
    }
}
