package net.vortexdevelopment.tiercache.driver.memory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Policy;
import net.vortexdevelopment.tiercache.debug.DebugLogger;
import net.vortexdevelopment.tiercache.driver.DynamicStore;
import net.vortexdevelopment.tiercache.driver.EntryKey;
import net.vortexdevelopment.tiercache.driver.MemoryUsage;
import net.vortexdevelopment.tiercache.driver.ValueCodec;
import org.jetbrains.annotations.NotNull;

import java.io.Serializable;
import java.time.Clock;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

/**
 * In-process memory tier backed by a Caffeine cache.
 *
 * <p>Values are kept serialized so that callers never share mutable instances with the cache.
 * Each entry carries its own time to live, measured against the supplied clock.
 */
public class CaffeineMemoryDriver implements VolatileDriver {

    public static final String ID = "caffeine";

    private final Cache<String, Slot> cache;
    private final long maxSize;

    /**
     * @param maxSize upper bound of the stored payload in bytes, {@link MemoryUsage#UNKNOWN} for none
     */
    public CaffeineMemoryDriver(long maxSize, @NotNull Clock clock) {
        this.maxSize = maxSize;
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run);
        if (maxSize > 0) {
            builder.maximumWeight(maxSize);
            builder.<String, Slot>weigher((key, slot) -> key.length() + slot.payload.length);
        }
        this.cache = builder.expireAfter(new SlotExpiry()).build();
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean clear(@NotNull String realm) {
        if (realm.isEmpty()) {
            cache.invalidateAll();
        } else {
            String prefix = EntryKey.realmPrefix(realm);
            cache.asMap().keySet().removeIf(key -> key.startsWith(prefix));
        }
        return true;
    }

    @Override
    public boolean exists(@NotNull String id, @NotNull String realm) {
        return cache.getIfPresent(EntryKey.of(id, realm).flatKey()) != null;
    }

    @Override
    public Optional<Object> get(@NotNull String id, @NotNull String realm) {
        Slot slot = cache.getIfPresent(EntryKey.of(id, realm).flatKey());
        return slot == null ? Optional.empty() : Optional.of(ValueCodec.decode(slot.payload));
    }

    @Override
    public boolean remove(@NotNull String id, @NotNull String realm) {
        return cache.asMap().remove(EntryKey.of(id, realm).flatKey()) != null;
    }

    @Override
    public boolean store(@NotNull String id, @NotNull Serializable data, @NotNull String realm, long ttlSeconds) {
        cache.put(EntryKey.of(id, realm).flatKey(), new Slot(ValueCodec.encode(data), ttlNanos(ttlSeconds)));
        return true;
    }

    /**
     * Adds to the counter in one atomic map operation. A missing counter starts at 0 with the
     * default time to live, an existing one keeps its remaining time to live.
     */
    @Override
    public long inc(@NotNull String id, @NotNull String realm, long delta) {
        long[] result = new long[1];
        cache.asMap().compute(EntryKey.of(id, realm).flatKey(), (key, current) -> {
            Optional<Object> stored = current == null ? Optional.empty() : Optional.of(ValueCodec.decode(current.payload));
            result[0] = DynamicStore.toCount(stored, id, realm) + delta;
            long ttl = current == null ? ttlNanos(DEFAULT_TTL) : Slot.KEEP_EXPIRY;
            return new Slot(ValueCodec.encode(result[0]), ttl);
        });
        return result[0];
    }

    @Override
    public MemoryUsage getInfo() {
        cache.cleanUp();
        Optional<Policy.Eviction<String, Slot>> eviction = cache.policy().eviction();
        OptionalLong weighted = eviction.map(Policy.Eviction::weightedSize).orElse(OptionalLong.empty());
        long occupied = weighted.isPresent() ? weighted.getAsLong() : occupiedBytes();
        return MemoryUsage.of(maxSize > 0 ? maxSize : MemoryUsage.UNKNOWN, occupied);
    }

    @Override
    public void close() {
        cache.invalidateAll();
        DebugLogger.log(CaffeineMemoryDriver.class, "Caffeine memory driver closed");
    }

    private long occupiedBytes() {
        return cache.asMap().entrySet().stream()
                .mapToLong(entry -> entry.getKey().length() + entry.getValue().payload.length)
                .sum();
    }

    private static long ttlNanos(long ttlSeconds) {
        return ttlSeconds > 0 ? TimeUnit.SECONDS.toNanos(ttlSeconds) : Long.MAX_VALUE;
    }

    private static final class Slot {

        static final long KEEP_EXPIRY = -1;

        final byte[] payload;
        final long ttlNanos;

        Slot(byte[] payload, long ttlNanos) {
            this.payload = payload;
            this.ttlNanos = ttlNanos;
        }
    }

    private static final class SlotExpiry implements Expiry<String, Slot> {

        @Override
        public long expireAfterCreate(String key, Slot slot, long currentTime) {
            return slot.ttlNanos == Slot.KEEP_EXPIRY ? ttlNanos(DEFAULT_TTL) : slot.ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, Slot slot, long currentTime, long currentDuration) {
            return slot.ttlNanos == Slot.KEEP_EXPIRY ? currentDuration : slot.ttlNanos;
        }

        @Override
        public long expireAfterRead(String key, Slot slot, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
