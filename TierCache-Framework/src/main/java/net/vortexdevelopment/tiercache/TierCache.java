package net.vortexdevelopment.tiercache;

import net.vortexdevelopment.tiercache.binding.Binding;
import net.vortexdevelopment.tiercache.binding.BindingRegistry;
import net.vortexdevelopment.tiercache.database.CacheSchema;
import net.vortexdevelopment.tiercache.database.DatabaseConnector;
import net.vortexdevelopment.tiercache.debug.DebugLogger;
import net.vortexdevelopment.tiercache.driver.DynamicStore;
import net.vortexdevelopment.tiercache.driver.MemoryUsage;
import net.vortexdevelopment.tiercache.driver.db.DbCacheDriver;
import net.vortexdevelopment.tiercache.driver.disk.FileCacheDriver;
import net.vortexdevelopment.tiercache.driver.memory.DriverRegistry;
import net.vortexdevelopment.tiercache.driver.memory.VolatileDriver;
import net.vortexdevelopment.tiercache.driver.memory.VolatileDriverProvider;
import net.vortexdevelopment.tiercache.exception.TierCacheException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.Serializable;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point of the cache. Owns one driver per tier and the event bindings.
 *
 * <ul>
 *     <li>disk: files under the cache directory, no expiry</li>
 *     <li>db: relational table, buffered and written when the cache is closed</li>
 *     <li>mem: the selected memory driver, or the db tier when none is available</li>
 * </ul>
 *
 * Close the cache (or use try-with-resources) so that buffered db writes and binding changes
 * are persisted.
 */
public class TierCache implements AutoCloseable {

    private final TierCacheConfig config;
    private final FileCacheDriver disk;
    private final DbCacheDriver db;
    private final DynamicStore mem;
    private final VolatileDriver memDriver;
    private final BindingRegistry bindings;

    private int lastTriggerFailures;
    private boolean closed;

    public TierCache(@NotNull TierCacheConfig config, @NotNull DatabaseConnector connector) {
        this(config, connector, DriverRegistry.probeDefaults(config), Clock.systemUTC());
    }

    /**
     * @throws net.vortexdevelopment.tiercache.exception.CacheConfigurationException if the cache
     *         directory is missing or not writable
     */
    public TierCache(@NotNull TierCacheConfig config, @NotNull DatabaseConnector connector,
                     @NotNull DriverRegistry registry, @NotNull Clock clock) {
        this.config = config;
        this.disk = new FileCacheDriver(config.getCacheDir());

        CacheSchema schema = new CacheSchema(connector.getSchemaFormatter(), config.getTablePrefix());
        this.db = new DbCacheDriver(connector, schema, clock);
        db.getAll(autoloadRealms(config));

        this.memDriver = selectMemDriver(config, registry, clock);
        this.mem = memDriver != null ? memDriver : db;
        if (memDriver == null) {
            DebugLogger.warn(TierCache.class, "No memory driver available, the db tier serves memory operations");
        }

        this.bindings = new BindingRegistry(connector, schema);
        Optional<Object> persisted = db.getAutoloaded(BindingRegistry.MIRROR_ID);
        if (persisted.isEmpty() || !bindings.warm(persisted.get())) {
            bindings.rebuild();
            persistBindings();
        }
    }

    private static List<String> autoloadRealms(TierCacheConfig config) {
        Set<String> realms = new LinkedHashSet<>();
        realms.add(CacheRealms.SYSTEM);
        realms.add(CacheRealms.DEFAULT);
        realms.addAll(config.getAutoloadRealms());
        return new ArrayList<>(realms);
    }

    @Nullable
    private static VolatileDriver selectMemDriver(TierCacheConfig config, DriverRegistry registry, Clock clock) {
        for (VolatileDriverProvider provider : registry.selectionOrder(config.getPreferredDriver())) {
            try {
                VolatileDriver driver = provider.create(config, clock);
                DebugLogger.log(TierCache.class, "Using memory driver %s", provider.id());
                return driver;
            } catch (RuntimeException e) {
                DebugLogger.warn(TierCache.class, "Memory driver %s could not be started: %s", provider.id(), e.getMessage());
            }
        }
        return null;
    }

    // Disk tier

    public Optional<Object> diskGet(@NotNull String id) {
        return diskGet(id, CacheRealms.DEFAULT);
    }

    public Optional<Object> diskGet(@NotNull String id, @NotNull String realm) {
        return disk.get(id, realm);
    }

    public boolean diskSet(@NotNull String id, @NotNull Serializable data) {
        return diskSet(id, data, CacheRealms.DEFAULT);
    }

    public boolean diskSet(@NotNull String id, @NotNull Serializable data, @NotNull String realm) {
        return disk.store(id, data, realm);
    }

    public boolean diskUnset(@NotNull String id) {
        return diskUnset(id, CacheRealms.DEFAULT);
    }

    public boolean diskUnset(@NotNull String id, @NotNull String realm) {
        return disk.remove(id, realm);
    }

    public boolean diskIsset(@NotNull String id) {
        return diskIsset(id, CacheRealms.DEFAULT);
    }

    public boolean diskIsset(@NotNull String id, @NotNull String realm) {
        return disk.exists(id, realm);
    }

    // Db tier

    public Optional<Object> dbGet(@NotNull String id) {
        return dbGet(id, CacheRealms.DEFAULT);
    }

    public Optional<Object> dbGet(@NotNull String id, @NotNull String realm) {
        return db.get(id, realm);
    }

    /**
     * Stores a db entry without expiry.
     */
    public boolean dbSet(@NotNull String id, @NotNull Serializable data) {
        return dbSet(id, data, CacheRealms.DEFAULT, 0);
    }

    public boolean dbSet(@NotNull String id, @NotNull Serializable data, @NotNull String realm) {
        return dbSet(id, data, realm, 0);
    }

    public boolean dbSet(@NotNull String id, @NotNull Serializable data, @NotNull String realm, long ttlSeconds) {
        return db.store(id, data, realm, ttlSeconds);
    }

    public boolean dbUnset(@NotNull String id) {
        return dbUnset(id, CacheRealms.DEFAULT);
    }

    public boolean dbUnset(@NotNull String id, @NotNull String realm) {
        return db.remove(id, realm);
    }

    public boolean dbIsset(@NotNull String id) {
        return dbIsset(id, CacheRealms.DEFAULT);
    }

    public boolean dbIsset(@NotNull String id, @NotNull String realm) {
        return db.exists(id, realm);
    }

    /**
     * Loads the auto-loadable entries of further realms into the autoload variables.
     *
     * @return number of entries loaded
     */
    public int dbLoad(@NotNull String... realms) {
        return db.getAll(Arrays.asList(realms));
    }

    /**
     * Value of an entry loaded at startup or through {@link #dbLoad}.
     */
    public Optional<Object> dbAutoloaded(@NotNull String name) {
        return db.getAutoloaded(name);
    }

    // Memory tier

    public Optional<Object> memGet(@NotNull String id) {
        return memGet(id, CacheRealms.DEFAULT);
    }

    public Optional<Object> memGet(@NotNull String id, @NotNull String realm) {
        return mem.get(id, realm);
    }

    /**
     * Stores a memory entry with the configured default time to live.
     */
    public boolean memSet(@NotNull String id, @NotNull Serializable data) {
        return memSet(id, data, CacheRealms.DEFAULT, config.getDefaultTtlSeconds());
    }

    public boolean memSet(@NotNull String id, @NotNull Serializable data, @NotNull String realm) {
        return memSet(id, data, realm, config.getDefaultTtlSeconds());
    }

    public boolean memSet(@NotNull String id, @NotNull Serializable data, @NotNull String realm, long ttlSeconds) {
        return mem.store(id, data, realm, ttlSeconds);
    }

    public boolean memUnset(@NotNull String id) {
        return memUnset(id, CacheRealms.DEFAULT);
    }

    public boolean memUnset(@NotNull String id, @NotNull String realm) {
        return mem.remove(id, realm);
    }

    public boolean memIsset(@NotNull String id) {
        return memIsset(id, CacheRealms.DEFAULT);
    }

    public boolean memIsset(@NotNull String id, @NotNull String realm) {
        return mem.exists(id, realm);
    }

    public long memInc(@NotNull String id) {
        return memInc(id, CacheRealms.DEFAULT, 1);
    }

    public long memInc(@NotNull String id, @NotNull String realm, long delta) {
        return mem.inc(id, realm, delta);
    }

    public long memDec(@NotNull String id) {
        return memDec(id, CacheRealms.DEFAULT, 1);
    }

    public long memDec(@NotNull String id, @NotNull String realm, long delta) {
        return mem.dec(id, realm, delta);
    }

    // Whole tiers

    /**
     * Clears every realm of a tier, or of all tiers for {@link CacheTier#ALL}.
     */
    public boolean clear(@NotNull CacheTier tier) {
        return clearRealm(CacheRealms.ALL, tier);
    }

    public boolean clearRealm(@NotNull String realm, @NotNull CacheTier tier) {
        return switch (tier) {
            case MEMORY -> mem.clear(realm);
            case DB -> db.clear(realm);
            case DISK -> disk.clear(realm);
            case ALL -> {
                boolean memCleared = mem.clear(realm);
                boolean dbCleared = db.clear(realm);
                boolean diskCleared = disk.clear(realm);
                yield memCleared && dbCleared && diskCleared;
            }
        };
    }

    /**
     * Memory figures of the memory tier.
     */
    public MemoryUsage getInfo() {
        return mem.getInfo();
    }

    public boolean isMemAvailable() {
        return memDriver != null;
    }

    /**
     * Identifier of the selected memory driver, empty when the db tier serves memory operations.
     */
    public String getMemDriver() {
        return memDriver != null ? memDriver.id() : "";
    }

    // Bindings

    public void bind(@NotNull String event, @NotNull String id, @NotNull String realm, @NotNull CacheTier tier) {
        bindings.bind(Binding.of(event, id, realm, tier));
    }

    /**
     * @return number of bindings added
     */
    public int bindAll(@NotNull Collection<Binding> batch) {
        return bindings.bindAll(batch);
    }

    /**
     * Removes the bindings of a realm, or of one entry when {@code id} is not empty.
     *
     * @return number of bindings removed
     */
    public int unbind(@NotNull String realm, @Nullable String id) {
        return bindings.unbind(realm, id);
    }

    public int unbind(@NotNull String realm) {
        return unbind(realm, null);
    }

    /**
     * Removes every entry bound to the event from its tier. A failing removal is reported and
     * counted in {@link #lastTriggerFailures()}, the remaining bindings are still processed.
     *
     * @return number of bindings processed
     */
    public int trigger(@NotNull String event) {
        List<Binding> bound = bindings.bindingsFor(event);
        int failures = 0;
        for (Binding binding : bound) {
            try {
                invalidate(binding);
            } catch (RuntimeException e) {
                failures++;
                DebugLogger.warn(TierCache.class, "Could not invalidate %s on event %s: %s", binding, event, e.getMessage());
            }
        }
        lastTriggerFailures = failures;
        DebugLogger.log(TierCache.class, "Event %s invalidated %d bindings (%d failed)", event, bound.size(), failures);
        return bound.size();
    }

    public int lastTriggerFailures() {
        return lastTriggerFailures;
    }

    private void invalidate(Binding binding) {
        String id = binding.getId();
        String realm = binding.getRealm();
        switch (binding.getTier()) {
            case MEMORY -> mem.remove(id, realm);
            case DISK -> disk.remove(id, realm);
            case DB -> db.remove(id, realm);
            case ALL -> {
                mem.remove(id, realm);
                disk.remove(id, realm);
                db.remove(id, realm);
            }
        }
    }

    private void persistBindings() {
        db.store(BindingRegistry.MIRROR_ID, bindings.snapshot(), CacheRealms.SYSTEM, 0);
        bindings.markClean();
    }

    // Lifecycle

    /**
     * Closes the cache from a JVM shutdown hook, for applications that cannot scope it.
     */
    public Thread registerShutdownHook() {
        Thread hook = new Thread(this::close, "TierCache-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }

    /**
     * Persists a changed binding mirror, writes the buffered db entries and closes the memory
     * driver. Only the first call has an effect.
     *
     * @throws TierCacheException if the buffered db entries could not be written
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (bindings.isDirty()) {
                persistBindings();
            }
            db.close();
        } finally {
            if (memDriver != null) {
                memDriver.close();
            }
            DebugLogger.log(TierCache.class, "Cache closed");
        }
    }

    public boolean isClosed() {
        return closed;
    }
}
