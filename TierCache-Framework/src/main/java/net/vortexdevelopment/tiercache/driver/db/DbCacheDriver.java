package net.vortexdevelopment.tiercache.driver.db;

import net.vortexdevelopment.tiercache.database.CacheSchema;
import net.vortexdevelopment.tiercache.database.DatabaseConnector;
import net.vortexdevelopment.tiercache.debug.DebugLogger;
import net.vortexdevelopment.tiercache.driver.writeback.WriteBackStore;
import org.jetbrains.annotations.NotNull;

import java.time.Clock;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Relational cache tier. Slower than the memory tier but survives restarts.
 *
 * <p>Writes are buffered and persisted in one batch when the driver is closed, see
 * {@link WriteBackStore}. Creating the driver makes sure the tables exist and removes expired
 * rows.
 */
public class DbCacheDriver extends WriteBackStore {

    private final JdbcCacheStore table;
    private final Map<String, Object> autoloaded = new LinkedHashMap<>();

    public DbCacheDriver(@NotNull DatabaseConnector connector, @NotNull CacheSchema schema, @NotNull Clock clock) {
        this(openTable(connector, schema, clock), clock);
    }

    private DbCacheDriver(JdbcCacheStore table, Clock clock) {
        super(table, clock);
        this.table = table;
        table.gc();
    }

    private static JdbcCacheStore openTable(DatabaseConnector connector, CacheSchema schema, Clock clock) {
        schema.ensureTables(connector);
        return new JdbcCacheStore(connector, schema, clock);
    }

    /**
     * Deletes expired rows.
     *
     * @return number of rows deleted
     */
    public int gc() {
        return table.gc();
    }

    /**
     * Loads every auto-loadable entry of the realms into the autoload variables, keyed by entry id.
     * Entries of later realms replace same-named entries of earlier ones.
     *
     * @return number of entries loaded
     */
    public int getAll(@NotNull Collection<String> realms) {
        int loaded = table.loadAutoloaded(realms, autoloaded::put);
        DebugLogger.log("Autoloaded %d entries from realms %s", loaded, realms);
        return loaded;
    }

    public int getAll(@NotNull String... realms) {
        return getAll(Arrays.asList(realms));
    }

    /**
     * Value of an autoloaded entry.
     */
    public Optional<Object> getAutoloaded(@NotNull String name) {
        return Optional.ofNullable(autoloaded.get(name));
    }

    public Map<String, Object> autoloaded() {
        return Collections.unmodifiableMap(autoloaded);
    }
}
