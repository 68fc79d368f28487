package net.vortexdevelopment.tiercache.driver.db;

import net.vortexdevelopment.tiercache.database.CacheSchema;
import net.vortexdevelopment.tiercache.database.DBUtils;
import net.vortexdevelopment.tiercache.database.DatabaseConnector;
import net.vortexdevelopment.tiercache.debug.DebugLogger;
import net.vortexdevelopment.tiercache.driver.DynamicStore;
import net.vortexdevelopment.tiercache.driver.EntryKey;
import net.vortexdevelopment.tiercache.driver.ValueCodec;
import net.vortexdevelopment.tiercache.driver.writeback.BatchWriter;
import net.vortexdevelopment.tiercache.driver.writeback.PendingStore;
import org.jetbrains.annotations.NotNull;

import java.io.Serializable;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

/**
 * Cache entries in a relational table, written through on every call.
 *
 * <p>A successful {@link #exists} keeps the fetched row in a read buffer so that the
 * {@link #get} following it does not query again. The buffer holds the row of the last
 * {@link #exists} only, until that get or until the row expires.
 */
public class JdbcCacheStore implements DynamicStore, BatchWriter {

    private final DatabaseConnector connector;
    private final CacheSchema schema;
    private final Clock clock;
    private final Map<EntryKey, BufferedRow> readBuffer = new ConcurrentHashMap<>();

    public JdbcCacheStore(@NotNull DatabaseConnector connector, @NotNull CacheSchema schema, @NotNull Clock clock) {
        this.connector = connector;
        this.schema = schema;
        this.clock = clock;
    }

    /**
     * Deletes rows whose expiration instant has passed.
     *
     * @return number of rows deleted
     */
    public int gc() {
        String sql = "DELETE FROM " + schema.cacheTable() + " WHERE c_expire > 0 AND c_expire < ?";
        int removed = connector.connect(connection -> {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                ps.setLong(1, now());
                return ps.executeUpdate();
            }
        });
        DebugLogger.log("Garbage collected %d expired rows", removed);
        return removed;
    }

    @Override
    public boolean clear(@NotNull String realm) {
        if (realm.isEmpty()) {
            connector.connect(connection -> {
                try (Statement stmt = connection.createStatement()) {
                    stmt.executeUpdate(schema.cacheTruncate());
                }
            });
            readBuffer.clear();
        } else {
            connector.connect(connection -> {
                try (PreparedStatement ps = connection.prepareStatement(
                        "DELETE FROM " + schema.cacheTable() + " WHERE c_realm = ?")) {
                    ps.setString(1, realm);
                    ps.executeUpdate();
                }
            });
            readBuffer.keySet().removeIf(key -> key.realm().equals(realm));
        }
        return true;
    }

    @Override
    public boolean exists(@NotNull String id, @NotNull String realm) {
        String sql = "SELECT c_value, c_expire FROM " + schema.cacheTable()
                + " WHERE c_realm = ? AND c_name = ? AND (c_expire = 0 OR c_expire >= ?)";
        Optional<BufferedRow> row = connector.connect(connection -> {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                ps.setString(1, realm);
                ps.setString(2, id);
                ps.setLong(3, now());
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.<BufferedRow>empty();
                    }
                    return Optional.of(new BufferedRow(ValueCodec.decode(rs.getBytes(1)), rs.getLong(2)));
                }
            }
        });
        readBuffer.clear();
        row.ifPresent(buffered -> readBuffer.put(EntryKey.of(id, realm), buffered));
        return row.isPresent();
    }

    /**
     * Number of rows held by the read buffer.
     */
    int bufferedRows() {
        return readBuffer.size();
    }

    @Override
    public Optional<Object> get(@NotNull String id, @NotNull String realm) {
        EntryKey key = EntryKey.of(id, realm);
        BufferedRow buffered = readBuffer.remove(key);
        if (buffered != null && !buffered.isExpired(now())) {
            return Optional.of(buffered.value);
        }
        if (exists(id, realm)) {
            BufferedRow fetched = readBuffer.remove(key);
            return fetched == null ? Optional.empty() : Optional.of(fetched.value);
        }
        return Optional.empty();
    }

    @Override
    public boolean remove(@NotNull String id, @NotNull String realm) {
        readBuffer.remove(EntryKey.of(id, realm));
        String sql = "DELETE FROM " + schema.cacheTable() + " WHERE c_realm = ? AND c_name = ?";
        int removed = connector.connect(connection -> {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                ps.setString(1, realm);
                ps.setString(2, id);
                return ps.executeUpdate();
            }
        });
        return removed == 1;
    }

    @Override
    public boolean store(@NotNull String id, @NotNull Serializable data, @NotNull String realm, long ttlSeconds) {
        readBuffer.remove(EntryKey.of(id, realm));
        PendingStore entry = new PendingStore(EntryKey.of(id, realm), data, ttlSeconds, now());
        connector.connect(connection -> {
            try (PreparedStatement ps = connection.prepareStatement(schema.cacheUpsert())) {
                bindUpsert(ps, entry);
                ps.executeUpdate();
            }
        });
        return true;
    }

    @Override
    public int removeAll(List<EntryKey> keys) {
        keys.forEach(readBuffer::remove);
        String sql = "DELETE FROM " + schema.cacheTable() + " WHERE c_realm = ? AND c_name = ?";
        return connector.transaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (EntryKey key : keys) {
                    ps.setString(1, key.realm());
                    ps.setString(2, key.id());
                    ps.addBatch();
                }
                int removed = 0;
                for (int count : ps.executeBatch()) {
                    if (count > 0) {
                        removed += count;
                    }
                }
                return removed;
            }
        });
    }

    @Override
    public int storeAll(List<PendingStore> entries) {
        entries.forEach(entry -> readBuffer.remove(entry.getKey()));
        return connector.transaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(schema.cacheUpsert())) {
                for (PendingStore entry : entries) {
                    bindUpsert(ps, entry);
                    ps.addBatch();
                }
                ps.executeBatch();
                return entries.size();
            }
        });
    }

    /**
     * Streams the auto-loadable, unexpired rows of the given realms.
     *
     * @return number of rows visited
     */
    public int loadAutoloaded(Collection<String> realms, BiConsumer<String, Object> consumer) {
        if (realms.isEmpty()) {
            return 0;
        }
        String sql = "SELECT c_name, c_value FROM " + schema.cacheTable()
                + " WHERE c_auto = 1 AND c_realm IN (" + DBUtils.placeholders(realms.size()) + ")"
                + " AND (c_expire = 0 OR c_expire >= ?)";
        return connector.connect(connection -> {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                int index = 1;
                for (String realm : realms) {
                    ps.setString(index++, realm);
                }
                ps.setLong(index, now());
                int count = 0;
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        consumer.accept(rs.getString(1), ValueCodec.decode(rs.getBytes(2)));
                        count++;
                    }
                }
                return count;
            }
        });
    }

    private void bindUpsert(PreparedStatement ps, PendingStore entry) throws Exception {
        ps.setString(1, entry.getKey().id());
        ps.setString(2, entry.getKey().realm());
        ps.setLong(3, entry.getExpiresAt());
        ps.setBytes(4, ValueCodec.encode(entry.getData()));
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private static final class BufferedRow {

        final Object value;
        final long expiresAt;

        BufferedRow(Object value, long expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        boolean isExpired(long now) {
            return expiresAt > 0 && expiresAt < now;
        }
    }
}
