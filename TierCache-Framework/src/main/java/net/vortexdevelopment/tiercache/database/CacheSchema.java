package net.vortexdevelopment.tiercache.database;

import net.vortexdevelopment.tiercache.database.formatter.SchemaFormatter;
import net.vortexdevelopment.tiercache.debug.DebugLogger;

import java.sql.Connection;
import java.sql.Statement;
import java.util.List;

/**
 * Tables used by the db tier and the invalidation bindings.
 *
 * <pre>
 * cache          (c_name, c_realm, c_expire, c_auto, c_value)  PRIMARY KEY (c_name, c_realm)
 * cache_bindings (c_event, c_id, c_realm, c_type)
 * </pre>
 */
public class CacheSchema {

    public static final String CACHE_TABLE = "cache";
    public static final String BINDINGS_TABLE = "cache_bindings";

    private final SchemaFormatter formatter;
    private final String tablePrefix;

    public CacheSchema(SchemaFormatter formatter, String tablePrefix) {
        this.formatter = formatter;
        this.tablePrefix = tablePrefix == null ? "" : tablePrefix;
    }

    public SchemaFormatter getFormatter() {
        return formatter;
    }

    /**
     * Quoted name of the cache entry table.
     */
    public String cacheTable() {
        return formatter.formatTableName(tablePrefix + CACHE_TABLE);
    }

    /**
     * Quoted name of the binding table.
     */
    public String bindingsTable() {
        return formatter.formatTableName(tablePrefix + BINDINGS_TABLE);
    }

    /**
     * Insert-or-update statement for a cache row, parameters in the order
     * {@code c_name, c_realm, c_expire, c_value}.
     */
    public String cacheUpsert() {
        return formatter.formatUpsert(tablePrefix + CACHE_TABLE,
                List.of("c_name", "c_realm", "c_expire", "c_value"),
                List.of("c_name", "c_realm"));
    }

    /**
     * Statement removing every cache row.
     */
    public String cacheTruncate() {
        return formatter.formatTruncate(tablePrefix + CACHE_TABLE);
    }

    /**
     * Creates the tables that do not exist yet.
     */
    public void ensureTables(DatabaseConnector connector) {
        connector.connect(connection -> {
            createIfMissing(connection, tablePrefix + CACHE_TABLE, List.of(
                    formatter.formatColumnDefinition("c_name", "VARCHAR(255) NOT NULL"),
                    formatter.formatColumnDefinition("c_realm", "VARCHAR(64) NOT NULL"),
                    formatter.formatColumnDefinition("c_expire", "BIGINT DEFAULT 0 NOT NULL"),
                    formatter.formatColumnDefinition("c_auto", "TINYINT DEFAULT 1 NOT NULL"),
                    formatter.formatColumnDefinition("c_value", formatter.binaryType()),
                    "PRIMARY KEY (c_name, c_realm)"
            ));
            createIfMissing(connection, tablePrefix + BINDINGS_TABLE, List.of(
                    formatter.formatColumnDefinition("c_event", "VARCHAR(64) NOT NULL"),
                    formatter.formatColumnDefinition("c_id", "VARCHAR(255) NOT NULL"),
                    formatter.formatColumnDefinition("c_realm", "VARCHAR(64) NOT NULL"),
                    formatter.formatColumnDefinition("c_type", "TINYINT DEFAULT 0 NOT NULL")
            ));
        });
    }

    private void createIfMissing(Connection connection, String tableName, List<String> definitions) throws Exception {
        if (DBUtils.tableExists(connection, tableName)) {
            return;
        }
        String sql = formatter.convertSqlSyntax(formatter.formatCreateTablePrefix(tableName)
                + " (\n  " + String.join(",\n  ", definitions) + "\n);");
        try (Statement stmt = connection.createStatement()) {
            stmt.executeUpdate(sql);
        }
        DebugLogger.log(CacheSchema.class, "Created table: %s", tableName);
    }
}
