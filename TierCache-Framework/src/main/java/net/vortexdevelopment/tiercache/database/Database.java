package net.vortexdevelopment.tiercache.database;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.vortexdevelopment.tiercache.config.Environment;
import net.vortexdevelopment.tiercache.database.formatter.H2SchemaFormatter;
import net.vortexdevelopment.tiercache.database.formatter.MySQLSchemaFormatter;
import net.vortexdevelopment.tiercache.database.formatter.SchemaFormatter;
import net.vortexdevelopment.tiercache.debug.DebugLogger;
import net.vortexdevelopment.tiercache.exception.CacheConfigurationException;
import net.vortexdevelopment.tiercache.exception.CacheStorageException;

import java.io.File;
import java.sql.Connection;
import java.util.Locale;

/**
 * Pooled connection to the relational engine holding the db tier and the binding table.
 * Supports H2 (file or in-memory), MySQL and MariaDB.
 */
public class Database implements DatabaseConnector, AutoCloseable {

    private final HikariConfig hikariConfig;
    private HikariDataSource hikariDataSource;
    private final SchemaFormatter schemaFormatter;

    public Database(String host, String port, String database, String type, String username, String password, int maxPoolSize, File h2File) {
        hikariConfig = new HikariConfig();

        if (type.equalsIgnoreCase("h2")) {
            schemaFormatter = new H2SchemaFormatter();
            hikariConfig.setDriverClassName("org.h2.Driver");

            // If h2 file name is "mem" use in-memory database
            if (h2File.getName().equalsIgnoreCase("mem")) {
                hikariConfig.setJdbcUrl("jdbc:h2:mem:" + database + ";DB_CLOSE_DELAY=-1;MODE=MySQL;DATABASE_TO_LOWER=TRUE;CASE_INSENSITIVE_IDENTIFIERS=TRUE");
            } else {
                hikariConfig.setJdbcUrl("jdbc:h2:file:./" + h2File.getPath().replaceAll("\\\\", "/") + ";AUTO_RECONNECT=TRUE;MODE=MySQL;DATABASE_TO_LOWER=TRUE;CASE_INSENSITIVE_IDENTIFIERS=TRUE");
            }
        } else {
            schemaFormatter = new MySQLSchemaFormatter();

            switch (type.toLowerCase(Locale.ENGLISH)) {
                case "mysql" -> hikariConfig.setDriverClassName("com.mysql.cj.jdbc.Driver");
                case "mariadb" -> hikariConfig.setDriverClassName("org.mariadb.jdbc.Driver");
                default -> throw new CacheConfigurationException("Unsupported database type: " + type);
            }

            hikariConfig.setJdbcUrl("jdbc:" + type.toLowerCase(Locale.ENGLISH) + "://" + host + ":" + port + "/" + database + "?autoReconnect=true&useSSL=false");
        }

        hikariConfig.setUsername(username);
        hikariConfig.setPassword(password);
        hikariConfig.setMaximumPoolSize(maxPoolSize);
        hikariConfig.setPoolName("TierCache-" + database);
        hikariConfig.addDataSourceProperty("cachePrepStmts", "true");
        hikariConfig.addDataSourceProperty("prepStmtCacheSize", "250");
        hikariConfig.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");
    }

    /**
     * Creates (but does not start) a database from {@code tiercache.database.*} settings.
     */
    public static Database fromEnvironment(Environment environment) {
        return new Database(
                environment.getProperty("tiercache.database.host", "localhost"),
                environment.getProperty("tiercache.database.port", "3306"),
                environment.getProperty("tiercache.database.name", "tiercache"),
                environment.getProperty("tiercache.database.type", "h2"),
                environment.getProperty("tiercache.database.user", "sa"),
                environment.getProperty("tiercache.database.password", ""),
                environment.getPropertyAsInt("tiercache.database.pool-size", 10),
                new File(environment.getProperty("tiercache.database.h2-file", "data/tiercache"))
        );
    }

    @Override
    public SchemaFormatter getSchemaFormatter() {
        return schemaFormatter;
    }

    public void init() {
        hikariDataSource = new HikariDataSource(hikariConfig);
        DebugLogger.log("Connection pool started for %s", hikariConfig.getJdbcUrl());
    }

    @Override
    public Connection getConnection() throws Exception {
        return hikariDataSource.getConnection();
    }

    @Override
    public void connect(VoidConnection connection) {
        try (Connection conn = hikariDataSource.getConnection()) {
            connection.connect(conn);
        } catch (CacheStorageException e) {
            throw e;
        } catch (Exception e) {
            throw new CacheStorageException("Database connection error", e);
        }
    }

    @Override
    public <T> T connect(ConnectionResult<T> connection) {
        try (Connection conn = hikariDataSource.getConnection()) {
            return connection.connect(conn);
        } catch (CacheStorageException e) {
            throw e;
        } catch (Exception e) {
            throw new CacheStorageException("Database connection error", e);
        }
    }

    public void shutdown() {
        try {
            if (this.hikariDataSource != null) {
                this.hikariDataSource.close();
            }
        } catch (Exception e) {
            DebugLogger.error(Database.class, "Error closing connection pool", e);
        }
    }

    @Override
    public void close() {
        shutdown();
    }
}
