package net.vortexdevelopment.tiercache.testing;

import net.vortexdevelopment.tiercache.database.Database;

import java.io.File;
import java.util.UUID;

/**
 * Builder for in-memory H2 databases used by the tests.
 *
 * <p>Usage example:
 * <pre>
 * {@code
 * Database db = MockDatabaseBuilder.createUnique("cache_test");
 * }
 * </pre>
 */
public class MockDatabaseBuilder {

    /**
     * Create an in-memory H2 database with a specific name. Databases with the same name share
     * their content for the lifetime of the JVM.
     */
    public static Database createInMemory(String dbName) {
        Database database = new Database(
                "",              // host (not used for in-memory)
                "",              // port (not used for in-memory)
                dbName,          // database name
                "h2",            // database type
                "sa",            // username
                "",              // password
                4,               // max pool size
                new File("mem")  // h2 file (in-memory mode)
        );
        database.init();
        return database;
    }

    /**
     * Create an in-memory H2 database no other test shares.
     */
    public static Database createUnique(String prefix) {
        return createInMemory(prefix + "_" + UUID.randomUUID().toString().replace("-", ""));
    }
}
