package net.vortexdevelopment.tiercache.database;

import net.vortexdevelopment.tiercache.config.Environment;
import net.vortexdevelopment.tiercache.database.formatter.H2SchemaFormatter;
import net.vortexdevelopment.tiercache.database.formatter.MySQLSchemaFormatter;
import net.vortexdevelopment.tiercache.exception.CacheConfigurationException;
import net.vortexdevelopment.tiercache.exception.CacheStorageException;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.sql.ResultSet;
import java.sql.Statement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatabaseTest {

    @Test
    void environmentSelectsAnInMemoryH2Database() {
        try (Database database = Database.fromEnvironment(Environment.getInstance())) {
            database.init();

            assertThat(database.getSchemaFormatter()).isInstanceOf(H2SchemaFormatter.class);
            int one = database.connect(connection -> {
                try (Statement stmt = connection.createStatement();
                     ResultSet rs = stmt.executeQuery("SELECT 1")) {
                    rs.next();
                    return rs.getInt(1);
                }
            });
            assertThat(one).isEqualTo(1);
        }
    }

    @Test
    void unsupportedTypeIsAConfigurationError() {
        assertThatThrownBy(() -> new Database("localhost", "1", "db", "oracle", "u", "p", 1, new File("mem")))
                .isInstanceOf(CacheConfigurationException.class)
                .hasMessageContaining("oracle");
    }

    @Test
    void mysqlDialectsUseTheMySqlFormatter() {
        Database database = new Database("localhost", "3306", "db", "mariadb", "u", "p", 1, new File("mem"));

        assertThat(database.getSchemaFormatter()).isInstanceOf(MySQLSchemaFormatter.class);
    }

    @Test
    void sqlFailuresAreWrapped() {
        try (Database database = new Database("", "", "wrap_test", "h2", "sa", "", 1, new File("mem"))) {
            database.init();

            assertThatThrownBy(() -> database.connect(connection -> {
                try (Statement stmt = connection.createStatement()) {
                    stmt.executeUpdate("DELETE FROM no_such_table");
                }
            })).isInstanceOf(CacheStorageException.class);
        }
    }

    @Test
    void upsertStatementsFollowTheDialect() {
        CacheSchema h2 = new CacheSchema(new H2SchemaFormatter(), "tc_");
        CacheSchema mysql = new CacheSchema(new MySQLSchemaFormatter(), "tc_");

        assertThat(h2.cacheUpsert()).startsWith("MERGE INTO \"tc_cache\"").contains("KEY (c_name, c_realm)");
        assertThat(mysql.cacheUpsert()).startsWith("INSERT INTO `tc_cache`").contains("ON DUPLICATE KEY UPDATE");
    }
}
