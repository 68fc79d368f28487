package net.vortexdevelopment.tiercache.database;

import net.vortexdevelopment.tiercache.database.formatter.SchemaFormatter;

import java.sql.Connection;

/**
 * Access to the relational engine backing the db tier.
 */
public interface DatabaseConnector {

    Connection getConnection() throws Exception;

    void connect(VoidConnection connection);

    <T> T connect(ConnectionResult<T> connection);

    /**
     * Runs the work in a single transaction, rolled back if it throws.
     */
    default <T> T transaction(ConnectionResult<T> work) {
        return connect(connection -> {
            return DBUtils.inTransaction(connection, work);
        });
    }

    /**
     * Formatter for the SQL dialect of this connection.
     */
    SchemaFormatter getSchemaFormatter();

    interface VoidConnection {

        void connect(Connection connection) throws Exception;

    }

    interface ConnectionResult<T> {

        T connect(Connection connection) throws Exception;

    }
}
