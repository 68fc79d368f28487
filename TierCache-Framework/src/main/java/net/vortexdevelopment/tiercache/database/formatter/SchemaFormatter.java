package net.vortexdevelopment.tiercache.database.formatter;

import java.util.List;

/**
 * Interface for formatting database schema elements (table names, column names, SQL statements)
 * according to database-specific syntax rules.
 */
public interface SchemaFormatter {

    /**
     * Formats a table name with appropriate quoting for the database type.
     *
     * @param tableName the table name to format
     * @return the formatted table name with appropriate quotes
     */
    String formatTableName(String tableName);

    /**
     * Formats a column definition (column name + SQL type) for use in CREATE TABLE statements.
     *
     * @param columnName the column name
     * @param sqlType the SQL type definition
     * @return the formatted column definition
     */
    String formatColumnDefinition(String columnName, String sqlType);

    /**
     * Converts database-specific SQL syntax in a statement (e.g. appending the storage engine).
     *
     * @param sql the SQL statement to convert
     * @return the converted SQL statement
     */
    String convertSqlSyntax(String sql);

    /**
     * Formats the beginning of a CREATE TABLE statement.
     *
     * @param tableName the table name
     * @return the formatted CREATE TABLE statement prefix
     */
    String formatCreateTablePrefix(String tableName);

    /**
     * SQL type used for serialized cache values.
     */
    String binaryType();

    /**
     * Formats a single-row insert-or-update statement with one placeholder per column.
     *
     * @param tableName the table name
     * @param columns all columns written by the statement
     * @param keyColumns the columns of the unique key deciding between insert and update
     * @return the upsert statement
     */
    String formatUpsert(String tableName, List<String> columns, List<String> keyColumns);

    /**
     * Formats a statement removing every row of a table.
     */
    default String formatTruncate(String tableName) {
        return "TRUNCATE TABLE " + formatTableName(tableName);
    }
}
