package net.vortexdevelopment.tiercache.database.formatter;

import net.vortexdevelopment.tiercache.database.DBUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Schema formatter implementation for MySQL and MariaDB databases.
 * Uses backticks for identifiers.
 */
public class MySQLSchemaFormatter implements SchemaFormatter {

    @Override
    public String formatTableName(String tableName) {
        return "`" + tableName + "`";
    }

    @Override
    public String formatColumnDefinition(String columnName, String sqlType) {
        return "`" + columnName + "` " + sqlType;
    }

    @Override
    public String convertSqlSyntax(String sql) {
        // Add ENGINE=InnoDB for MySQL/MariaDB if it's a CREATE TABLE statement
        if (sql.toUpperCase().startsWith("CREATE TABLE")) {
            if (sql.endsWith(";")) {
                sql = sql.substring(0, sql.length() - 1);
            }
            return sql + " ENGINE=InnoDB;";
        }
        return sql;
    }

    @Override
    public String formatCreateTablePrefix(String tableName) {
        return "CREATE TABLE IF NOT EXISTS " + formatTableName(tableName);
    }

    @Override
    public String binaryType() {
        return "MEDIUMBLOB";
    }

    @Override
    public String formatUpsert(String tableName, List<String> columns, List<String> keyColumns) {
        List<String> updates = new ArrayList<>();
        for (String column : columns) {
            if (!keyColumns.contains(column)) {
                updates.add(column + " = VALUES(" + column + ")");
            }
        }
        return "INSERT INTO " + formatTableName(tableName)
                + " (" + String.join(", ", columns) + ")"
                + " VALUES (" + DBUtils.placeholders(columns.size()) + ")"
                + " ON DUPLICATE KEY UPDATE " + String.join(", ", updates);
    }
}
