package net.vortexdevelopment.tiercache.database.formatter;

import net.vortexdevelopment.tiercache.database.DBUtils;

import java.util.List;

/**
 * Schema formatter implementation for H2 database.
 * Uses double quotes for identifiers and H2's MERGE for upserts.
 */
public class H2SchemaFormatter implements SchemaFormatter {

    @Override
    public String formatTableName(String tableName) {
        return "\"" + tableName + "\"";
    }

    @Override
    public String formatColumnDefinition(String columnName, String sqlType) {
        return columnName + " " + sqlType;
    }

    @Override
    public String convertSqlSyntax(String sql) {
        return sql.replaceAll("(?i)AUTO_INCREMENT", "IDENTITY");
    }

    @Override
    public String formatCreateTablePrefix(String tableName) {
        return "CREATE TABLE IF NOT EXISTS " + formatTableName(tableName);
    }

    @Override
    public String binaryType() {
        return "BLOB";
    }

    @Override
    public String formatUpsert(String tableName, List<String> columns, List<String> keyColumns) {
        return "MERGE INTO " + formatTableName(tableName)
                + " (" + String.join(", ", columns) + ")"
                + " KEY (" + String.join(", ", keyColumns) + ")"
                + " VALUES (" + DBUtils.placeholders(columns.size()) + ")";
    }
}
