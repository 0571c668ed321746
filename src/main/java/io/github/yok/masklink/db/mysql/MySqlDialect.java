package io.github.yok.masklink.db.mysql;

import io.github.yok.masklink.db.DialectType;
import io.github.yok.masklink.db.SqlDialect;
import java.util.List;
import java.util.stream.Collectors;

/**
 * MySQL dialect.
 *
 * <p>
 * Upserts use {@code ON DUPLICATE KEY UPDATE col = VALUES(col)}. When every column is a key column
 * the statement assigns the first key column to itself so that a duplicate is a no-op. The
 * conditional insert uses {@code INSERT IGNORE}.
 * </p>
 */
public class MySqlDialect implements SqlDialect {

    @Override
    public DialectType getType() {
        return DialectType.MYSQL;
    }

    @Override
    public String buildUpsertSql(String tableName, List<String> keyColumns,
            List<String> insertColumns, List<String> updateColumns) {
        List<String> assigned = updateColumns.isEmpty() ? keyColumns.subList(0, 1) : updateColumns;
        return buildInsertSql(tableName, insertColumns) + " ON DUPLICATE KEY UPDATE "
                + assigned.stream().map(this::identifier).map(c -> c + " = VALUES(" + c + ")")
                        .collect(Collectors.joining(", "));
    }

    @Override
    public String buildConditionalInsertSql(String tableName, String keyColumn,
            List<String> columns) {
        identifier(keyColumn);
        return "INSERT IGNORE INTO " + identifier(tableName) + " (" + columnList(columns)
                + ") VALUES (" + placeholders(columns.size()) + ")";
    }

    @Override
    public String getCurrentUserSql() {
        // CURRENT_USER() is "user@host"
        return "SELECT SUBSTRING_INDEX(CURRENT_USER(), '@', 1)";
    }
}
