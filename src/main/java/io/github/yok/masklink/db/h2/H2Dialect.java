package io.github.yok.masklink.db.h2;

import io.github.yok.masklink.db.DialectType;
import io.github.yok.masklink.db.SqlDialect;
import java.util.List;

/**
 * H2 dialect.
 *
 * <p>
 * Upserts use {@code MERGE INTO ... KEY (...)}. The conditional insert is a plain insert: an
 * existing key surfaces as a unique constraint violation (SQLState {@code 23505}).
 * </p>
 */
public class H2Dialect implements SqlDialect {

    @Override
    public DialectType getType() {
        return DialectType.H2;
    }

    @Override
    public String buildUpsertSql(String tableName, List<String> keyColumns,
            List<String> insertColumns, List<String> updateColumns) {
        return "MERGE INTO " + identifier(tableName) + " (" + columnList(insertColumns)
                + ") KEY (" + columnList(keyColumns) + ") VALUES ("
                + placeholders(insertColumns.size()) + ")";
    }

    @Override
    public String buildConditionalInsertSql(String tableName, String keyColumn,
            List<String> columns) {
        identifier(keyColumn);
        return buildInsertSql(tableName, columns);
    }

    @Override
    public String getCurrentUserSql() {
        return "SELECT CURRENT_USER";
    }

    @Override
    public String getJsonPlaceholder() {
        return "? FORMAT JSON";
    }
}
