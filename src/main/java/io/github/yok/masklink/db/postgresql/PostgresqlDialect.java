package io.github.yok.masklink.db.postgresql;

import io.github.yok.masklink.db.DialectType;
import io.github.yok.masklink.db.SqlDialect;
import java.util.List;
import java.util.stream.Collectors;

/**
 * PostgreSQL dialect.
 *
 * <p>
 * Upserts use {@code INSERT ... ON CONFLICT (key) DO UPDATE SET col = EXCLUDED.col}; the token
 * vault's conditional insert uses {@code ON CONFLICT (key) DO NOTHING}, which reports an existing
 * key as an update count of {@code 0} without aborting the surrounding transaction.
 * </p>
 */
public class PostgresqlDialect implements SqlDialect {

    @Override
    public DialectType getType() {
        return DialectType.POSTGRESQL;
    }

    @Override
    public String buildUpsertSql(String tableName, List<String> keyColumns,
            List<String> insertColumns, List<String> updateColumns) {
        StringBuilder sql = new StringBuilder(buildInsertSql(tableName, insertColumns));
        sql.append(" ON CONFLICT (").append(columnList(keyColumns)).append(")");
        if (updateColumns.isEmpty()) {
            sql.append(" DO NOTHING");
        } else {
            sql.append(" DO UPDATE SET ").append(updateColumns.stream().map(this::identifier)
                    .map(c -> c + " = EXCLUDED." + c).collect(Collectors.joining(", ")));
        }
        return sql.toString();
    }

    @Override
    public String buildConditionalInsertSql(String tableName, String keyColumn,
            List<String> columns) {
        return buildInsertSql(tableName, columns) + " ON CONFLICT (" + identifier(keyColumn)
                + ") DO NOTHING";
    }

    @Override
    public String getCurrentUserSql() {
        return "SELECT current_user";
    }

    @Override
    public String getJsonPlaceholder() {
        return "CAST(? AS jsonb)";
    }
}
