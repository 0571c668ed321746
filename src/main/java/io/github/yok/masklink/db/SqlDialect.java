package io.github.yok.masklink.db;

import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * SQL grammar operations that differ between database products.
 *
 * <p>
 * Identifiers coming from configuration are validated rather than quoted, so that the database's
 * own case folding applies the same way it does for hand-written SQL against the same tables.
 * </p>
 */
public interface SqlDialect {

    /**
     * Accepted identifier shape: letters, digits, underscores and {@code $}, optionally qualified
     * with a schema.
     */
    Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*(\\.[A-Za-z_][A-Za-z0-9_$]*)?");

    /**
     * Returns the product this dialect targets.
     *
     * @return dialect type
     */
    DialectType getType();

    /**
     * Validates an identifier taken from configuration or result set metadata.
     *
     * @param name table or column name
     * @return the name, unchanged
     * @throws IllegalArgumentException if the name is not a plain identifier
     */
    default String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + name);
        }
        return name;
    }

    /**
     * Applies dialect pagination to base SQL.
     *
     * @param baseSql base select SQL
     * @param offset rows to skip
     * @param limit max rows
     * @return paginated SQL
     */
    default String applyPagination(String baseSql, long offset, int limit) {
        return baseSql + " LIMIT " + limit + " OFFSET " + offset;
    }

    /**
     * Builds a plain parameterized insert.
     *
     * @param tableName table name
     * @param columns insert columns
     * @return insert SQL
     */
    default String buildInsertSql(String tableName, List<String> columns) {
        return "INSERT INTO " + identifier(tableName) + " (" + columnList(columns) + ") VALUES ("
                + placeholders(columns.size()) + ")";
    }

    /**
     * Builds an insert that overwrites every non-key column when the key already exists.
     *
     * @param tableName table name
     * @param keyColumns key columns
     * @param insertColumns insert columns (includes the key columns)
     * @param updateColumns columns overwritten on conflict
     * @return upsert SQL
     */
    String buildUpsertSql(String tableName, List<String> keyColumns, List<String> insertColumns,
            List<String> updateColumns);

    /**
     * Builds an insert that either adds the row or reports an existing key.
     *
     * <p>
     * An existing key is reported either as an update count of {@code 0} or as an integrity
     * constraint violation (SQLState class {@code 23}), depending on the product.
     * </p>
     *
     * @param tableName table name
     * @param keyColumn unique column
     * @param columns insert columns
     * @return conditional insert SQL
     */
    String buildConditionalInsertSql(String tableName, String keyColumn, List<String> columns);

    /**
     * Returns SQL that selects the identity of the current session.
     *
     * @return single-row, single-column query
     */
    String getCurrentUserSql();

    /**
     * Returns SQL that removes every row from a table.
     *
     * @param tableName table name
     * @return truncate SQL
     */
    default String getTruncateSql(String tableName) {
        return "TRUNCATE TABLE " + identifier(tableName);
    }

    /**
     * Returns the parameter placeholder used for a JSON-typed column.
     *
     * @return placeholder expression
     */
    default String getJsonPlaceholder() {
        return "?";
    }

    /**
     * Renders a string as a SQL character literal.
     *
     * @param value raw value
     * @return quoted literal with embedded quotes doubled
     */
    default String quoteLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Joins validated column names with commas.
     *
     * @param columns column names
     * @return comma-separated list
     */
    default String columnList(List<String> columns) {
        return columns.stream().map(this::identifier).collect(Collectors.joining(", "));
    }

    /**
     * Returns {@code count} comma-separated {@code ?} placeholders.
     *
     * @param count number of placeholders
     * @return placeholder list
     */
    default String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
