package io.github.yok.masklink.core;

import com.google.common.base.Preconditions;
import io.github.yok.masklink.db.SqlDialect;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes batches to the destination.
 *
 * <p>
 * Every batch is one transaction: all rows are written and committed together, or the transaction
 * is rolled back in full and the error propagates to the caller, which owns the retry policy.
 * </p>
 * <ul>
 * <li>With a declared primary key the write is an upsert: an existing key has every non-key column
 * overwritten. Loading the same batch again leaves the table unchanged, so retries and watermark
 * replays are safe.</li>
 * <li>Without a key the write is a plain insert. A retry after an ambiguous failure, or the replay
 * of the last batch after a crash, can duplicate rows. No deduplication is attempted.</li>
 * </ul>
 */
@Slf4j
public class BatchLoader {

    private final Connection connection;
    private final SqlDialect dialect;

    /**
     * Creates a loader.
     *
     * @param connection destination connection owned by the calling worker (auto-commit disabled)
     * @param dialect destination dialect
     */
    public BatchLoader(Connection connection, SqlDialect dialect) {
        this.connection = connection;
        this.dialect = dialect;
    }

    /**
     * Writes one batch in a single transaction.
     *
     * @param table destination table
     * @param primaryKey declared key columns; empty for a plain insert
     * @param rows non-empty batch whose rows share one column set
     * @return number of rows written
     * @throws SQLException if the write fails; the transaction has been rolled back
     * @throws IllegalArgumentException if the batch is empty, the rows disagree on their columns or
     *         a key column is missing
     */
    public int insert(String table, List<String> primaryKey, List<Map<String, Object>> rows)
            throws SQLException {
        Preconditions.checkArgument(rows != null && !rows.isEmpty(), "rows must not be empty");
        List<String> columns = new ArrayList<>(rows.get(0).keySet());
        Set<String> columnSet = rows.get(0).keySet();
        for (Map<String, Object> row : rows) {
            Preconditions.checkArgument(row.keySet().equals(columnSet),
                    "[%s] rows in one batch must share the same columns", table);
        }

        String sql;
        if (primaryKey.isEmpty()) {
            sql = dialect.buildInsertSql(table, columns);
        } else {
            List<String> keys = new ArrayList<>();
            for (String key : primaryKey) {
                keys.add(matchColumn(table, columns, key));
            }
            List<String> updates = new ArrayList<>(columns);
            updates.removeAll(keys);
            sql = dialect.buildUpsertSql(table, keys, columns, updates);
        }
        log.debug("[{}] {}", table, sql);

        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            for (Map<String, Object> row : rows) {
                int idx = 1;
                for (String column : columns) {
                    ps.setObject(idx++, row.get(column));
                }
                ps.addBatch();
            }
            ps.executeBatch();
            connection.commit();
            return rows.size();
        } catch (SQLException | RuntimeException e) {
            rollback(table, e);
            throw e;
        }
    }

    /**
     * Removes every row from a destination table and commits.
     *
     * @param table destination table
     * @throws SQLException if the truncate fails; the transaction has been rolled back
     */
    public void truncate(String table) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.executeUpdate(dialect.getTruncateSql(table));
            connection.commit();
            log.info("[{}] Destination table truncated", table);
        } catch (SQLException e) {
            rollback(table, e);
            throw e;
        }
    }

    private void rollback(String table, Exception cause) {
        try {
            connection.rollback();
            log.warn("[{}] Transaction rolled back due to error: {}", table, cause.getMessage());
        } catch (SQLException rollbackEx) {
            log.warn("[{}] Rollback failed: {}", table, rollbackEx.getMessage(), rollbackEx);
            cause.addSuppressed(rollbackEx);
        }
    }

    private static String matchColumn(String table, List<String> columns, String key) {
        for (String column : columns) {
            if (column.equalsIgnoreCase(key)) {
                return column;
            }
        }
        throw new IllegalArgumentException(
                "[" + table + "] primary key column not present in batch: " + key);
    }
}
