package io.github.yok.masklink.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.google.common.collect.ImmutableList;
import io.github.yok.masklink.db.SqlDialect;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe accumulator of per-run statistics, persisted once as a row of
 * {@code execution_audit}.
 *
 * <p>
 * {@link #logTable(String, long)} and {@link #logError(String, String)} may be called from any
 * worker. {@link #finish(Connection, SqlDialect)} is called exactly once, after all workers have
 * stopped: it rolls back whatever transaction the connection may have left open, inserts the
 * summary and commits.
 * </p>
 */
@Slf4j
public class AuditRecorder {

    static final String INSERT_SQL_TEMPLATE = "INSERT INTO execution_audit (execution_id, "
            + "started_at, finished_at, env_name, tables_processed, rows_copied, rows_failed, "
            + "errors) VALUES (?, ?, ?, ?, %1$s, ?, ?, %1$s)";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Getter
    private final String executionId;
    @Getter
    private final String envName;
    @Getter
    private final LocalDateTime startedAt;
    private final Clock clock;

    private final List<AuditSummary.TableCount> tablesProcessed = new ArrayList<>();
    private final List<AuditSummary.ErrorEntry> errors = new ArrayList<>();
    private long rowsCopied;
    private final AtomicBoolean finished = new AtomicBoolean();

    /**
     * Starts a run record using the system clock.
     *
     * @param envName environment label
     */
    public AuditRecorder(String envName) {
        this(envName, Clock.systemDefaultZone());
    }

    /**
     * Starts a run record.
     *
     * @param envName environment label
     * @param clock clock providing the start and finish times
     */
    public AuditRecorder(String envName, Clock clock) {
        this.executionId = UUID.randomUUID().toString();
        this.envName = envName;
        this.clock = clock;
        this.startedAt = LocalDateTime.now(clock);
    }

    /**
     * Records rows of one batch attributed to a table.
     *
     * @param table table name
     * @param rows row count of the batch
     */
    public synchronized void logTable(String table, long rows) {
        tablesProcessed.add(new AuditSummary.TableCount(table, rows));
        rowsCopied += rows;
    }

    /**
     * Records an error. Never throws.
     *
     * @param unit table name, {@code "thread"} or {@code "general"}
     * @param message error description
     */
    public synchronized void logError(String unit, String message) {
        errors.add(new AuditSummary.ErrorEntry(String.valueOf(unit), String.valueOf(message)));
    }

    /**
     * Returns the current in-memory summary (not persisted).
     *
     * @return summary
     */
    public synchronized AuditSummary snapshot() {
        return AuditSummary.builder().executionId(executionId).envName(envName)
                .startedAt(startedAt).tablesProcessed(ImmutableList.copyOf(tablesProcessed))
                .rowsCopied(rowsCopied).rowsFailed(errors.size())
                .errors(ImmutableList.copyOf(errors)).build();
    }

    /**
     * Persists the summary.
     *
     * @param connection destination connection (auto-commit disabled)
     * @param dialect destination dialect
     * @return the persisted summary
     * @throws AuditPersistenceException if the summary could not be written; the exception carries
     *         the in-memory summary
     * @throws IllegalStateException if called more than once
     */
    public AuditSummary finish(Connection connection, SqlDialect dialect) {
        if (!finished.compareAndSet(false, true)) {
            throw new IllegalStateException("Audit already finished: " + executionId);
        }
        AuditSummary summary = snapshot().toBuilder().finishedAt(LocalDateTime.now(clock)).build();

        try {
            connection.rollback();
        } catch (SQLException e) {
            // No transaction to clear, or the connection is already unusable; the insert decides
            log.debug("Rollback before audit insert failed: {}", e.getMessage());
        }

        String sql = String.format(INSERT_SQL_TEMPLATE, dialect.getJsonPlaceholder());
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, summary.getExecutionId());
            ps.setTimestamp(2, Timestamp.valueOf(summary.getStartedAt()));
            ps.setTimestamp(3, Timestamp.valueOf(summary.getFinishedAt()));
            ps.setString(4, summary.getEnvName());
            ps.setString(5, tablesJson(summary));
            ps.setLong(6, summary.getRowsCopied());
            ps.setInt(7, summary.getRowsFailed());
            ps.setString(8, errorsJson(summary));
            ps.executeUpdate();
            connection.commit();
        } catch (SQLException | JsonProcessingException e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackEx) {
                e.addSuppressed(rollbackEx);
            }
            throw new AuditPersistenceException(
                    "Failed to persist audit record " + executionId, summary, e);
        }
        log.info("Audit record saved: executionId={}", executionId);
        return summary.toBuilder().persisted(true).build();
    }

    static String tablesJson(AuditSummary summary) throws JsonProcessingException {
        ArrayNode array = MAPPER.createArrayNode();
        for (AuditSummary.TableCount count : summary.getTablesProcessed()) {
            array.addObject().put("table", count.getTable()).put("rows", count.getRows());
        }
        return MAPPER.writeValueAsString(array);
    }

    static String errorsJson(AuditSummary summary) throws JsonProcessingException {
        ArrayNode array = MAPPER.createArrayNode();
        for (AuditSummary.ErrorEntry error : summary.getErrors()) {
            array.addObject().put("table", error.getUnit()).put("error", error.getMessage());
        }
        return MAPPER.writeValueAsString(array);
    }
}
