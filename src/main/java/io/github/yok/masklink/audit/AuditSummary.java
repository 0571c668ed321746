package io.github.yok.masklink.audit;

import com.google.common.collect.ImmutableList;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable summary of one run, as written to {@code execution_audit}.
 */
@Value
@Builder(toBuilder = true)
public class AuditSummary {

    String executionId;
    String envName;
    LocalDateTime startedAt;
    LocalDateTime finishedAt;
    // One entry per loaded (or dry-run counted) batch, in logging order
    @Builder.Default
    List<TableCount> tablesProcessed = ImmutableList.of();
    long rowsCopied;
    // Number of recorded errors (failed batches, failed tables and run-level errors)
    int rowsFailed;
    @Builder.Default
    List<ErrorEntry> errors = ImmutableList.of();
    // true once the summary has been committed to the destination
    boolean persisted;

    /**
     * Rows of one batch attributed to a table.
     */
    @Value
    public static class TableCount {
        String table;
        long rows;
    }

    /**
     * One recorded error. The unit is a table name, {@code "thread"} or {@code "general"}.
     */
    @Value
    public static class ErrorEntry {
        String unit;
        String message;
    }
}
