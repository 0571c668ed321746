package io.github.yok.masklink.core;

import com.google.common.base.Stopwatch;
import io.github.yok.masklink.audit.AuditRecorder;
import io.github.yok.masklink.db.SqlDialect;
import io.github.yok.masklink.masking.JdbcTokenVault;
import io.github.yok.masklink.masking.MaskingEngine;
import io.github.yok.masklink.masking.MaskingRule;
import io.github.yok.masklink.masking.MaskingRuleSet;
import io.github.yok.masklink.masking.RuleKind;
import io.github.yok.masklink.masking.TokenVault;
import io.github.yok.masklink.util.RetryPolicy;
import java.sql.Connection;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs extract, mask, load and watermark advance for one table.
 *
 * <p>
 * The unit of failure isolation is the batch: an exception while masking, loading or advancing the
 * watermark of one batch is recorded under the table name and the next batch is processed. An
 * {@link ExtractionException} ends the table and propagates to the caller.
 * </p>
 *
 * <p>
 * Instances are shared by all workers of a run; every per-table resource (connections, extractor,
 * loader, token vault) is created inside {@link #process(TableDescriptor, Connection, Connection)}.
 * </p>
 */
@Slf4j
@Builder
public class TableProcessor {

    @NonNull
    private final RunMode mode;
    private final boolean dryRun;
    @NonNull
    private final MaskingEngine maskingEngine;
    @NonNull
    private final MaskingRuleSet ruleSet;
    @NonNull
    private final AuditRecorder audit;
    // null in full mode
    private final WatermarkStore watermarks;
    @NonNull
    private final SqlDialect sourceDialect;
    @NonNull
    private final SqlDialect destinationDialect;
    @NonNull
    private final RetryPolicy extractRetry;
    @NonNull
    private final RetryPolicy loadRetry;

    /**
     * Processes one table.
     *
     * @param table table to copy
     * @param source source connection owned by the calling worker
     * @param destination destination connection owned by the calling worker
     * @return table outcome
     * @throws ExtractionException if a page cannot be read after all retries
     * @throws LoadException if the full-mode truncate fails after all retries
     */
    public TableResult process(TableDescriptor table, Connection source, Connection destination) {
        String name = table.getName();
        Stopwatch stopwatch = Stopwatch.createStarted();
        log.info("[{}] Processing table (batch-size={})", name, table.getBatchSize());

        Map<String, MaskingRule> rules = ruleSet.forTable(name);
        TokenVault vault = usesTokenize(rules)
                ? new JdbcTokenVault(destination, destinationDialect)
                : null;
        BatchLoader loader = new BatchLoader(destination, destinationDialect);
        if (!dryRun && !table.isKeyed()) {
            log.warn("[{}] No primary key declared; plain inserts are not idempotent on replay",
                    name);
        }

        if (mode == RunMode.FULL && table.isTruncateOnFull() && !dryRun) {
            try {
                loadRetry.execute("Truncate [" + name + "]", () -> {
                    loader.truncate(name);
                    return null;
                });
            } catch (Exception e) {
                throw new LoadException("Truncate failed for table " + name, e);
            }
        }

        String filter = resolveFilter(table);
        BatchExtractor extractor = new BatchExtractor(source, sourceDialect, extractRetry);
        Iterator<List<Map<String, Object>>> batches =
                extractor.extract(name, table.getBatchSize(), filter);

        int batchCount = 0;
        int failed = 0;
        long rows = 0;
        while (batches.hasNext()) {
            List<Map<String, Object>> batch = batches.next();
            batchCount++;
            try {
                rows += processBatch(table, batch, rules, vault, loader);
            } catch (Exception e) {
                failed++;
                log.error("[{}] Batch {} failed: {}", name, batchCount, e.getMessage(), e);
                audit.logError(name, describe(e));
            }
        }

        TableResult result =
                new TableResult(name, batchCount, rows, failed, stopwatch.stop().elapsed());
        if (rows == 0) {
            log.info("[{}] No rows processed", name);
        }
        log.info("[{}] Table finished: rows={} batches={} failed={} elapsed={} ms", name, rows,
                batchCount, failed, result.getElapsed().toMillis());
        return result;
    }

    /**
     * Returns the extraction predicate of a table for this run.
     *
     * @param table table
     * @return watermark predicate in delta mode when a watermark exists, otherwise the static
     *         filter (may be {@code null})
     */
    String resolveFilter(TableDescriptor table) {
        if (mode == RunMode.DELTA && watermarks != null && table.getWatermarkColumn() != null) {
            String last = watermarks.get(table.getName());
            if (last != null) {
                log.info("[{}] Using watermark: {} > {}", table.getName(),
                        table.getWatermarkColumn(), last);
                return sourceDialect.identifier(table.getWatermarkColumn()) + " > "
                        + sourceDialect.quoteLiteral(last);
            }
            log.info("[{}] No prior watermark; extracting all rows", table.getName());
        }
        return table.getFilter();
    }

    private long processBatch(TableDescriptor table, List<Map<String, Object>> batch,
            Map<String, MaskingRule> rules, TokenVault vault, BatchLoader loader)
            throws Exception {
        String name = table.getName();
        List<Map<String, Object>> masked = maskingEngine.maskBatch(batch, rules, vault);

        if (dryRun) {
            log.info("[{}] (Dry run) Skipped load of {} rows", name, masked.size());
        } else {
            try {
                loadRetry.execute("Load [" + name + "]",
                        () -> loader.insert(name, table.getPrimaryKey(), masked));
            } catch (Exception e) {
                throw new LoadException("Load failed for table " + name, e);
            }
            log.info("[{}] Batch loaded: rows={}", name, masked.size());
        }
        if (mode == RunMode.DELTA && watermarks != null && table.getWatermarkColumn() != null) {
            List<Object> values = new ArrayList<>(batch.size());
            for (Map<String, Object> row : batch) {
                values.add(columnValue(row, table.getWatermarkColumn()));
            }
            if (watermarks.advance(name, values)) {
                log.info("[{}] Watermark advanced to {}", name, watermarks.get(name));
            }
        }
        // Counted after the watermark is durable
        audit.logTable(name, masked.size());
        return masked.size();
    }

    private static Object columnValue(Map<String, Object> row, String column) {
        if (row.containsKey(column)) {
            return row.get(column);
        }
        for (Map.Entry<String, Object> e : row.entrySet()) {
            if (e.getKey().equalsIgnoreCase(column)) {
                return e.getValue();
            }
        }
        return null;
    }

    private static boolean usesTokenize(Map<String, MaskingRule> rules) {
        return rules.values().stream().anyMatch(r -> r.getKind() == RuleKind.TOKENIZE);
    }

    /**
     * Returns the most specific message of an exception chain for the audit record.
     *
     * @param e exception
     * @return message
     */
    static String describe(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage() != null ? root.getMessage() : root.toString();
        return root == e ? message : e.getMessage() + ": " + message;
    }
}
