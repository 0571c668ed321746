package io.github.yok.masklink.core;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.yok.masklink.audit.AuditPersistenceException;
import io.github.yok.masklink.audit.AuditRecorder;
import io.github.yok.masklink.audit.AuditSummary;
import io.github.yok.masklink.config.ConnectionConfig;
import io.github.yok.masklink.config.MaskingConfig;
import io.github.yok.masklink.config.PipelineConfig;
import io.github.yok.masklink.db.JdbcConnector;
import io.github.yok.masklink.db.SqlDialect;
import io.github.yok.masklink.masking.MaskingEngine;
import io.github.yok.masklink.masking.MaskingRuleSet;
import io.github.yok.masklink.util.RetryPolicy;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives a pipeline run.
 *
 * <p>
 * A run moves through three phases:
 * </p>
 * <ol>
 * <li><strong>Authorization</strong>: source and destination connections are opened and the
 * destination session identity is checked against {@code pipeline.allowed-runner-roles}. A
 * rejected identity closes both connections and raises {@link AuthorizationException}; no audit
 * record is created.</li>
 * <li><strong>Running</strong>: every selected table is processed by a {@link TableProcessor},
 * either sequentially or on a bounded worker pool (one task per table) when parallel execution is
 * enabled and more than one table is selected. Each table opens its own connections. A failing
 * batch is recorded and skipped; a failing table is recorded under its name and does not affect
 * the other tables.</li>
 * <li><strong>Finalizing</strong>: always runs. The audit summary is persisted on the connection
 * opened for authorization, then both connections are closed and an aligned summary is
 * logged.</li>
 * </ol>
 */
@Slf4j
public class PipelineOrchestrator {

    static final String UNIT_GENERAL = "general";
    static final String UNIT_THREAD = "thread";

    private final ConnectionConfig connectionConfig;
    private final PipelineConfig pipelineConfig;
    private final MaskingConfig maskingConfig;
    private final Function<ConnectionConfig.Entry, SqlDialect> dialectProvider;
    private final JdbcConnector connector;

    /**
     * Creates an orchestrator.
     *
     * @param connectionConfig source and destination settings
     * @param pipelineConfig run settings and table list
     * @param maskingConfig masking rules and salt
     * @param dialectProvider resolves the dialect of a connection entry
     * @param connector opens connections with the configured connect retries
     */
    public PipelineOrchestrator(ConnectionConfig connectionConfig, PipelineConfig pipelineConfig,
            MaskingConfig maskingConfig,
            Function<ConnectionConfig.Entry, SqlDialect> dialectProvider,
            JdbcConnector connector) {
        this.connectionConfig = connectionConfig;
        this.pipelineConfig = pipelineConfig;
        this.maskingConfig = maskingConfig;
        this.dialectProvider = dialectProvider;
        this.connector = connector;
    }

    /**
     * Executes a run.
     *
     * @param mode run mode
     * @param dryRun {@code true} to extract and mask without writing to the destination
     * @param tableNames tables to process; {@code null} or empty selects every configured table
     * @return the audit summary; {@link AuditSummary#isPersisted()} tells whether it was written
     * @throws AuthorizationException if the destination identity is not allowed to run
     * @throws IllegalArgumentException if the table or masking configuration is invalid, including
     *         masking rules for a table that is not configured
     * @throws IllegalStateException if a required setting (salt, secret, dialect) is missing
     * @throws io.github.yok.masklink.db.ConnectivityException if the initial connections fail
     */
    public AuditSummary execute(RunMode mode, boolean dryRun, List<String> tableNames) {
        List<TableDescriptor> tables = selectTables(tableNames);
        MaskingRuleSet ruleSet = MaskingRuleSet.from(maskingConfig);
        ruleSet.checkTables(pipelineConfig.getTables().stream()
                .map(PipelineConfig.TableEntry::getName).collect(Collectors.toList()));
        MaskingEngine engine = MaskingEngine.from(maskingConfig, ruleSet);
        SqlDialect sourceDialect = dialectProvider.apply(connectionConfig.getSource());
        SqlDialect destinationDialect = dialectProvider.apply(connectionConfig.getDestination());
        boolean parallel = pipelineConfig.isParallelTables() && tables.size() > 1;

        log.info("=== Pipeline started (env={}, mode={}, dry-run={}, parallel={}, workers={}) ===",
                pipelineConfig.getEnvName(), mode, dryRun, parallel,
                parallel ? pipelineConfig.getMaxWorkers() : 1);

        Connection source = connector.open(connectionConfig.getSource());
        Connection destination;
        try {
            destination = connector.open(connectionConfig.getDestination());
        } catch (RuntimeException e) {
            closeQuietly(source, "source");
            throw e;
        }

        try {
            authorize(destination, destinationDialect);
        } catch (RuntimeException e) {
            closeQuietly(source, "source");
            closeQuietly(destination, "destination");
            throw e;
        }

        AuditRecorder audit = new AuditRecorder(pipelineConfig.getEnvName());
        Map<String, TableResult> results = Collections.synchronizedMap(new LinkedHashMap<>());
        AuditSummary summary;
        try {
            WatermarkStore watermarks = mode == RunMode.DELTA
                    ? WatermarkStore.open(Paths.get(pipelineConfig.getStateFile()))
                    : null;
            TableProcessor processor = TableProcessor.builder().mode(mode).dryRun(dryRun)
                    .maskingEngine(engine).ruleSet(ruleSet).audit(audit).watermarks(watermarks)
                    .sourceDialect(sourceDialect).destinationDialect(destinationDialect)
                    .extractRetry(RetryPolicy.from(pipelineConfig.getExtractRetry()))
                    .loadRetry(RetryPolicy.from(pipelineConfig.getLoadRetry())).build();

            if (parallel) {
                runParallel(tables, processor, audit, results);
            } else {
                for (TableDescriptor table : tables) {
                    runTable(table, processor, audit, results);
                }
            }
            log.info("=== Pipeline completed ===");
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("Pipeline error: {}", e.getMessage(), e);
            audit.logError(UNIT_GENERAL, TableProcessor.describe(e));
        } finally {
            try {
                summary = audit.finish(destination, destinationDialect);
            } catch (AuditPersistenceException e) {
                log.error("Audit record could not be saved: {}", e.getMessage(), e);
                summary = e.getSummary();
            }
            closeQuietly(source, "source");
            closeQuietly(destination, "destination");
        }
        logSummary(results, summary);
        return summary;
    }

    /**
     * Checks the destination session identity against the allow-list.
     *
     * @param destination destination connection
     * @param dialect destination dialect
     * @throws AuthorizationException if the identity is not allowed or cannot be determined
     */
    void authorize(Connection destination, SqlDialect dialect) {
        List<String> allowed = pipelineConfig.getAllowedRunnerRoles();
        if (allowed == null || allowed.isEmpty()) {
            log.info("No runner allow-list configured; authorization check skipped");
            return;
        }
        String currentUser;
        try (Statement stmt = destination.createStatement();
                ResultSet rs = stmt.executeQuery(dialect.getCurrentUserSql())) {
            currentUser = rs.next() ? rs.getString(1) : null;
            destination.commit();
        } catch (SQLException e) {
            throw new AuthorizationException("Could not determine the destination session user",
                    e);
        }
        if (currentUser == null || !allowed.contains(currentUser)) {
            log.error("Runner not authorized: '{}' (allowed: {})", currentUser, allowed);
            throw new AuthorizationException("Database role not authorized to run the pipeline: '"
                    + currentUser + "'. Allowed: " + String.join(", ", allowed) + ".");
        }
        log.info("Runner '{}' authorized", currentUser);
    }

    /**
     * Resolves the tables of this run in configuration order.
     *
     * @param tableNames requested names; {@code null} or empty for all
     * @return validated descriptors
     */
    List<TableDescriptor> selectTables(List<String> tableNames) {
        Map<String, TableDescriptor> configured = new LinkedHashMap<>();
        for (PipelineConfig.TableEntry entry : pipelineConfig.getTables()) {
            TableDescriptor descriptor = TableDescriptor.from(entry);
            if (configured.putIfAbsent(descriptor.getName().toLowerCase(Locale.ROOT),
                    descriptor) != null) {
                throw new IllegalArgumentException(
                        "Table configured more than once: " + descriptor.getName());
            }
        }
        if (tableNames == null || tableNames.isEmpty()) {
            return ImmutableList.copyOf(configured.values());
        }
        List<String> requested = new ArrayList<>();
        for (String name : tableNames) {
            String key = name.trim().toLowerCase(Locale.ROOT);
            if (!configured.containsKey(key)) {
                log.warn("Table [{}] is not configured; ignoring", name);
            } else if (!requested.contains(key)) {
                requested.add(key);
            }
        }
        List<TableDescriptor> selected = new ArrayList<>();
        configured.forEach((key, descriptor) -> {
            if (requested.contains(key)) {
                selected.add(descriptor);
            }
        });
        return ImmutableList.copyOf(selected);
    }

    private void runParallel(List<TableDescriptor> tables, TableProcessor processor,
            AuditRecorder audit, Map<String, TableResult> results) throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(pipelineConfig.getMaxWorkers(),
                new ThreadFactoryBuilder().setNameFormat("masklink-worker-%d").build());
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (TableDescriptor table : tables) {
                futures.add(pool.submit(() -> runTable(table, processor, audit, results)));
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Worker failed: {}", cause.getMessage(), cause);
                    audit.logError(UNIT_THREAD, TableProcessor.describe(cause));
                }
            }
        } finally {
            pool.shutdown();
            if (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                log.warn("Worker pool did not terminate; forcing shutdown");
                pool.shutdownNow();
            }
        }
    }

    private void runTable(TableDescriptor table, TableProcessor processor, AuditRecorder audit,
            Map<String, TableResult> results) {
        String name = table.getName();
        Connection source = null;
        Connection destination = null;
        try {
            source = connector.open(connectionConfig.getSource());
            destination = connector.open(connectionConfig.getDestination());
            results.put(name, processor.process(table, source, destination));
        } catch (Exception e) {
            log.error("[{}] Table failed: {}", name, e.getMessage(), e);
            audit.logError(name, TableProcessor.describe(e));
        } finally {
            closeQuietly(source, name + "/source");
            closeQuietly(destination, name + "/destination");
        }
    }

    private static void closeQuietly(Connection connection, String label) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("[{}] Failed to close connection: {}", label, e.getMessage());
        }
    }

    /**
     * Outputs an aligned end-of-run summary.
     */
    private void logSummary(Map<String, TableResult> results, AuditSummary summary) {
        log.info("===== Summary =====");
        synchronized (results) {
            int maxNameLen =
                    results.keySet().stream().mapToInt(String::length).max().orElse(0);
            int maxCountDigits = results.values().stream()
                    .map(r -> String.valueOf(r.getRows()).length()).mapToInt(Integer::intValue)
                    .max().orElse(0);
            String fmt = "  Table[%-" + Math.max(maxNameLen, 1) + "s] Rows=%"
                    + Math.max(maxCountDigits, 1) + "d Batches=%d Failed=%d Time=%d ms";
            results.values().forEach(r -> log.info(String.format(fmt, r.getTable(), r.getRows(),
                    r.getBatches(), r.getFailedBatches(), r.getElapsed().toMillis())));
        }
        log.info("Execution id: {} | rows copied={} | errors={} | audit saved={}",
                summary.getExecutionId(), summary.getRowsCopied(), summary.getRowsFailed(),
                summary.isPersisted());
    }
}
