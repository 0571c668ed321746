package io.github.yok.masklink.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds run-level pipeline settings ({@code pipeline.*}).
 *
 * <pre>
 * pipeline:
 *   env-name: qa
 *   mode: delta
 *   dry-run: false
 *   parallel-tables: true
 *   max-workers: 3
 *   allowed-runner-roles: [qa_runner]
 *   state-file: state/last_run.json
 *   tables:
 *     - name: customers
 *       batch-size: 500
 *       watermark-column: updated_at
 *       primary-key: [customer_id]
 *     - name: audit_log
 *       filter: "created_at &gt; now() - interval '30 days'"
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "pipeline")
@Data
public class PipelineConfig {

    // Environment label recorded in the audit summary
    private String envName = "dev_local";

    // Default run mode when the command line does not choose one ("delta" or "full")
    private String mode = "delta";

    // Extract and mask but skip destination writes
    private boolean dryRun;

    // Run tables on a worker pool when more than one table is configured
    private boolean parallelTables;

    // Worker pool size used when parallelTables is enabled
    private int maxWorkers = 3;

    // Destination identities allowed to run the pipeline; empty disables the check
    private List<String> allowedRunnerRoles = new ArrayList<>();

    // Location of the persisted watermark state
    private String stateFile = "state/last_run.json";

    // Optional dotenv-style file consulted for password-env lookups
    private String envFile = ".env.local";

    private List<TableEntry> tables = new ArrayList<>();

    private RetrySettings extractRetry = RetrySettings.fixed(3, Duration.ofSeconds(1));

    private RetrySettings loadRetry =
            RetrySettings.exponential(5, Duration.ofSeconds(1), Duration.ofSeconds(5));

    private RetrySettings connectRetry =
            RetrySettings.exponential(3, Duration.ofSeconds(1), Duration.ofSeconds(5));

    /**
     * Settings of one table copied by the pipeline.
     */
    @Data
    public static class TableEntry {
        private String name;
        private int batchSize = 500;
        // Static predicate used in full mode and on the first delta run
        private String filter;
        private String watermarkColumn = "updated_at";
        // Declared key columns; non-empty switches loading to upsert
        private List<String> primaryKey = new ArrayList<>();
        // Truncate the destination table before loading in full mode
        private boolean truncateOnFull;
    }

    /**
     * Bounded retry settings.
     */
    @Data
    public static class RetrySettings {
        private int maxAttempts = 3;
        private Backoff backoff = Backoff.FIXED;
        // Fixed delay, or the first delay of an exponential sequence
        private Duration initialDelay = Duration.ofSeconds(1);
        // Upper bound of an exponential sequence
        private Duration maxDelay = Duration.ofSeconds(5);

        /**
         * Creates fixed-delay settings.
         *
         * @param maxAttempts maximum number of attempts
         * @param delay delay between attempts
         * @return settings
         */
        public static RetrySettings fixed(int maxAttempts, Duration delay) {
            RetrySettings settings = new RetrySettings();
            settings.setMaxAttempts(maxAttempts);
            settings.setBackoff(Backoff.FIXED);
            settings.setInitialDelay(delay);
            settings.setMaxDelay(delay);
            return settings;
        }

        /**
         * Creates exponential-backoff settings.
         *
         * @param maxAttempts maximum number of attempts
         * @param initialDelay first delay
         * @param maxDelay delay cap
         * @return settings
         */
        public static RetrySettings exponential(int maxAttempts, Duration initialDelay,
                Duration maxDelay) {
            RetrySettings settings = new RetrySettings();
            settings.setMaxAttempts(maxAttempts);
            settings.setBackoff(Backoff.EXPONENTIAL);
            settings.setInitialDelay(initialDelay);
            settings.setMaxDelay(maxDelay);
            return settings;
        }
    }

    /**
     * Delay strategy between retry attempts.
     */
    public enum Backoff {
        FIXED, EXPONENTIAL
    }
}
