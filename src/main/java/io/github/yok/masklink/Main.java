package io.github.yok.masklink;

import io.github.yok.masklink.audit.AuditSummary;
import io.github.yok.masklink.config.ConnectionConfig;
import io.github.yok.masklink.config.MaskingConfig;
import io.github.yok.masklink.config.PipelineConfig;
import io.github.yok.masklink.core.AuthorizationException;
import io.github.yok.masklink.core.PipelineOrchestrator;
import io.github.yok.masklink.core.RunMode;
import io.github.yok.masklink.db.JdbcConnector;
import io.github.yok.masklink.db.SqlDialectFactory;
import io.github.yok.masklink.util.ErrorHandler;
import io.github.yok.masklink.util.RetryPolicy;
import io.github.yok.masklink.util.SecretResolver;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options, then runs a {@link PipelineOrchestrator} with the configuration
 * bound from {@code application.yml}.
 * </p>
 *
 * <p>
 * Arguments:
 * </p>
 * <ul>
 * <li>{@code --mode delta|full} or {@code -m delta|full} selects the run mode. If omitted or
 * invalid, {@code pipeline.mode} is used.</li>
 * <li>{@code --dry-run} or {@code -n} extracts and masks without writing to the destination.</li>
 * <li>{@code --tables [t1,t2,…]} or {@code -t [t1,t2,…]} restricts the run to the named
 * configured tables. If omitted, all configured tables are processed.</li>
 * </ul>
 *
 * @see ConnectionConfig
 * @see PipelineConfig
 * @see MaskingConfig
 * @see SqlDialectFactory
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final ConnectionConfig connectionConfig;
    private final PipelineConfig pipelineConfig;
    private final MaskingConfig maskingConfig;
    private final SqlDialectFactory dialectFactory;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        String modeArg = null;
        boolean dryRun = pipelineConfig.isDryRun();
        List<String> tables = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--mode":
                case "-m":
                    modeArg = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--dry-run":
                case "-n":
                    dryRun = true;
                    break;
                case "--tables":
                case "-t":
                    if (i + 1 < args.length) {
                        tables = Arrays.stream(args[++i].split(",")).map(String::trim)
                                .filter(s -> !s.isEmpty()).collect(Collectors.toList());
                    }
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        // Defaults
        RunMode mode = RunMode.parse(modeArg);
        if (mode == null) {
            if (modeArg != null) {
                log.warn("Invalid mode '{}'; falling back to pipeline.mode", modeArg);
            }
            mode = RunMode.parse(pipelineConfig.getMode());
        }
        if (mode == null) {
            ErrorHandler.errorAndExit("Invalid pipeline.mode: " + pipelineConfig.getMode());
            return;
        }

        log.info("Mode: {}, Dry run: {}, Tables: {}", mode, dryRun,
                tables.isEmpty() ? "(all)" : tables);

        // Execute
        try {
            SecretResolver secrets = new SecretResolver(Paths.get(pipelineConfig.getEnvFile()));
            JdbcConnector connector = new JdbcConnector(secrets,
                    RetryPolicy.from(pipelineConfig.getConnectRetry()));
            AuditSummary summary = new PipelineOrchestrator(connectionConfig, pipelineConfig,
                    maskingConfig, dialectFactory::create, connector).execute(mode, dryRun,
                            tables);
            if (!summary.isPersisted()) {
                log.warn("Run finished but the audit record was not saved (execution id {})",
                        summary.getExecutionId());
            }
            log.info("Pipeline run finished. Execution id [{}]", summary.getExecutionId());
        } catch (AuthorizationException e) {
            ErrorHandler.errorAndExit("Security error: " + e.getMessage(), e);
        } catch (Exception e) {
            log.error("Fatal error occurred (mode={}): {}", mode, e.getMessage(), e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }
}
