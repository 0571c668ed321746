package io.github.yok.masklink.db;

import io.github.yok.masklink.config.ConnectionConfig;
import io.github.yok.masklink.util.JdbcDriverLoader;
import io.github.yok.masklink.util.RetryPolicy;
import io.github.yok.masklink.util.SecretResolver;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Opens JDBC connections for configured entries.
 *
 * <p>
 * Secrets are resolved through {@link SecretResolver}; a missing secret is a configuration error
 * and is not retried. Connection attempts are retried according to the given
 * {@link RetryPolicy}; exhaustion surfaces as {@link ConnectivityException}. Returned connections
 * have auto-commit disabled, so every write is committed or rolled back explicitly.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcConnector {

    private final SecretResolver secretResolver;
    private final RetryPolicy retryPolicy;

    /**
     * Opens a connection for the entry.
     *
     * @param entry connection settings
     * @return live connection with auto-commit disabled
     * @throws ConnectivityException if the connection cannot be established
     * @throws IllegalStateException if the configuration is incomplete
     */
    public Connection open(ConnectionConfig.Entry entry) {
        String label = entry.getId();
        String url = entry.resolveUrl();
        String password =
                secretResolver.resolve(entry.getPassword(), entry.getPasswordEnv(), label);
        try {
            JdbcDriverLoader.loadIfConfigured(entry.getDriverClass());
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException(
                    "JDBC driver class not found: " + entry.getDriverClass(), e);
        }

        try {
            Connection conn = retryPolicy.execute("Connect [" + label + "]", () -> {
                Connection c = DriverManager.getConnection(url, entry.getUser(), password);
                try {
                    c.setAutoCommit(false);
                } catch (SQLException e) {
                    c.close();
                    throw e;
                }
                return c;
            });
            log.debug("[{}] Connected as {}", label, entry.getUser());
            return conn;
        } catch (Exception e) {
            throw new ConnectivityException("Failed to connect [" + label + "] " + url, e);
        }
    }
}
