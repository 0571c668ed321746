package io.github.yok.masklink.config;

import lombok.Data;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds the source and destination connection settings.
 *
 * <pre>
 * connections:
 *   source:
 *     host: localhost
 *     port: 5432
 *     database: prod
 *     user: reader
 *     password-env: SRC_DB_PASSWORD
 *   destination:
 *     url: jdbc:postgresql://qa-host:5432/qa
 *     user: qa_runner
 *     password-env: DST_DB_PASSWORD
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "connections")
@Data
public class ConnectionConfig {

    /**
     * Store rows are read from.
     */
    private Entry source = Entry.named("source");

    /**
     * Store masked rows, tokens and audit records are written to.
     */
    private Entry destination = Entry.named("destination");

    /**
     * Inner class that holds one connection setting.
     */
    @Data
    public static class Entry {
        // Logical label used in logs ("source" / "destination")
        private String id;
        // JDBC URL; composed from host/port/database when blank
        private String url;
        private String host = "localhost";
        private int port = 5432;
        private String database;
        private String user;
        // Literal secret; takes precedence over passwordEnv
        @ToString.Exclude
        private String password;
        // Name of the environment variable holding the secret
        private String passwordEnv;
        // Fully qualified JDBC driver class name; optional with JDBC 4 drivers
        private String driverClass;

        /**
         * Creates an entry with the given label.
         *
         * @param id label
         * @return new entry
         */
        public static Entry named(String id) {
            Entry entry = new Entry();
            entry.setId(id);
            return entry;
        }

        /**
         * Returns the JDBC URL, composing a PostgreSQL URL from host, port and database when no
         * explicit URL is configured.
         *
         * @return JDBC URL
         * @throws IllegalStateException if neither a URL nor a database name is configured
         */
        public String resolveUrl() {
            if (StringUtils.isNotBlank(url)) {
                return url.trim();
            }
            if (StringUtils.isBlank(database)) {
                throw new IllegalStateException(
                        "Neither 'url' nor 'database' is configured for connection: " + id);
            }
            return "jdbc:postgresql://" + host + ":" + port + "/" + database;
        }
    }
}
