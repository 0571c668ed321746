package io.github.yok.masklink.db;

import io.github.yok.masklink.config.ConnectionConfig;
import io.github.yok.masklink.db.h2.H2Dialect;
import io.github.yok.masklink.db.mysql.MySqlDialect;
import io.github.yok.masklink.db.postgresql.PostgresqlDialect;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory class that creates a {@link SqlDialect} according to the database type.
 *
 * <p>
 * The dialect is resolved per {@link ConnectionConfig.Entry} using {@code driver-class} first and
 * the JDBC URL as a fallback.
 * </p>
 */
@Slf4j
@Component
public class SqlDialectFactory {

    /**
     * Creates a {@link SqlDialect} for the provided connection entry.
     *
     * @param entry connection information
     * @return dialect instance
     * @throws IllegalStateException if the database type cannot be determined
     */
    public SqlDialect create(ConnectionConfig.Entry entry) {
        DialectType type;
        try {
            type = resolveType(entry);
        } catch (IllegalArgumentException e) {
            log.error("Invalid dialect resolution input", e);
            throw new IllegalStateException(e.getMessage(), e);
        }
        log.debug("[{}] Resolved dialect {}", entry.getId(), type);
        switch (type) {
            case POSTGRESQL:
                return new PostgresqlDialect();
            case MYSQL:
                return new MySqlDialect();
            case H2:
                return new H2Dialect();
            default:
                throw new IllegalStateException("Unhandled dialect: " + type);
        }
    }

    /**
     * Resolves the database type for a connection entry.
     *
     * @param entry connection entry
     * @return resolved database type
     * @throws IllegalArgumentException if the database type cannot be determined
     */
    DialectType resolveType(ConnectionConfig.Entry entry) {
        DialectType fromDriverClass = resolveTypeFromDriverClass(entry.getDriverClass());
        if (fromDriverClass != null) {
            return fromDriverClass;
        }

        DialectType fromUrl = resolveTypeFromJdbcUrl(entry.resolveUrl());
        if (fromUrl != null) {
            return fromUrl;
        }

        throw new IllegalArgumentException("Unsupported database dialect for connection id="
                + entry.getId() + " (driver-class=" + entry.getDriverClass() + ", url="
                + entry.getUrl() + ")");
    }

    /**
     * Resolves the database type from a JDBC driver class name.
     *
     * @param driverClass JDBC driver class name
     * @return resolved database type, or {@code null} when not recognized
     */
    private DialectType resolveTypeFromDriverClass(String driverClass) {
        String normalized = normalizeLower(driverClass);
        if (normalized == null) {
            return null;
        }
        if ("org.postgresql.driver".equals(normalized)) {
            return DialectType.POSTGRESQL;
        }
        if ("com.mysql.cj.jdbc.driver".equals(normalized)
                || "com.mysql.jdbc.driver".equals(normalized)) {
            return DialectType.MYSQL;
        }
        if ("org.h2.driver".equals(normalized)) {
            return DialectType.H2;
        }
        return null;
    }

    /**
     * Resolves the database type from a JDBC URL.
     *
     * @param jdbcUrl JDBC URL
     * @return resolved database type, or {@code null} when not recognized
     */
    private DialectType resolveTypeFromJdbcUrl(String jdbcUrl) {
        String normalized = normalizeLower(jdbcUrl);
        if (normalized == null) {
            return null;
        }
        if (normalized.startsWith("jdbc:postgresql:")) {
            return DialectType.POSTGRESQL;
        }
        if (normalized.startsWith("jdbc:mysql:")) {
            return DialectType.MYSQL;
        }
        if (normalized.startsWith("jdbc:h2:")) {
            return DialectType.H2;
        }
        return null;
    }

    private String normalizeLower(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
