package io.github.yok.masklink.util;

import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Utility for optional JDBC driver class loading.
 *
 * <p>
 * When {@code connections.*.driver-class} is configured, the class is loaded explicitly. When it is
 * {@code null} or blank nothing happens, so JDBC 4 service loading picks the driver from the URL.
 * </p>
 */
public final class JdbcDriverLoader {

    /**
     * Prevents instantiation.
     */
    @Generated
    private JdbcDriverLoader() {}

    /**
     * Loads the JDBC driver class only when the class name is configured.
     *
     * @param driverClass fully qualified JDBC driver class name, or {@code null}/blank
     * @throws ClassNotFoundException when the specified class cannot be found
     */
    public static void loadIfConfigured(String driverClass) throws ClassNotFoundException {
        if (StringUtils.isBlank(driverClass)) {
            return;
        }
        Class.forName(driverClass.trim());
    }
}
