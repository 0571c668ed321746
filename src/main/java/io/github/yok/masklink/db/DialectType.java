package io.github.yok.masklink.db;

/**
 * Enumerates supported database products.
 *
 * <ul>
 * <li>POSTGRESQL: {@code ON CONFLICT} upserts and conditional inserts</li>
 * <li>MYSQL: {@code ON DUPLICATE KEY UPDATE} upserts, {@code INSERT IGNORE}</li>
 * <li>H2: {@code MERGE ... KEY} upserts; used for local runs and tests</li>
 * </ul>
 */
public enum DialectType {
    POSTGRESQL,
    MYSQL,
    H2
}
