/**
 * Database access package.
 *
 * <p>
 * Holds the per-product SQL dialects (PostgreSQL, MySQL, H2), the factory that selects one from a
 * connection entry, and the connector that opens JDBC connections with bounded retries.
 * </p>
 */
package io.github.yok.masklink.db;
