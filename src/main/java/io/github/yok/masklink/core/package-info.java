/**
 * Pipeline engine: paginated extraction, batch loading, watermark state, per-table processing and
 * run orchestration.
 */
package io.github.yok.masklink.core;
