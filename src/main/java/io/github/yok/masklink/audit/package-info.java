/**
 * Run auditing: thread-safe accumulation of per-run statistics and their persistence to the
 * destination's {@code execution_audit} table.
 */
package io.github.yok.masklink.audit;
