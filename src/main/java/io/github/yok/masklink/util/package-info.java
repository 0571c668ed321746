/**
 * Small stateless helpers shared by the pipeline: fatal error reporting, JDBC driver loading and
 * secret resolution.
 */
package io.github.yok.masklink.util;
