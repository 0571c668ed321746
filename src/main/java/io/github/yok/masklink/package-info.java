/**
 * MaskLink: copies rows from a source database to a destination database while de-identifying
 * sensitive columns.
 *
 * <p>
 * {@link io.github.yok.masklink.Main} is the command-line entry point.
 * </p>
 */
package io.github.yok.masklink;
