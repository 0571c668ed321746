/**
 * Configuration model package for MaskLink.
 *
 * <p>
 * Defines classes bound from {@code application.yml} (or equivalent sources): source and
 * destination connections, run-level pipeline settings with table descriptors and retry settings,
 * and masking rules.
 * </p>
 *
 * <p>
 * This package only holds configuration data; validation into runtime types happens in
 * {@code core} and {@code masking}.
 * </p>
 */
package io.github.yok.masklink.config;
