/**
 * Masking package.
 *
 * <p>
 * {@link io.github.yok.masklink.masking.RuleKind} is the closed set of rules,
 * {@link io.github.yok.masklink.masking.MaskingRuleSet} the validated per-table configuration,
 * {@link io.github.yok.masklink.masking.ValueMasker} the pure value transforms and
 * {@link io.github.yok.masklink.masking.MaskingEngine} applies them to rows. Tokenization is backed
 * by a {@link io.github.yok.masklink.masking.TokenVault}.
 * </p>
 */
package io.github.yok.masklink.masking;
