package io.github.yok.masklink.masking;

import lombok.Value;

/**
 * A masking rule with its parameters.
 *
 * <p>
 * {@code keepLength} and {@code maskChar} only apply to {@link RuleKind#REDACT}.
 * </p>
 */
@Value
public class MaskingRule {

    public static final MaskingRule HASH = new MaskingRule(RuleKind.HASH, false, '*');
    public static final MaskingRule PRESERVE_FORMAT =
            new MaskingRule(RuleKind.PRESERVE_FORMAT, false, '*');
    public static final MaskingRule TOKENIZE = new MaskingRule(RuleKind.TOKENIZE, false, '*');
    public static final MaskingRule NONE = new MaskingRule(RuleKind.NONE, false, '*');

    RuleKind kind;
    boolean keepLength;
    char maskChar;

    /**
     * Creates a redaction rule.
     *
     * @param keepLength repeat {@code maskChar} once per input character instead of returning the
     *        placeholder
     * @param maskChar mask character
     * @return rule
     */
    public static MaskingRule redact(boolean keepLength, char maskChar) {
        return new MaskingRule(RuleKind.REDACT, keepLength, maskChar);
    }
}
