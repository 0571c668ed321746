package io.github.yok.masklink.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One masking rule as written in configuration.
 *
 * <p>
 * The rule name is validated when the rule set is built, not here, so that binding errors and
 * unknown rule names are reported with the table and column they belong to.
 * </p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RuleProperties {

    // Rule name, e.g. "hash", "redact", "preserve-format", "tokenize", "none"
    private String type;

    // Redaction only: repeat the mask character once per input character
    private boolean keepLength;

    // Redaction only: mask character; falls back to masking.default-mask-char
    private String maskChar;

    /**
     * Creates properties holding only a rule name.
     *
     * @param type rule name
     * @return properties
     */
    public static RuleProperties of(String type) {
        return new RuleProperties(type, false, null);
    }
}
