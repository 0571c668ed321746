package io.github.yok.masklink.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds masking settings ({@code masking.*}).
 *
 * <p>
 * Rules are keyed by table, then by column. A rule is either a scalar rule name or an object with
 * parameters:
 * </p>
 *
 * <pre>
 * masking:
 *   salt: ${MASKING_SALT}
 *   rules:
 *     customers:
 *       email: hash
 *       phone: preserve-format
 *       customer_ref: tokenize
 *       notes:
 *         type: redact
 *         keep-length: true
 *         mask-char: '#'
 * </pre>
 *
 * <p>
 * <strong>Operational hazard:</strong> changing {@code salt} changes every hash and every
 * format-preserving substitution produced afterwards, so values masked before and after the change
 * no longer join.
 * </p>
 */
@Component
@ConfigurationProperties(prefix = "masking")
@Data
public class MaskingConfig {

    // Secret salt appended before hashing; keep it fixed for the lifetime of the masked data
    @ToString.Exclude
    private String salt;

    // Literal returned by redaction when keep-length is off
    private String redactionPlaceholder = "REDACTED";

    // Mask character used by keep-length redaction when a rule does not set one
    private String defaultMaskChar = "*";

    // table -> column -> rule
    private Map<String, Map<String, RuleProperties>> rules = new LinkedHashMap<>();
}
