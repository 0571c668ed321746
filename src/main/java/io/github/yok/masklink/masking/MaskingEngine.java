package io.github.yok.masklink.masking;

import io.github.yok.masklink.config.MaskingConfig;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Applies masking rules to rows.
 *
 * <p>
 * A row is an ordered column-to-value mapping. Masking returns a new row with the same columns in
 * the same order; only columns named by a rule are replaced, and a rule naming a column the row
 * does not have is ignored. Column names are matched exactly first, then case-insensitively, so
 * rules written in lower case also apply to drivers that report upper-case labels.
 * </p>
 */
public class MaskingEngine {

    private final ValueMasker masker;

    /**
     * Creates an engine.
     *
     * @param masker value transforms
     */
    public MaskingEngine(ValueMasker masker) {
        this.masker = masker;
    }

    /**
     * Creates an engine from configuration, checking that a salt is configured when any rule
     * needs one.
     *
     * @param config masking configuration
     * @param ruleSet validated rule set
     * @return engine
     * @throws IllegalStateException if hashing rules are configured without a salt
     */
    public static MaskingEngine from(MaskingConfig config, MaskingRuleSet ruleSet) {
        boolean needsSalt =
                ruleSet.uses(RuleKind.HASH) || ruleSet.uses(RuleKind.PRESERVE_FORMAT);
        if (needsSalt && StringUtils.isEmpty(config.getSalt())) {
            throw new IllegalStateException(
                    "masking.salt is required by hash / preserve-format rules");
        }
        String salt = StringUtils.defaultString(config.getSalt());
        return new MaskingEngine(new ValueMasker(salt, config.getRedactionPlaceholder()));
    }

    /**
     * Masks every row of a batch.
     *
     * @param batch rows to mask (not modified)
     * @param rules column to rule mapping of the batch's table
     * @param vault token vault; may be {@code null} when no rule tokenizes
     * @return masked rows in the same order
     * @throws SQLException if the token vault fails
     */
    public List<Map<String, Object>> maskBatch(List<Map<String, Object>> batch,
            Map<String, MaskingRule> rules, TokenVault vault) throws SQLException {
        List<Map<String, Object>> masked = new ArrayList<>(batch.size());
        for (Map<String, Object> row : batch) {
            masked.add(maskRow(row, rules, vault));
        }
        return masked;
    }

    /**
     * Masks one row.
     *
     * @param row source row (not modified)
     * @param rules column to rule mapping
     * @param vault token vault; may be {@code null} when no rule tokenizes
     * @return new row with masked values
     * @throws SQLException if the token vault fails
     */
    public Map<String, Object> maskRow(Map<String, Object> row, Map<String, MaskingRule> rules,
            TokenVault vault) throws SQLException {
        Map<String, Object> masked = new LinkedHashMap<>(row);
        for (Map.Entry<String, MaskingRule> rule : rules.entrySet()) {
            String column = findColumn(row, rule.getKey());
            if (column == null) {
                continue;
            }
            masked.put(column, apply(row.get(column), rule.getValue(), vault));
        }
        return masked;
    }

    /**
     * Applies one rule to one value.
     *
     * @param value source value
     * @param rule rule
     * @param vault token vault; required for {@link RuleKind#TOKENIZE}
     * @return masked value; {@code null} for {@code null} input
     * @throws SQLException if the token vault fails
     */
    public Object apply(Object value, MaskingRule rule, TokenVault vault) throws SQLException {
        if (value == null) {
            return null;
        }
        switch (rule.getKind()) {
            case HASH:
                return masker.hash(value);
            case REDACT:
                return masker.redact(value, rule.isKeepLength(), rule.getMaskChar());
            case PRESERVE_FORMAT:
                return masker.preserveFormat(value);
            case TOKENIZE:
                if (vault == null) {
                    throw new IllegalStateException("tokenize rule used without a token vault");
                }
                return vault.getOrCreate(String.valueOf(value));
            case NONE:
                return value;
            default:
                throw new IllegalStateException("Unhandled rule kind: " + rule.getKind());
        }
    }

    private static String findColumn(Map<String, Object> row, String column) {
        if (row.containsKey(column)) {
            return column;
        }
        for (String key : row.keySet()) {
            if (key.equalsIgnoreCase(column)) {
                return key;
            }
        }
        return null;
    }
}
