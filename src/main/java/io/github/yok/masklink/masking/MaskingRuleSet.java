package io.github.yok.masklink.masking;

import com.google.common.collect.ImmutableMap;
import io.github.yok.masklink.config.MaskingConfig;
import io.github.yok.masklink.config.RuleProperties;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * Validated, immutable masking rules keyed by table, then by column.
 *
 * <p>
 * Table names are matched case-insensitively, like table selection and column matching.
 * </p>
 */
public final class MaskingRuleSet {

    private final ImmutableMap<String, ImmutableMap<String, MaskingRule>> rules;

    private MaskingRuleSet(ImmutableMap<String, ImmutableMap<String, MaskingRule>> rules) {
        this.rules = rules;
    }

    /**
     * Returns a rule set without any rule.
     *
     * @return empty rule set
     */
    public static MaskingRuleSet empty() {
        return new MaskingRuleSet(ImmutableMap.of());
    }

    /**
     * Builds a rule set from configuration.
     *
     * @param config masking configuration
     * @return rule set
     * @throws IllegalArgumentException if a rule name is unknown, a mask character is not a
     *         single character (the message names the table and column) or two rule tables differ
     *         only in case
     */
    public static MaskingRuleSet from(MaskingConfig config) {
        char defaultMaskChar = toMaskChar(config.getDefaultMaskChar(), '*', "masking",
                "default-mask-char");
        Map<String, ImmutableMap<String, MaskingRule>> tables = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, RuleProperties>> table : config.getRules()
                .entrySet()) {
            ImmutableMap.Builder<String, MaskingRule> columns = ImmutableMap.builder();
            for (Map.Entry<String, RuleProperties> column : table.getValue().entrySet()) {
                columns.put(column.getKey(), toRule(table.getKey(), column.getKey(),
                        column.getValue(), defaultMaskChar));
            }
            if (tables.putIfAbsent(key(table.getKey()), columns.build()) != null) {
                throw new IllegalArgumentException(
                        "Masking rules configured more than once for table: " + table.getKey());
            }
        }
        return new MaskingRuleSet(ImmutableMap.copyOf(tables));
    }

    /**
     * Returns the rules of one table.
     *
     * @param table table name
     * @return column to rule mapping; empty when the table has no rules
     */
    public Map<String, MaskingRule> forTable(String table) {
        ImmutableMap<String, MaskingRule> tableRules = rules.get(key(table));
        return tableRules != null ? tableRules : ImmutableMap.of();
    }

    /**
     * Checks that every rule table is one of the configured tables.
     *
     * @param configuredTables names of all configured tables
     * @throws IllegalArgumentException naming the rule tables that match no configured table
     */
    public void checkTables(Collection<String> configuredTables) {
        Set<String> known = new HashSet<>();
        for (String table : configuredTables) {
            known.add(key(table));
        }
        List<String> unknown = new ArrayList<>();
        for (String table : rules.keySet()) {
            if (!known.contains(table)) {
                unknown.add(table);
            }
        }
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException(
                    "masking.rules names tables that are not configured: " + unknown);
        }
    }

    /**
     * Returns whether any table uses the given rule kind.
     *
     * @param kind rule kind
     * @return {@code true} when used
     */
    public boolean uses(RuleKind kind) {
        return rules.values().stream().flatMap(m -> m.values().stream())
                .anyMatch(r -> r.getKind() == kind);
    }

    private static MaskingRule toRule(String table, String column, RuleProperties props,
            char defaultMaskChar) {
        RuleKind kind;
        try {
            kind = RuleKind.parse(props == null ? null : props.getType());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid masking rule for " + table + "." + column + ": " + e.getMessage(), e);
        }
        switch (kind) {
            case HASH:
                return MaskingRule.HASH;
            case PRESERVE_FORMAT:
                return MaskingRule.PRESERVE_FORMAT;
            case TOKENIZE:
                return MaskingRule.TOKENIZE;
            case NONE:
                return MaskingRule.NONE;
            case REDACT:
                return MaskingRule.redact(props.isKeepLength(),
                        toMaskChar(props.getMaskChar(), defaultMaskChar, table, column));
            default:
                throw new IllegalStateException("Unhandled rule kind: " + kind);
        }
    }

    private static String key(String table) {
        return table.trim().toLowerCase(Locale.ROOT);
    }

    private static char toMaskChar(String value, char fallback, String table, String column) {
        if (StringUtils.isEmpty(value)) {
            return fallback;
        }
        if (value.length() != 1) {
            throw new IllegalArgumentException("mask-char must be a single character for "
                    + table + "." + column + ": '" + value + "'");
        }
        return value.charAt(0);
    }
}
