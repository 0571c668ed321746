package io.github.yok.masklink.masking;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.masklink.config.MaskingConfig;
import io.github.yok.masklink.config.RuleProperties;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MaskingRuleSetTest {

    private static MaskingConfig config(Map<String, RuleProperties> customerRules) {
        MaskingConfig config = new MaskingConfig();
        config.getRules().put("customers", customerRules);
        return config;
    }

    @Test
    void from_正常ケース_ルールが列ごとに解決されること() {
        Map<String, RuleProperties> rules = new LinkedHashMap<>();
        rules.put("email", RuleProperties.of("hash"));
        rules.put("notes", new RuleProperties("redact", true, "#"));
        rules.put("nickname", new RuleProperties("redaction", false, null));
        rules.put("ref", RuleProperties.of("none"));

        MaskingRuleSet ruleSet = MaskingRuleSet.from(config(rules));
        Map<String, MaskingRule> table = ruleSet.forTable("customers");

        assertEquals(MaskingRule.HASH, table.get("email"));
        assertEquals(MaskingRule.redact(true, '#'), table.get("notes"));
        assertEquals(MaskingRule.redact(false, '*'), table.get("nickname"));
        assertEquals(MaskingRule.NONE, table.get("ref"));
        assertTrue(ruleSet.uses(RuleKind.HASH));
        assertFalse(ruleSet.uses(RuleKind.TOKENIZE));
        assertTrue(ruleSet.forTable("orders").isEmpty());
    }

    @Test
    void from_正常ケース_既定マスク文字が使われること() {
        MaskingConfig config = config(Map.of("notes", new RuleProperties("redact", true, null)));
        config.setDefaultMaskChar("X");
        assertEquals(MaskingRule.redact(true, 'X'),
                MaskingRuleSet.from(config).forTable("customers").get("notes"));
    }

    @Test
    void from_異常ケース_未知のルール名_テーブルと列を含むメッセージで失敗すること() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> MaskingRuleSet.from(config(Map.of("email", RuleProperties.of("sha1")))));
        assertTrue(ex.getMessage().contains("customers.email"), ex.getMessage());
    }

    @Test
    void from_異常ケース_マスク文字が複数文字_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> MaskingRuleSet
                .from(config(Map.of("notes", new RuleProperties("redact", true, "##")))));
    }

    @Test
    void forTable_正常ケース_テーブル名の大文字小文字を区別せずに解決されること() {
        MaskingRuleSet ruleSet =
                MaskingRuleSet.from(config(Map.of("email", RuleProperties.of("hash"))));

        assertEquals(MaskingRule.HASH, ruleSet.forTable("Customers").get("email"));
        assertEquals(MaskingRule.HASH, ruleSet.forTable("CUSTOMERS").get("email"));
    }

    @Test
    void from_異常ケース_大文字小文字だけが異なるテーブル_IllegalArgumentExceptionが送出されること() {
        MaskingConfig config = config(Map.of("email", RuleProperties.of("hash")));
        config.getRules().put("Customers", Map.of("phone", RuleProperties.of("redact")));

        assertThrows(IllegalArgumentException.class, () -> MaskingRuleSet.from(config));
    }

    @Test
    void checkTables_正常ケース_設定済みテーブルのみ_例外が送出されないこと() {
        MaskingRuleSet ruleSet =
                MaskingRuleSet.from(config(Map.of("email", RuleProperties.of("hash"))));
        assertDoesNotThrow(() -> ruleSet.checkTables(List.of("Customers", "orders")));
    }

    @Test
    void checkTables_異常ケース_未設定テーブルのルール_テーブル名を含むメッセージで失敗すること() {
        MaskingRuleSet ruleSet =
                MaskingRuleSet.from(config(Map.of("email", RuleProperties.of("hash"))));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> ruleSet.checkTables(List.of("customer", "orders")));
        assertTrue(ex.getMessage().contains("customers"), ex.getMessage());
    }

    @Test
    void empty_正常ケース_ルールを持たないこと() {
        assertTrue(MaskingRuleSet.empty().forTable("customers").isEmpty());
        assertFalse(MaskingRuleSet.empty().uses(RuleKind.HASH));
    }
}
