package io.github.yok.masklink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import org.junit.jupiter.api.Test;

class RunModeTest {

    @Test
    void parse_正常ケース_大文字小文字を区別しないこと() {
        assertEquals(RunMode.DELTA, RunMode.parse("delta"));
        assertEquals(RunMode.FULL, RunMode.parse(" FULL "));
    }

    @Test
    void parse_異常ケース_不正値や空_nullが返ること() {
        assertNull(RunMode.parse("incremental"));
        assertNull(RunMode.parse(""));
        assertNull(RunMode.parse(null));
    }
}
