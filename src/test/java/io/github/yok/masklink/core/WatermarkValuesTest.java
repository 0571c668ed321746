package io.github.yok.masklink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.masklink.core.WatermarkValues.Kind;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import org.junit.jupiter.api.Test;

class WatermarkValuesTest {

    @Test
    void render_正常ケース_日時型_空白区切りのISO形式となること() {
        assertEquals("2024-01-03 12:00:00",
                WatermarkValues.render(LocalDateTime.of(2024, 1, 3, 12, 0)));
    }

    @Test
    void render_正常ケース_オフセット付き日時_UTCに正規化されオフセットが保持されること() {
        assertEquals("2024-01-03 03:00:00+00:00", WatermarkValues
                .render(OffsetDateTime.of(2024, 1, 3, 12, 0, 0, 0, ZoneOffset.ofHours(9))));
        assertEquals("2024-01-03 16:00:00.5+00:00", WatermarkValues.render(ZonedDateTime
                .of(2024, 1, 3, 10, 0, 0, 500_000_000, ZoneId.of("America/Mexico_City"))));
    }

    @Test
    void render_正常ケース_数値と文字列とnull() {
        assertEquals("100", WatermarkValues.render(new BigDecimal("1E+2")));
        assertEquals("42", WatermarkValues.render(42L));
        assertEquals("abc", WatermarkValues.render("abc"));
        assertNull(WatermarkValues.render(null));
    }

    @Test
    void of_正常ケース_値の型から比較方法が決まること() {
        assertEquals(Kind.NUMBER, Kind.of(10));
        assertEquals(Kind.OFFSET_TIMESTAMP, Kind.of(OffsetDateTime.now()));
        assertEquals(Kind.TEXT, Kind.of("10"));
        assertEquals(Kind.TEXT, Kind.of(LocalDateTime.now()));
    }

    @Test
    void compare_正常ケース_数値列は数値として比較されること() {
        assertTrue(WatermarkValues.compare("10", "9", Kind.NUMBER) > 0);
        assertEquals(0, WatermarkValues.compare("1.0", "1", Kind.NUMBER));
    }

    @Test
    void compare_正常ケース_文字列列は数字でも文字列として比較されること() {
        // varchar の "10" > "9" は偽（データベースの比較と一致させる）
        assertTrue(WatermarkValues.compare("10", "9", Kind.TEXT) < 0);
        assertTrue(WatermarkValues.compare("2024-01-02", "2024-01-10", Kind.TEXT) < 0);
    }

    @Test
    void compare_正常ケース_オフセット付き日時は時点で比較されること() {
        assertEquals(0, WatermarkValues.compare("2024-01-03 10:00:00+00:00",
                "2024-01-03 19:00:00+09:00", Kind.OFFSET_TIMESTAMP));
        assertTrue(WatermarkValues.compare("2024-01-03 12:00:00+00:00",
                "2024-01-03 20:00:00+09:00", Kind.OFFSET_TIMESTAMP) > 0);
    }
}
