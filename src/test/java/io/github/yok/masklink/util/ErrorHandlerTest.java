package io.github.yok.masklink.util;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ErrorHandlerTest {

    @AfterEach
    void restore() {
        ErrorHandler.restoreExitForCurrentThread();
    }

    @Test
    void errorAndExit_異常ケース_終了無効化時_IllegalStateExceptionが送出されること() {
        ErrorHandler.disableExitForCurrentThread();
        RuntimeException cause = new RuntimeException("root");

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> ErrorHandler.errorAndExit("fatal", cause));

        assertEquals("fatal", ex.getMessage());
        assertSame(cause, ex.getCause());
    }

    @Test
    void errorAndExit_正常ケース_通常時_標準エラーにメッセージが出力されること() {
        PrintStream original = System.err;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        System.setErr(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        try {
            assertDoesNotThrow(() -> ErrorHandler.errorAndExit("config missing"));
        } finally {
            System.setErr(original);
        }
        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("ERROR: config missing"));
    }
}
