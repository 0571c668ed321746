package io.github.yok.masklink.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.masklink.config.ConnectionConfig;
import io.github.yok.masklink.integration.H2Support;
import io.github.yok.masklink.util.RetryPolicy;
import io.github.yok.masklink.util.SecretResolver;
import java.sql.Connection;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JdbcConnectorTest {

    private final List<Duration> sleeps = new ArrayList<>();

    private JdbcConnector connector(Map<String, String> env) {
        return new JdbcConnector(new SecretResolver(env, null),
                RetryPolicy.fixed(2, Duration.ofMillis(10)).withSleeper(sleeps::add));
    }

    @Test
    void open_正常ケース_環境変数のパスワードで接続しオートコミットが無効であること() throws Exception {
        ConnectionConfig.Entry entry = H2Support.entry("destination", "connector_ok");
        entry.setPassword(null);
        entry.setPasswordEnv("QA_PW");
        entry.setDriverClass("org.h2.Driver");

        try (Connection conn = connector(Map.of("QA_PW", H2Support.PASSWORD)).open(entry)) {
            assertFalse(conn.getAutoCommit(), "オートコミットが無効化されていません");
        }
    }

    @Test
    void open_異常ケース_接続不可_リトライ後にConnectivityExceptionが送出されること() {
        ConnectionConfig.Entry entry = ConnectionConfig.Entry.named("source");
        entry.setUrl("jdbc:h2:tcp://127.0.0.1:1/connector_ng");
        entry.setUser("sa");
        entry.setPassword("x");

        ConnectivityException ex =
                assertThrows(ConnectivityException.class, () -> connector(Map.of()).open(entry));
        assertTrue(ex.getMessage().contains("source"));
        assertEquals(1, sleeps.size(), "接続が再試行されていません");
    }

    @Test
    void open_異常ケース_パスワード未設定_再試行せずIllegalStateExceptionが送出されること() {
        ConnectionConfig.Entry entry = H2Support.entry("source", "connector_nopw");
        entry.setPassword(null);
        entry.setPasswordEnv("NOT_DEFINED");

        assertThrows(IllegalStateException.class, () -> connector(Map.of()).open(entry));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void open_異常ケース_ドライバクラスが存在しない_IllegalStateExceptionが送出されること() {
        ConnectionConfig.Entry entry = H2Support.entry("source", "connector_nodriver");
        entry.setDriverClass("com.example.MissingDriver");

        assertThrows(IllegalStateException.class, () -> connector(Map.of()).open(entry));
    }
}
