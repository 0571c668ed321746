package io.github.yok.masklink.integration;

import io.github.yok.masklink.config.ConnectionConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * H2 インメモリ DB（PostgreSQL 互換モード）を用いたテストの共通処理。
 *
 * <p>
 * DB 名ごとに独立したインメモリ DB を作成します。{@code DB_CLOSE_DELAY=-1} のため、
 * 全接続を閉じても JVM 終了まで内容は保持されます。テストごとに一意な DB 名を使用してください。
 * </p>
 */
public final class H2Support {

    public static final String USER = "sa";
    public static final String PASSWORD = "test";

    private H2Support() {}

    /**
     * JDBC URL を返します。
     *
     * @param name DB 名
     * @return JDBC URL
     */
    public static String url(String name) {
        return "jdbc:h2:mem:" + name + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1";
    }

    /**
     * オートコミット無効の接続を開きます。
     *
     * @param name DB 名
     * @return 接続
     * @throws SQLException 接続に失敗した場合
     */
    public static Connection open(String name) throws SQLException {
        Connection conn = DriverManager.getConnection(url(name), USER, PASSWORD);
        conn.setAutoCommit(false);
        return conn;
    }

    /**
     * パイプライン設定用の接続エントリを作成します。
     *
     * @param id 接続ラベル
     * @param name DB 名
     * @return 接続エントリ
     */
    public static ConnectionConfig.Entry entry(String id, String name) {
        ConnectionConfig.Entry entry = ConnectionConfig.Entry.named(id);
        entry.setUrl(url(name));
        entry.setUser(USER);
        entry.setPassword(PASSWORD);
        return entry;
    }

    /**
     * SQL を順に実行してコミットします。
     *
     * @param conn 接続
     * @param sqls SQL 文
     * @throws SQLException 実行に失敗した場合
     */
    public static void execute(Connection conn, String... sqls) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : sqls) {
                st.execute(sql);
            }
        }
        conn.commit();
    }

    /**
     * 出力先 DB にトークン保管表と監査表を作成します。
     *
     * @param conn 出力先接続
     * @throws SQLException 実行に失敗した場合
     */
    public static void createDestinationTables(Connection conn) throws SQLException {
        execute(conn,
                "CREATE TABLE token_vault (original_id VARCHAR(255) PRIMARY KEY, "
                        + "token_uuid VARCHAR(36) NOT NULL UNIQUE)",
                "CREATE TABLE execution_audit (execution_id VARCHAR(36) PRIMARY KEY, "
                        + "started_at TIMESTAMP NOT NULL, finished_at TIMESTAMP NOT NULL, "
                        + "env_name VARCHAR(64), tables_processed JSON NOT NULL, "
                        + "rows_copied BIGINT NOT NULL, rows_failed INTEGER NOT NULL, "
                        + "errors JSON NOT NULL)");
    }

    /**
     * 件数を返します。
     *
     * @param conn 接続
     * @param table テーブル名
     * @return 件数
     * @throws SQLException 実行に失敗した場合
     */
    public static long count(Connection conn, String table) throws SQLException {
        try (Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            long count = rs.getLong(1);
            conn.commit();
            return count;
        }
    }

    /**
     * 単一値を返します。
     *
     * @param conn 接続
     * @param sql 1 行 1 列を返す SQL
     * @return 値（文字列）、行がない場合は {@code null}
     * @throws SQLException 実行に失敗した場合
     */
    public static String queryString(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            String value = rs.next() ? rs.getString(1) : null;
            conn.commit();
            return value;
        }
    }
}
