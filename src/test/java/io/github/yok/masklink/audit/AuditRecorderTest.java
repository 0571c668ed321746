package io.github.yok.masklink.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.masklink.db.h2.H2Dialect;
import io.github.yok.masklink.integration.H2Support;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

class AuditRecorderTest {

    private static final Clock CLOCK =
            Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private static String newDb() {
        return "audit_" + UUID.randomUUID().toString().replace("-", "");
    }

    @Test
    void finish_正常ケース_集計結果が1行保存されること() throws Exception {
        try (Connection conn = H2Support.open(newDb())) {
            H2Support.createDestinationTables(conn);
            AuditRecorder audit = new AuditRecorder("qa", CLOCK);
            audit.logTable("customers", 500);
            audit.logTable("customers", 20);
            audit.logError("orders", "duplicate key");

            AuditSummary summary = audit.finish(conn, new H2Dialect());

            assertTrue(summary.isPersisted());
            assertEquals(520, summary.getRowsCopied());
            assertEquals(1, summary.getRowsFailed());
            assertEquals(LocalDateTime.of(2024, 5, 1, 10, 0), summary.getStartedAt());
            assertNotNull(summary.getFinishedAt());

            try (Statement st = conn.createStatement();
                    ResultSet rs = st.executeQuery("SELECT execution_id, env_name, rows_copied,"
                            + " rows_failed, tables_processed, errors FROM execution_audit")) {
                assertTrue(rs.next(), "監査行が保存されていません");
                assertEquals(audit.getExecutionId(), rs.getString(1));
                assertEquals("qa", rs.getString(2));
                assertEquals(520, rs.getLong(3));
                assertEquals(1, rs.getInt(4));

                ObjectMapper mapper = new ObjectMapper();
                JsonNode tables = mapper.readTree(rs.getString(5));
                assertEquals(2, tables.size());
                assertEquals("customers", tables.get(0).get("table").asText());
                assertEquals(500, tables.get(0).get("rows").asLong());
                JsonNode errors = mapper.readTree(rs.getString(6));
                assertEquals("orders", errors.get(0).get("table").asText());
                assertEquals("duplicate key", errors.get(0).get("error").asText());
                assertFalse(rs.next());
            }
        }
    }

    @Test
    void finish_正常ケース_失敗したトランザクションが残っていても保存されること() throws Exception {
        try (Connection conn = H2Support.open(newDb())) {
            H2Support.createDestinationTables(conn);
            try (Statement st = conn.createStatement()) {
                st.executeUpdate("INSERT INTO token_vault VALUES ('pending', 'uncommitted')");
            }
            AuditRecorder audit = new AuditRecorder("qa", CLOCK);

            assertTrue(audit.finish(conn, new H2Dialect()).isPersisted());
            assertEquals(0, H2Support.count(conn, "token_vault"), "保存前にロールバックされていません");
            assertEquals(1, H2Support.count(conn, "execution_audit"));
        }
    }

    @Test
    void finish_異常ケース_監査表なし_要約を保持したAuditPersistenceExceptionが送出されること()
            throws Exception {
        try (Connection conn = H2Support.open(newDb())) {
            AuditRecorder audit = new AuditRecorder("qa", CLOCK);
            audit.logTable("customers", 3);

            AuditPersistenceException ex = assertThrows(AuditPersistenceException.class,
                    () -> audit.finish(conn, new H2Dialect()));

            assertFalse(ex.getSummary().isPersisted());
            assertEquals(3, ex.getSummary().getRowsCopied());
            assertEquals(audit.getExecutionId(), ex.getSummary().getExecutionId());
        }
    }

    @Test
    void finish_異常ケース_2回目の呼出し_IllegalStateExceptionが送出されること() throws Exception {
        try (Connection conn = H2Support.open(newDb())) {
            H2Support.createDestinationTables(conn);
            AuditRecorder audit = new AuditRecorder("qa", CLOCK);
            audit.finish(conn, new H2Dialect());
            assertThrows(IllegalStateException.class, () -> audit.finish(conn, new H2Dialect()));
        }
    }

    @Test
    void logTable_正常ケース_複数スレッドから記録_件数が失われないこと() throws Exception {
        AuditRecorder audit = new AuditRecorder("qa", CLOCK);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Void>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                String table = "t" + t;
                Callable<Void> task = () -> {
                    for (int i = 0; i < 1000; i++) {
                        audit.logTable(table, 1);
                        if (i % 100 == 0) {
                            audit.logError(table, "e" + i);
                        }
                    }
                    return null;
                };
                futures.add(pool.submit(task));
            }
            for (Future<Void> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        AuditSummary summary = audit.snapshot();
        assertEquals(8000, summary.getRowsCopied());
        assertEquals(8000, summary.getTablesProcessed().size());
        assertEquals(80, summary.getRowsFailed());
        assertEquals(80, summary.getErrors().size());
    }

    @Test
    void tablesJson_正常ケース_記録がない場合は空配列となること() throws Exception {
        AuditSummary summary = new AuditRecorder("qa", CLOCK).snapshot();
        assertEquals("[]", AuditRecorder.tablesJson(summary));
        assertEquals("[]", AuditRecorder.errorsJson(summary));
    }
}
