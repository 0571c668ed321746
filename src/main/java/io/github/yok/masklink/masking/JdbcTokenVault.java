package io.github.yok.masklink.masking;

import com.google.common.base.Preconditions;
import io.github.yok.masklink.db.SqlDialect;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link TokenVault} backed by the destination table {@code token_vault(original_id, token_uuid)}
 * with a unique constraint on {@code original_id}.
 *
 * <p>
 * Token creation is a conditional insert: the insert either adds the mapping or reports that the
 * identifier already exists (update count {@code 0}, or an integrity constraint violation,
 * depending on the dialect). On a conflict the winning token is read back and returned. Workers
 * share nothing in process; the unique constraint is what keeps one token per identifier.
 * </p>
 *
 * <p>
 * Each creation is committed on its own. Callers must not hold uncommitted writes on the same
 * connection while tokenizing; the pipeline masks a whole batch before it starts the batch's load
 * transaction.
 * </p>
 */
@Slf4j
public class JdbcTokenVault implements TokenVault {

    static final String TABLE = "token_vault";
    static final String ORIGINAL_ID = "original_id";
    static final String TOKEN = "token_uuid";

    private final Connection connection;
    private final Supplier<String> tokenGenerator;
    private final String selectSql;
    private final String insertSql;

    /**
     * Creates a vault generating random UUID tokens.
     *
     * @param connection destination connection (auto-commit disabled)
     * @param dialect destination dialect
     */
    public JdbcTokenVault(Connection connection, SqlDialect dialect) {
        this(connection, dialect, () -> UUID.randomUUID().toString());
    }

    /**
     * Creates a vault with a custom token generator.
     *
     * @param connection destination connection (auto-commit disabled)
     * @param dialect destination dialect
     * @param tokenGenerator supplier of fresh, globally unique tokens
     */
    JdbcTokenVault(Connection connection, SqlDialect dialect, Supplier<String> tokenGenerator) {
        this.connection = connection;
        this.tokenGenerator = tokenGenerator;
        this.selectSql = "SELECT " + TOKEN + " FROM " + TABLE + " WHERE " + ORIGINAL_ID + " = ?";
        this.insertSql =
                dialect.buildConditionalInsertSql(TABLE, ORIGINAL_ID, List.of(ORIGINAL_ID, TOKEN));
    }

    @Override
    public String getOrCreate(String originalId) throws SQLException {
        Preconditions.checkNotNull(originalId, "originalId must not be null");

        String existing = find(originalId);
        if (existing != null) {
            return existing;
        }

        String token = tokenGenerator.get();
        try (PreparedStatement ps = connection.prepareStatement(insertSql)) {
            ps.setString(1, originalId);
            ps.setString(2, token);
            int inserted = ps.executeUpdate();
            connection.commit();
            if (inserted > 0) {
                return token;
            }
        } catch (SQLException e) {
            rollbackQuietly();
            if (!isIntegrityViolation(e)) {
                throw e;
            }
            log.debug("Token vault insert lost a race (sqlState={})", e.getSQLState());
        }

        String winner = find(originalId);
        if (winner == null) {
            throw new SQLException("Token vault reported an existing mapping that cannot be read");
        }
        return winner;
    }

    private String find(String originalId) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(selectSql)) {
            ps.setString(1, originalId);
            try (ResultSet rs = ps.executeQuery()) {
                String token = rs.next() ? rs.getString(1) : null;
                connection.commit();
                return token;
            }
        }
    }

    private void rollbackQuietly() {
        try {
            connection.rollback();
        } catch (SQLException rollbackEx) {
            log.warn("Token vault rollback failed: {}", rollbackEx.getMessage(), rollbackEx);
        }
    }

    /**
     * Returns whether the exception is an integrity constraint violation (SQLState class 23).
     *
     * @param e exception
     * @return {@code true} for constraint violations
     */
    static boolean isIntegrityViolation(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            String state = cur.getSQLState();
            if (state != null && state.startsWith("23")) {
                return true;
            }
        }
        return false;
    }
}
