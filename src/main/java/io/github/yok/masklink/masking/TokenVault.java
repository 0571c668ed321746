package io.github.yok.masklink.masking;

import java.sql.SQLException;

/**
 * Durable one-to-one mapping from an original identifier to an opaque token.
 *
 * <p>
 * Implementations guarantee at most one token per distinct identifier, also when several workers
 * ask for the same identifier at the same time.
 * </p>
 */
public interface TokenVault {

    /**
     * Returns the token of an identifier, creating and recording one on first use.
     *
     * @param originalId original identifier
     * @return the identifier's token
     * @throws SQLException if the vault cannot be read or written
     */
    String getOrCreate(String originalId) throws SQLException;
}
