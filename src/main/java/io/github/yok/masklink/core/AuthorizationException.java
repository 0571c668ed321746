package io.github.yok.masklink.core;

/**
 * Thrown when the destination identity is not in the configured allow-list.
 *
 * <p>
 * Raised before any audit record exists and before any row is read or written.
 * </p>
 */
public class AuthorizationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message description
     */
    public AuthorizationException(String message) {
        super(message);
    }

    /**
     * Creates the exception.
     *
     * @param message description
     * @param cause last failure
     */
    public AuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
