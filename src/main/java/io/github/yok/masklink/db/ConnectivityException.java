package io.github.yok.masklink.db;

/**
 * Thrown when a connection cannot be established after the connector's retries.
 */
public class ConnectivityException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message description including the connection label
     * @param cause last connection failure
     */
    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
