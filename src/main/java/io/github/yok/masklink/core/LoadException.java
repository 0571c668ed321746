package io.github.yok.masklink.core;

/**
 * Thrown when a batch cannot be written after the load retries.
 *
 * <p>
 * The batch is recorded as failed in the audit and skipped.
 * </p>
 */
public class LoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message description
     */
    public LoadException(String message) {
        super(message);
    }

    /**
     * Creates the exception.
     *
     * @param message description
     * @param cause last failure
     */
    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
