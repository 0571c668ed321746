package io.github.yok.masklink.core;

/**
 * Thrown when a page of source rows cannot be read after the extraction retries.
 *
 * <p>
 * Ends the extraction of the affected table; batches already processed stay committed.
 * </p>
 */
public class ExtractionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message description
     */
    public ExtractionException(String message) {
        super(message);
    }

    /**
     * Creates the exception.
     *
     * @param message description
     * @param cause last failure
     */
    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
