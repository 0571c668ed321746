package io.github.yok.masklink.audit;

import lombok.Getter;

/**
 * Thrown when the run summary could not be written to the destination.
 *
 * <p>
 * Carries the in-memory summary so that callers can still report it.
 * </p>
 */
@Getter
public class AuditPersistenceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient AuditSummary summary;

    /**
     * Creates the exception.
     *
     * @param message detail message
     * @param summary summary that was not persisted
     * @param cause underlying failure
     */
    public AuditPersistenceException(String message, AuditSummary summary, Throwable cause) {
        super(message, cause);
        this.summary = summary;
    }
}
