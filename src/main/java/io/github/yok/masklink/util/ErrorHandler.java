package io.github.yok.masklink.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports outcomes that end a pipeline run.
 *
 * <p>
 * The command-line entry point routes a rejected runner identity, an invalid configuration value
 * and any unexpected error escaping the orchestrator through this class. The full error goes to
 * the log; operators get one {@code ERROR:} line (plus the root cause, when there is one) on
 * {@code System.err}. The JVM is not terminated here.
 * </p>
 *
 * <p>
 * Tests can make the current thread throw {@link IllegalStateException} instead of reporting.
 * </p>
 */
@Slf4j
public final class ErrorHandler {

    private static final ThreadLocal<Boolean> THROW_INSTEAD =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private ErrorHandler() {}

    /**
     * Makes {@code errorAndExit} throw on the current thread.
     */
    public static void disableExitForCurrentThread() {
        THROW_INSTEAD.set(Boolean.TRUE);
    }

    /**
     * Restores reporting on the current thread.
     */
    public static void restoreExitForCurrentThread() {
        THROW_INSTEAD.remove();
    }

    /**
     * Reports a fatal error with its cause.
     *
     * @param message operator-facing message
     * @param cause cause of the failure
     * @throws IllegalStateException if throwing is enabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (THROW_INSTEAD.get()) {
            throw new IllegalStateException(message, cause);
        }
        print(message, ExceptionUtils.getRootCauseMessage(cause));
    }

    /**
     * Reports a fatal error that has no underlying exception, such as an invalid setting.
     *
     * @param message operator-facing message
     * @throws IllegalStateException if throwing is enabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (THROW_INSTEAD.get()) {
            throw new IllegalStateException(message);
        }
        print(message, null);
    }

    private static void print(String message, String rootCause) {
        StringBuilder line = new StringBuilder("ERROR: ").append(message);
        if (rootCause != null && !rootCause.isEmpty()) {
            line.append(System.lineSeparator()).append("  cause: ").append(rootCause);
        }
        System.err.println(line);
    }
}
