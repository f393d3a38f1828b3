package io.github.yok.batchbulkedit.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that logs a fatal error and echoes a concise message to {@code System.err}.
 *
 * <p>
 * Used by the command line front end to report a failed {@code xml2excel} or {@code excel2xml}
 * run. The JVM is not terminated here; {@code Main} turns the failure into exit code 1.
 * </p>
 *
 * <p>
 * Tests can switch the current thread to throwing an {@link IllegalStateException} instead, so the
 * reported message can be asserted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private ErrorHandler() {
        // Utility class; do not instantiate.
    }

    /**
     * Switch to "throw exception instead of reporting" for the current thread (useful for tests).
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs the message with the stack trace of its cause and prints the message to
     * {@code System.err}.
     *
     * @param message message to report, e.g. {@code Validation error: ...}
     * @param cause root cause
     * @throws IllegalStateException when exit is disabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println(message);
    }

    /**
     * Logs the message and prints it to {@code System.err}.
     *
     * @param message message to report
     * @throws IllegalStateException when exit is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println(message);
    }
}
