package io.github.yok.sheetlink.util;

import io.github.yok.sheetlink.ImportSetupException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports a fatal CLI error in the application log and as a short message on
 * {@code System.err}.
 *
 * <p>
 * Setup failures ({@link ImportSetupException}) are user errors such as a misspelled table or a
 * wrong sheet name: they are reported with their error code and without a stack trace. Any other
 * cause is logged with its stack trace and echoed with its root cause message.
 * </p>
 *
 * <p>
 * The JVM is never terminated here. In tests, the current thread can be switched to throwing an
 * {@link IllegalStateException} instead of printing.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Throw instead of printing on the current thread (for tests).
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore printing on the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Reports an error with its cause.
     *
     * @param message summary of what failed
     * @param cause underlying error
     * @throws IllegalStateException if printing is disabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        if (cause instanceof ImportSetupException) {
            log.error("{} [{}] {}", message, ((ImportSetupException) cause).getErrorCode(),
                    cause.getMessage());
        } else {
            log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        }
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + describe(cause));
    }

    /**
     * Reports an error without a cause, such as an invalid command line.
     *
     * @param message error message
     * @throws IllegalStateException if printing is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }

    static String describe(Throwable cause) {
        if (cause instanceof ImportSetupException) {
            return "[" + ((ImportSetupException) cause).getErrorCode() + "] " + cause.getMessage();
        }
        return ExceptionUtils.getRootCauseMessage(cause);
    }
}
