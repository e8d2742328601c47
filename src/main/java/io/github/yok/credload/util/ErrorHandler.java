package io.github.yok.credload.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports conditions that abort an import run.
 *
 * <p>
 * Logs the error through SLF4J and echoes a one-line diagnostic to {@code System.err}. The JVM is
 * not terminated here; {@link io.github.yok.credload.Main} turns a reported fatal error into a
 * non-zero exit code.
 * </p>
 *
 * <p>
 * Tests can switch the current thread to "throw instead of report" so that fatal paths are
 * observable as {@link IllegalStateException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Makes {@code errorAndExit} throw on the current thread (useful for tests).
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restores normal reporting for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs the message and its cause at error level and prints a concise diagnostic.
     *
     * @param message message to log
     * @param cause root cause
     * @throws IllegalStateException when exit is disabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
    }
}
