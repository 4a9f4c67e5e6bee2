package io.github.yok.gettime.util;

import io.github.yok.gettime.model.ConversionError;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports fatal CLI errors: logs them and echoes a one-line message to {@code System.err}.
 *
 * <p>
 * The JVM is not terminated here; the caller decides the exit code. Tests can switch the current
 * thread to "throw {@link IllegalStateException} instead" with
 * {@link #disableExitForCurrentThread()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private ErrorHandler() {}

    /**
     * Makes the report methods throw on the current thread (for tests).
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restores normal reporting on the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Reports an unexpected exception with its stack trace.
     *
     * @param message message to log
     * @param cause root cause
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
    }

    /**
     * Reports a usage or configuration problem.
     *
     * @param message message to log
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }

    /**
     * Reports a failed conversion.
     *
     * @param error conversion failure
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(ConversionError error) {
        errorAndExit(describe(error));
    }

    /**
     * Builds a human-readable message for a conversion failure.
     *
     * @param error conversion failure
     * @return message
     */
    public static String describe(ConversionError error) {
        String value = String.valueOf(error.getValue());
        String message;
        switch (error.getKind()) {
            case INVALID_DB_TIMEZONE_CONFIG:
                message = "gettime.default-db-timezone is not a valid timezone: " + value;
                break;
            case INVALID_USER_TIMEZONE_CONFIG:
                message = "gettime.default-user-timezone is not configured";
                break;
            case INVALID_TIMEZONE:
                message = "Unknown timezone: " + value;
                break;
            case UNPARSEABLE_TIMESTAMP:
                message = "Unparseable timestamp: " + value;
                break;
            case AMBIGUOUS_TIMESTAMP:
                message = "Ambiguous timestamp (US or EU day/month order?): " + value;
                break;
            case UNSUPPORTED_TIMESTAMP_FORMAT:
                message = "Unsupported timestamp type";
                break;
            default:
                message = "Conversion failed (" + error.getKind() + "): " + value;
                break;
        }
        return error.getDetail() == null ? message : message + " - " + error.getDetail();
    }
}
