package com.forumbot.common.infra;

/**
 * Error formatting utilities for log lines and outcome reports.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Format an exception message safely.
     *
     * @return a non-null human-readable error string
     */
    public static String formatErrorMessage(Throwable err) {
        if (err == null)
            return "Error";
        String msg = err.getMessage();
        if (msg != null && !msg.isBlank()) {
            return msg;
        }
        return err.getClass().getSimpleName();
    }

    /**
     * Walk to the deepest cause, guarding against cycles.
     */
    public static Throwable rootCause(Throwable err) {
        if (err == null)
            return null;
        Throwable current = err;
        int depth = 0;
        while (current.getCause() != null && current.getCause() != current && depth++ < 16) {
            current = current.getCause();
        }
        return current;
    }
}
