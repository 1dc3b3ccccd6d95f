package net.seanstash.util;

import java.util.Arrays;
import org.slf4j.Logger;

/**
 * Logs warnings and errors with the cause appended after the message arguments.
 */
public final class LoggingUtils {

    private LoggingUtils() {
    }

    public static void error(Logger logger, Throwable throwable, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }
        logger.error(message, withCause(throwable, args));
    }

    public static void warn(Logger logger, Throwable throwable, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }
        logger.warn(message, withCause(throwable, args));
    }

    /**
     * Message for a failure, falling back to the exception type when the message is blank.
     */
    public static String describe(Throwable throwable) {
        if (throwable == null) {
            return "unknown error";
        }
        String message = throwable.getMessage();
        return message == null || message.isBlank() ? throwable.getClass().getSimpleName() : message;
    }

    private static Object[] withCause(Throwable throwable, Object... args) {
        Object[] base = args == null ? new Object[0] : args;
        if (throwable == null) {
            return base;
        }
        Object[] combined = Arrays.copyOf(base, base.length + 1);
        combined[base.length] = throwable;
        return combined;
    }
}
