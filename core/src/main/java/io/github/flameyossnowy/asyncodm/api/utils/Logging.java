package io.github.flameyossnowy.asyncodm.api.utils;

import org.jetbrains.annotations.ApiStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.NOPLogger;

import java.util.function.Supplier;

/**
 * Logging facade of the mapper.
 * <p>
 * Messages go to SLF4J when a binding is present and to {@code java.util.logging} otherwise.
 * Errors are always logged; informational messages only when {@link #ENABLED} is set, and the
 * per-query messages only when {@link #DEEP} is set as well.
 */
@ApiStatus.Internal
public final class Logging {
    public static boolean ENABLED = false;
    public static boolean DEEP = false;

    private static final Logger LOGGER;
    private static final java.util.logging.Logger FALLBACK;

    static {
        Logger detected;
        try {
            Logger logger = LoggerFactory.getLogger("io.github.flameyossnowy.asyncodm");
            detected = logger instanceof NOPLogger ? null : logger;
        } catch (NoClassDefFoundError e) {
            detected = null;
        }
        LOGGER = detected;
        FALLBACK = LOGGER == null ? java.util.logging.Logger.getLogger("io.github.flameyossnowy.asyncodm") : null;
    }

    private Logging() {}

    /**
     * Logs an error, regardless of {@link #ENABLED}.
     * @param message the message
     * @param throwable the cause
     */
    public static void error(String message, Throwable throwable) {
        if (LOGGER != null) LOGGER.error(message, throwable);
        else FALLBACK.log(java.util.logging.Level.SEVERE, message, throwable);
    }

    /**
     * Logs a warning, regardless of {@link #ENABLED}.
     * @param message the message
     */
    public static void warn(String message) {
        if (LOGGER != null) LOGGER.warn(message);
        else FALLBACK.warning(message);
    }

    public static void info(String message) {
        if (!ENABLED) return;
        if (LOGGER != null) LOGGER.info(message);
        else FALLBACK.info(message);
    }

    /**
     * Logs a message about a single storage round trip. The message is only built when both
     * {@link #ENABLED} and {@link #DEEP} are set.
     * @param message the message supplier
     */
    public static void deepInfo(Supplier<String> message) {
        if (!ENABLED || !DEEP) return;
        if (LOGGER != null) LOGGER.info(message.get());
        else FALLBACK.info(message.get());
    }
}
