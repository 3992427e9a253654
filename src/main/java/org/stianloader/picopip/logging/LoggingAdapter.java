package org.stianloader.picopip.logging;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * Logging sink used throughout picopip.
 *
 * <p>picopip does not require SLF4J to be present at runtime. If {@code org.slf4j.LoggerFactory}
 * can be loaded, log records are forwarded to SLF4J, otherwise they are written to
 * {@link java.util.logging.Logger java.util.logging}.
 *
 * <p>Messages use SLF4J-style "{}" placeholders. Arguments without a matching placeholder are
 * appended to the end of the message, unmatched placeholders are kept verbatim. A trailing
 * {@link Throwable} argument has its stack trace logged.
 */
public abstract class LoggingAdapter {

    @NotNull
    static LoggingAdapter currentInstance;

    static {
        LoggingAdapter instance;
        try {
            Class.forName("org.slf4j.LoggerFactory");
            instance = new SLF4JLogAdapter();
        } catch (ClassNotFoundException | NoClassDefFoundError expected) {
            instance = new JULLogAdapter();
        }
        currentInstance = instance;
    }

    @NotNull
    public static LoggingAdapter getDefaultLogger() {
        return LoggingAdapter.currentInstance;
    }

    public static void setDefaultLogger(@NotNull LoggingAdapter instance) {
        LoggingAdapter.currentInstance = Objects.requireNonNull(instance, "instance may not be null");
    }

    public abstract void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args);

    /**
     * Whether debug records of the given class would be written. Callers use this to avoid
     * assembling expensive debug output, such as the list of all pins of a resolution round.
     *
     * @param clazz The class that logs
     * @return True if debug records are written, false otherwise
     */
    public abstract boolean isDebugEnabled(@NotNull Class<?> clazz);

    public abstract void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args);
}
