package org.stianloader.picoversion.logging;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * picoversion rarely has anything to say, but a few literals are accepted in a way that the caller
 * should probably know about (for example a dotted literal with a single component, or a version
 * whose decimal rendering loses information).
 *
 * <p>As picoversion should run without any dependency on the class path, logging is routed through
 * this facade. The default implementation uses SLF4J if it can be found, otherwise messages are passed
 * to {@link java.util.logging.Logger}.
 *
 * <p>Messages use SLF4J-style "{}" placeholders. Arguments without a matching placeholder are appended
 * to the message, unused placeholders are kept as-is. A trailing {@link Throwable} argument should have
 * its stacktrace logged.
 */
public abstract class LoggingAdapter {

    @NotNull
    private static volatile LoggingAdapter currentInstance;

    static {
        LoggingAdapter instance;
        try {
            Class.forName("org.slf4j.LoggerFactory");
            instance = new SLF4JLogAdapter();
        } catch (ClassNotFoundException | NoClassDefFoundError expected) {
            instance = new JULLogAdapter();
        }
        LoggingAdapter.currentInstance = instance;
    }

    @NotNull
    public static LoggingAdapter getDefaultLogger() {
        return LoggingAdapter.currentInstance;
    }

    public static void setDefaultLogger(@NotNull LoggingAdapter instance) {
        LoggingAdapter.currentInstance = Objects.requireNonNull(instance, "instance may not be null");
    }

    public abstract void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args);
    public abstract void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args);
}
