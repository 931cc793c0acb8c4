package org.stianloader.picoversion.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

final class JULLogAdapter extends LoggingAdapter {

    @NotNull
    @Contract(pure = true)
    static String format(@NotNull String message, Object... args) {
        StringBuilder builder = new StringBuilder(message.length() + 16 * args.length);
        int cursor = 0;
        int argIndex = 0;
        for (; argIndex < args.length; argIndex++) {
            int placeholder = message.indexOf("{}", cursor);
            if (placeholder == -1) {
                break;
            }
            builder.append(message, cursor, placeholder).append(Objects.toString(args[argIndex]));
            cursor = placeholder + 2;
        }
        builder.append(message, cursor, message.length());

        // Leftover arguments are appended, a trailing throwable gets its stacktrace printed
        for (; argIndex < args.length; argIndex++) {
            Object arg = args[argIndex];
            if (argIndex == args.length - 1 && arg instanceof Throwable) {
                StringWriter sw = new StringWriter();
                ((Throwable) arg).printStackTrace(new PrintWriter(sw));
                builder.append('\n').append(sw);
            } else {
                builder.append(' ').append(Objects.toString(arg));
            }
        }
        return builder.toString();
    }

    private static void log(@NotNull Class<?> clazz, @NotNull Level level, @NotNull String message, Object... args) {
        Logger logger = Logger.getLogger(clazz.getName());
        if (logger.isLoggable(level)) {
            logger.log(level, JULLogAdapter.format(message, args));
        }
    }

    @Override
    public void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.FINE, message, args);
    }

    @Override
    public void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.WARNING, message, args);
    }
}
