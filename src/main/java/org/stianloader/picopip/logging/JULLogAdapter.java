package org.stianloader.picopip.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

class JULLogAdapter extends LoggingAdapter {

    @NotNull
    @Contract(pure = true)
    static String format(@NotNull String message, Object... args) {
        StringBuilder builder = new StringBuilder();
        int cursor = 0;
        int argumentCount = args.length;
        Throwable trailing = null;
        if (argumentCount != 0 && args[argumentCount - 1] instanceof Throwable) {
            trailing = (Throwable) args[argumentCount - 1];
        }

        int i = 0;
        for (; i < argumentCount; i++) {
            int placeholder = message.indexOf("{}", cursor);
            if (placeholder == -1) {
                break;
            }
            builder.append(message, cursor, placeholder).append(Objects.toString(args[i]));
            cursor = placeholder + 2;
        }
        builder.append(message, cursor, message.length());

        for (; i < argumentCount; i++) {
            if (i == argumentCount - 1 && trailing != null) {
                StringWriter writer = new StringWriter();
                trailing.printStackTrace(new PrintWriter(writer));
                builder.append('\n').append(writer);
            } else {
                builder.append(' ').append(Objects.toString(args[i]));
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
    public boolean isDebugEnabled(@NotNull Class<?> clazz) {
        return Logger.getLogger(clazz.getName()).isLoggable(Level.FINE);
    }

    @Override
    public void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.WARNING, message, args);
    }
}
