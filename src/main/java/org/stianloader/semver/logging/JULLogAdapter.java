package org.stianloader.semver.logging;

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
        StringBuilder builder = new StringBuilder(message.length() + 16 * args.length);
        int head = 0;
        int argIndex = 0;
        while (argIndex < args.length) {
            int placeholder = message.indexOf("{}", head);
            if (placeholder == -1) {
                break;
            }
            builder.append(message, head, placeholder).append(Objects.toString(args[argIndex++]));
            head = placeholder + 2;
        }
        builder.append(message, head, message.length());

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

    @Override
    public void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        Logger.getLogger(clazz.getName()).fine(() -> JULLogAdapter.format(message, args));
    }

    @Override
    public boolean isDebugEnabled(@NotNull Class<?> clazz) {
        return Logger.getLogger(clazz.getName()).isLoggable(Level.FINE);
    }

    @Override
    public void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        Logger.getLogger(clazz.getName()).warning(() -> JULLogAdapter.format(message, args));
    }
}
