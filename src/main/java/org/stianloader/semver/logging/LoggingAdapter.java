package org.stianloader.semver.logging;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * Logging facade used by semver-tools.
 *
 * <p>The library is meant to be embedded into resolvers and build tools which bring their own
 * logging setup, so it does not hard-depend on SLF4J. If SLF4J is present on the classpath the
 * default adapter writes to it, otherwise messages end up in {@link java.util.logging.Logger}.
 * Embedders may install their own sink through {@link #setDefaultLogger(LoggingAdapter)}.
 *
 * <p>Messages use SLF4J-style "{}" placeholders. Surplus arguments are appended to the end of
 * the message and surplus placeholders are left untouched. A trailing {@link Throwable} argument
 * has its stacktrace logged.
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
     * Checks whether debug messages logged on behalf of the given class would be written anywhere.
     * Parsers call this before assembling rejection messages for input that is rejected often.
     *
     * @param clazz The class on whose behalf the message would be logged
     * @return True if {@link #debug(Class, String, Object...)} is not a no-op for the class
     */
    public abstract boolean isDebugEnabled(@NotNull Class<?> clazz);

    public abstract void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args);
}
