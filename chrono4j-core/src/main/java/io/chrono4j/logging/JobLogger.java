package io.chrono4j.logging;

/**
 * Narrow logging collaborator used by the scheduler and its components.
 *
 * <p>Messages use {@link String#format} placeholders ({@code %s}, {@code %d}). A trailing {@link Throwable}
 * argument is treated as the cause.
 */
public interface JobLogger {

    void debug(String msg, Object... args);

    void info(String msg, Object... args);

    void warn(String msg, Object... args);

    void error(String msg, Object... args);
}
