package io.chrono4j.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Default {@link JobLogger} backed by SLF4J.
 */
public class Slf4jJobLogger implements JobLogger {

    private final Logger log;

    public Slf4jJobLogger() {
        this(LoggerFactory.getLogger("io.chrono4j"));
    }

    public Slf4jJobLogger(Class<?> owner) {
        this(LoggerFactory.getLogger(owner));
    }

    public Slf4jJobLogger(Logger log) {
        this.log = Objects.requireNonNull(log, "log must not be null");
    }

    @Override
    public void debug(String msg, Object... args) {
        if (log.isDebugEnabled()) {
            log.debug(format(msg, args), cause(args));
        }
    }

    @Override
    public void info(String msg, Object... args) {
        if (log.isInfoEnabled()) {
            log.info(format(msg, args), cause(args));
        }
    }

    @Override
    public void warn(String msg, Object... args) {
        if (log.isWarnEnabled()) {
            log.warn(format(msg, args), cause(args));
        }
    }

    @Override
    public void error(String msg, Object... args) {
        if (log.isErrorEnabled()) {
            log.error(format(msg, args), cause(args));
        }
    }

    static String format(String msg, Object... args) {
        if (args == null || args.length == 0) {
            return msg;
        }
        Object[] fmtArgs = cause(args) != null ? Arrays.copyOf(args, args.length - 1) : args;
        if (fmtArgs.length == 0) {
            return msg;
        }
        try {
            return String.format(msg, fmtArgs);
        } catch (java.util.IllegalFormatException e) {
            return msg + " " + Arrays.toString(fmtArgs);
        }
    }

    static Throwable cause(Object... args) {
        if (args == null || args.length == 0) {
            return null;
        }
        return args[args.length - 1] instanceof Throwable t ? t : null;
    }
}
