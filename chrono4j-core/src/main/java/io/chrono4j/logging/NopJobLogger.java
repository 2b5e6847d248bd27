package io.chrono4j.logging;

public final class NopJobLogger implements JobLogger {

    public static final NopJobLogger INSTANCE = new NopJobLogger();

    private NopJobLogger() {
    }

    @Override
    public void debug(String msg, Object... args) {
    }

    @Override
    public void info(String msg, Object... args) {
    }

    @Override
    public void warn(String msg, Object... args) {
    }

    @Override
    public void error(String msg, Object... args) {
    }
}
