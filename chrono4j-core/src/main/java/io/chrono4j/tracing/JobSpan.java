package io.chrono4j.tracing;

public interface JobSpan extends AutoCloseable {

    JobSpan setAttribute(String key, String value);

    JobSpan setAttribute(String key, long value);

    JobSpan addEvent(String name);

    void recordError(Throwable error);

    void setStatus(boolean ok, String description);

    SpanReference reference();

    void end();

    @Override
    default void close() {
        end();
    }
}
