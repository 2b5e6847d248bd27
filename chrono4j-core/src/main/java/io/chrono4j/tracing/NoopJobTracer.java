package io.chrono4j.tracing;

import java.util.List;
import java.util.Map;

public final class NoopJobTracer implements JobTracer {

    public static final NoopJobTracer INSTANCE = new NoopJobTracer();

    private static final JobSpan NOOP_SPAN = new JobSpan() {
        @Override
        public JobSpan setAttribute(String key, String value) {
            return this;
        }

        @Override
        public JobSpan setAttribute(String key, long value) {
            return this;
        }

        @Override
        public JobSpan addEvent(String name) {
            return this;
        }

        @Override
        public void recordError(Throwable error) {
        }

        @Override
        public void setStatus(boolean ok, String description) {
        }

        @Override
        public SpanReference reference() {
            return SpanReference.invalid();
        }

        @Override
        public void end() {
        }
    };

    private NoopJobTracer() {
    }

    @Override
    public JobSpan startSpan(String name, Map<String, String> attributes, List<SpanReference> links) {
        return NOOP_SPAN;
    }
}
