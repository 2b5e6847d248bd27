package io.chrono4j.tracing;

import java.util.List;
import java.util.Map;

/**
 * Optional tracing provider. The engine calls it around job execution and batch flushes and behaves
 * identically when it is a {@link NoopJobTracer}.
 */
public interface JobTracer {

    /**
     * Starts a root span.
     *
     * @param name       span name, e.g. {@code job.execute}
     * @param attributes initial attributes
     * @param links      references to related spans; links are not parents
     */
    JobSpan startSpan(String name, Map<String, String> attributes, List<SpanReference> links);

    default JobSpan startSpan(String name, Map<String, String> attributes) {
        return startSpan(name, attributes, List.of());
    }
}
