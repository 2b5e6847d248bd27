package io.chrono4j.tracing;

/**
 * Identity of a span, used to link a batch flush back to the executions that produced its updates.
 */
public record SpanReference(String traceId, String spanId) {

    private static final SpanReference INVALID = new SpanReference("", "");

    public static SpanReference invalid() {
        return INVALID;
    }

    public boolean isValid() {
        return traceId != null && !traceId.isEmpty() && spanId != null && !spanId.isEmpty();
    }
}
