package io.chrono4j.tracing;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.StatusCode;

/**
 * {@link JobSpan} over an OpenTelemetry {@link Span}.
 */
public class OtelJobSpan implements JobSpan {

    private final Span span;

    public OtelJobSpan(Span span) {
        this.span = span;
    }

    @Override
    public JobSpan setAttribute(String key, String value) {
        span.setAttribute(key, value);
        return this;
    }

    @Override
    public JobSpan setAttribute(String key, long value) {
        span.setAttribute(key, value);
        return this;
    }

    @Override
    public JobSpan addEvent(String name) {
        span.addEvent(name);
        return this;
    }

    @Override
    public void recordError(Throwable error) {
        span.recordException(error);
    }

    @Override
    public void setStatus(boolean ok, String description) {
        span.setStatus(ok ? StatusCode.OK : StatusCode.ERROR, description == null ? "" : description);
    }

    @Override
    public SpanReference reference() {
        SpanContext ctx = span.getSpanContext();
        return ctx.isValid() ? new SpanReference(ctx.getTraceId(), ctx.getSpanId()) : SpanReference.invalid();
    }

    @Override
    public void end() {
        span.end();
    }
}
