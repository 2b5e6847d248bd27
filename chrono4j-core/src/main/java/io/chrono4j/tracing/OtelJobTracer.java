package io.chrono4j.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.api.trace.Tracer;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link JobTracer} backed by the OpenTelemetry API.
 *
 * <p>Every span is a root span of kind {@link SpanKind#INTERNAL}. Valid references become span links.
 */
public class OtelJobTracer implements JobTracer {

    public static final String INSTRUMENTATION_NAME = "io.chrono4j";

    private final Tracer tracer;

    public OtelJobTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    public static OtelJobTracer of(OpenTelemetry openTelemetry) {
        Objects.requireNonNull(openTelemetry, "openTelemetry must not be null");
        return new OtelJobTracer(openTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    @Override
    public JobSpan startSpan(String name, Map<String, String> attributes, List<SpanReference> links) {
        SpanBuilder builder = tracer.spanBuilder(name)
                .setNoParent()
                .setSpanKind(SpanKind.INTERNAL);
        if (attributes != null) {
            for (Map.Entry<String, String> attribute : attributes.entrySet()) {
                builder.setAttribute(attribute.getKey(), attribute.getValue());
            }
        }
        if (links != null) {
            for (SpanReference link : links) {
                if (link != null && link.isValid()) {
                    builder.addLink(SpanContext.create(link.traceId(), link.spanId(),
                            TraceFlags.getSampled(), TraceState.getDefault()));
                }
            }
        }
        return new OtelJobSpan(builder.startSpan());
    }
}
