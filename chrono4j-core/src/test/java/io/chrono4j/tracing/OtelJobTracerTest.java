package io.chrono4j.tracing;

import io.chrono4j.core.Job;
import io.chrono4j.core.JobStatus;
import io.chrono4j.core.Run;
import io.chrono4j.core.SchedulerConfig;
import io.chrono4j.internal.DefaultJobScheduler;
import io.chrono4j.logging.NopJobLogger;
import io.chrono4j.storage.InMemoryJobStorage;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.EventData;
import io.opentelemetry.sdk.trace.data.LinkData;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OtelJobTracerTest {

    private InMemorySpanExporter exporter;
    private SdkTracerProvider provider;
    private OtelJobTracer tracer;

    @BeforeEach
    void setUp() {
        exporter = InMemorySpanExporter.create();
        provider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(exporter))
                .build();
        tracer = new OtelJobTracer(provider.get("test"));
    }

    @AfterEach
    void tearDown() {
        provider.close();
    }

    private SpanData only(String name) {
        List<SpanData> spans = exporter.getFinishedSpanItems().stream()
                .filter(s -> s.getName().equals(name))
                .toList();
        assertEquals(1, spans.size(), "spans named " + name);
        return spans.get(0);
    }

    @Test
    void spanShouldCarryAttributesEventsAndStatus() {
        try (JobSpan span = tracer.startSpan("job.execute", Map.of("job.name", "report"))) {
            span.setAttribute("job.retry_count", 2L);
            span.addEvent("handler_executing");
            span.recordError(new IllegalStateException("boom"));
            span.setStatus(false, "boom");
        }

        SpanData data = only("job.execute");
        assertEquals(SpanKind.INTERNAL, data.getKind());
        assertFalse(data.getParentSpanContext().isValid());
        assertEquals("report", data.getAttributes().get(AttributeKey.stringKey("job.name")));
        assertEquals(2L, data.getAttributes().get(AttributeKey.longKey("job.retry_count")));
        assertThat(data.getEvents()).extracting(EventData::getName).contains("handler_executing", "exception");
        assertEquals(StatusCode.ERROR, data.getStatus().getStatusCode());
        assertEquals("boom", data.getStatus().getDescription());
    }

    @Test
    void referenceShouldIdentifyTheExportedSpan() {
        JobSpan span = tracer.startSpan("job.execute", Map.of());
        SpanReference ref = span.reference();
        span.setStatus(true, "completed");
        span.end();

        assertTrue(ref.isValid());
        SpanData data = only("job.execute");
        assertEquals(data.getTraceId(), ref.traceId());
        assertEquals(data.getSpanId(), ref.spanId());
        assertEquals(StatusCode.OK, data.getStatus().getStatusCode());
    }

    @Test
    void validReferencesShouldBecomeLinks() {
        JobSpan origin = tracer.startSpan("job.execute", Map.of());
        SpanReference ref = origin.reference();
        origin.end();

        tracer.startSpan("batch.flush.jobs", Map.of("batch.size", "2"), List.of(ref, SpanReference.invalid())).end();

        SpanData flush = only("batch.flush.jobs");
        assertThat(flush.getLinks()).hasSize(1);
        LinkData link = flush.getLinks().get(0);
        assertEquals(ref.traceId(), link.getSpanContext().getTraceId());
        assertEquals(ref.spanId(), link.getSpanContext().getSpanId());
        assertFalse(flush.getParentSpanContext().isValid());
        assertThat(flush.getTraceId()).isNotEqualTo(ref.traceId());
    }

    @Test
    void schedulerShouldRecordTraceIdsAndLinkBatchFlushes() {
        InMemoryJobStorage storage = new InMemoryJobStorage();
        DefaultJobScheduler scheduler = new DefaultJobScheduler(storage, SchedulerConfig.defaults()
                .setTickInterval(Duration.ofMillis(20))
                .setEnableBatchUpdate(true)
                .setBatchSize(10)
                .setBatchFlushInterval(Duration.ofMillis(50))
                .setLogger(NopJobLogger.INSTANCE)
                .setTracer(tracer));
        scheduler.registerHandler("noop", (ctx, payload) -> "ok");
        Job job = scheduler.create("traced").handler("noop").save();

        scheduler.start();
        try {
            await().atMost(Duration.ofSeconds(5))
                    .until(() -> storage.getJob(job.getId()).getStatus() == JobStatus.COMPLETED);
        } finally {
            scheduler.stop();
        }

        SpanData execute = only("job.execute");
        Run run = scheduler.getRuns(job.getId(), 1).get(0);
        assertEquals(execute.getTraceId(), run.getTraceId());
        assertEquals(job.getId(), execute.getAttributes().get(AttributeKey.stringKey("job.id")));

        SpanData flush = only("batch.flush.jobs");
        assertThat(flush.getLinks()).extracting(l -> l.getSpanContext().getSpanId())
                .containsExactly(execute.getSpanId());
    }
}
