package io.chrono4j.config;

import io.chrono4j.JobScheduler;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Map;
import java.util.Objects;

/**
 * Publishes the scheduler's metrics snapshot as Micrometer gauges.
 *
 * <p>Each snapshot key becomes {@code chrono.scheduler.<key>}, e.g. {@code chrono.scheduler.pending_jobs}.
 * The two ratios are {@code chrono.scheduler.cache_hit_rate} and {@code chrono.scheduler.success_rate}.
 */
public class ChronoMetricsBinder implements MeterBinder {

    static final String PREFIX = "chrono.scheduler.";

    private final JobScheduler scheduler;

    public ChronoMetricsBinder(JobScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        for (String key : scheduler.getMetrics().snapshot().keySet()) {
            Gauge.builder(PREFIX + key, scheduler, s -> valueOf(s.getMetrics().snapshot(), key))
                    .description("Scheduler metric " + key)
                    .register(registry);
        }
        Gauge.builder(PREFIX + "cache_hit_rate", scheduler, s -> s.getMetrics().cacheHitRate())
                .description("Share of job lookups served from the cache")
                .register(registry);
        Gauge.builder(PREFIX + "success_rate", scheduler, s -> s.getMetrics().successRate())
                .description("Share of finished runs that succeeded")
                .register(registry);
    }

    private static double valueOf(Map<String, Long> snapshot, String key) {
        Long value = snapshot.get(key);
        return value == null ? Double.NaN : value;
    }
}
