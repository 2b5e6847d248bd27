package io.chrono4j.core;

import io.chrono4j.logging.JobLogger;
import io.chrono4j.logging.Slf4jJobLogger;
import io.chrono4j.tracing.JobTracer;
import io.chrono4j.tracing.NoopJobTracer;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Runtime configuration for scheduler behavior.
 */
public class SchedulerConfig {
    private int concurrentRuns = 5;
    private Duration jobTimeout = Duration.ofMinutes(5);
    private Duration retryDelay = Duration.ofSeconds(5);
    private Duration tickInterval = Duration.ofSeconds(1);
    private Duration cleanupInterval = Duration.ofMinutes(5); // heap sweep
    private boolean autoStart = false;
    private ZoneId zone = ZoneId.systemDefault(); // cron evaluation

    private boolean enableBatchUpdate = false;
    private int batchSize = 10;
    private Duration batchFlushInterval = Duration.ofSeconds(1);

    private boolean enableCache = false;
    private int cacheCapacity = 100;
    private Duration cacheTtl = Duration.ofMinutes(5);
    private Duration cacheCleanupInterval = Duration.ofMinutes(1);
    private Duration cacheLoadTimeout = Duration.ofSeconds(5);

    private JobLogger logger = new Slf4jJobLogger();
    private JobTracer tracer = NoopJobTracer.INSTANCE;

    public static SchedulerConfig defaults() {
        return new SchedulerConfig();
    }

    /**
     * Replaces non-positive values with defaults and fails on missing collaborators.
     */
    public SchedulerConfig validate() {
        if (concurrentRuns <= 0) {
            concurrentRuns = 5;
        }
        requirePositive(jobTimeout, "jobTimeout");
        requirePositive(tickInterval, "tickInterval");
        requirePositive(cleanupInterval, "cleanupInterval");
        Objects.requireNonNull(retryDelay, "retryDelay must not be null");
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative");
        }
        if (zone == null) {
            zone = ZoneId.systemDefault();
        }
        if (logger == null) {
            logger = new Slf4jJobLogger();
        }
        if (tracer == null) {
            tracer = NoopJobTracer.INSTANCE;
        }
        return this;
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    public int getConcurrentRuns() {
        return concurrentRuns;
    }

    public SchedulerConfig setConcurrentRuns(int concurrentRuns) {
        this.concurrentRuns = concurrentRuns;
        return this;
    }

    public Duration getJobTimeout() {
        return jobTimeout;
    }

    public SchedulerConfig setJobTimeout(Duration jobTimeout) {
        this.jobTimeout = jobTimeout;
        return this;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public SchedulerConfig setRetryDelay(Duration retryDelay) {
        this.retryDelay = retryDelay;
        return this;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public SchedulerConfig setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
        return this;
    }

    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    public SchedulerConfig setCleanupInterval(Duration cleanupInterval) {
        this.cleanupInterval = cleanupInterval;
        return this;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public SchedulerConfig setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
        return this;
    }

    public ZoneId getZone() {
        return zone;
    }

    public SchedulerConfig setZone(ZoneId zone) {
        this.zone = zone;
        return this;
    }

    public boolean isEnableBatchUpdate() {
        return enableBatchUpdate;
    }

    public SchedulerConfig setEnableBatchUpdate(boolean enableBatchUpdate) {
        this.enableBatchUpdate = enableBatchUpdate;
        return this;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public SchedulerConfig setBatchSize(int batchSize) {
        this.batchSize = batchSize;
        return this;
    }

    public Duration getBatchFlushInterval() {
        return batchFlushInterval;
    }

    public SchedulerConfig setBatchFlushInterval(Duration batchFlushInterval) {
        this.batchFlushInterval = batchFlushInterval;
        return this;
    }

    public boolean isEnableCache() {
        return enableCache;
    }

    public SchedulerConfig setEnableCache(boolean enableCache) {
        this.enableCache = enableCache;
        return this;
    }

    public int getCacheCapacity() {
        return cacheCapacity;
    }

    public SchedulerConfig setCacheCapacity(int cacheCapacity) {
        this.cacheCapacity = cacheCapacity;
        return this;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public SchedulerConfig setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl;
        return this;
    }

    public Duration getCacheCleanupInterval() {
        return cacheCleanupInterval;
    }

    public SchedulerConfig setCacheCleanupInterval(Duration cacheCleanupInterval) {
        this.cacheCleanupInterval = cacheCleanupInterval;
        return this;
    }

    public Duration getCacheLoadTimeout() {
        return cacheLoadTimeout;
    }

    public SchedulerConfig setCacheLoadTimeout(Duration cacheLoadTimeout) {
        this.cacheLoadTimeout = cacheLoadTimeout;
        return this;
    }

    public JobLogger getLogger() {
        return logger;
    }

    public SchedulerConfig setLogger(JobLogger logger) {
        this.logger = logger;
        return this;
    }

    public JobTracer getTracer() {
        return tracer;
    }

    public SchedulerConfig setTracer(JobTracer tracer) {
        this.tracer = tracer;
        return this;
    }
}
