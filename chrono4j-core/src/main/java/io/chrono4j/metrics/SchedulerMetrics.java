package io.chrono4j.metrics;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lock-free counters and gauges describing scheduler activity.
 *
 * <p>Purely observational: no scheduling decision reads these values. A {@link #snapshot()} is not atomic
 * across counters.
 */
public class SchedulerMetrics {

    private final AtomicLong totalJobs = new AtomicLong();
    private final AtomicLong pendingJobs = new AtomicLong();
    private final AtomicLong runningJobs = new AtomicLong();
    private final AtomicLong completedJobs = new AtomicLong();
    private final AtomicLong failedJobs = new AtomicLong();

    private final AtomicLong totalRuns = new AtomicLong();
    private final AtomicLong successRuns = new AtomicLong();
    private final AtomicLong failedRuns = new AtomicLong();

    private final AtomicLong totalDuration = new AtomicLong();
    private final AtomicLong avgDuration = new AtomicLong();
    private final AtomicLong maxDuration = new AtomicLong();
    private final AtomicLong minDuration = new AtomicLong(Long.MAX_VALUE);

    private final AtomicLong heapSize = new AtomicLong();
    private final AtomicLong cacheSize = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();

    private final AtomicLong batchJobUpdates = new AtomicLong();
    private final AtomicLong batchRunUpdates = new AtomicLong();

    private final AtomicLong storageErrors = new AtomicLong();
    private final AtomicLong handlerErrors = new AtomicLong();
    private final AtomicLong timeoutErrors = new AtomicLong();

    public void recordJobAdded() {
        totalJobs.incrementAndGet();
        pendingJobs.incrementAndGet();
    }

    public void recordJobRemoved() {
        totalJobs.decrementAndGet();
    }

    public void recordJobStarted() {
        pendingJobs.decrementAndGet();
        runningJobs.incrementAndGet();
    }

    /**
     * Running job went back to pending: recurring success, a retry, or an aborted start.
     */
    public void recordJobRescheduled() {
        runningJobs.decrementAndGet();
        pendingJobs.incrementAndGet();
    }

    public void recordJobCompleted() {
        runningJobs.decrementAndGet();
        completedJobs.incrementAndGet();
    }

    public void recordJobFailed() {
        runningJobs.decrementAndGet();
        failedJobs.incrementAndGet();
    }

    public void recordRunSuccess(long durationMillis) {
        totalRuns.incrementAndGet();
        successRuns.incrementAndGet();
        updateDuration(durationMillis);
    }

    public void recordRunFailed(long durationMillis) {
        totalRuns.incrementAndGet();
        failedRuns.incrementAndGet();
        updateDuration(durationMillis);
    }

    // avg is approximate: total and count are read separately
    private void updateDuration(long durationMillis) {
        long total = totalDuration.addAndGet(durationMillis);
        long runs = totalRuns.get();
        if (runs > 0) {
            avgDuration.set(total / runs);
        }
        maxDuration.accumulateAndGet(durationMillis, Math::max);
        minDuration.accumulateAndGet(durationMillis, Math::min);
    }

    public void recordCacheHit() {
        cacheHits.incrementAndGet();
    }

    public void recordCacheMiss() {
        cacheMisses.incrementAndGet();
    }

    public void updateHeapSize(long size) {
        heapSize.set(size);
    }

    public void updateCacheSize(long size) {
        cacheSize.set(size);
    }

    public void recordBatchJobUpdate(long count) {
        batchJobUpdates.addAndGet(count);
    }

    public void recordBatchRunUpdate(long count) {
        batchRunUpdates.addAndGet(count);
    }

    public void recordStorageError() {
        storageErrors.incrementAndGet();
    }

    public void recordHandlerError() {
        handlerErrors.incrementAndGet();
    }

    public void recordTimeoutError() {
        timeoutErrors.incrementAndGet();
    }

    public long getTotalRuns() {
        return totalRuns.get();
    }

    public long getSuccessRuns() {
        return successRuns.get();
    }

    public long getFailedRuns() {
        return failedRuns.get();
    }

    public long getCacheHits() {
        return cacheHits.get();
    }

    public long getCacheMisses() {
        return cacheMisses.get();
    }

    public long getStorageErrors() {
        return storageErrors.get();
    }

    public long getHandlerErrors() {
        return handlerErrors.get();
    }

    public long getTimeoutErrors() {
        return timeoutErrors.get();
    }

    public long getBatchJobUpdates() {
        return batchJobUpdates.get();
    }

    public long getBatchRunUpdates() {
        return batchRunUpdates.get();
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> m = new LinkedHashMap<>();
        m.put("total_jobs", totalJobs.get());
        m.put("pending_jobs", pendingJobs.get());
        m.put("running_jobs", runningJobs.get());
        m.put("completed_jobs", completedJobs.get());
        m.put("failed_jobs", failedJobs.get());
        m.put("total_runs", totalRuns.get());
        m.put("success_runs", successRuns.get());
        m.put("failed_runs", failedRuns.get());
        m.put("total_duration_ms", totalDuration.get());
        m.put("avg_duration_ms", avgDuration.get());
        m.put("max_duration_ms", maxDuration.get());
        long min = minDuration.get();
        m.put("min_duration_ms", min == Long.MAX_VALUE ? 0L : min);
        m.put("heap_size", heapSize.get());
        m.put("cache_size", cacheSize.get());
        m.put("cache_hits", cacheHits.get());
        m.put("cache_misses", cacheMisses.get());
        m.put("batch_job_updates", batchJobUpdates.get());
        m.put("batch_run_updates", batchRunUpdates.get());
        m.put("storage_errors", storageErrors.get());
        m.put("handler_errors", handlerErrors.get());
        m.put("timeout_errors", timeoutErrors.get());
        return m;
    }

    /**
     * Cache hit rate in percent, 0 when the cache was never consulted.
     */
    public double cacheHitRate() {
        long hits = cacheHits.get();
        long total = hits + cacheMisses.get();
        return total == 0 ? 0 : (double) hits / total * 100;
    }

    /**
     * Successful runs in percent, 0 before the first run.
     */
    public double successRate() {
        long total = totalRuns.get();
        return total == 0 ? 0 : (double) successRuns.get() / total * 100;
    }

    public void reset() {
        for (AtomicLong counter : new AtomicLong[]{
                totalJobs, pendingJobs, runningJobs, completedJobs, failedJobs,
                totalRuns, successRuns, failedRuns,
                totalDuration, avgDuration, maxDuration,
                heapSize, cacheSize, cacheHits, cacheMisses,
                batchJobUpdates, batchRunUpdates,
                storageErrors, handlerErrors, timeoutErrors}) {
            counter.set(0);
        }
        minDuration.set(Long.MAX_VALUE);
    }
}
