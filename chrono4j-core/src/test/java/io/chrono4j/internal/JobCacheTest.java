package io.chrono4j.internal;

import io.chrono4j.core.ErrorCode;
import io.chrono4j.core.Job;
import io.chrono4j.core.JobStatus;
import io.chrono4j.core.JobType;
import io.chrono4j.core.SchedulerException;
import io.chrono4j.logging.NopJobLogger;
import io.chrono4j.metrics.SchedulerMetrics;
import io.chrono4j.storage.InMemoryJobStorage;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JobCacheTest {

    /**
     * Counts reads and makes each one slow enough for concurrent misses to overlap.
     */
    static class SlowStorage extends InMemoryJobStorage {
        final AtomicInteger reads = new AtomicInteger();
        volatile long delayMillis;

        @Override
        public Job getJob(String id) {
            reads.incrementAndGet();
            if (delayMillis > 0) {
                try {
                    Thread.sleep(delayMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return super.getJob(id);
        }
    }

    private static Job job(String id) {
        Job job = new Job();
        job.setId(id);
        job.setName(id);
        job.setHandlerName("noop");
        job.setType(JobType.ONCE);
        job.setStatus(JobStatus.PENDING);
        return job;
    }

    private static JobCache cache(SlowStorage storage, int capacity, Duration ttl, SchedulerMetrics metrics) {
        return new JobCache(storage, capacity, ttl, Duration.ofSeconds(5), metrics, NopJobLogger.INSTANCE);
    }

    @Test
    void concurrentMissesShouldShareOneStorageRead() throws Exception {
        SlowStorage storage = new SlowStorage();
        storage.createJob(job("a"));
        storage.delayMillis = 200;
        SchedulerMetrics metrics = new SchedulerMetrics();
        JobCache cache = cache(storage, 10, Duration.ofMinutes(1), metrics);

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Job>> results = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    go.await();
                    return cache.get("a");
                }));
            }
            go.countDown();
            for (Future<Job> f : results) {
                assertEquals("a", f.get(5, TimeUnit.SECONDS).getId());
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, storage.reads.get());
        assertEquals(callers, metrics.getCacheHits() + metrics.getCacheMisses());
        assertEquals(1, cache.size());
    }

    @Test
    void hitShouldNotTouchStorage() {
        SlowStorage storage = new SlowStorage();
        storage.createJob(job("a"));
        SchedulerMetrics metrics = new SchedulerMetrics();
        JobCache cache = cache(storage, 10, Duration.ofMinutes(1), metrics);

        cache.get("a");
        cache.get("a");
        cache.get("a");

        assertEquals(1, storage.reads.get());
        assertEquals(1, metrics.getCacheMisses());
        assertEquals(2, metrics.getCacheHits());
    }

    @Test
    void returnedJobsShouldBeCopies() {
        SlowStorage storage = new SlowStorage();
        JobCache cache = cache(storage, 10, Duration.ofMinutes(1), new SchedulerMetrics());
        cache.set("a", job("a"));

        cache.get("a").setStatus(JobStatus.FAILED);

        assertEquals(JobStatus.PENDING, cache.get("a").getStatus());
    }

    @Test
    void missingJobShouldPropagateNotFound() {
        JobCache cache = cache(new SlowStorage(), 10, Duration.ofMinutes(1), new SchedulerMetrics());
        SchedulerException ex = assertThrows(SchedulerException.class, () -> cache.get("missing"));
        assertEquals(ErrorCode.JOB_NOT_FOUND, ex.code());
        assertEquals(0, cache.size());
    }

    @Test
    void slowLoadShouldTimeOutWithStorageFailure() {
        SlowStorage storage = new SlowStorage();
        storage.createJob(job("a"));
        storage.delayMillis = 500;
        JobCache cache = new JobCache(storage, 10, Duration.ofMinutes(1), Duration.ofMillis(50),
                new SchedulerMetrics(), NopJobLogger.INSTANCE);

        SchedulerException ex = assertThrows(SchedulerException.class, () -> cache.get("a"));
        assertEquals(ErrorCode.STORAGE_FAILURE, ex.code());
    }

    @Test
    void leastRecentlyUsedEntryShouldBeEvicted() {
        JobCache cache = cache(new SlowStorage(), 2, Duration.ofMinutes(1), new SchedulerMetrics());
        cache.set("a", job("a"));
        cache.set("b", job("b"));
        // a becomes most recently used once the promotion is applied
        cache.get("a");
        cache.drainPromotions();
        cache.set("c", job("c"));

        assertThat(cache.keys()).containsExactly("c", "a");
    }

    @Test
    void expiredEntriesShouldBeReloadedAndCleaned() throws InterruptedException {
        SlowStorage storage = new SlowStorage();
        storage.createJob(job("a"));
        JobCache cache = cache(storage, 10, Duration.ofMillis(30), new SchedulerMetrics());
        cache.set("a", job("a"));
        cache.set("b", job("b"));

        Thread.sleep(60);

        assertEquals(2, cache.cleanExpired());
        assertEquals(0, cache.size());
        cache.get("a");
        assertEquals(1, storage.reads.get());
    }

    @Test
    void deleteAndClearShouldDropEntries() {
        JobCache cache = cache(new SlowStorage(), 10, Duration.ofMinutes(1), new SchedulerMetrics());
        cache.set("a", job("a"));
        cache.set("b", job("b"));

        cache.delete("a");
        assertThat(cache.keys()).containsExactly("b");

        cache.clear();
        assertEquals(0, cache.size());
        assertThat(cache.keys()).isEmpty();
    }
}
