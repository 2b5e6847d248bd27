package io.chrono4j.internal;

import io.chrono4j.core.Job;
import io.chrono4j.core.Run;
import io.chrono4j.logging.JobLogger;
import io.chrono4j.metrics.SchedulerMetrics;
import io.chrono4j.storage.BatchJobStorage;
import io.chrono4j.storage.JobStorage;
import io.chrono4j.tracing.JobSpan;
import io.chrono4j.tracing.JobTracer;
import io.chrono4j.tracing.SpanReference;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.LongConsumer;

/**
 * Coalesces final job and run writes into batches.
 *
 * <p>Jobs and runs have separate bounded queues ({@code 2 * batchSize}), each drained by its own worker
 * thread. A worker flushes when it holds {@code batchSize} updates or when the flush interval elapses,
 * whichever comes first. An update that finds its queue full, or the updater not running, is written
 * synchronously on the caller's thread instead. A failed bulk write is retried item by item.
 */
public class BatchUpdater {

    private static final int DEFAULT_BATCH_SIZE = 10;
    private static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(1);

    private final JobStorage storage;
    private final SchedulerMetrics metrics;
    private final JobLogger logger;

    private final Lane<Job> jobs;
    private final Lane<Run> runs;

    // guards the running check in enqueue against stop
    private final ReadWriteLock stateLock = new ReentrantReadWriteLock();
    private boolean running;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final CountDownLatch stopped = new CountDownLatch(1);

    public BatchUpdater(JobStorage storage, int batchSize, Duration flushInterval,
                        SchedulerMetrics metrics, JobLogger logger, JobTracer tracer) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
        Objects.requireNonNull(tracer, "tracer must not be null");

        int size = batchSize > 0 ? batchSize : DEFAULT_BATCH_SIZE;
        Duration interval = flushInterval != null && !flushInterval.isZero() && !flushInterval.isNegative()
                ? flushInterval : DEFAULT_FLUSH_INTERVAL;

        Consumer<List<Job>> bulkJobs = null;
        Consumer<List<Run>> bulkRuns = null;
        if (storage instanceof BatchJobStorage bulk) {
            bulkJobs = bulk::batchUpdateJobs;
            bulkRuns = bulk::batchUpdateRuns;
        }
        this.jobs = new Lane<>("jobs", size, interval, tracer, logger, metrics,
                bulkJobs,
                storage::updateJob,
                Job::getId,
                metrics::recordBatchJobUpdate);
        this.runs = new Lane<>("runs", size, interval, tracer, logger, metrics,
                bulkRuns,
                storage::updateRun,
                Run::getId,
                metrics::recordBatchRunUpdate);
    }

    public void start() {
        if (stopping.get()) {
            throw new IllegalStateException("BatchUpdater cannot be restarted after stop");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        stateLock.writeLock().lock();
        try {
            running = true;
        } finally {
            stateLock.writeLock().unlock();
        }
        jobs.start();
        runs.start();
    }

    /**
     * Drains both queues, flushes what they held and stops the workers. Safe to call more than once;
     * every caller returns only after the drain has completed.
     */
    public void stop() {
        if (!stopping.compareAndSet(false, true)) {
            awaitStopped();
            return;
        }
        try {
            stateLock.writeLock().lock();
            try {
                running = false;
            } finally {
                stateLock.writeLock().unlock();
            }
            if (started.get()) {
                jobs.stop();
                runs.stop();
            }
        } finally {
            stopped.countDown();
        }
    }

    private void awaitStopped() {
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public void updateJob(Job job, SpanReference origin) {
        Objects.requireNonNull(job, "job must not be null");
        if (!enqueue(jobs, job.copy(), origin)) {
            writeSync("job", job.getId(), () -> storage.updateJob(job));
        }
    }

    public void updateRun(Run run, SpanReference origin) {
        Objects.requireNonNull(run, "run must not be null");
        if (!enqueue(runs, run.copy(), origin)) {
            writeSync("run", run.getId(), () -> storage.updateRun(run));
        }
    }

    private <T> boolean enqueue(Lane<T> lane, T item, SpanReference origin) {
        stateLock.readLock().lock();
        try {
            return running && lane.offer(item, origin);
        } finally {
            stateLock.readLock().unlock();
        }
    }

    private void writeSync(String kind, String id, Runnable write) {
        try {
            write.run();
        } catch (RuntimeException e) {
            metrics.recordStorageError();
            logger.error("[batch] synchronous %s update failed id=%s msg=%s", kind, id, e.getMessage(), e);
        }
    }

    public int pendingJobUpdates() {
        return jobs.queue.size();
    }

    public int pendingRunUpdates() {
        return runs.queue.size();
    }

    private record Update<T>(T item, SpanReference origin) {
    }

    /**
     * One queue plus the worker thread that drains it.
     */
    private static final class Lane<T> {

        private final Update<T> poison = new Update<>(null, null);

        private final String kind;
        private final int batchSize;
        private final long flushIntervalNanos;
        private final JobTracer tracer;
        private final JobLogger logger;
        private final SchedulerMetrics metrics;
        private final Consumer<List<T>> bulkWrite;
        private final Consumer<T> singleWrite;
        private final Function<T, String> idOf;
        private final LongConsumer flushed;

        private final BlockingQueue<Update<T>> queue;
        private Thread worker;

        Lane(String kind, int batchSize, Duration flushInterval, JobTracer tracer, JobLogger logger,
             SchedulerMetrics metrics, Consumer<List<T>> bulkWrite, Consumer<T> singleWrite,
             Function<T, String> idOf, LongConsumer flushed) {
            this.kind = kind;
            this.batchSize = batchSize;
            this.flushIntervalNanos = flushInterval.toNanos();
            this.tracer = tracer;
            this.logger = logger;
            this.metrics = metrics;
            this.bulkWrite = bulkWrite;
            this.singleWrite = singleWrite;
            this.idOf = idOf;
            this.flushed = flushed;
            this.queue = new ArrayBlockingQueue<>(batchSize * 2);
        }

        boolean offer(T item, SpanReference origin) {
            return queue.offer(new Update<>(item, origin != null ? origin : SpanReference.invalid()));
        }

        void start() {
            worker = new Thread(this::loop);
            worker.setName("chrono.batch." + kind);
            worker.setDaemon(true);
            worker.start();
        }

        void stop() {
            try {
                queue.put(poison);
                worker.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("[batch] interrupted while draining %s updates", kind);
            }
        }

        private void loop() {
            List<Update<T>> batch = new ArrayList<>(batchSize);
            long deadline = System.nanoTime() + flushIntervalNanos;
            while (true) {
                long wait = deadline - System.nanoTime();
                if (wait <= 0) {
                    flush(batch);
                    deadline = System.nanoTime() + flushIntervalNanos;
                    continue;
                }
                Update<T> update;
                try {
                    update = queue.poll(wait, TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    // only stop() ends the loop; keep draining
                    continue;
                }
                if (update == null) {
                    continue;
                }
                if (update == poison) {
                    List<Update<T>> rest = new ArrayList<>();
                    queue.drainTo(rest);
                    batch.addAll(rest);
                    flush(batch);
                    return;
                }
                batch.add(update);
                if (batch.size() >= batchSize) {
                    flush(batch);
                }
            }
        }

        private void flush(List<Update<T>> batch) {
            if (batch.isEmpty()) {
                return;
            }
            List<T> items = new ArrayList<>(batch.size());
            List<SpanReference> links = new ArrayList<>(batch.size());
            for (Update<T> u : batch) {
                items.add(u.item());
                if (u.origin().isValid()) {
                    links.add(u.origin());
                }
            }
            batch.clear();

            try (JobSpan span = tracer.startSpan("batch.flush." + kind, Map.of("batch.size", String.valueOf(items.size())), links)) {
                if (bulkWrite != null) {
                    try {
                        bulkWrite.accept(items);
                        flushed.accept(items.size());
                        span.setStatus(true, "flushed");
                        return;
                    } catch (RuntimeException e) {
                        // the bulk call is all or nothing
                        span.addEvent("bulk_write_failed");
                        logger.warn("[batch] bulk %s update failed size=%d msg=%s, writing items one by one",
                                kind, items.size(), e.getMessage());
                    }
                }
                int ok = 0;
                for (T item : items) {
                    try {
                        singleWrite.accept(item);
                        ok++;
                    } catch (RuntimeException e) {
                        metrics.recordStorageError();
                        span.recordError(e);
                        logger.error("[batch] %s update failed id=%s msg=%s", kind, idOf.apply(item), e.getMessage(), e);
                    }
                }
                flushed.accept(ok);
                span.setStatus(ok == items.size(), ok + "/" + items.size() + " written");
            }
        }
    }
}
