package io.chrono4j.internal;

import io.chrono4j.JobBuilder;
import io.chrono4j.JobHandler;
import io.chrono4j.JobScheduler;
import io.chrono4j.core.ErrorCode;
import io.chrono4j.core.Job;
import io.chrono4j.core.JobHandlerRegistry;
import io.chrono4j.core.JobStatus;
import io.chrono4j.core.JobType;
import io.chrono4j.core.Run;
import io.chrono4j.core.RunStatus;
import io.chrono4j.core.SchedulerConfig;
import io.chrono4j.core.SchedulerException;
import io.chrono4j.logging.JobLogger;
import io.chrono4j.metrics.SchedulerMetrics;
import io.chrono4j.storage.JobStorage;
import io.chrono4j.tracing.JobSpan;
import io.chrono4j.tracing.JobTracer;
import io.chrono4j.utils.IntervalParser;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Default {@link JobScheduler}.
 *
 * <p>The registry, the time heap and the claimed set are guarded by one read/write lock. Storage calls and
 * handler invocations never run while it is held. The registry is the only mutable truth for a job: callers,
 * the cache and storage receive copies, and heap entries are the registry's own objects.
 *
 * <p>A job id in the claimed set is reserved: either an execution owns it (dispatched, possibly not yet
 * {@link JobStatus#RUNNING}) or a pause/resume is persisting a transition for it. Claimed jobs are never
 * dispatched a second time.
 */
public class DefaultJobScheduler implements JobScheduler {

    private final JobStorage storage;
    private final SchedulerConfig config;
    private final JobHandlerRegistry handlers;
    private final JobLogger logger;
    private final JobTracer tracer;
    private final SchedulerMetrics metrics = new SchedulerMetrics();
    private final JobCache cache;
    private final CronTrigger cronTrigger;
    private final Semaphore slots;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    // guarded by lock
    private final Map<String, Job> registry = new HashMap<>();
    private final JobHeap heap = new JobHeap();
    private final Set<String> claimed = new HashSet<>();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Set<ExecutionContext> inFlight = ConcurrentHashMap.newKeySet();

    private volatile ExecutorService workerPool;
    private volatile ScheduledExecutorService timer;
    private ScheduledFuture<?> tickTask;
    private ScheduledFuture<?> cleanupTask;
    private volatile BatchUpdater batchUpdater;

    public DefaultJobScheduler(JobStorage storage, SchedulerConfig config) {
        this(storage, config, new JobHandlerRegistry());
    }

    public DefaultJobScheduler(JobStorage storage, SchedulerConfig config, JobHandlerRegistry handlers) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.config = (config != null ? config : SchedulerConfig.defaults()).validate();
        this.handlers = Objects.requireNonNull(handlers, "handlers must not be null");
        this.logger = this.config.getLogger();
        this.tracer = this.config.getTracer();
        this.slots = new Semaphore(this.config.getConcurrentRuns());
        this.cronTrigger = new CronTrigger(this::onCronFire, this.config.getZone(), logger);
        this.cache = this.config.isEnableCache()
                ? new JobCache(storage, this.config.getCacheCapacity(), this.config.getCacheTtl(),
                this.config.getCacheLoadTimeout(), metrics, logger)
                : null;
    }

    /**
     * Creates a scheduler over the given handlers and starts it right away when
     * {@link SchedulerConfig#isAutoStart()} is set.
     */
    public static DefaultJobScheduler open(JobStorage storage, SchedulerConfig config, JobHandlerRegistry handlers) {
        DefaultJobScheduler scheduler = new DefaultJobScheduler(storage, config, handlers);
        if (scheduler.config.isAutoStart()) {
            scheduler.start();
        }
        return scheduler;
    }

    // ------------------------------------------------------------------ handlers

    @Override
    public void registerHandler(String name, JobHandler handler) {
        handlers.register(name, handler);
    }

    @Override
    public Optional<JobHandler> getHandler(String name) {
        return Optional.ofNullable(handlers.find(name));
    }

    // ------------------------------------------------------------------ job management

    @Override
    public JobBuilder create(String name) {
        return new SimpleJobBuilder(name, this::addJob);
    }

    @Override
    public Job addJob(Job input) {
        Objects.requireNonNull(input, "job must not be null");
        Job job = input.copy();
        job.validate();
        if (!handlers.contains(job.getHandlerName())) {
            throw SchedulerException.handlerNotFound(job.getHandlerName());
        }
        if (job.getId() == null || job.getId().isBlank()) {
            job.setId(UUID.randomUUID().toString());
        }
        job.setStatus(JobStatus.PENDING);
        job.setNextRunAt(firstRunAt(job, now()));

        try {
            storage.createJob(job);
        } catch (SchedulerException e) {
            countStorageError(e);
            throw e;
        }

        Job added = job.copy();
        boolean armCron;
        int heapSize;
        lock.writeLock().lock();
        try {
            registry.put(job.getId(), job);
            if (!job.isCron()) {
                heap.add(job);
            }
            heapSize = heap.size();
            armCron = job.isCron() && started.get();
        } finally {
            lock.writeLock().unlock();
        }

        metrics.recordJobAdded();
        metrics.updateHeapSize(heapSize);
        cacheSet(added);
        if (armCron) {
            armCron(added);
        }
        logger.debug("[scheduler] job added name=%s id=%s type=%s nextRunAt=%s",
                added.getName(), added.getId(), added.getType(), added.getNextRunAt());
        return added;
    }

    @Override
    public void removeJob(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Job removed;
        lock.writeLock().lock();
        try {
            removed = registry.remove(id);
            heap.remove(id);
        } finally {
            lock.writeLock().unlock();
        }
        cronTrigger.cancel(id);
        if (cache != null) {
            cache.delete(id);
        }

        try {
            storage.deleteJob(id);
        } catch (SchedulerException e) {
            countStorageError(e);
            throw e;
        }
        if (removed != null) {
            metrics.recordJobRemoved();
        }
        logger.debug("[scheduler] job removed id=%s", id);
    }

    @Override
    public void pauseJob(String id) {
        Objects.requireNonNull(id, "id must not be null");

        // phase 1: check and reserve
        Job paused;
        lock.writeLock().lock();
        try {
            Job current = registry.get(id);
            if (current == null) {
                paused = null;
            } else {
                if (current.getStatus() == JobStatus.PAUSED) {
                    return;
                }
                checkPausable(current, claimed.contains(id));
                claimed.add(id);
                paused = current.copy();
                paused.setStatus(JobStatus.PAUSED);
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (paused == null) {
            pauseUnregistered(id);
            return;
        }

        // phase 2: persist
        try {
            storage.updateJob(paused);
        } catch (RuntimeException e) {
            release(id);
            countStorageError(e);
            throw e;
        }

        // phase 3: commit
        lock.writeLock().lock();
        try {
            claimed.remove(id);
            if (registry.containsKey(id)) {
                registry.put(id, paused.copy());
                heap.remove(id);
            }
        } finally {
            lock.writeLock().unlock();
        }
        cronTrigger.cancel(id);
        cacheSet(paused);
        logger.info("[scheduler] job paused name=%s id=%s", paused.getName(), id);
    }

    // job known to storage only, e.g. added through another scheduler sharing the storage
    private void pauseUnregistered(String id) {
        Job stored = storage.getJob(id);
        if (stored.getStatus() == JobStatus.PAUSED) {
            return;
        }
        checkPausable(stored, false);
        stored.setStatus(JobStatus.PAUSED);
        try {
            storage.updateJob(stored);
        } catch (RuntimeException e) {
            countStorageError(e);
            throw e;
        }
        cacheSet(stored);
    }

    private static void checkPausable(Job job, boolean isClaimed) {
        if (job.getStatus() == JobStatus.RUNNING || isClaimed) {
            throw new SchedulerException(ErrorCode.JOB_RUNNING, "job is running: " + job.getId());
        }
        if (job.getStatus() != null && job.getStatus().isTerminal()) {
            throw new SchedulerException(ErrorCode.INVALID_STATE,
                    "job " + job.getId() + " cannot be paused in status " + job.getStatus());
        }
    }

    @Override
    public void resumeJob(String id) {
        Objects.requireNonNull(id, "id must not be null");

        // phase 1: check and reserve
        Job resumed;
        lock.writeLock().lock();
        try {
            Job current = registry.get(id);
            if (current != null) {
                if (current.getStatus() != JobStatus.PAUSED) {
                    throw notPaused(current);
                }
                if (claimed.contains(id)) {
                    throw new SchedulerException(ErrorCode.JOB_RUNNING, "job is being updated: " + id);
                }
                claimed.add(id);
                resumed = current.copy();
            } else {
                resumed = null;
            }
        } finally {
            lock.writeLock().unlock();
        }

        boolean reserved = resumed != null;
        try {
            if (resumed == null) {
                resumed = storage.getJob(id);
                if (resumed.getStatus() != JobStatus.PAUSED) {
                    throw notPaused(resumed);
                }
            }
            if (!handlers.contains(resumed.getHandlerName())) {
                throw SchedulerException.handlerNotFound(resumed.getHandlerName());
            }
            resumed.setStatus(JobStatus.PENDING);
            resumed.setNextRunAt(resumeRunAt(resumed, now()));

            // phase 2: persist
            storage.updateJob(resumed);
        } catch (RuntimeException e) {
            if (reserved) {
                release(id);
            }
            countStorageError(e);
            throw e;
        }

        // phase 3: commit
        Job committed = resumed;
        resumed = committed.copy();
        boolean armCron;
        lock.writeLock().lock();
        try {
            claimed.remove(id);
            registry.put(id, committed);
            if (!committed.isCron()) {
                heap.add(committed);
            }
            armCron = committed.isCron() && started.get();
        } finally {
            lock.writeLock().unlock();
        }
        if (armCron) {
            armCron(resumed);
        }
        cacheSet(resumed);
        logger.info("[scheduler] job resumed name=%s id=%s nextRunAt=%s", resumed.getName(), id, resumed.getNextRunAt());
    }

    private static SchedulerException notPaused(Job job) {
        return new SchedulerException(ErrorCode.JOB_NOT_PAUSED,
                "job " + job.getId() + " is not paused (status " + job.getStatus() + ")");
    }

    @Override
    public void triggerJob(String id) {
        Objects.requireNonNull(id, "id must not be null");
        if (!started.get()) {
            throw new SchedulerException(ErrorCode.SCHEDULER_NOT_STARTED, "scheduler is not started");
        }

        // a job unknown to this scheduler is adopted from storage
        Job loaded = isRegistered(id) ? null : storage.getJob(id);

        lock.writeLock().lock();
        try {
            Job job = registry.get(id);
            boolean adopted = job == null;
            if (adopted) {
                job = loaded;
                if (job == null) {
                    throw SchedulerException.jobNotFound(id);
                }
            }
            if (job.getStatus() == JobStatus.PAUSED) {
                throw new SchedulerException(ErrorCode.JOB_PAUSED, "job is paused: " + id);
            }
            if (job.getStatus() == JobStatus.RUNNING || claimed.contains(id)) {
                throw new SchedulerException(ErrorCode.JOB_RUNNING, "job is running: " + id);
            }
            if (adopted) {
                registry.put(id, job);
            }
            claimed.add(id);
            // the triggered execution replaces the pending occurrence
            heap.remove(id);
        } finally {
            lock.writeLock().unlock();
        }

        logger.debug("[scheduler] job triggered id=%s", id);
        dispatch(id);
    }

    private boolean isRegistered(String id) {
        lock.readLock().lock();
        try {
            return registry.containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Job getJob(String id) {
        Objects.requireNonNull(id, "id must not be null");
        if (cache != null) {
            return cache.get(id);
        }
        return storage.getJob(id);
    }

    @Override
    public List<Job> listJobs() {
        return storage.listJobs(null);
    }

    @Override
    public List<Job> listJobs(JobStatus status) {
        return storage.listJobs(status);
    }

    @Override
    public List<Run> getRuns(String jobId, int limit) {
        return storage.getRuns(jobId, limit);
    }

    @Override
    public long getRunCount(String jobId) {
        return storage.getRunCount(jobId);
    }

    // ------------------------------------------------------------------ lifecycle

    @Override
    public void start() {
        lock.writeLock().lock();
        try {
            if (started.get()) {
                throw new SchedulerException(ErrorCode.SCHEDULER_ALREADY_STARTED, "scheduler is already started");
            }
            workerPool = Executors.newCachedThreadPool(new NamedDaemonThreadFactory("chrono.worker"));
            timer = Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("chrono.scheduler"));
            started.set(true);
        } finally {
            lock.writeLock().unlock();
        }

        logger.info("[scheduler] starting concurrentRuns=%d jobTimeout=%s tickInterval=%s batch=%s cache=%s",
                config.getConcurrentRuns(), config.getJobTimeout(), config.getTickInterval(),
                config.isEnableBatchUpdate(), config.isEnableCache());

        if (config.isEnableBatchUpdate()) {
            batchUpdater = new BatchUpdater(storage, config.getBatchSize(), config.getBatchFlushInterval(),
                    metrics, logger, tracer);
            batchUpdater.start();
        }
        if (cache != null) {
            cache.start(config.getCacheCleanupInterval());
        }
        cronTrigger.start();

        try {
            recover();
        } catch (RuntimeException e) {
            logger.error("[scheduler] failed to load jobs on start msg=%s", e.getMessage(), e);
            shutdown();
            throw e;
        }

        long tick = config.getTickInterval().toMillis();
        long cleanup = config.getCleanupInterval().toMillis();
        tickTask = timer.scheduleAtFixedRate(this::tick, tick, Math.max(1, tick), TimeUnit.MILLISECONDS);
        cleanupTask = timer.scheduleAtFixedRate(this::cleanup, cleanup, Math.max(1, cleanup), TimeUnit.MILLISECONDS);
        logger.info("[scheduler] started jobs=%d", registrySize());
    }

    private void recover() {
        for (Job job : storage.listJobs(JobStatus.PENDING)) {
            register(job);
        }

        List<Job> stuck;
        try {
            stuck = storage.listJobs(JobStatus.RUNNING);
        } catch (RuntimeException e) {
            countStorageError(e);
            logger.error("[scheduler] failed to load running jobs msg=%s", e.getMessage(), e);
            return;
        }
        for (Job job : stuck) {
            job.setStatus(JobStatus.PENDING);
            try {
                storage.updateJob(job);
            } catch (RuntimeException e) {
                countStorageError(e);
                logger.error("[scheduler] failed to reset running job id=%s msg=%s", job.getId(), e.getMessage(), e);
                continue;
            }
            logger.warn("[scheduler] reset interrupted job to pending name=%s id=%s", job.getName(), job.getId());
            register(job);
        }
    }

    private void register(Job stored) {
        Job job = stored.copy();
        lock.writeLock().lock();
        try {
            registry.put(stored.getId(), stored);
            if (!stored.isCron() && stored.getNextRunAt() != null) {
                heap.add(stored);
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (job.isCron()) {
            if (!handlers.contains(job.getHandlerName())) {
                logger.error("[scheduler] handler not found name=%s job=%s", job.getHandlerName(), job.getId());
            }
            armCron(job);
        }
        cacheSet(job);
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            throw new SchedulerException(ErrorCode.SCHEDULER_NOT_STARTED, "scheduler is not started");
        }
        logger.info("[scheduler] stopping inFlight=%d", inFlight.size());
        shutdown();
        logger.info("[scheduler] stopped");
    }

    private void shutdown() {
        started.set(false);
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
        if (cleanupTask != null) {
            cleanupTask.cancel(false);
            cleanupTask = null;
        }
        cronTrigger.stop();

        for (ExecutionContext ctx : inFlight) {
            ctx.cancel(ExecutionContext.CancelReason.SHUTDOWN);
        }
        workerPool.shutdown();
        boolean interrupted = false;
        while (true) {
            try {
                if (workerPool.awaitTermination(1, TimeUnit.SECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        timer.shutdownNow();

        BatchUpdater updater = batchUpdater;
        if (updater != null) {
            updater.stop();
            batchUpdater = null;
        }
        if (cache != null) {
            cache.stop();
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isStarted() {
        return started.get();
    }

    @Override
    public SchedulerMetrics getMetrics() {
        lock.readLock().lock();
        try {
            metrics.updateHeapSize(heap.size());
        } finally {
            lock.readLock().unlock();
        }
        if (cache != null) {
            metrics.updateCacheSize(cache.size());
        }
        return metrics;
    }

    /**
     * Cache statistics, empty when the cache is disabled.
     */
    public Map<String, Object> getCacheStats() {
        return cache != null ? cache.stats() : new LinkedHashMap<>();
    }

    // ------------------------------------------------------------------ background loops

    void tick() {
        try {
            List<String> ready = new ArrayList<>();
            lock.writeLock().lock();
            try {
                for (Job due : heap.popDue(Instant.now())) {
                    Job job = registry.get(due.getId());
                    if (job == null || job.getStatus() != JobStatus.PENDING) {
                        continue;
                    }
                    if (claimed.contains(job.getId())) {
                        // reserved by a pause, resume or trigger; look again next tick
                        heap.add(job);
                        continue;
                    }
                    claimed.add(job.getId());
                    ready.add(job.getId());
                }
            } finally {
                lock.writeLock().unlock();
            }
            for (String id : ready) {
                dispatch(id);
            }
        } catch (RuntimeException e) {
            logger.error("[scheduler] tick failed msg=%s", e.getMessage(), e);
        }
    }

    void cleanup() {
        try {
            int removed;
            int size;
            lock.writeLock().lock();
            try {
                removed = heap.cleanCompleted();
                size = heap.size();
            } finally {
                lock.writeLock().unlock();
            }
            metrics.updateHeapSize(size);
            if (removed > 0) {
                logger.debug("[scheduler] removed %d finished jobs from the heap", removed);
            }
        } catch (RuntimeException e) {
            logger.error("[scheduler] heap cleanup failed msg=%s", e.getMessage(), e);
        }
    }

    private void onCronFire(String id) {
        if (!started.get()) {
            return;
        }
        lock.writeLock().lock();
        try {
            Job job = registry.get(id);
            if (job == null || job.getStatus() != JobStatus.PENDING || claimed.contains(id)) {
                logger.debug("[scheduler] skipping cron firing id=%s", id);
                return;
            }
            claimed.add(id);
        } finally {
            lock.writeLock().unlock();
        }
        dispatch(id);
    }

    private void dispatch(String id) {
        try {
            workerPool.execute(() -> execute(id));
        } catch (RejectedExecutionException e) {
            logger.warn("[scheduler] dispatch rejected id=%s, scheduler is stopping", id);
            requeue(id);
        }
    }

    // ------------------------------------------------------------------ execution

    private void execute(String id) {
        if (!slots.tryAcquire()) {
            requeue(id);
            logger.warn("[scheduler] no free execution slot, job %s re-queued for the next tick", id);
            return;
        }
        try {
            executeWithSlot(id);
        } catch (RuntimeException | Error e) {
            restorePending(id);
            logger.error("[scheduler] execution of job %s failed msg=%s", id, e.getMessage(), e);
        } finally {
            slots.release();
        }
    }

    private void executeWithSlot(String id) {
        Instant startAt = now();
        JobHandler handler;
        Job job;

        lock.writeLock().lock();
        try {
            Job current = registry.get(id);
            if (current == null) {
                claimed.remove(id);
                return;
            }
            handler = handlers.find(current.getHandlerName());
            if (handler == null) {
                claimed.remove(id);
                logger.error("[scheduler] handler not found name=%s job=%s", current.getHandlerName(), id);
                return;
            }
            if (current.getStatus() == JobStatus.RUNNING) {
                // the claim belongs to the execution already running
                return;
            }
            current.setStatus(JobStatus.RUNNING);
            current.setLastRunAt(startAt);
            job = current.copy();
        } finally {
            lock.writeLock().unlock();
        }
        metrics.recordJobStarted();

        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("job.id", job.getId());
        attributes.put("job.name", job.getName());
        attributes.put("job.handler", job.getHandlerName());
        try (JobSpan span = tracer.startSpan("job.execute", attributes)) {
            try {
                storage.updateJob(job);
            } catch (RuntimeException e) {
                abortStart(job, span, "failed to mark job running", e);
                return;
            }
            cacheSetIfRegistered(job);

            Run run = new Run();
            run.setId(UUID.randomUUID().toString());
            run.setJobId(job.getId());
            run.setStatus(RunStatus.RUNNING);
            run.setStartAt(startAt);
            run.setTraceId(span.reference().traceId());
            try {
                storage.createRun(run);
            } catch (RuntimeException e) {
                abortStart(job, span, "failed to create run record", e);
                return;
            }

            Outcome outcome = invoke(handler, job, run, span);
            finish(job, run, outcome, span);
        }
    }

    private record Outcome(String output, Throwable error, boolean timedOut, long durationMillis) {
        boolean failed() {
            return error != null || timedOut;
        }

        String errorMessage(Duration timeout) {
            if (timedOut) {
                return "job timed out after " + timeout.toMillis() + "ms";
            }
            String msg = error.getMessage();
            return msg != null ? msg : error.getClass().getName();
        }
    }

    private Outcome invoke(JobHandler handler, Job job, Run run, JobSpan span) {
        Duration timeout = config.getJobTimeout();
        long startNanos = System.nanoTime();
        ExecutionContext ctx = new ExecutionContext(job.getId(), job.getName(), run.getId(), run.getTraceId(),
                Instant.now().plus(timeout));
        inFlight.add(ctx);
        if (!started.get()) {
            ctx.cancel(ExecutionContext.CancelReason.SHUTDOWN);
        }
        ScheduledFuture<?> watchdog = scheduleTimeout(ctx, timeout);

        String output = null;
        Throwable error = null;
        span.addEvent("handler_executing");
        ctx.attach(Thread.currentThread());
        try {
            output = handler.execute(ctx, job.getPayload());
        } catch (Throwable t) {
            // handler failures of any kind only fail this run
            error = t;
        } finally {
            ctx.detach();
            // clear an interrupt aimed at the handler before this thread goes back to the pool
            Thread.interrupted();
            if (watchdog != null) {
                watchdog.cancel(false);
            }
            inFlight.remove(ctx);
        }

        long duration = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        boolean timedOut = ctx.cancelReason() == ExecutionContext.CancelReason.TIMEOUT;
        if (timedOut) {
            metrics.recordTimeoutError();
        }
        if (error != null || timedOut) {
            metrics.recordRunFailed(duration);
            metrics.recordHandlerError();
        } else {
            metrics.recordRunSuccess(duration);
        }
        return new Outcome(output, error, timedOut, duration);
    }

    private ScheduledFuture<?> scheduleTimeout(ExecutionContext ctx, Duration timeout) {
        try {
            return timer.schedule(() -> ctx.cancel(ExecutionContext.CancelReason.TIMEOUT),
                    timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // timer already shut down: the scheduler is stopping and ctx was cancelled
            return null;
        }
    }

    private void finish(Job job, Run run, Outcome outcome, JobSpan span) {
        Instant endAt = now();
        run.setEndAt(endAt);
        run.setDuration(outcome.durationMillis());

        if (outcome.failed()) {
            String message = outcome.errorMessage(config.getJobTimeout());
            run.setStatus(RunStatus.FAILED);
            run.setError(message);
            if (job.getRetryCount() < job.getMaxRetry()) {
                job.setRetryCount(job.getRetryCount() + 1);
                job.setStatus(JobStatus.PENDING);
                // a cron retry waits for the next firing
                job.setNextRunAt(job.isCron() ? nextOccurrence(job, endAt) : endAt.plus(config.getRetryDelay()));
                span.addEvent("retry_scheduled");
                span.setAttribute("job.retry_count", job.getRetryCount());
            } else {
                job.setStatus(JobStatus.FAILED);
                job.setLastResult(message);
            }
            span.recordError(outcome.error() != null ? outcome.error() : new IllegalStateException(message));
            span.setStatus(false, message);
        } else {
            run.setStatus(RunStatus.SUCCESS);
            run.setOutput(outcome.output());
            job.setStatus(JobStatus.COMPLETED);
            job.setLastResult(outcome.output());
            if (job.getType().shouldReschedule()) {
                Instant next = nextOccurrence(job, endAt);
                if (next != null) {
                    job.setStatus(JobStatus.PENDING);
                    job.setNextRunAt(next);
                    job.setRetryCount(0);
                    span.addEvent("next_run_scheduled");
                }
            }
            span.setStatus(true, "completed");
        }

        Job toPersist;
        boolean registered;
        lock.writeLock().lock();
        try {
            Job current = registry.get(job.getId());
            registered = current != null;
            if (registered) {
                current.setStatus(job.getStatus());
                current.setLastRunAt(job.getLastRunAt());
                current.setLastResult(job.getLastResult());
                current.setRetryCount(job.getRetryCount());
                current.setNextRunAt(job.getNextRunAt());
                if (!current.isCron() && current.getStatus() == JobStatus.PENDING && current.getNextRunAt() != null) {
                    heap.update(current);
                }
            }
            claimed.remove(job.getId());
            toPersist = job.copy();
        } finally {
            lock.writeLock().unlock();
        }

        switch (toPersist.getStatus()) {
            case PENDING -> metrics.recordJobRescheduled();
            case COMPLETED -> metrics.recordJobCompleted();
            default -> metrics.recordJobFailed();
        }
        span.setAttribute("run.duration_ms", run.getDuration());
        span.setAttribute("run.status", run.getStatus().name());

        if (!registered) {
            // removed while running: storage no longer holds the job or its runs
            if (cache != null) {
                cache.delete(toPersist.getId());
            }
            logger.debug("[scheduler] job %s was removed during run %s, result discarded", toPersist.getId(), run.getId());
            return;
        }
        if (toPersist.isCron() && toPersist.getStatus() != JobStatus.PENDING) {
            cronTrigger.cancel(toPersist.getId());
        }
        cacheSetIfRegistered(toPersist);
        persistResult(toPersist, run.copy(), span);
        logger.debug("[scheduler] job finished name=%s id=%s run=%s status=%s duration=%dms",
                toPersist.getName(), toPersist.getId(), run.getId(), run.getStatus(), run.getDuration());
    }

    private void persistResult(Job job, Run run, JobSpan span) {
        BatchUpdater updater = batchUpdater;
        if (updater != null) {
            updater.updateRun(run, span.reference());
            updater.updateJob(job, span.reference());
            return;
        }
        // run first: a stored job that left RUNNING always has a finished run record
        try {
            storage.updateRun(run);
        } catch (RuntimeException e) {
            countStorageError(e);
            logger.error("[scheduler] failed to persist run id=%s msg=%s", run.getId(), e.getMessage(), e);
        }
        try {
            storage.updateJob(job);
        } catch (RuntimeException e) {
            countStorageError(e);
            logger.error("[scheduler] failed to persist job id=%s msg=%s", job.getId(), e.getMessage(), e);
        }
    }

    /**
     * Puts a job whose start could not be recorded back to pending, due again after the retry delay.
     */
    private void abortStart(Job job, JobSpan span, String what, RuntimeException e) {
        countStorageError(e);
        span.recordError(e);
        span.setStatus(false, e.getMessage());
        logger.error("[scheduler] %s id=%s msg=%s, restoring to pending", what, job.getId(), e.getMessage(), e);
        lock.writeLock().lock();
        try {
            Job current = registry.get(job.getId());
            if (current != null) {
                current.setStatus(JobStatus.PENDING);
                if (!current.isCron()) {
                    current.setNextRunAt(now().plus(config.getRetryDelay()));
                    heap.update(current);
                }
            }
            claimed.remove(job.getId());
        } finally {
            lock.writeLock().unlock();
        }
        metrics.recordJobRescheduled();
    }

    /**
     * Gives back an unused claim and puts the job back in the heap at its current time. Cron jobs stay with
     * the cron trigger.
     */
    private void requeue(String id) {
        lock.writeLock().lock();
        try {
            claimed.remove(id);
            Job current = registry.get(id);
            if (current != null && !current.isCron()
                    && current.getStatus() == JobStatus.PENDING && current.getNextRunAt() != null) {
                heap.add(current);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Undoes a claim whose execution ended abnormally: a job left RUNNING goes back to pending.
     */
    private void restorePending(String id) {
        Job restored = null;
        lock.writeLock().lock();
        try {
            Job current = registry.get(id);
            if (current != null && current.getStatus() == JobStatus.RUNNING) {
                current.setStatus(JobStatus.PENDING);
                if (!current.isCron()) {
                    current.setNextRunAt(now().plus(config.getRetryDelay()));
                    heap.update(current);
                }
                restored = current.copy();
            }
            claimed.remove(id);
        } finally {
            lock.writeLock().unlock();
        }
        if (restored == null) {
            return;
        }
        metrics.recordJobRescheduled();
        try {
            storage.updateJob(restored);
        } catch (RuntimeException e) {
            countStorageError(e);
            logger.error("[scheduler] failed to restore job id=%s msg=%s", id, e.getMessage(), e);
        }
        cacheSetIfRegistered(restored);
    }

    private void release(String id) {
        lock.writeLock().lock();
        try {
            claimed.remove(id);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ------------------------------------------------------------------ helpers

    private Instant firstRunAt(Job job, Instant now) {
        Instant preset = job.getNextRunAt();
        return switch (job.getType()) {
            case CRON -> nextCronFire(job, now);
            case ONCE -> preset != null && preset.isAfter(now) ? preset : now;
            case INTERVAL -> preset != null && preset.isAfter(now) ? preset : now.plus(job.getInterval());
        };
    }

    private Instant resumeRunAt(Job job, Instant now) {
        Instant next = job.getNextRunAt();
        return switch (job.getType()) {
            case CRON -> nextCronFire(job, now);
            case ONCE -> next == null || next.isBefore(now) ? now : next;
            case INTERVAL -> next == null || next.isBefore(now) ? now.plus(job.getInterval()) : next;
        };
    }

    private Instant nextOccurrence(Job job, Instant after) {
        if (job.getType() == JobType.INTERVAL) {
            return after.plus(job.getInterval());
        }
        try {
            return nextCronFire(job, after);
        } catch (SchedulerException e) {
            logger.warn("[scheduler] cron job %s has no next firing: %s", job.getId(), e.getMessage());
            return null;
        }
    }

    private Instant nextCronFire(Job job, Instant after) {
        try {
            return IntervalParser.nextFireTime(job.getCron(), config.getZone(), after);
        } catch (IllegalArgumentException e) {
            throw new SchedulerException(ErrorCode.INVALID_CRON, e.getMessage(), e);
        }
    }

    private void armCron(Job job) {
        try {
            cronTrigger.schedule(job.getId(), job.getCron());
        } catch (IllegalArgumentException e) {
            logger.error("[scheduler] failed to arm cron job id=%s msg=%s", job.getId(), e.getMessage(), e);
        }
    }

    private void cacheSet(Job job) {
        if (cache != null) {
            cache.set(job.getId(), job);
        }
    }

    // a concurrent removeJob deletes from the registry before the cache, so this re-check sees it
    private void cacheSetIfRegistered(Job job) {
        if (cache == null) {
            return;
        }
        cache.set(job.getId(), job);
        if (!isRegistered(job.getId())) {
            cache.delete(job.getId());
        }
    }

    // storage keeps millisecond precision
    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    private void countStorageError(RuntimeException e) {
        if (!(e instanceof SchedulerException se) || se.code().isStorage()) {
            metrics.recordStorageError();
        }
    }

    private int registrySize() {
        lock.readLock().lock();
        try {
            return registry.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
