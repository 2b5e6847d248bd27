package io.chrono4j.internal;

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
import io.chrono4j.logging.NopJobLogger;
import io.chrono4j.storage.InMemoryJobStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class DefaultJobSchedulerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private InMemoryJobStorage storage;
    private DefaultJobScheduler scheduler;

    @BeforeEach
    void setUp() {
        storage = new InMemoryJobStorage();
        scheduler = newScheduler(baseConfig());
        scheduler.registerHandler("noop", (ctx, payload) -> "ok");
    }

    @AfterEach
    void tearDown() {
        if (scheduler.isStarted()) {
            scheduler.stop();
        }
    }

    private static SchedulerConfig baseConfig() {
        return SchedulerConfig.defaults()
                .setTickInterval(Duration.ofMillis(20))
                .setRetryDelay(Duration.ofMillis(50))
                .setJobTimeout(Duration.ofSeconds(2))
                .setLogger(NopJobLogger.INSTANCE);
    }

    private DefaultJobScheduler newScheduler(SchedulerConfig config) {
        return new DefaultJobScheduler(storage, config);
    }

    private JobStatus storedStatus(String id) {
        return storage.getJob(id).getStatus();
    }

    @Test
    void addJobShouldPersistPendingJob() {
        Job added = scheduler.create("report").handler("noop").payload("{}").repeatEvery(Duration.ofMinutes(5)).save();

        assertNotNull(added.getId());
        assertEquals(JobStatus.PENDING, added.getStatus());
        assertThat(added.getNextRunAt()).isAfter(Instant.now().plusSeconds(200));
        assertEquals(added, scheduler.getJob(added.getId()));
        assertEquals(1L, scheduler.getMetrics().snapshot().get("total_jobs"));
    }

    @Test
    void addJobShouldRejectUnknownHandlerAndBadDefinitions() {
        SchedulerException noHandler = assertThrows(SchedulerException.class,
                () -> scheduler.create("x").handler("missing").save());
        assertEquals(ErrorCode.HANDLER_NOT_FOUND, noHandler.code());

        SchedulerException badCron = assertThrows(SchedulerException.class,
                () -> scheduler.create("x").handler("noop").cron("every day").save());
        assertEquals(ErrorCode.INVALID_CRON, badCron.code());

        assertThat(scheduler.listJobs()).isEmpty();
    }

    @Test
    void duplicateIdShouldBeRejected() {
        scheduler.create("a").id("fixed").handler("noop").schedule(Instant.now().plusSeconds(60)).save();
        SchedulerException ex = assertThrows(SchedulerException.class,
                () -> scheduler.create("b").id("fixed").handler("noop").save());
        assertEquals(ErrorCode.JOB_ALREADY_EXISTS, ex.code());
    }

    @Test
    void builderShouldAcceptIntervalTextOrCron() {
        Job interval = scheduler.create("i").handler("noop").repeatEvery("1m30s").save();
        assertEquals(JobType.INTERVAL, interval.getType());
        assertEquals(Duration.ofSeconds(90), interval.getInterval());

        Job cron = scheduler.create("c").handler("noop").repeatEvery("*/5 * * * *").save();
        assertEquals(JobType.CRON, cron.getType());
        assertNotNull(cron.getNextRunAt());
    }

    @Test
    void pauseAndResumeShouldToggleStatus() {
        Job job = scheduler.create("p").handler("noop").repeatEvery(Duration.ofMinutes(1)).save();

        scheduler.pauseJob(job.getId());
        assertEquals(JobStatus.PAUSED, storedStatus(job.getId()));
        scheduler.pauseJob(job.getId());
        assertEquals(JobStatus.PAUSED, storedStatus(job.getId()));

        scheduler.resumeJob(job.getId());
        assertEquals(JobStatus.PENDING, storedStatus(job.getId()));
        assertThat(scheduler.getJob(job.getId()).getNextRunAt()).isAfter(Instant.now());

        SchedulerException ex = assertThrows(SchedulerException.class, () -> scheduler.resumeJob(job.getId()));
        assertEquals(ErrorCode.JOB_NOT_PAUSED, ex.code());
    }

    @Test
    void unknownJobOperationsShouldRaiseNotFound() {
        assertEquals(ErrorCode.JOB_NOT_FOUND, assertThrows(SchedulerException.class,
                () -> scheduler.pauseJob("missing")).code());
        assertEquals(ErrorCode.JOB_NOT_FOUND, assertThrows(SchedulerException.class,
                () -> scheduler.resumeJob("missing")).code());
        assertEquals(ErrorCode.JOB_NOT_FOUND, assertThrows(SchedulerException.class,
                () -> scheduler.removeJob("missing")).code());
        assertEquals(ErrorCode.JOB_NOT_FOUND, assertThrows(SchedulerException.class,
                () -> scheduler.getJob("missing")).code());
    }

    @Test
    void removeJobShouldDeleteJobAndRuns() {
        Job job = scheduler.create("r").handler("noop").save();
        scheduler.start();
        await().atMost(WAIT).until(() -> storedStatus(job.getId()) == JobStatus.COMPLETED);

        scheduler.removeJob(job.getId());

        assertThrows(SchedulerException.class, () -> scheduler.getJob(job.getId()));
        assertEquals(0, scheduler.getRunCount(job.getId()));
    }

    @Test
    void onceJobShouldRunAndComplete() {
        scheduler.registerHandler("echo", (ctx, payload) -> "got " + payload);
        Job job = scheduler.create("once").handler("echo").payload("hello").save();

        scheduler.start();
        await().atMost(WAIT).until(() -> storedStatus(job.getId()) == JobStatus.COMPLETED);

        Job done = scheduler.getJob(job.getId());
        assertEquals("got hello", done.getLastResult());
        assertNotNull(done.getLastRunAt());
        List<Run> runs = scheduler.getRuns(job.getId(), 10);
        assertEquals(1, runs.size());
        assertEquals(RunStatus.SUCCESS, runs.get(0).getStatus());
        assertEquals("got hello", runs.get(0).getOutput());
        assertNotNull(runs.get(0).getEndAt());
    }

    @Test
    void failingJobShouldRetryUntilSuccess() {
        AtomicInteger attempts = new AtomicInteger();
        scheduler.registerHandler("flaky", (ctx, payload) -> {
            if (attempts.incrementAndGet() <= 2) {
                throw new IllegalStateException("boom " + attempts.get());
            }
            return "finally";
        });
        Job job = scheduler.create("flaky").handler("flaky").maxRetry(3)
                .schedule(Instant.now().plus(Duration.ofHours(1))).save();

        scheduler.start();
        scheduler.triggerJob(job.getId());
        await().atMost(WAIT).until(() -> storedStatus(job.getId()) == JobStatus.COMPLETED);

        List<Run> runs = scheduler.getRuns(job.getId(), 10);
        assertThat(runs).extracting(Run::getStatus)
                .containsExactly(RunStatus.SUCCESS, RunStatus.FAILED, RunStatus.FAILED);
        assertEquals("boom 1", runs.get(2).getError());
        assertEquals("boom 2", runs.get(1).getError());
        assertEquals(3, attempts.get());
        assertEquals(2, storage.getJob(job.getId()).getRetryCount());
        assertEquals(2L, scheduler.getMetrics().getHandlerErrors());
    }

    @Test
    void exhaustedRetriesShouldFailJob() {
        scheduler.registerHandler("broken", (ctx, payload) -> {
            throw new IllegalStateException("always");
        });
        Job job = scheduler.create("broken").handler("broken").maxRetry(1).save();

        scheduler.start();
        await().atMost(WAIT).until(() -> storedStatus(job.getId()) == JobStatus.FAILED);

        Job failed = storage.getJob(job.getId());
        assertEquals("always", failed.getLastResult());
        assertEquals(1, failed.getRetryCount());
        assertEquals(2, scheduler.getRunCount(job.getId()));
    }

    @Test
    void intervalJobShouldRunRepeatedly() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        scheduler.registerHandler("count", (ctx, payload) -> String.valueOf(calls.incrementAndGet()));
        Job job = scheduler.create("tick").handler("count").repeatEvery(Duration.ofMillis(100)).save();

        scheduler.start();
        Thread.sleep(350);
        // one tick of slack for the third run
        await().atMost(Duration.ofMillis(60)).until(() -> calls.get() >= 3);
        scheduler.stop();

        assertThat(calls.get()).isBetween(3, 4);
        List<Instant> starts = scheduler.getRuns(job.getId(), 10).stream()
                .filter(run -> run.getStatus() == RunStatus.SUCCESS)
                .map(Run::getStartAt)
                .sorted()
                .toList();
        assertThat(starts).hasSizeGreaterThanOrEqualTo(3);
        for (int i = 1; i < starts.size(); i++) {
            assertThat(Duration.between(starts.get(i - 1), starts.get(i)).toMillis()).isBetween(80L, 200L);
        }
        Job stored = storage.getJob(job.getId());
        assertEquals(JobStatus.PENDING, stored.getStatus());
        assertThat(stored.getNextRunAt()).isAfter(stored.getLastRunAt());
    }

    @Test
    void slowHandlerShouldTimeOut() {
        scheduler = newScheduler(baseConfig().setJobTimeout(Duration.ofMillis(100)));
        scheduler.registerHandler("slow", (ctx, payload) -> {
            Thread.sleep(5_000);
            return "late";
        });
        Job job = scheduler.create("slow").handler("slow").save();

        scheduler.start();
        await().atMost(WAIT).until(() -> storedStatus(job.getId()) == JobStatus.FAILED);

        Run run = scheduler.getRuns(job.getId(), 1).get(0);
        assertEquals(RunStatus.FAILED, run.getStatus());
        assertThat(run.getError()).contains("timed out");
        assertEquals(1L, scheduler.getMetrics().getTimeoutErrors());
    }

    @Test
    void handlerShouldSeeItsContext() {
        CountDownLatch seen = new CountDownLatch(1);
        String[] captured = new String[2];
        scheduler.registerHandler("ctx", (ctx, payload) -> {
            captured[0] = ctx.jobName();
            captured[1] = ctx.runId();
            seen.countDown();
            return "";
        });
        Job job = scheduler.create("ctx-job").handler("ctx").save();

        scheduler.start();
        await().atMost(WAIT).until(() -> seen.getCount() == 0);
        await().atMost(WAIT).until(() -> storedStatus(job.getId()) == JobStatus.COMPLETED);

        assertEquals("ctx-job", captured[0]);
        assertEquals(scheduler.getRuns(job.getId(), 1).get(0).getId(), captured[1]);
    }

    @Test
    void triggerShouldRespectState() throws Exception {
        Job job = scheduler.create("t").handler("noop").repeatEvery(Duration.ofHours(1)).save();
        SchedulerException notStarted = assertThrows(SchedulerException.class, () -> scheduler.triggerJob(job.getId()));
        assertEquals(ErrorCode.SCHEDULER_NOT_STARTED, notStarted.code());

        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch entered = new CountDownLatch(1);
        scheduler.registerHandler("block", (ctx, payload) -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "released";
        });
        Job blocking = scheduler.create("b").handler("block").repeatEvery(Duration.ofHours(1)).save();
        scheduler.start();

        scheduler.triggerJob(blocking.getId());
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        SchedulerException running = assertThrows(SchedulerException.class, () -> scheduler.triggerJob(blocking.getId()));
        assertEquals(ErrorCode.JOB_RUNNING, running.code());
        SchedulerException pauseRunning = assertThrows(SchedulerException.class, () -> scheduler.pauseJob(blocking.getId()));
        assertEquals(ErrorCode.JOB_RUNNING, pauseRunning.code());
        release.countDown();

        scheduler.pauseJob(job.getId());
        SchedulerException paused = assertThrows(SchedulerException.class, () -> scheduler.triggerJob(job.getId()));
        assertEquals(ErrorCode.JOB_PAUSED, paused.code());

        scheduler.resumeJob(job.getId());
        scheduler.triggerJob(job.getId());
        await().atMost(WAIT).until(() -> scheduler.getRunCount(job.getId()) == 1);
        await().atMost(WAIT).until(() -> scheduler.getRunCount(blocking.getId()) == 1
                && storedStatus(blocking.getId()) == JobStatus.PENDING);
        assertEquals("released", storage.getJob(blocking.getId()).getLastResult());
    }

    @Test
    void triggeredCronJobShouldStayScheduled() {
        Job job = scheduler.create("yearly").handler("noop").cron("0 0 1 1 *").save();
        scheduler.start();

        scheduler.triggerJob(job.getId());

        await().atMost(WAIT).until(() -> scheduler.getRunCount(job.getId()) == 1
                && storedStatus(job.getId()) == JobStatus.PENDING
                && "ok".equals(storage.getJob(job.getId()).getLastResult()));
        assertThat(storage.getJob(job.getId()).getNextRunAt()).isAfter(Instant.now());
    }

    @Test
    void storageFailureOnAddShouldLeaveNothingBehind() {
        storage = spy(new InMemoryJobStorage());
        doThrow(new SchedulerException(ErrorCode.STORAGE_FAILURE, "disk full")).when(storage).createJob(any());
        scheduler = newScheduler(baseConfig());
        scheduler.registerHandler("noop", (ctx, payload) -> "ok");

        SchedulerException ex = assertThrows(SchedulerException.class,
                () -> scheduler.create("x").handler("noop").save());

        assertEquals(ErrorCode.STORAGE_FAILURE, ex.code());
        assertThat(scheduler.listJobs()).isEmpty();
        assertEquals(0L, scheduler.getMetrics().snapshot().get("total_jobs"));
        assertEquals(0L, scheduler.getMetrics().snapshot().get("heap_size"));
        assertEquals(1L, scheduler.getMetrics().getStorageErrors());
    }

    @Test
    void storageFailureOnPauseShouldKeepJobPending() {
        Job job = scheduler.create("p").handler("noop").repeatEvery(Duration.ofMinutes(1)).save();
        storage = spy(storage);
        scheduler = newScheduler(baseConfig());
        scheduler.registerHandler("noop", (ctx, payload) -> "ok");
        scheduler.start();
        doThrow(new SchedulerException(ErrorCode.STORAGE_FAILURE, "disk full")).when(storage).updateJob(any());

        assertThrows(SchedulerException.class, () -> scheduler.pauseJob(job.getId()));

        assertEquals(JobStatus.PENDING, storage.getJob(job.getId()).getStatus());
        assertEquals(1L, scheduler.getMetrics().snapshot().get("heap_size"));
    }

    @Test
    void startShouldRecoverInterruptedJobs() {
        Job stuck = new Job();
        stuck.setId("stuck");
        stuck.setName("stuck");
        stuck.setHandlerName("noop");
        stuck.setType(JobType.ONCE);
        stuck.setStatus(JobStatus.RUNNING);
        stuck.setNextRunAt(Instant.now().minusSeconds(10));
        storage.createJob(stuck);

        scheduler.start();

        await().atMost(WAIT).until(() -> storedStatus("stuck") == JobStatus.COMPLETED);
        assertEquals(1, scheduler.getRunCount("stuck"));
    }

    @Test
    void startAndStopShouldNotBeRepeatable() {
        assertThrows(SchedulerException.class, scheduler::stop);
        scheduler.start();
        assertTrue(scheduler.isStarted());

        SchedulerException again = assertThrows(SchedulerException.class, scheduler::start);
        assertEquals(ErrorCode.SCHEDULER_ALREADY_STARTED, again.code());

        scheduler.stop();
        assertFalse(scheduler.isStarted());
        SchedulerException stopped = assertThrows(SchedulerException.class, scheduler::stop);
        assertEquals(ErrorCode.SCHEDULER_NOT_STARTED, stopped.code());
    }

    @Test
    void schedulerShouldRestartAfterStop() {
        scheduler.start();
        scheduler.stop();

        Job job = scheduler.create("later").handler("noop").save();
        scheduler.start();

        await().atMost(WAIT).until(() -> storedStatus(job.getId()) == JobStatus.COMPLETED);
    }

    @Test
    void stopShouldCancelRunningHandlers() throws InterruptedException {
        CountDownLatch entered = new CountDownLatch(1);
        scheduler.registerHandler("forever", (ctx, payload) -> {
            entered.countDown();
            while (!ctx.isCancelled()) {
                Thread.sleep(10);
            }
            ctx.throwIfCancelled();
            return "unreachable";
        });
        Job job = scheduler.create("forever").handler("forever").save();
        scheduler.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        scheduler.stop();

        Run run = scheduler.getRuns(job.getId(), 1).get(0);
        assertEquals(RunStatus.FAILED, run.getStatus());
    }

    @Test
    void cacheAndBatchModesShouldPersistResults() {
        scheduler = newScheduler(baseConfig()
                .setEnableCache(true)
                .setEnableBatchUpdate(true)
                .setBatchSize(2)
                .setBatchFlushInterval(Duration.ofMillis(50)));
        scheduler.registerHandler("noop", (ctx, payload) -> "ok");
        Job first = scheduler.create("a").handler("noop").save();
        Job second = scheduler.create("b").handler("noop").save();

        scheduler.start();
        await().atMost(WAIT).until(() -> storedStatus(first.getId()) == JobStatus.COMPLETED
                && storedStatus(second.getId()) == JobStatus.COMPLETED);

        assertEquals(JobStatus.COMPLETED, scheduler.getJob(first.getId()).getStatus());
        await().atMost(WAIT).until(() -> scheduler.getMetrics().getBatchJobUpdates() >= 2);
        assertThat(scheduler.getMetrics().getCacheHits()).isGreaterThanOrEqualTo(1);
        assertEquals(2, scheduler.getCacheStats().get("size"));
    }

    @Test
    void openShouldHonorAutoStart() {
        JobHandlerRegistry handlers = new JobHandlerRegistry();
        handlers.register("noop", (ctx, payload) -> "ok");

        DefaultJobScheduler manual = DefaultJobScheduler.open(storage, baseConfig(), handlers);
        assertFalse(manual.isStarted());

        scheduler = DefaultJobScheduler.open(storage, baseConfig().setAutoStart(true), handlers);
        assertTrue(scheduler.isStarted());
    }

    @Test
    void jobSchedulerInterfaceShouldExposeHandlers() {
        JobScheduler api = scheduler;
        assertTrue(api.getHandler("noop").isPresent());
        assertFalse(api.getHandler("nope").isPresent());
    }

    @Test
    void handlerErrorShouldFailRunInsteadOfStickingRunning() {
        scheduler.registerHandler("assert", (ctx, payload) -> {
            throw new AssertionError("boom");
        });
        Job job = scheduler.create("assert").handler("assert").maxRetry(0)
                .schedule(Instant.now().plus(Duration.ofHours(1))).save();

        scheduler.start();
        scheduler.triggerJob(job.getId());
        await().atMost(WAIT).until(() -> storedStatus(job.getId()) == JobStatus.FAILED);

        Run run = scheduler.getRuns(job.getId(), 1).get(0);
        assertEquals(RunStatus.FAILED, run.getStatus());
        assertEquals("boom", run.getError());
        assertEquals(1L, scheduler.getMetrics().getHandlerErrors());
        assertEquals(JobStatus.FAILED, scheduler.getJob(job.getId()).getStatus());
    }

    @Test
    void jobRemovedDuringRunShouldNotReturnThroughTheCache() throws InterruptedException {
        scheduler = newScheduler(baseConfig().setEnableCache(true));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        scheduler.registerHandler("block", (ctx, payload) -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "done";
        });
        Job job = scheduler.create("doomed").handler("block").save();

        scheduler.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        scheduler.removeJob(job.getId());
        release.countDown();

        await().atMost(WAIT).until(() -> scheduler.getMetrics().snapshot().get("completed_jobs") == 1L);
        SchedulerException gone = assertThrows(SchedulerException.class, () -> scheduler.getJob(job.getId()));
        assertEquals(ErrorCode.JOB_NOT_FOUND, gone.code());
        assertThrows(SchedulerException.class, () -> storage.getJob(job.getId()));
        assertEquals(0, scheduler.getCacheStats().get("size"));
        assertEquals(0L, scheduler.getRunCount(job.getId()));
    }

    @Test
    void cronJobWithoutFreeSlotShouldNotEnterTheHeap() throws InterruptedException {
        RecordingLogger logger = new RecordingLogger();
        scheduler = newScheduler(baseConfig().setConcurrentRuns(1).setLogger(logger));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        scheduler.registerHandler("noop", (ctx, payload) -> "ok");
        scheduler.registerHandler("block", (ctx, payload) -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "done";
        });
        Job yearly = scheduler.create("yearly").handler("noop").cron("0 0 1 1 *").save();
        scheduler.create("busy").handler("block").save();

        scheduler.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        scheduler.triggerJob(yearly.getId());

        await().atMost(WAIT).until(() -> logger.warnings().stream().anyMatch(m -> m.contains("re-queued")));
        assertEquals(0L, scheduler.getMetrics().snapshot().get("heap_size"));
        assertEquals(JobStatus.PENDING, storedStatus(yearly.getId()));
        assertEquals(0L, scheduler.getRunCount(yearly.getId()));
        release.countDown();
    }

    @Test
    void pausedJobInStorageShouldNotBeAdoptedByTrigger() {
        Job external = new Job();
        external.setId("external");
        external.setName("external");
        external.setHandlerName("noop");
        external.setType(JobType.ONCE);
        external.setStatus(JobStatus.PAUSED);
        external.setNextRunAt(Instant.now().minusSeconds(1));
        scheduler.start();
        storage.createJob(external);

        SchedulerException paused = assertThrows(SchedulerException.class, () -> scheduler.triggerJob("external"));
        assertEquals(ErrorCode.JOB_PAUSED, paused.code());

        // once resumed elsewhere, the stored state is what a later trigger sees
        Job resumed = storage.getJob("external");
        resumed.setStatus(JobStatus.PENDING);
        storage.updateJob(resumed);
        scheduler.triggerJob("external");

        await().atMost(WAIT).until(() -> storedStatus("external") == JobStatus.COMPLETED);
        assertEquals(1L, scheduler.getRunCount("external"));
    }

    private static final class RecordingLogger implements JobLogger {

        private final List<String> warnings = new CopyOnWriteArrayList<>();

        List<String> warnings() {
            return warnings;
        }

        @Override
        public void debug(String msg, Object... args) {
        }

        @Override
        public void info(String msg, Object... args) {
        }

        @Override
        public void warn(String msg, Object... args) {
            warnings.add(String.format(msg, args));
        }

        @Override
        public void error(String msg, Object... args) {
        }
    }
}
