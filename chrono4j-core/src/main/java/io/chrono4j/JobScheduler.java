package io.chrono4j;

import io.chrono4j.core.Job;
import io.chrono4j.core.JobStatus;
import io.chrono4j.core.Run;
import io.chrono4j.core.SchedulerException;
import io.chrono4j.metrics.SchedulerMetrics;

import java.util.List;
import java.util.Optional;

/**
 * Main scheduler API.
 *
 * <p>Jobs recur by cron expression, run once (now or at an absolute time) or repeat at a fixed interval.
 * Every method that returns a {@link Job} or {@link Run} returns a private copy. Domain failures are thrown
 * as {@link SchedulerException}.
 */
public interface JobScheduler {

    void registerHandler(String name, JobHandler handler);

    Optional<JobHandler> getHandler(String name);

    /**
     * Validates, persists and registers a job. The argument is not modified.
     *
     * @return the registered job, with id, status and first {@code nextRunAt} assigned
     */
    Job addJob(Job job);

    /**
     * Starts a builder for a job with the given name.
     */
    JobBuilder create(String name);

    void removeJob(String id);

    /**
     * Pausing an already paused job succeeds without change.
     */
    void pauseJob(String id);

    void resumeJob(String id);

    /**
     * Executes the job once, asynchronously, under its own timeout.
     */
    void triggerJob(String id);

    Job getJob(String id);

    List<Job> listJobs();

    List<Job> listJobs(JobStatus status);

    /**
     * Most recent runs first.
     */
    List<Run> getRuns(String jobId, int limit);

    long getRunCount(String jobId);

    void start();

    /**
     * Stops the background loops, cancels in-flight executions and waits for them to finish.
     */
    void stop();

    boolean isStarted();

    SchedulerMetrics getMetrics();
}
