package io.chrono4j.storage;

import io.chrono4j.core.Job;
import io.chrono4j.core.JobStatus;
import io.chrono4j.core.Run;
import io.chrono4j.core.SchedulerException;

import java.util.List;

/**
 * Persistence boundary for jobs and their runs.
 *
 * <p>Implementations must be thread-safe and must never hand out or retain references to caller objects:
 * writes store copies and reads return copies. Failures are reported as {@link SchedulerException}.
 * Backends stamp the audit fields ({@code createdAt}, {@code updatedAt}) on the argument as well as on the
 * stored copy, so the caller's object matches what a later read returns.
 */
public interface JobStorage extends AutoCloseable {

    int DEFAULT_RUN_LIMIT = 10;

    /**
     * @throws SchedulerException {@code JOB_ALREADY_EXISTS} when the id is taken
     */
    void createJob(Job job);

    /**
     * @throws SchedulerException {@code JOB_NOT_FOUND} when absent
     */
    Job getJob(String id);

    /**
     * Replaces the stored job with the same id.
     *
     * @throws SchedulerException {@code JOB_NOT_FOUND} when absent
     */
    void updateJob(Job job);

    /**
     * Deletes the job and all its runs.
     *
     * @throws SchedulerException {@code JOB_NOT_FOUND} when absent
     */
    void deleteJob(String id);

    /**
     * @param status filter, or {@code null} for all jobs
     */
    List<Job> listJobs(JobStatus status);

    /**
     * Inserts a run, assigning a random id to the argument when it has none.
     */
    void createRun(Run run);

    /**
     * @throws SchedulerException {@code RUN_NOT_FOUND} when absent
     */
    void updateRun(Run run);

    /**
     * Most recent runs first.
     *
     * @param limit maximum number of runs, {@link #DEFAULT_RUN_LIMIT} when {@code <= 0}
     */
    List<Run> getRuns(String jobId, int limit);

    long getRunCount(String jobId);

    /**
     * Health check.
     *
     * @throws SchedulerException {@code STORAGE_CLOSED} or {@code STORAGE_FAILURE} when unusable
     */
    void ping();

    /**
     * Marks the storage closed; every later call fails with {@code STORAGE_CLOSED}.
     */
    @Override
    void close();
}
