package io.chrono4j;

import io.chrono4j.core.Job;

import java.time.Duration;
import java.time.Instant;

/**
 * Fluent builder for configuring a job before adding it to a scheduler.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an unregistered job</li>
 *   <li>save(): build() + {@link JobScheduler#addJob(Job)}</li>
 * </ul>
 * Without a recurrence the job runs once.
 */
public interface JobBuilder {

    JobBuilder id(String id);

    JobBuilder description(String description);

    /**
     * Name of the registered handler that executes this job.
     */
    JobBuilder handler(String handlerName);

    JobBuilder payload(String payload);

    /**
     * Run once at the given absolute time.
     */
    JobBuilder schedule(Instant time);

    /**
     * Repeat by cron expression (5 fields, or 6 with leading seconds).
     */
    JobBuilder cron(String expression);

    /**
     * Repeat at a fixed interval.
     */
    JobBuilder repeatEvery(Duration interval);

    /**
     * Repeat every X amount of time.
     * Accepts cron expressions, compact intervals ("100ms", "1m30s") or human-interval strings ("5 minutes").
     */
    JobBuilder repeatEvery(String intervalOrCron);

    JobBuilder maxRetry(int maxRetry);

    Job build();

    /**
     * @return the job as registered
     */
    Job save();
}
