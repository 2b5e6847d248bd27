package io.chrono4j;

/**
 * Executes the work bound to a job.
 *
 * <p>Returning normally records a successful run with the returned string as output. Throwing records a
 * failed run and drives the retry policy; the exception never reaches the caller of the scheduler.
 * Handlers should check {@link JobContext#isCancelled()} or react to interruption when the job times out.
 */
@FunctionalInterface
public interface JobHandler {

    String execute(JobContext context, String payload) throws Exception;
}
