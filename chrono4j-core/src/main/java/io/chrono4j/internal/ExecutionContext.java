package io.chrono4j.internal;

import io.chrono4j.JobContext;

import java.time.Instant;

/**
 * {@link JobContext} of one execution. Cancellation sets a flag and interrupts the thread currently running
 * the handler, if any.
 */
final class ExecutionContext implements JobContext {

    enum CancelReason { TIMEOUT, SHUTDOWN }

    private final String jobId;
    private final String jobName;
    private final String runId;
    private final String traceId;
    private final Instant deadline;

    private volatile CancelReason cancelReason;
    private Thread runner; // guarded by this

    ExecutionContext(String jobId, String jobName, String runId, String traceId, Instant deadline) {
        this.jobId = jobId;
        this.jobName = jobName;
        this.runId = runId;
        this.traceId = traceId == null ? "" : traceId;
        this.deadline = deadline;
    }

    @Override
    public String jobId() {
        return jobId;
    }

    @Override
    public String jobName() {
        return jobName;
    }

    @Override
    public String runId() {
        return runId;
    }

    @Override
    public String traceId() {
        return traceId;
    }

    @Override
    public Instant deadline() {
        return deadline;
    }

    @Override
    public boolean isCancelled() {
        return cancelReason != null;
    }

    CancelReason cancelReason() {
        return cancelReason;
    }

    synchronized void attach(Thread thread) {
        runner = thread;
        if (cancelReason != null) {
            thread.interrupt();
        }
    }

    synchronized void detach() {
        runner = null;
    }

    synchronized void cancel(CancelReason reason) {
        if (cancelReason != null) {
            return;
        }
        cancelReason = reason;
        if (runner != null) {
            runner.interrupt();
        }
    }
}
