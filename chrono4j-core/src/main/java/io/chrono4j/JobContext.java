package io.chrono4j;

import java.time.Instant;
import java.util.concurrent.CancellationException;

/**
 * Per-execution view handed to a {@link JobHandler}.
 */
public interface JobContext {

    String jobId();

    String jobName();

    String runId();

    /**
     * Trace id of the execution span, empty when tracing is disabled.
     */
    String traceId();

    /**
     * Instant after which the engine cancels this execution.
     */
    Instant deadline();

    boolean isCancelled();

    default void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("job " + jobName() + " (" + jobId() + ") was cancelled");
        }
    }
}
