package io.chrono4j.core;

public enum JobStatus {
    PENDING,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED;

    /**
     * Completed and failed jobs are never dispatched again unless explicitly re-added.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
