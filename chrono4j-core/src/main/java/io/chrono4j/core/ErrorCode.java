package io.chrono4j.core;

/**
 * Error codes carried by {@link SchedulerException}.
 */
public enum ErrorCode {

    JOB_NOT_FOUND(1001),
    JOB_ALREADY_EXISTS(1002),
    JOB_PAUSED(1003),
    JOB_RUNNING(1004),
    INVALID_CRON(1005),
    SCHEDULER_NOT_STARTED(1006),
    SCHEDULER_ALREADY_STARTED(1007),
    HANDLER_NOT_FOUND(1008),
    STORAGE_CLOSED(1009),
    EXECUTION_FAILED(1010),
    INVALID_JOB_NAME(1011),
    INVALID_PAYLOAD(1012),
    RUN_NOT_FOUND(1013),
    JOB_NOT_PAUSED(1014),
    INVALID_STATE(1015),
    STORAGE_FAILURE(1016),
    INVALID_INTERVAL(1017),
    INVALID_RETRY(1018);

    private final int value;

    ErrorCode(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public boolean isValidation() {
        return this == INVALID_CRON
                || this == INVALID_JOB_NAME
                || this == INVALID_PAYLOAD
                || this == INVALID_INTERVAL
                || this == INVALID_RETRY;
    }

    public boolean isConflict() {
        return this == JOB_PAUSED
                || this == JOB_RUNNING
                || this == JOB_NOT_PAUSED
                || this == INVALID_STATE
                || this == SCHEDULER_NOT_STARTED
                || this == SCHEDULER_ALREADY_STARTED;
    }

    public boolean isStorage() {
        return this == STORAGE_CLOSED || this == STORAGE_FAILURE;
    }
}
