package io.chrono4j.core;

import java.util.Objects;

/**
 * Domain error raised by the scheduler and by storage backends.
 *
 * <p>Handler failures are never surfaced through this type; they are captured in the run record.
 */
public class SchedulerException extends RuntimeException {

    private final ErrorCode code;

    public SchedulerException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    public SchedulerException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    public ErrorCode code() {
        return code;
    }

    public boolean is(ErrorCode other) {
        return code == other;
    }

    public static SchedulerException jobNotFound(String id) {
        return new SchedulerException(ErrorCode.JOB_NOT_FOUND, "job not found: " + id);
    }

    public static SchedulerException runNotFound(String id) {
        return new SchedulerException(ErrorCode.RUN_NOT_FOUND, "run not found: " + id);
    }

    public static SchedulerException jobAlreadyExists(String id) {
        return new SchedulerException(ErrorCode.JOB_ALREADY_EXISTS, "job already exists: " + id);
    }

    public static SchedulerException storageClosed() {
        return new SchedulerException(ErrorCode.STORAGE_CLOSED, "storage is closed");
    }

    public static SchedulerException handlerNotFound(String name) {
        return new SchedulerException(ErrorCode.HANDLER_NOT_FOUND, "handler not found: " + name);
    }
}
