package io.chrono4j.core;

import io.chrono4j.utils.IntervalParser;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A schedulable unit of work.
 *
 * <p>Instances are mutable and not thread-safe. The scheduler, the cache, storage backends and callers
 * each hold their own copy; copies are exchanged through {@link #copy()}, never by sharing a reference.
 */
public class Job {

    public static final int MAX_JOB_NAME_LENGTH = 128;
    public static final int MAX_HANDLER_NAME_LENGTH = 128;
    public static final int MAX_PAYLOAD_LENGTH = 65535;

    private String id;
    private String name;
    private String description;

    // scheduling
    private JobType type;
    private String cron;
    private Duration interval;

    // execution binding
    private String handlerName;
    private String payload;

    // runtime state
    private JobStatus status;
    private Instant nextRunAt;
    private Instant lastRunAt;
    private String lastResult;
    private int retryCount;
    private int maxRetry;

    private Instant createdAt;
    private Instant updatedAt;

    public Job() {
    }

    /**
     * Returns an independent copy. Every field is an immutable value, so a field-wise copy is a deep copy.
     */
    public Job copy() {
        Job job = new Job();
        job.id = id;
        job.name = name;
        job.description = description;
        job.type = type;
        job.cron = cron;
        job.interval = interval;
        job.handlerName = handlerName;
        job.payload = payload;
        job.status = status;
        job.nextRunAt = nextRunAt;
        job.lastRunAt = lastRunAt;
        job.lastResult = lastResult;
        job.retryCount = retryCount;
        job.maxRetry = maxRetry;
        job.createdAt = createdAt;
        job.updatedAt = updatedAt;
        return job;
    }

    /**
     * Checks the static parts of the job definition.
     *
     * @throws SchedulerException with a validation {@link ErrorCode} when the definition is rejected
     */
    public void validate() {
        if (isBlank(name)) {
            throw new SchedulerException(ErrorCode.INVALID_JOB_NAME, "job name is required");
        }
        if (name.length() > MAX_JOB_NAME_LENGTH) {
            throw new SchedulerException(ErrorCode.INVALID_JOB_NAME, "job name too long (max " + MAX_JOB_NAME_LENGTH + ")");
        }
        if (isBlank(handlerName)) {
            throw new SchedulerException(ErrorCode.HANDLER_NOT_FOUND, "handler name is required");
        }
        if (handlerName.length() > MAX_HANDLER_NAME_LENGTH) {
            throw new SchedulerException(ErrorCode.HANDLER_NOT_FOUND, "handler name too long (max " + MAX_HANDLER_NAME_LENGTH + ")");
        }
        if (type == null) {
            throw new SchedulerException(ErrorCode.INVALID_CRON, "job type is required");
        }
        if (type == JobType.CRON) {
            if (isBlank(cron)) {
                throw new SchedulerException(ErrorCode.INVALID_CRON, "cron expression is required for cron job");
            }
            if (!IntervalParser.looksLikeCron(cron)) {
                throw new SchedulerException(ErrorCode.INVALID_CRON, "invalid cron expression format: " + cron);
            }
        }
        if (type == JobType.INTERVAL && (interval == null || interval.isZero() || interval.isNegative())) {
            throw new SchedulerException(ErrorCode.INVALID_INTERVAL, "interval is required for interval job");
        }
        if (payload != null && payload.length() > MAX_PAYLOAD_LENGTH) {
            throw new SchedulerException(ErrorCode.INVALID_PAYLOAD, "payload too long (max " + MAX_PAYLOAD_LENGTH + ")");
        }
        if (maxRetry < 0) {
            throw new SchedulerException(ErrorCode.INVALID_RETRY, "max retry cannot be negative");
        }
    }

    public boolean isCron() {
        return type == JobType.CRON;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public JobType getType() {
        return type;
    }

    public void setType(JobType type) {
        this.type = type;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }

    public Duration getInterval() {
        return interval;
    }

    public void setInterval(Duration interval) {
        this.interval = interval;
    }

    public String getHandlerName() {
        return handlerName;
    }

    public void setHandlerName(String handlerName) {
        this.handlerName = handlerName;
    }

    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public String getLastResult() {
        return lastResult;
    }

    public void setLastResult(String lastResult) {
        this.lastResult = lastResult;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public int getMaxRetry() {
        return maxRetry;
    }

    public void setMaxRetry(int maxRetry) {
        this.maxRetry = maxRetry;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Job other)) return false;
        return retryCount == other.retryCount
                && maxRetry == other.maxRetry
                && Objects.equals(id, other.id)
                && Objects.equals(name, other.name)
                && Objects.equals(description, other.description)
                && type == other.type
                && Objects.equals(cron, other.cron)
                && Objects.equals(interval, other.interval)
                && Objects.equals(handlerName, other.handlerName)
                && Objects.equals(payload, other.payload)
                && status == other.status
                && Objects.equals(nextRunAt, other.nextRunAt)
                && Objects.equals(lastRunAt, other.lastRunAt)
                && Objects.equals(lastResult, other.lastResult)
                && Objects.equals(createdAt, other.createdAt)
                && Objects.equals(updatedAt, other.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, type, status, nextRunAt, retryCount);
    }

    @Override
    public String toString() {
        return "Job{id=" + id
                + ", name=" + name
                + ", type=" + type
                + ", status=" + status
                + ", handler=" + handlerName
                + ", nextRunAt=" + nextRunAt
                + ", retry=" + retryCount + "/" + maxRetry
                + '}';
    }
}
