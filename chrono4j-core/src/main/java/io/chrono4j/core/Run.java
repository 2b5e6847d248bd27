package io.chrono4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * One recorded execution attempt of a {@link Job}.
 *
 * <p>Created with status {@link RunStatus#RUNNING} when execution starts and finalized once when the
 * handler returns.
 */
public class Run {

    private String id;
    private String jobId;
    private RunStatus status;
    private Instant startAt;
    private Instant endAt;
    private String output;
    private String error;
    private long duration; // millis
    private String traceId;
    private Instant createdAt;

    public Run() {
    }

    public Run copy() {
        Run run = new Run();
        run.id = id;
        run.jobId = jobId;
        run.status = status;
        run.startAt = startAt;
        run.endAt = endAt;
        run.output = output;
        run.error = error;
        run.duration = duration;
        run.traceId = traceId;
        run.createdAt = createdAt;
        return run;
    }

    public boolean isFinished() {
        return status != null && status != RunStatus.RUNNING;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public RunStatus getStatus() {
        return status;
    }

    public void setStatus(RunStatus status) {
        this.status = status;
    }

    public Instant getStartAt() {
        return startAt;
    }

    public void setStartAt(Instant startAt) {
        this.startAt = startAt;
    }

    public Instant getEndAt() {
        return endAt;
    }

    public void setEndAt(Instant endAt) {
        this.endAt = endAt;
    }

    public String getOutput() {
        return output;
    }

    public void setOutput(String output) {
        this.output = output;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public long getDuration() {
        return duration;
    }

    public void setDuration(long duration) {
        this.duration = duration;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Run other)) return false;
        return duration == other.duration
                && Objects.equals(id, other.id)
                && Objects.equals(jobId, other.jobId)
                && status == other.status
                && Objects.equals(startAt, other.startAt)
                && Objects.equals(endAt, other.endAt)
                && Objects.equals(output, other.output)
                && Objects.equals(error, other.error)
                && Objects.equals(traceId, other.traceId)
                && Objects.equals(createdAt, other.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, jobId, status, startAt);
    }

    @Override
    public String toString() {
        return "Run{id=" + id + ", jobId=" + jobId + ", status=" + status + ", duration=" + duration + "ms}";
    }
}
