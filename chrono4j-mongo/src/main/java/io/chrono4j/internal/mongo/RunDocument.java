package io.chrono4j.internal.mongo;

import io.chrono4j.core.Run;
import io.chrono4j.core.RunStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo document model for execution records.
 */
@Document(collection = MongoJobStorage.DEFAULT_RUN_COLLECTION)
public class RunDocument {

    @Id
    private String id;

    private String jobId;
    private RunStatus status;
    private Instant startAt;
    private Instant endAt;
    private String output;
    private String error;
    private long duration;
    private String traceId;
    private Instant createdAt;

    public RunDocument() {
    }

    static RunDocument from(Run run) {
        RunDocument doc = new RunDocument();
        doc.id = run.getId();
        doc.jobId = run.getJobId();
        doc.status = run.getStatus();
        doc.startAt = run.getStartAt();
        doc.endAt = run.getEndAt();
        doc.output = run.getOutput();
        doc.error = run.getError();
        doc.duration = run.getDuration();
        doc.traceId = run.getTraceId();
        doc.createdAt = run.getCreatedAt();
        return doc;
    }

    Run toRun() {
        Run run = new Run();
        run.setId(id);
        run.setJobId(jobId);
        run.setStatus(status);
        run.setStartAt(startAt);
        run.setEndAt(endAt);
        run.setOutput(output);
        run.setError(error);
        run.setDuration(duration);
        run.setTraceId(traceId);
        run.setCreatedAt(createdAt);
        return run;
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
}
