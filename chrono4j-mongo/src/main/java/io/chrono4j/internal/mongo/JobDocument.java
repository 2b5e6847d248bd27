package io.chrono4j.internal.mongo;

import io.chrono4j.core.Job;
import io.chrono4j.core.JobStatus;
import io.chrono4j.core.JobType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Duration;
import java.time.Instant;

/**
 * Mongo document model for persisted jobs.
 */
@Document(collection = MongoJobStorage.DEFAULT_JOB_COLLECTION)
public class JobDocument {

    @Id
    private String id;

    private String name;
    private String description;
    private JobType type;
    private String cron;
    private Long intervalMillis;
    private String handlerName;
    private String payload;
    private JobStatus status;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextRunAt;

    private Instant lastRunAt;
    private String lastResult;
    private int retryCount;
    private int maxRetry;
    private Instant createdAt;
    private Instant updatedAt;

    public JobDocument() {
    }

    static JobDocument from(Job job) {
        JobDocument doc = new JobDocument();
        doc.id = job.getId();
        doc.name = job.getName();
        doc.description = job.getDescription();
        doc.type = job.getType();
        doc.cron = job.getCron();
        doc.intervalMillis = job.getInterval() == null ? null : job.getInterval().toMillis();
        doc.handlerName = job.getHandlerName();
        doc.payload = job.getPayload();
        doc.status = job.getStatus();
        doc.nextRunAt = job.getNextRunAt();
        doc.lastRunAt = job.getLastRunAt();
        doc.lastResult = job.getLastResult();
        doc.retryCount = job.getRetryCount();
        doc.maxRetry = job.getMaxRetry();
        doc.createdAt = job.getCreatedAt();
        doc.updatedAt = job.getUpdatedAt();
        return doc;
    }

    Job toJob() {
        Job job = new Job();
        job.setId(id);
        job.setName(name);
        job.setDescription(description);
        job.setType(type);
        job.setCron(cron);
        job.setInterval(intervalMillis == null ? null : Duration.ofMillis(intervalMillis));
        job.setHandlerName(handlerName);
        job.setPayload(payload);
        job.setStatus(status);
        job.setNextRunAt(nextRunAt);
        job.setLastRunAt(lastRunAt);
        job.setLastResult(lastResult);
        job.setRetryCount(retryCount);
        job.setMaxRetry(maxRetry);
        job.setCreatedAt(createdAt);
        job.setUpdatedAt(updatedAt);
        return job;
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

    public Long getIntervalMillis() {
        return intervalMillis;
    }

    public void setIntervalMillis(Long intervalMillis) {
        this.intervalMillis = intervalMillis;
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
}
