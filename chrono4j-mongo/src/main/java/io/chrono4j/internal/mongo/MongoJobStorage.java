package io.chrono4j.internal.mongo;

import com.mongodb.bulk.BulkWriteResult;
import com.mongodb.client.result.UpdateResult;
import io.chrono4j.core.ErrorCode;
import io.chrono4j.core.Job;
import io.chrono4j.core.JobStatus;
import io.chrono4j.core.Run;
import io.chrono4j.core.SchedulerException;
import io.chrono4j.storage.BatchJobStorage;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * MongoDB persistence for jobs and runs.
 *
 * <p>Jobs and runs live in two collections, {@value #DEFAULT_JOB_COLLECTION} and
 * {@value #DEFAULT_RUN_COLLECTION} unless configured otherwise. Every driver error is reported as a
 * {@link SchedulerException} with {@link ErrorCode#STORAGE_FAILURE}. Timestamps are kept at millisecond
 * precision, the precision of a BSON date.
 *
 * <p>The {@link MongoTemplate} belongs to the caller; {@link #close()} only stops this storage from
 * accepting calls.
 */
public class MongoJobStorage implements BatchJobStorage {

    private static final Logger log = LoggerFactory.getLogger(MongoJobStorage.class);

    public static final String DEFAULT_JOB_COLLECTION = "chrono_jobs";
    public static final String DEFAULT_RUN_COLLECTION = "chrono_runs";

    private final MongoTemplate mongoTemplate;
    private final String jobCollection;
    private final String runCollection;

    private volatile boolean closed;

    public MongoJobStorage(MongoTemplate mongoTemplate) {
        this(mongoTemplate, DEFAULT_JOB_COLLECTION, DEFAULT_RUN_COLLECTION);
    }

    public MongoJobStorage(MongoTemplate mongoTemplate, String jobCollection, String runCollection) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        if (isBlank(jobCollection) || isBlank(runCollection)) {
            throw new IllegalArgumentException("collection names must not be blank");
        }
        this.jobCollection = jobCollection;
        this.runCollection = runCollection;
    }

    public String getJobCollection() {
        return jobCollection;
    }

    public String getRunCollection() {
        return runCollection;
    }

    // ------------------------------------------------------------------ jobs

    @Override
    public void createJob(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        execute("create job " + job.getId(), () -> {
            Instant now = now();
            if (job.getCreatedAt() == null) {
                job.setCreatedAt(now);
            }
            job.setUpdatedAt(now);
            truncate(job);
            try {
                mongoTemplate.insert(JobDocument.from(job), jobCollection);
            } catch (DuplicateKeyException e) {
                throw SchedulerException.jobAlreadyExists(job.getId());
            }
            return null;
        });
    }

    @Override
    public Job getJob(String id) {
        return execute("get job " + id, () -> {
            JobDocument doc = mongoTemplate.findById(id, JobDocument.class, jobCollection);
            if (doc == null) {
                throw SchedulerException.jobNotFound(id);
            }
            return doc.toJob();
        });
    }

    @Override
    public void updateJob(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        execute("update job " + job.getId(), () -> {
            prepareJobUpdate(job, now());
            UpdateResult result = mongoTemplate.updateFirst(byId(job.getId()), jobUpdate(JobDocument.from(job)),
                    JobDocument.class, jobCollection);
            if (result.getMatchedCount() == 0) {
                throw SchedulerException.jobNotFound(job.getId());
            }
            return null;
        });
    }

    @Override
    public void deleteJob(String id) {
        execute("delete job " + id, () -> {
            long deleted = mongoTemplate.remove(byId(id), JobDocument.class, jobCollection).getDeletedCount();
            if (deleted == 0) {
                throw SchedulerException.jobNotFound(id);
            }
            long runs = mongoTemplate.remove(byJobId(id), RunDocument.class, runCollection).getDeletedCount();
            log.debug("[mongo] deleted job id={} runs={}", id, runs);
            return null;
        });
    }

    @Override
    public List<Job> listJobs(JobStatus status) {
        return execute("list jobs", () -> {
            Query q = status == null ? new Query() : new Query(Criteria.where("status").is(status));
            q.with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("_id")));
            List<JobDocument> docs = mongoTemplate.find(q, JobDocument.class, jobCollection);
            List<Job> jobs = new ArrayList<>(docs.size());
            for (JobDocument doc : docs) {
                jobs.add(doc.toJob());
            }
            return jobs;
        });
    }

    // ------------------------------------------------------------------ runs

    @Override
    public void createRun(Run run) {
        Objects.requireNonNull(run, "run must not be null");
        execute("create run", () -> {
            if (isBlank(run.getId())) {
                run.setId(UUID.randomUUID().toString());
            }
            if (run.getCreatedAt() == null) {
                run.setCreatedAt(now());
            }
            truncate(run);
            try {
                mongoTemplate.insert(RunDocument.from(run), runCollection);
            } catch (DuplicateKeyException e) {
                throw new SchedulerException(ErrorCode.STORAGE_FAILURE, "run already exists: " + run.getId(), e);
            }
            return null;
        });
    }

    @Override
    public void updateRun(Run run) {
        Objects.requireNonNull(run, "run must not be null");
        execute("update run " + run.getId(), () -> {
            prepareRunUpdate(run);
            UpdateResult result = mongoTemplate.updateFirst(byId(run.getId()), runUpdate(RunDocument.from(run)),
                    RunDocument.class, runCollection);
            if (result.getMatchedCount() == 0) {
                throw SchedulerException.runNotFound(run.getId());
            }
            return null;
        });
    }

    @Override
    public List<Run> getRuns(String jobId, int limit) {
        int max = limit <= 0 ? DEFAULT_RUN_LIMIT : limit;
        return execute("get runs of job " + jobId, () -> {
            Query q = byJobId(jobId)
                    .with(Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("startAt")))
                    .limit(max);
            List<RunDocument> docs = mongoTemplate.find(q, RunDocument.class, runCollection);
            List<Run> runs = new ArrayList<>(docs.size());
            for (RunDocument doc : docs) {
                runs.add(doc.toRun());
            }
            return runs;
        });
    }

    @Override
    public long getRunCount(String jobId) {
        return execute("count runs of job " + jobId,
                () -> mongoTemplate.count(byJobId(jobId), RunDocument.class, runCollection));
    }

    // ------------------------------------------------------------------ bulk

    /**
     * Writes every job in one ordered bulk request. Missing ids are detected before anything is written.
     */
    @Override
    public void batchUpdateJobs(List<Job> jobs) {
        Objects.requireNonNull(jobs, "jobs must not be null");
        if (jobs.isEmpty()) {
            return;
        }
        execute("batch update jobs", () -> {
            Set<String> ids = new LinkedHashSet<>();
            for (Job job : jobs) {
                ids.add(job.getId());
            }
            String missing = firstMissing(ids, jobCollection);
            if (missing != null) {
                throw SchedulerException.jobNotFound(missing);
            }

            Instant now = now();
            BulkOperations ops = mongoTemplate.bulkOps(BulkOperations.BulkMode.ORDERED, JobDocument.class, jobCollection);
            for (Job job : jobs) {
                prepareJobUpdate(job, now);
                ops.updateOne(byId(job.getId()), jobUpdate(JobDocument.from(job)));
            }
            BulkWriteResult result = ops.execute();
            log.debug("[mongo] batch job update size={} matched={}", jobs.size(), result.getMatchedCount());
            return null;
        });
    }

    @Override
    public void batchUpdateRuns(List<Run> runs) {
        Objects.requireNonNull(runs, "runs must not be null");
        if (runs.isEmpty()) {
            return;
        }
        execute("batch update runs", () -> {
            Set<String> ids = new LinkedHashSet<>();
            for (Run run : runs) {
                ids.add(run.getId());
            }
            String missing = firstMissing(ids, runCollection);
            if (missing != null) {
                throw SchedulerException.runNotFound(missing);
            }

            BulkOperations ops = mongoTemplate.bulkOps(BulkOperations.BulkMode.ORDERED, RunDocument.class, runCollection);
            for (Run run : runs) {
                prepareRunUpdate(run);
                ops.updateOne(byId(run.getId()), runUpdate(RunDocument.from(run)));
            }
            BulkWriteResult result = ops.execute();
            log.debug("[mongo] batch run update size={} matched={}", runs.size(), result.getMatchedCount());
            return null;
        });
    }

    // ------------------------------------------------------------------ lifecycle

    @Override
    public void ping() {
        execute("ping", () -> mongoTemplate.executeCommand(new Document("ping", 1)));
    }

    @Override
    public void close() {
        closed = true;
    }

    // ------------------------------------------------------------------ helpers

    private <T> T execute(String action, Supplier<T> body) {
        if (closed) {
            throw SchedulerException.storageClosed();
        }
        try {
            return body.get();
        } catch (DataAccessException e) {
            log.warn("[mongo] {} failed msg={}", action, e.getMessage());
            throw new SchedulerException(ErrorCode.STORAGE_FAILURE, action + " failed: " + e.getMessage(), e);
        }
    }

    private void prepareJobUpdate(Job job, Instant now) {
        if (job.getCreatedAt() == null) {
            JobDocument stored = mongoTemplate.findById(job.getId(), JobDocument.class, jobCollection);
            if (stored == null) {
                throw SchedulerException.jobNotFound(job.getId());
            }
            job.setCreatedAt(stored.getCreatedAt());
        }
        job.setUpdatedAt(now);
        truncate(job);
    }

    private void prepareRunUpdate(Run run) {
        if (run.getCreatedAt() == null) {
            RunDocument stored = mongoTemplate.findById(run.getId(), RunDocument.class, runCollection);
            if (stored == null) {
                throw SchedulerException.runNotFound(run.getId());
            }
            run.setCreatedAt(stored.getCreatedAt());
        }
        truncate(run);
    }

    /**
     * BSON dates hold milliseconds. Timestamps are cut to that precision on the caller's object too.
     */
    private static void truncate(Job job) {
        job.setNextRunAt(millis(job.getNextRunAt()));
        job.setLastRunAt(millis(job.getLastRunAt()));
        job.setCreatedAt(millis(job.getCreatedAt()));
        job.setUpdatedAt(millis(job.getUpdatedAt()));
    }

    private static void truncate(Run run) {
        run.setStartAt(millis(run.getStartAt()));
        run.setEndAt(millis(run.getEndAt()));
        run.setCreatedAt(millis(run.getCreatedAt()));
    }

    private static Instant millis(Instant instant) {
        return instant == null ? null : instant.truncatedTo(ChronoUnit.MILLIS);
    }

    private String firstMissing(Set<String> ids, String collection) {
        Query q = new Query(Criteria.where("_id").in(ids));
        q.fields().include("_id");
        Set<String> found = new HashSet<>();
        for (Document doc : mongoTemplate.find(q, Document.class, collection)) {
            found.add(String.valueOf(doc.get("_id")));
        }
        for (String id : ids) {
            if (!found.contains(id)) {
                return id;
            }
        }
        return null;
    }

    private static Update jobUpdate(JobDocument d) {
        Update u = new Update();
        setOrUnset(u, "name", d.getName());
        setOrUnset(u, "description", d.getDescription());
        setOrUnset(u, "type", d.getType());
        setOrUnset(u, "cron", d.getCron());
        setOrUnset(u, "intervalMillis", d.getIntervalMillis());
        setOrUnset(u, "handlerName", d.getHandlerName());
        setOrUnset(u, "payload", d.getPayload());
        setOrUnset(u, "status", d.getStatus());
        u.set("nextRunAt", d.getNextRunAt());
        setOrUnset(u, "lastRunAt", d.getLastRunAt());
        setOrUnset(u, "lastResult", d.getLastResult());
        u.set("retryCount", d.getRetryCount());
        u.set("maxRetry", d.getMaxRetry());
        setOrUnset(u, "createdAt", d.getCreatedAt());
        setOrUnset(u, "updatedAt", d.getUpdatedAt());
        return u;
    }

    private static Update runUpdate(RunDocument d) {
        Update u = new Update();
        setOrUnset(u, "jobId", d.getJobId());
        setOrUnset(u, "status", d.getStatus());
        setOrUnset(u, "startAt", d.getStartAt());
        setOrUnset(u, "endAt", d.getEndAt());
        setOrUnset(u, "output", d.getOutput());
        setOrUnset(u, "error", d.getError());
        u.set("duration", d.getDuration());
        setOrUnset(u, "traceId", d.getTraceId());
        setOrUnset(u, "createdAt", d.getCreatedAt());
        return u;
    }

    private static void setOrUnset(Update u, String key, Object value) {
        if (value != null) {
            u.set(key, value);
        } else {
            u.unset(key);
        }
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }

    private static Query byJobId(String jobId) {
        return new Query(Criteria.where("jobId").is(jobId));
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
