package io.chrono4j.config;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the job and run collections.
 *
 * <p>Indexes are not created at startup unless {@code chrono.mongo.ensure-indexes-on-startup=true}.
 * Production deployments usually manage them with migration scripts:
 * <pre>
 * db.chrono_jobs.createIndex({ status: 1, nextRunAt: 1 }, { name: "idx_status_next_run" });
 * db.chrono_jobs.createIndex({ createdAt: 1 }, { name: "idx_created" });
 * db.chrono_runs.createIndex({ jobId: 1, createdAt: -1 }, { name: "idx_job_runs" });
 * </pre>
 */
public class ChronoMongoIndexConfig {

    public static final String IDX_STATUS_NEXT_RUN = "idx_status_next_run";
    public static final String IDX_CREATED = "idx_created";
    public static final String IDX_JOB_RUNS = "idx_job_runs";

    private final MongoTemplate mongoTemplate;
    private final String jobCollection;
    private final String runCollection;

    public ChronoMongoIndexConfig(MongoTemplate mongoTemplate, String jobCollection, String runCollection) {
        this.mongoTemplate = mongoTemplate;
        this.jobCollection = jobCollection;
        this.runCollection = runCollection;
    }

    /**
     * Creates the indexes; existing indexes with the same definition are left alone.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(jobCollection).ensureIndex(statusNextRunIndex());
        mongoTemplate.indexOps(jobCollection).ensureIndex(createdIndex());
        mongoTemplate.indexOps(runCollection).ensureIndex(jobRunsIndex());
    }

    /**
     * Recovery and listing by status. Keys: status ASC, nextRunAt ASC
     */
    public static Index statusNextRunIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("nextRunAt", Sort.Direction.ASC)
                .named(IDX_STATUS_NEXT_RUN);
    }

    public static Index createdIndex() {
        return new Index()
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_CREATED);
    }

    /**
     * Run history, newest first. Keys: jobId ASC, createdAt DESC
     */
    public static Index jobRunsIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.DESC)
                .named(IDX_JOB_RUNS);
    }
}
