package io.chrono4j.storage;

import io.chrono4j.core.Job;
import io.chrono4j.core.Run;

import java.util.List;

/**
 * Optional bulk extension. Each call is committed as a single unit: either every element is written or none.
 */
public interface BatchJobStorage extends JobStorage {

    void batchUpdateJobs(List<Job> jobs);

    void batchUpdateRuns(List<Run> runs);
}
