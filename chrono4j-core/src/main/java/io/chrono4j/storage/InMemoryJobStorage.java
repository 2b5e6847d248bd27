package io.chrono4j.storage;

import io.chrono4j.core.ErrorCode;
import io.chrono4j.core.Job;
import io.chrono4j.core.JobStatus;
import io.chrono4j.core.Run;
import io.chrono4j.core.SchedulerException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Heap-backed {@link BatchJobStorage}. Nothing survives a restart.
 */
public class InMemoryJobStorage implements BatchJobStorage {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final Map<String, Run> runs = new HashMap<>();
    // jobId -> runIds in insertion order
    private final Map<String, List<String>> jobRuns = new HashMap<>();

    private boolean closed;

    @Override
    public void createJob(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        lock.writeLock().lock();
        try {
            ensureOpen();
            if (jobs.containsKey(job.getId())) {
                throw SchedulerException.jobAlreadyExists(job.getId());
            }
            Instant now = Instant.now();
            if (job.getCreatedAt() == null) {
                job.setCreatedAt(now);
            }
            job.setUpdatedAt(now);
            jobs.put(job.getId(), job.copy());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Job getJob(String id) {
        lock.readLock().lock();
        try {
            ensureOpen();
            Job job = jobs.get(id);
            if (job == null) {
                throw SchedulerException.jobNotFound(id);
            }
            return job.copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void updateJob(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        lock.writeLock().lock();
        try {
            ensureOpen();
            putExistingJob(job, Instant.now());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void deleteJob(String id) {
        lock.writeLock().lock();
        try {
            ensureOpen();
            if (jobs.remove(id) == null) {
                throw SchedulerException.jobNotFound(id);
            }
            List<String> runIds = jobRuns.remove(id);
            if (runIds != null) {
                runIds.forEach(runs::remove);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Job> listJobs(JobStatus status) {
        lock.readLock().lock();
        try {
            ensureOpen();
            List<Job> out = new ArrayList<>(jobs.size());
            for (Job job : jobs.values()) {
                if (status == null || job.getStatus() == status) {
                    out.add(job.copy());
                }
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void createRun(Run run) {
        Objects.requireNonNull(run, "run must not be null");
        lock.writeLock().lock();
        try {
            ensureOpen();
            if (run.getId() == null || run.getId().isBlank()) {
                run.setId(UUID.randomUUID().toString());
            }
            if (runs.containsKey(run.getId())) {
                throw new SchedulerException(ErrorCode.STORAGE_FAILURE, "run already exists: " + run.getId());
            }
            if (run.getCreatedAt() == null) {
                run.setCreatedAt(Instant.now());
            }
            runs.put(run.getId(), run.copy());
            jobRuns.computeIfAbsent(run.getJobId(), k -> new ArrayList<>()).add(run.getId());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void updateRun(Run run) {
        Objects.requireNonNull(run, "run must not be null");
        lock.writeLock().lock();
        try {
            ensureOpen();
            putExistingRun(run);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Run> getRuns(String jobId, int limit) {
        lock.readLock().lock();
        try {
            ensureOpen();
            List<String> runIds = jobRuns.get(jobId);
            if (runIds == null || runIds.isEmpty()) {
                return Collections.emptyList();
            }
            int max = limit <= 0 ? DEFAULT_RUN_LIMIT : limit;
            List<Run> out = new ArrayList<>(Math.min(max, runIds.size()));
            for (int i = runIds.size() - 1; i >= 0 && out.size() < max; i--) {
                Run run = runs.get(runIds.get(i));
                if (run != null) {
                    out.add(run.copy());
                }
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long getRunCount(String jobId) {
        lock.readLock().lock();
        try {
            ensureOpen();
            List<String> runIds = jobRuns.get(jobId);
            return runIds == null ? 0 : runIds.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void batchUpdateJobs(List<Job> batch) {
        Objects.requireNonNull(batch, "jobs must not be null");
        lock.writeLock().lock();
        try {
            ensureOpen();
            for (Job job : batch) {
                if (!jobs.containsKey(job.getId())) {
                    throw SchedulerException.jobNotFound(job.getId());
                }
            }
            Instant now = Instant.now();
            for (Job job : batch) {
                putExistingJob(job, now);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void batchUpdateRuns(List<Run> batch) {
        Objects.requireNonNull(batch, "runs must not be null");
        lock.writeLock().lock();
        try {
            ensureOpen();
            for (Run run : batch) {
                if (!runs.containsKey(run.getId())) {
                    throw SchedulerException.runNotFound(run.getId());
                }
            }
            for (Run run : batch) {
                putExistingRun(run);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void ping() {
        lock.readLock().lock();
        try {
            ensureOpen();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            closed = true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void putExistingJob(Job job, Instant now) {
        Job stored = jobs.get(job.getId());
        if (stored == null) {
            throw SchedulerException.jobNotFound(job.getId());
        }
        if (job.getCreatedAt() == null) {
            job.setCreatedAt(stored.getCreatedAt());
        }
        job.setUpdatedAt(now);
        jobs.put(job.getId(), job.copy());
    }

    private void putExistingRun(Run run) {
        Run stored = runs.get(run.getId());
        if (stored == null) {
            throw SchedulerException.runNotFound(run.getId());
        }
        if (run.getCreatedAt() == null) {
            run.setCreatedAt(stored.getCreatedAt());
        }
        runs.put(run.getId(), run.copy());
    }

    private void ensureOpen() {
        if (closed) {
            throw SchedulerException.storageClosed();
        }
    }
}
