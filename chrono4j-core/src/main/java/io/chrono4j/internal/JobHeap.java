package io.chrono4j.internal;

import io.chrono4j.core.Job;
import io.chrono4j.core.JobStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Binary min-heap of jobs ordered by {@code nextRunAt}, with an id index for O(log n) removal and update.
 *
 * <p>Jobs without a {@code nextRunAt} sort last. The heap keeps the references it is given; a caller that
 * changes a job's {@code nextRunAt} must call {@link #update(Job)} afterwards. Not thread-safe.
 */
public class JobHeap {

    private final List<Job> items = new ArrayList<>();
    private final Map<String, Integer> index = new HashMap<>();

    /**
     * Inserts the job, replacing any entry with the same id.
     */
    public void add(Job job) {
        Integer idx = index.get(job.getId());
        if (idx != null) {
            removeAt(idx);
        }
        push(job);
    }

    public Job remove(String jobId) {
        Integer idx = index.get(jobId);
        if (idx == null) {
            return null;
        }
        return removeAt(idx);
    }

    /**
     * Replaces the entry with the same id and restores ordering, inserting it when absent.
     */
    public void update(Job job) {
        Integer idx = index.get(job.getId());
        if (idx == null) {
            push(job);
            return;
        }
        items.set(idx, job);
        fix(idx);
    }

    public Job peek() {
        return items.isEmpty() ? null : items.get(0);
    }

    /**
     * Removes and returns every job with {@code nextRunAt <= now}, earliest first.
     */
    public List<Job> popDue(Instant now) {
        List<Job> due = null;
        while (!items.isEmpty()) {
            Instant next = items.get(0).getNextRunAt();
            if (next == null || next.isAfter(now)) {
                break;
            }
            if (due == null) {
                due = new ArrayList<>();
            }
            due.add(removeAt(0));
        }
        return due == null ? Collections.emptyList() : due;
    }

    /**
     * Drops every COMPLETED or FAILED entry and re-heapifies.
     *
     * @return number of entries removed
     */
    public int cleanCompleted() {
        List<Job> kept = new ArrayList<>(items.size());
        for (Job job : items) {
            JobStatus status = job.getStatus();
            if (status != JobStatus.COMPLETED && status != JobStatus.FAILED) {
                kept.add(job);
            }
        }
        int removed = items.size() - kept.size();
        if (removed == 0) {
            return 0;
        }
        items.clear();
        index.clear();
        for (Job job : kept) {
            index.put(job.getId(), items.size());
            items.add(job);
        }
        for (int i = items.size() / 2 - 1; i >= 0; i--) {
            siftDown(i);
        }
        return removed;
    }

    public Instant nextRunTime() {
        return items.isEmpty() ? null : items.get(0).getNextRunAt();
    }

    public int size() {
        return items.size();
    }

    public boolean contains(String jobId) {
        return index.containsKey(jobId);
    }

    public void clear() {
        items.clear();
        index.clear();
    }

    private void push(Job job) {
        index.put(job.getId(), items.size());
        items.add(job);
        siftUp(items.size() - 1);
    }

    private Job removeAt(int idx) {
        int last = items.size() - 1;
        if (idx != last) {
            swap(idx, last);
        }
        Job removed = items.remove(last);
        index.remove(removed.getId());
        if (idx != last) {
            fix(idx);
        }
        return removed;
    }

    private void fix(int idx) {
        if (!siftDown(idx)) {
            siftUp(idx);
        }
    }

    private void siftUp(int idx) {
        while (idx > 0) {
            int parent = (idx - 1) / 2;
            if (!less(idx, parent)) {
                break;
            }
            swap(idx, parent);
            idx = parent;
        }
    }

    // returns true when the element moved
    private boolean siftDown(int idx) {
        int start = idx;
        int n = items.size();
        while (true) {
            int left = 2 * idx + 1;
            if (left >= n) {
                break;
            }
            int smallest = left;
            int right = left + 1;
            if (right < n && less(right, left)) {
                smallest = right;
            }
            if (!less(smallest, idx)) {
                break;
            }
            swap(idx, smallest);
            idx = smallest;
        }
        return idx > start;
    }

    private boolean less(int i, int j) {
        Instant a = items.get(i).getNextRunAt();
        Instant b = items.get(j).getNextRunAt();
        if (a == null) {
            return false;
        }
        if (b == null) {
            return true;
        }
        return a.isBefore(b);
    }

    private void swap(int i, int j) {
        Job a = items.get(i);
        Job b = items.get(j);
        items.set(i, b);
        items.set(j, a);
        index.put(b.getId(), i);
        index.put(a.getId(), j);
    }
}
