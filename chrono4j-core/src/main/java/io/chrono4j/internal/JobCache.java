package io.chrono4j.internal;

import io.chrono4j.core.ErrorCode;
import io.chrono4j.core.Job;
import io.chrono4j.core.SchedulerException;
import io.chrono4j.logging.JobLogger;
import io.chrono4j.metrics.SchedulerMetrics;
import io.chrono4j.storage.JobStorage;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Read-through LRU cache of jobs with per-entry TTL.
 *
 * <p>Hits never take the write lock: recency is recorded by offering the id to a bounded promotion queue,
 * which the maintenance loop (or {@link #drainPromotions()}) applies later. A full queue drops the signal,
 * which only affects eviction order.
 *
 * <p>Concurrent misses for the same id share one storage read. The read runs on a loader thread, so a
 * caller that gives up (timeout or interrupt) does not fail the other waiters. The loaded job is installed
 * in the cache before any waiter returns.
 */
public class JobCache {

    static final int PROMOTION_QUEUE_CAPACITY = 256;

    private static final int DEFAULT_CAPACITY = 100;
    private static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    private static final Duration DEFAULT_LOAD_TIMEOUT = Duration.ofSeconds(5);

    private final JobStorage storage;
    private final int capacity;
    private final long ttlNanos;
    private final Duration ttl;
    private final Duration loadTimeout;
    private final SchedulerMetrics metrics;
    private final JobLogger logger;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Node> items = new HashMap<>();
    // sentinel of the recency list: head.next is most recent, head.prev least recent
    private final Node head = new Node(null, null, 0);

    private final BlockingQueue<String> promotions = new ArrayBlockingQueue<>(PROMOTION_QUEUE_CAPACITY);
    private final Map<String, CompletableFuture<Job>> inFlight = new ConcurrentHashMap<>();
    private final ExecutorService loader;

    private ScheduledExecutorService maintenance;

    public JobCache(JobStorage storage, int capacity, Duration ttl, Duration loadTimeout,
                    SchedulerMetrics metrics, JobLogger logger) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
        this.capacity = capacity > 0 ? capacity : DEFAULT_CAPACITY;
        this.ttl = ttl != null && !ttl.isZero() && !ttl.isNegative() ? ttl : DEFAULT_TTL;
        this.ttlNanos = this.ttl.toNanos();
        this.loadTimeout = loadTimeout != null && !loadTimeout.isZero() && !loadTimeout.isNegative()
                ? loadTimeout : DEFAULT_LOAD_TIMEOUT;
        this.loader = Executors.newCachedThreadPool(new NamedDaemonThreadFactory("chrono.cacheLoader"));
        head.prev = head;
        head.next = head;
    }

    /**
     * Returns a copy of the cached job, loading it from storage on a miss or an expired entry.
     *
     * @throws SchedulerException the storage error of the shared load, or {@code STORAGE_FAILURE} when the
     *                            load does not finish within the load timeout
     */
    public Job get(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Job cached = lookup(id);
        if (cached != null) {
            metrics.recordCacheHit();
            promotions.offer(id);
            return cached;
        }
        metrics.recordCacheMiss();
        return await(id, loadShared(id));
    }

    private CompletableFuture<Job> loadShared(String id) {
        CompletableFuture<Job> mine = new CompletableFuture<>();
        CompletableFuture<Job> existing = inFlight.putIfAbsent(id, mine);
        if (existing != null) {
            return existing;
        }
        try {
            loader.execute(() -> load(id, mine));
        } catch (RuntimeException e) {
            inFlight.remove(id, mine);
            mine.completeExceptionally(e);
        }
        return mine;
    }

    private void load(String id, CompletableFuture<Job> future) {
        try {
            // another load may have finished between the lookup and the in-flight registration
            Job job = lookup(id);
            if (job == null) {
                job = storage.getJob(id);
                set(id, job);
            }
            inFlight.remove(id, future);
            future.complete(job);
        } catch (RuntimeException e) {
            inFlight.remove(id, future);
            future.completeExceptionally(e);
        }
    }

    private Job await(String id, CompletableFuture<Job> future) {
        try {
            return future.get(loadTimeout.toMillis(), TimeUnit.MILLISECONDS).copy();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SchedulerException se) {
                throw se;
            }
            throw new SchedulerException(ErrorCode.STORAGE_FAILURE, "failed to load job " + id, cause);
        } catch (TimeoutException e) {
            throw new SchedulerException(ErrorCode.STORAGE_FAILURE,
                    "timed out loading job " + id + " after " + loadTimeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SchedulerException(ErrorCode.STORAGE_FAILURE, "interrupted while loading job " + id, e);
        }
    }

    private Job lookup(String id) {
        lock.readLock().lock();
        try {
            Node node = items.get(id);
            if (node == null || node.expired(System.nanoTime())) {
                return null;
            }
            return node.job.copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Inserts or replaces the entry, marking it most recently used and resetting its TTL.
     */
    public void set(String id, Job job) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(job, "job must not be null");
        Job copy = job.copy();
        long expiresAt = System.nanoTime() + ttlNanos;
        lock.writeLock().lock();
        try {
            Node node = items.get(id);
            if (node != null) {
                node.job = copy;
                node.expiresAt = expiresAt;
                moveToFront(node);
                return;
            }
            if (items.size() >= capacity) {
                Node oldest = head.prev;
                if (oldest != head) {
                    unlink(oldest);
                    items.remove(oldest.key);
                }
            }
            node = new Node(id, copy, expiresAt);
            linkFirst(node);
            items.put(id, node);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void delete(String id) {
        lock.writeLock().lock();
        try {
            Node node = items.remove(id);
            if (node != null) {
                unlink(node);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            items.clear();
            head.prev = head;
            head.next = head;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return items.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes every expired entry. Scans the whole list since deferred promotions can leave it out of order.
     *
     * @return number of entries removed
     */
    public int cleanExpired() {
        long now = System.nanoTime();
        int count = 0;
        lock.writeLock().lock();
        try {
            Node node = head.prev;
            while (node != head) {
                Node prev = node.prev;
                if (node.expired(now)) {
                    unlink(node);
                    items.remove(node.key);
                    count++;
                }
                node = prev;
            }
        } finally {
            lock.writeLock().unlock();
        }
        return count;
    }

    /**
     * Applies every pending promotion signal.
     *
     * @return number of signals consumed
     */
    public int drainPromotions() {
        int count = 0;
        lock.writeLock().lock();
        try {
            String id;
            while ((id = promotions.poll()) != null) {
                count++;
                Node node = items.get(id);
                if (node != null) {
                    moveToFront(node);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return count;
    }

    /**
     * Ids from most to least recently used.
     */
    public List<String> keys() {
        lock.readLock().lock();
        try {
            List<String> out = new ArrayList<>(items.size());
            for (Node node = head.next; node != head; node = node.next) {
                out.add(node.key);
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public synchronized void start(Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (maintenance != null) {
            return;
        }
        maintenance = Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("chrono.cacheMaintenance"));
        long millis = Math.max(1, interval.toMillis());
        maintenance.scheduleWithFixedDelay(this::maintain, millis, millis, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (maintenance == null) {
            return;
        }
        maintenance.shutdownNow();
        maintenance = null;
    }

    private void maintain() {
        try {
            drainPromotions();
            int count = cleanExpired();
            metrics.updateCacheSize(size());
            if (count > 0) {
                logger.debug("[cache] removed %d expired entries", count);
            }
        } catch (RuntimeException e) {
            logger.error("[cache] maintenance failed: %s", e.getMessage(), e);
        }
    }

    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("size", size());
        stats.put("capacity", capacity);
        stats.put("ttl", ttl.toString());
        return stats;
    }

    private void moveToFront(Node node) {
        if (head.next == node) {
            return;
        }
        unlink(node);
        linkFirst(node);
    }

    private void linkFirst(Node node) {
        node.prev = head;
        node.next = head.next;
        head.next.prev = node;
        head.next = node;
    }

    private void unlink(Node node) {
        node.prev.next = node.next;
        node.next.prev = node.prev;
        node.prev = null;
        node.next = null;
    }

    private static final class Node {
        final String key;
        Job job;
        long expiresAt;
        Node prev;
        Node next;

        Node(String key, Job job, long expiresAt) {
            this.key = key;
            this.job = job;
            this.expiresAt = expiresAt;
        }

        boolean expired(long now) {
            return now - expiresAt > 0;
        }
    }
}
