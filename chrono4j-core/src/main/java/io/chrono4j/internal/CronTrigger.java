package io.chrono4j.internal;

import io.chrono4j.logging.JobLogger;
import io.chrono4j.utils.IntervalParser;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Fires a signal for each armed cron job at its next firing time.
 *
 * <p>The dispatcher thread only hands the job id to the callback and re-arms the entry; the callback must
 * not block.
 */
public class CronTrigger {

    private final Consumer<String> callback;
    private final ZoneId zone;
    private final JobLogger logger;

    private final DelayQueue<Firing> queue = new DelayQueue<>();
    // current firing per job; a dequeued firing that is no longer current was cancelled or replaced
    private final Map<String, Firing> armed = new ConcurrentHashMap<>();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private Thread dispatcherThread;

    public CronTrigger(Consumer<String> callback, ZoneId zone, JobLogger logger) {
        this.callback = Objects.requireNonNull(callback, "callback must not be null");
        this.zone = zone != null ? zone : ZoneId.systemDefault();
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    private static final class Firing implements Delayed {
        private final String jobId;
        private final String cron;
        private final Instant fireAt;

        private Firing(String jobId, String cron, Instant fireAt) {
            this.jobId = jobId;
            this.cron = cron;
            this.fireAt = fireAt;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long ms = Duration.between(Instant.now(), fireAt).toMillis();
            return unit.convert(ms, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other == this) return 0;
            if (other instanceof Firing o) {
                return this.fireAt.compareTo(o.fireAt);
            }
            long d1 = this.getDelay(TimeUnit.MILLISECONDS);
            long d2 = other.getDelay(TimeUnit.MILLISECONDS);
            return Long.compare(d1, d2);
        }
    }

    /**
     * Arms (or re-arms) the job at the first firing after now.
     *
     * @return the first firing time
     * @throws IllegalArgumentException when the expression is invalid or never fires
     */
    public Instant schedule(String jobId, String cron) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Instant next = IntervalParser.nextFireTime(cron, zone, Instant.now());
        Firing firing = new Firing(jobId, cron, next);
        Firing previous = armed.put(jobId, firing);
        if (previous != null) {
            queue.remove(previous);
        }
        queue.offer(firing);
        return next;
    }

    public boolean cancel(String jobId) {
        Firing previous = armed.remove(jobId);
        if (previous == null) {
            return false;
        }
        queue.remove(previous);
        return true;
    }

    public boolean isScheduled(String jobId) {
        return armed.containsKey(jobId);
    }

    public Instant nextFireTime(String jobId) {
        Firing firing = armed.get(jobId);
        return firing == null ? null : firing.fireAt;
    }

    public int size() {
        return armed.size();
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        dispatcherThread = new Thread(this::dispatchLoop);
        dispatcherThread.setName("chrono.cronDispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();
    }

    /**
     * Stops dispatching and disarms every job.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            try {
                dispatcherThread.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            dispatcherThread = null;
        }
        armed.clear();
        queue.clear();
    }

    private void dispatchLoop() {
        while (started.get()) {
            try {
                Firing firing = queue.take();
                if (armed.get(firing.jobId) != firing) {
                    continue;
                }
                rearm(firing);
                callback.accept(firing.jobId);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                logger.error("[cron] dispatch failed msg=%s", e.getMessage(), e);
            }
        }
    }

    private void rearm(Firing fired) {
        // a late dispatcher skips the firings it missed
        Instant base = Instant.now().isAfter(fired.fireAt) ? Instant.now() : fired.fireAt;
        Instant next;
        try {
            next = IntervalParser.nextFireTime(fired.cron, zone, base);
        } catch (IllegalArgumentException e) {
            armed.remove(fired.jobId, fired);
            logger.warn("[cron] job %s has no further firing time: %s", fired.jobId, e.getMessage());
            return;
        }
        Firing following = new Firing(fired.jobId, fired.cron, next);
        if (armed.replace(fired.jobId, fired, following)) {
            queue.offer(following);
        }
    }
}
