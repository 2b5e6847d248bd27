package io.chrono4j.config;

import io.chrono4j.core.SchedulerConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Spring binding of the scheduler configuration, under the {@code chrono} prefix.
 */
@ConfigurationProperties(prefix = "chrono")
public class ChronoProperties {

    public enum StorageType {
        MEMORY,
        MONGO
    }

    private boolean enabled = true;
    private StorageType storageType = StorageType.MEMORY;

    private int concurrentRuns = 5;
    private Duration jobTimeout = Duration.ofMinutes(5);
    private Duration retryDelay = Duration.ofSeconds(5);
    private Duration tickInterval = Duration.ofSeconds(1);
    private Duration cleanupInterval = Duration.ofMinutes(5);
    private boolean autoStart = false;
    private String zone; // system default when unset

    private final Batch batch = new Batch();
    private final Cache cache = new Cache();
    private final Mongo mongo = new Mongo();

    /**
     * Copies the bound values onto a fresh {@link SchedulerConfig}.
     */
    public SchedulerConfig toSchedulerConfig() {
        SchedulerConfig config = SchedulerConfig.defaults()
                .setConcurrentRuns(concurrentRuns)
                .setJobTimeout(jobTimeout)
                .setRetryDelay(retryDelay)
                .setTickInterval(tickInterval)
                .setCleanupInterval(cleanupInterval)
                .setAutoStart(autoStart)
                .setEnableBatchUpdate(batch.isEnabled())
                .setBatchSize(batch.getSize())
                .setBatchFlushInterval(batch.getFlushInterval())
                .setEnableCache(cache.isEnabled())
                .setCacheCapacity(cache.getCapacity())
                .setCacheTtl(cache.getTtl())
                .setCacheCleanupInterval(cache.getCleanupInterval())
                .setCacheLoadTimeout(cache.getLoadTimeout());
        if (zone != null && !zone.isBlank()) {
            config.setZone(ZoneId.of(zone));
        }
        return config;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public StorageType getStorageType() {
        return storageType;
    }

    public void setStorageType(StorageType storageType) {
        this.storageType = storageType;
    }

    public int getConcurrentRuns() {
        return concurrentRuns;
    }

    public void setConcurrentRuns(int concurrentRuns) {
        this.concurrentRuns = concurrentRuns;
    }

    public Duration getJobTimeout() {
        return jobTimeout;
    }

    public void setJobTimeout(Duration jobTimeout) {
        this.jobTimeout = jobTimeout;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public void setRetryDelay(Duration retryDelay) {
        this.retryDelay = retryDelay;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    public void setCleanupInterval(Duration cleanupInterval) {
        this.cleanupInterval = cleanupInterval;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Batch getBatch() {
        return batch;
    }

    public Cache getCache() {
        return cache;
    }

    public Mongo getMongo() {
        return mongo;
    }

    public static class Batch {
        private boolean enabled = false;
        private int size = 10;
        private Duration flushInterval = Duration.ofSeconds(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }

        public Duration getFlushInterval() {
            return flushInterval;
        }

        public void setFlushInterval(Duration flushInterval) {
            this.flushInterval = flushInterval;
        }
    }

    public static class Cache {
        private boolean enabled = false;
        private int capacity = 100;
        private Duration ttl = Duration.ofMinutes(5);
        private Duration cleanupInterval = Duration.ofMinutes(1);
        private Duration loadTimeout = Duration.ofSeconds(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Duration getCleanupInterval() {
            return cleanupInterval;
        }

        public void setCleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
        }

        public Duration getLoadTimeout() {
            return loadTimeout;
        }

        public void setLoadTimeout(Duration loadTimeout) {
            this.loadTimeout = loadTimeout;
        }
    }

    public static class Mongo {
        private String jobCollection = "chrono_jobs";
        private String runCollection = "chrono_runs";
        private boolean ensureIndexesOnStartup = false;

        public String getJobCollection() {
            return jobCollection;
        }

        public void setJobCollection(String jobCollection) {
            this.jobCollection = jobCollection;
        }

        public String getRunCollection() {
            return runCollection;
        }

        public void setRunCollection(String runCollection) {
            this.runCollection = runCollection;
        }

        public boolean isEnsureIndexesOnStartup() {
            return ensureIndexesOnStartup;
        }

        public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
            this.ensureIndexesOnStartup = ensureIndexesOnStartup;
        }
    }
}
