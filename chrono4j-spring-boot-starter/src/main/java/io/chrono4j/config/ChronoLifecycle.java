package io.chrono4j.config;

import io.chrono4j.JobScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges scheduler start/stop with the Spring container lifecycle.
 *
 * <p>The container starts the scheduler only when {@code chrono.auto-start} is set. A scheduler started by
 * application code is still stopped on context close.
 */
public class ChronoLifecycle implements SmartLifecycle {
    private final JobScheduler scheduler;
    private final boolean autoStart;

    public ChronoLifecycle(JobScheduler scheduler, boolean autoStart) {
        this.scheduler = scheduler;
        this.autoStart = autoStart;
    }

    @Override
    public void start() {
        if (!scheduler.isStarted()) {
            scheduler.start();
        }
    }

    @Override
    public void stop() {
        if (scheduler.isStarted()) {
            scheduler.stop();
        }
    }

    @Override
    public boolean isRunning() {
        return scheduler.isStarted();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }
}
