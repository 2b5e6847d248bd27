package io.chrono4j.internal;

import io.chrono4j.JobBuilder;
import io.chrono4j.core.Job;
import io.chrono4j.core.JobType;
import io.chrono4j.utils.IntervalParser;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Default {@link JobBuilder} implementation.
 */
public class SimpleJobBuilder implements JobBuilder {

    private final UnaryOperator<Job> persister;
    private final Job job = new Job();

    public SimpleJobBuilder(String name, UnaryOperator<Job> persister) {
        Objects.requireNonNull(name, "job name must not be null");
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
        job.setName(name);
        job.setType(JobType.ONCE);
    }

    @Override
    public JobBuilder id(String id) {
        job.setId(id);
        return this;
    }

    @Override
    public JobBuilder description(String description) {
        job.setDescription(description);
        return this;
    }

    @Override
    public JobBuilder handler(String handlerName) {
        Objects.requireNonNull(handlerName, "handlerName must not be null");
        job.setHandlerName(handlerName);
        return this;
    }

    @Override
    public JobBuilder payload(String payload) {
        job.setPayload(payload);
        return this;
    }

    @Override
    public JobBuilder schedule(Instant time) {
        Objects.requireNonNull(time, "time must not be null");
        job.setNextRunAt(time);
        return this;
    }

    @Override
    public JobBuilder cron(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        job.setType(JobType.CRON);
        job.setCron(expression);
        job.setInterval(null);
        return this;
    }

    @Override
    public JobBuilder repeatEvery(Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        job.setType(JobType.INTERVAL);
        job.setInterval(interval);
        job.setCron(null);
        return this;
    }

    @Override
    public JobBuilder repeatEvery(String intervalOrCron) {
        Objects.requireNonNull(intervalOrCron, "intervalOrCron must not be null");
        if (IntervalParser.looksLikeCron(intervalOrCron)) {
            return cron(intervalOrCron);
        }
        return repeatEvery(IntervalParser.parseDuration(intervalOrCron));
    }

    @Override
    public JobBuilder maxRetry(int maxRetry) {
        if (maxRetry < 0) {
            throw new IllegalArgumentException("maxRetry must not be negative");
        }
        job.setMaxRetry(maxRetry);
        return this;
    }

    @Override
    public Job build() {
        Job built = job.copy();
        built.validate();
        return built;
    }

    @Override
    public Job save() {
        return persister.apply(build());
    }
}
