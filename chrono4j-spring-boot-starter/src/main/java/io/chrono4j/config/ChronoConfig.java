package io.chrono4j.config;

import io.chrono4j.JobScheduler;
import io.chrono4j.NamedJobHandler;
import io.chrono4j.core.JobHandlerRegistry;
import io.chrono4j.core.SchedulerConfig;
import io.chrono4j.internal.DefaultJobScheduler;
import io.chrono4j.internal.mongo.MongoJobStorage;
import io.chrono4j.logging.JobLogger;
import io.chrono4j.storage.InMemoryJobStorage;
import io.chrono4j.storage.JobStorage;
import io.chrono4j.tracing.JobTracer;
import io.chrono4j.tracing.OtelJobTracer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.opentelemetry.api.OpenTelemetry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the scheduler.
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.tracing.OpenTelemetryAutoConfiguration"
})
@ConditionalOnClass(JobScheduler.class)
@EnableConfigurationProperties(ChronoProperties.class)
@ConditionalOnProperty(prefix = "chrono", name = "enabled", havingValue = "true", matchIfMissing = true)
@Import({
        ChronoConfig.MongoStorageConfiguration.class,
        ChronoConfig.MemoryStorageConfiguration.class,
        ChronoConfig.OpenTelemetryConfiguration.class,
        ChronoConfig.MetricsConfiguration.class
})
public class ChronoConfig {

    @Bean
    @ConditionalOnMissingBean
    public JobHandlerRegistry jobHandlerRegistry(ObjectProvider<List<NamedJobHandler>> handlersProvider) {
        List<NamedJobHandler> handlers = handlersProvider.getIfAvailable(List::of);
        return new JobHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerConfig schedulerConfig(ChronoProperties props,
                                           ObjectProvider<JobLogger> logger,
                                           ObjectProvider<JobTracer> tracer) {
        SchedulerConfig config = props.toSchedulerConfig();
        logger.ifAvailable(config::setLogger);
        tracer.ifAvailable(config::setTracer);
        return config;
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(JobStorage storage, SchedulerConfig config, JobHandlerRegistry registry) {
        return new DefaultJobScheduler(storage, config, registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public ChronoLifecycle chronoLifecycle(JobScheduler scheduler, SchedulerConfig config) {
        return new ChronoLifecycle(scheduler, config.isAutoStart());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass({MongoTemplate.class, MongoJobStorage.class})
    @ConditionalOnProperty(prefix = "chrono", name = "storage-type", havingValue = "mongo")
    static class MongoStorageConfiguration {

        @Bean
        @ConditionalOnMissingBean(JobStorage.class)
        @ConditionalOnBean(MongoTemplate.class)
        public MongoJobStorage mongoJobStorage(MongoTemplate mongoTemplate, ChronoProperties props) {
            return new MongoJobStorage(mongoTemplate,
                    props.getMongo().getJobCollection(), props.getMongo().getRunCollection());
        }

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnBean(MongoTemplate.class)
        public ChronoMongoIndexConfig chronoMongoIndexConfig(MongoTemplate mongoTemplate, ChronoProperties props) {
            return new ChronoMongoIndexConfig(mongoTemplate,
                    props.getMongo().getJobCollection(), props.getMongo().getRunCollection());
        }

        @Bean
        @ConditionalOnProperty(prefix = "chrono.mongo", name = "ensure-indexes-on-startup", havingValue = "true")
        public SmartInitializingSingleton chronoIndexesInitializer(ChronoMongoIndexConfig indexConfig) {
            return indexConfig::ensureIndexes;
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class MemoryStorageConfiguration {

        @Bean
        @ConditionalOnMissingBean(JobStorage.class)
        public InMemoryJobStorage inMemoryJobStorage() {
            return new InMemoryJobStorage();
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass({OpenTelemetry.class, OtelJobTracer.class})
    static class OpenTelemetryConfiguration {

        @Bean
        @ConditionalOnMissingBean(JobTracer.class)
        @ConditionalOnBean(OpenTelemetry.class)
        public JobTracer chronoJobTracer(OpenTelemetry openTelemetry) {
            return OtelJobTracer.of(openTelemetry);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterBinder.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public ChronoMetricsBinder chronoMetricsBinder(JobScheduler scheduler) {
            return new ChronoMetricsBinder(scheduler);
        }
    }
}
