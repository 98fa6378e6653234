package io.cronhook.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronhook.ObjectStore;
import io.cronhook.internal.mongo.FireEventPurger;
import io.cronhook.internal.mongo.MongoDispatchQueue;
import io.cronhook.internal.mongo.MongoScheduleStore;
import io.cronhook.internal.mongo.MongoScheduleTicker;
import io.cronhook.internal.s3.S3ObjectStore;
import io.cronhook.metrics.MetricsReader;
import io.cronhook.metrics.MetricsRecorder;
import io.cronhook.trigger.TriggerCoordinator;
import io.cronhook.worker.DispatchWorker;
import io.cronhook.worker.ExecutionWorker;
import io.cronhook.worker.HttpTriggerInvoker;
import io.cronhook.worker.RetryPolicy;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Spring Boot auto-configuration entrypoint for cronhook components.
 */
@AutoConfiguration
@ConditionalOnClass({TriggerCoordinator.class, MongoTemplate.class})
@EnableConfigurationProperties(CronhookProperties.class)
@ConditionalOnProperty(prefix = "cronhook", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CronhookConfig {

    private static final Duration PURGE_INTERVAL = Duration.ofMinutes(10);

    @Bean
    @ConditionalOnMissingBean
    public MongoScheduleStore mongoScheduleStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper,
                                                 CronhookProperties props) {
        return new MongoScheduleStore(mongoTemplate, objectMapper, ZoneId.of(props.getTimezone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public MongoDispatchQueue mongoDispatchQueue(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoDispatchQueue(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    protected CronhookMongoIndexConfig cronhookMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new CronhookMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public TriggerCoordinator triggerCoordinator(MongoScheduleStore scheduleStore) {
        return new TriggerCoordinator(scheduleStore);
    }

    @Bean
    @ConditionalOnMissingBean(ObjectStore.class)
    public S3ObjectStore s3ObjectStore(CronhookProperties props) {
        return S3ObjectStore.create(props.getS3Endpoint(), props.getS3Region(), props.getS3AccessKey(),
                props.getS3SecretKey(), props.getS3Bucket());
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsRecorder metricsRecorder(ObjectStore objectStore, ObjectMapper objectMapper, CronhookProperties props) {
        return new MetricsRecorder(objectStore, objectMapper, props.getMetricsBufferSize(), props.getMetricsFlushInterval());
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsReader metricsReader(ObjectStore objectStore, ObjectMapper objectMapper, CronhookProperties props) {
        MetricsReader.ScanOptions options = new MetricsReader.ScanOptions(
                props.getMetricsLookbackHours(),
                props.getMetricsLegacyLookbackHours(),
                props.getMetricsReadBatchHours(),
                props.getMetricsMaxObjectsPerPartition(),
                props.getMetricsLegacyMaxObjectsPerPartition());
        return new MetricsReader(objectStore, objectMapper, options, props.getMetricsReadParallelism());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "cronhook", name = "ticker-enabled", havingValue = "true", matchIfMissing = true)
    public MongoScheduleTicker mongoScheduleTicker(MongoScheduleStore scheduleStore, MongoDispatchQueue dispatchQueue,
                                                   CronhookProperties props) {
        return new MongoScheduleTicker(scheduleStore, dispatchQueue, props.getBatchSize(), props.getProcessEvery(),
                props.getTickLockLifetime(), props.getCatchUpWindow(), props.resolveWorkerId());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "cronhook", name = "worker-enabled", havingValue = "true", matchIfMissing = true)
    public ExecutionWorker executionWorker(MongoDispatchQueue dispatchQueue, MetricsRecorder metricsRecorder,
                                           ObjectMapper objectMapper, CronhookProperties props) {
        HttpTriggerInvoker invoker = new HttpTriggerInvoker(objectMapper, props.getRequestTimeout());
        RetryPolicy retryPolicy = new RetryPolicy(props.getMaxRetries(), props.getRetryBaseDelay());
        return new ExecutionWorker(dispatchQueue, invoker, metricsRecorder, retryPolicy, props.resolveWorkerId());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "cronhook", name = "worker-enabled", havingValue = "true", matchIfMissing = true)
    public DispatchWorker dispatchWorker(MongoDispatchQueue dispatchQueue, ExecutionWorker executionWorker,
                                         CronhookProperties props) {
        return new DispatchWorker(dispatchQueue, executionWorker, props.getMaxConcurrency(),
                props.getRateLimitPerSecond(), props.getProcessEvery(), props.getDefaultLockLifetime(),
                props.getShutdownGracePeriod());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "cronhook", name = "worker-enabled", havingValue = "true", matchIfMissing = true)
    public FireEventPurger fireEventPurger(MongoDispatchQueue dispatchQueue, CronhookProperties props) {
        return new FireEventPurger(dispatchQueue, props.getCompletedRetention(), props.getFailedRetention(),
                PURGE_INTERVAL);
    }

    @Bean
    @ConditionalOnMissingBean
    public CronhookLifecycle cronhookLifecycle(MetricsRecorder metricsRecorder,
                                               ObjectProvider<MongoScheduleTicker> ticker,
                                               ObjectProvider<DispatchWorker> dispatchWorker,
                                               ObjectProvider<FireEventPurger> purger) {
        return new CronhookLifecycle(metricsRecorder, ticker.getIfAvailable(), dispatchWorker.getIfAvailable(),
                purger.getIfAvailable());
    }

    @Bean
    @ConditionalOnProperty(prefix = "cronhook", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton cronhookIndexesInitializer(CronhookMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
