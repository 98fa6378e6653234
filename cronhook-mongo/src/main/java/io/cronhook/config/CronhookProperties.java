package io.cronhook.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.UUID;

/**
 * Runtime configuration for scheduling, dispatch and metrics.
 */
@ConfigurationProperties(prefix = "cronhook")
public class CronhookProperties {
    private static final Logger log = LoggerFactory.getLogger(CronhookProperties.class);

    private boolean enabled = true;

    // scheduling
    private String workerId;
    private Duration processEvery = Duration.ofSeconds(1);
    private Duration defaultLockLifetime = Duration.ofMinutes(2);
    // must stay below catchUpWindow so a crashed ticker's claim expires while its tick is still replayable
    private Duration tickLockLifetime = Duration.ofSeconds(30);
    private int batchSize = 10;
    private Duration catchUpWindow = Duration.ofMinutes(1);
    private String timezone = "UTC";
    private boolean tickerEnabled = true;
    private boolean ensureIndexesOnStartup = false;

    // dispatch
    private boolean workerEnabled = true;
    private int maxConcurrency = 10;
    private double rateLimitPerSecond = 100;
    private Duration requestTimeout = Duration.ofSeconds(30);
    private int maxRetries = 3;
    private Duration retryBaseDelay = Duration.ofSeconds(2);
    private Duration shutdownGracePeriod = Duration.ofSeconds(35);
    private Duration completedRetention = Duration.ofHours(24);
    private Duration failedRetention = Duration.ofDays(7);

    // metrics
    private int metricsBufferSize = 10;
    private Duration metricsFlushInterval = Duration.ofSeconds(60);
    private int metricsLookbackHours = 168;
    private int metricsLegacyLookbackHours = 24;
    private int metricsReadBatchHours = 24;
    private int metricsReadParallelism = 8;
    private int metricsMaxObjectsPerPartition = 100;
    private int metricsLegacyMaxObjectsPerPartition = 5;

    // object storage
    private String s3Endpoint;
    private String s3Region = "us-east-1";
    private String s3AccessKey;
    private String s3SecretKey;
    private String s3Bucket = "scheduler-metrics";

    /**
     * The configured worker id, or {@code host-pid-uuid} when none is set. A generated id is kept, so every
     * component of this process reports the same one.
     */
    public synchronized String resolveWorkerId() {
        if (workerId != null && !workerId.isBlank()) {
            return workerId;
        }

        String host = "cronhook";
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException | SecurityException e) {
            log.debug("Could not resolve local host name msg={}", e.getMessage());
        }

        String pid = String.valueOf(ManagementFactory.getRuntimeMXBean().getPid());

        String generated = host + "-" + pid + "-" + UUID.randomUUID();
        if (generated.length() > 128) {
            generated = generated.substring(0, 128);
        }
        workerId = generated;
        return generated;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public Duration getDefaultLockLifetime() {
        return defaultLockLifetime;
    }

    public void setDefaultLockLifetime(Duration defaultLockLifetime) {
        this.defaultLockLifetime = defaultLockLifetime;
    }

    public Duration getTickLockLifetime() {
        return tickLockLifetime;
    }

    public void setTickLockLifetime(Duration tickLockLifetime) {
        this.tickLockLifetime = tickLockLifetime;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getCatchUpWindow() {
        return catchUpWindow;
    }

    public void setCatchUpWindow(Duration catchUpWindow) {
        this.catchUpWindow = catchUpWindow;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public boolean isTickerEnabled() {
        return tickerEnabled;
    }

    public void setTickerEnabled(boolean tickerEnabled) {
        this.tickerEnabled = tickerEnabled;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public boolean isWorkerEnabled() {
        return workerEnabled;
    }

    public void setWorkerEnabled(boolean workerEnabled) {
        this.workerEnabled = workerEnabled;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public double getRateLimitPerSecond() {
        return rateLimitPerSecond;
    }

    public void setRateLimitPerSecond(double rateLimitPerSecond) {
        this.rateLimitPerSecond = rateLimitPerSecond;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public void setRetryBaseDelay(Duration retryBaseDelay) {
        this.retryBaseDelay = retryBaseDelay;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
    }

    public Duration getCompletedRetention() {
        return completedRetention;
    }

    public void setCompletedRetention(Duration completedRetention) {
        this.completedRetention = completedRetention;
    }

    public Duration getFailedRetention() {
        return failedRetention;
    }

    public void setFailedRetention(Duration failedRetention) {
        this.failedRetention = failedRetention;
    }

    public int getMetricsBufferSize() {
        return metricsBufferSize;
    }

    public void setMetricsBufferSize(int metricsBufferSize) {
        this.metricsBufferSize = metricsBufferSize;
    }

    public Duration getMetricsFlushInterval() {
        return metricsFlushInterval;
    }

    public void setMetricsFlushInterval(Duration metricsFlushInterval) {
        this.metricsFlushInterval = metricsFlushInterval;
    }

    public int getMetricsLookbackHours() {
        return metricsLookbackHours;
    }

    public void setMetricsLookbackHours(int metricsLookbackHours) {
        this.metricsLookbackHours = metricsLookbackHours;
    }

    public int getMetricsLegacyLookbackHours() {
        return metricsLegacyLookbackHours;
    }

    public void setMetricsLegacyLookbackHours(int metricsLegacyLookbackHours) {
        this.metricsLegacyLookbackHours = metricsLegacyLookbackHours;
    }

    public int getMetricsReadBatchHours() {
        return metricsReadBatchHours;
    }

    public void setMetricsReadBatchHours(int metricsReadBatchHours) {
        this.metricsReadBatchHours = metricsReadBatchHours;
    }

    public int getMetricsReadParallelism() {
        return metricsReadParallelism;
    }

    public void setMetricsReadParallelism(int metricsReadParallelism) {
        this.metricsReadParallelism = metricsReadParallelism;
    }

    public int getMetricsMaxObjectsPerPartition() {
        return metricsMaxObjectsPerPartition;
    }

    public void setMetricsMaxObjectsPerPartition(int metricsMaxObjectsPerPartition) {
        this.metricsMaxObjectsPerPartition = metricsMaxObjectsPerPartition;
    }

    public int getMetricsLegacyMaxObjectsPerPartition() {
        return metricsLegacyMaxObjectsPerPartition;
    }

    public void setMetricsLegacyMaxObjectsPerPartition(int metricsLegacyMaxObjectsPerPartition) {
        this.metricsLegacyMaxObjectsPerPartition = metricsLegacyMaxObjectsPerPartition;
    }

    public String getS3Endpoint() {
        return s3Endpoint;
    }

    public void setS3Endpoint(String s3Endpoint) {
        this.s3Endpoint = s3Endpoint;
    }

    public String getS3Region() {
        return s3Region;
    }

    public void setS3Region(String s3Region) {
        this.s3Region = s3Region;
    }

    public String getS3AccessKey() {
        return s3AccessKey;
    }

    public void setS3AccessKey(String s3AccessKey) {
        this.s3AccessKey = s3AccessKey;
    }

    public String getS3SecretKey() {
        return s3SecretKey;
    }

    public void setS3SecretKey(String s3SecretKey) {
        this.s3SecretKey = s3SecretKey;
    }

    public String getS3Bucket() {
        return s3Bucket;
    }

    public void setS3Bucket(String s3Bucket) {
        this.s3Bucket = s3Bucket;
    }
}
