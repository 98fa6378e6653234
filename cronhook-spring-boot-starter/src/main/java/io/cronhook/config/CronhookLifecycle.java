package io.cronhook.config;

import io.cronhook.internal.mongo.FireEventPurger;
import io.cronhook.internal.mongo.MongoScheduleTicker;
import io.cronhook.metrics.MetricsRecorder;
import io.cronhook.worker.DispatchWorker;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the ticker, the dispatch worker and the metrics recorder with the Spring container lifecycle.
 *
 * <p>On stop the ticker stops emitting first, the worker then drains its in-flight calls, and the recorder
 * is closed last so the drained executions are flushed. Ticker, worker and purger are absent when the
 * process runs with {@code ticker-enabled} or {@code worker-enabled} set to false.
 */
public class CronhookLifecycle implements SmartLifecycle {
    private final MetricsRecorder metricsRecorder;
    private final MongoScheduleTicker ticker;
    private final DispatchWorker dispatchWorker;
    private final FireEventPurger purger;
    private volatile boolean running = false;

    public CronhookLifecycle(MetricsRecorder metricsRecorder,
                             MongoScheduleTicker ticker,
                             DispatchWorker dispatchWorker,
                             FireEventPurger purger) {
        this.metricsRecorder = metricsRecorder;
        this.ticker = ticker;
        this.dispatchWorker = dispatchWorker;
        this.purger = purger;
    }

    @Override
    public void start() {
        metricsRecorder.start();
        if (purger != null) {
            purger.start();
        }
        if (dispatchWorker != null) {
            dispatchWorker.start();
        }
        if (ticker != null) {
            ticker.start();
        }
        running = true;
    }

    @Override
    public void stop() {
        if (ticker != null) {
            ticker.stop();
        }
        if (dispatchWorker != null) {
            dispatchWorker.stop();
        }
        if (purger != null) {
            purger.stop();
        }
        metricsRecorder.close();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
