package io.cronhook.worker;

import io.cronhook.DispatchQueue;
import io.cronhook.core.FireEvent;
import io.cronhook.core.FireEventState;
import io.cronhook.core.Trigger;
import io.cronhook.metrics.ExecutionRecord;
import io.cronhook.metrics.ExecutionStatus;
import io.cronhook.metrics.MetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Runs one claimed fire event: performs the call, records exactly one execution record for the attempt,
 * and reports the outcome back to the {@link DispatchQueue}.
 *
 * <p>A delivered call (any HTTP status) ends in {@link FireEventState#SUCCEEDED}. A transport failure is
 * retried with backoff while {@link RetryPolicy#shouldRetry(int)} allows it, then ends in
 * {@link FireEventState#PERMANENTLY_FAILED}.
 */
public class ExecutionWorker {
    private static final Logger log = LoggerFactory.getLogger(ExecutionWorker.class);

    private final DispatchQueue dispatchQueue;
    private final HttpTriggerInvoker invoker;
    private final MetricsRecorder metricsRecorder;
    private final RetryPolicy retryPolicy;
    private final String workerId;
    private final Clock clock;

    public ExecutionWorker(DispatchQueue dispatchQueue,
                           HttpTriggerInvoker invoker,
                           MetricsRecorder metricsRecorder,
                           RetryPolicy retryPolicy,
                           String workerId) {
        this(dispatchQueue, invoker, metricsRecorder, retryPolicy, workerId, Clock.systemUTC());
    }

    public ExecutionWorker(DispatchQueue dispatchQueue,
                           HttpTriggerInvoker invoker,
                           MetricsRecorder metricsRecorder,
                           RetryPolicy retryPolicy,
                           String workerId,
                           Clock clock) {
        this.dispatchQueue = Objects.requireNonNull(dispatchQueue, "dispatchQueue must not be null");
        this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
        this.metricsRecorder = Objects.requireNonNull(metricsRecorder, "metricsRecorder must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.workerId = Objects.requireNonNull(workerId, "workerId must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public String workerId() {
        return workerId;
    }

    /**
     * @return the state the event was moved to
     */
    public FireEventState execute(FireEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        Trigger trigger = event.trigger();
        String workspaceId = event.workspaceId();

        log.debug("[{}] Executing trigger: {} {} job={} attempt={}",
                workspaceId, trigger.method(), trigger.url(), event.id(), event.attempt());

        InvocationOutcome outcome = invoker.invoke(trigger);
        metricsRecorder.record(toRecord(event, outcome));

        if (outcome.delivered()) {
            log.debug("[{}] Trigger executed: {} job={}", workspaceId, outcome.httpStatus(), event.id());
            dispatchQueue.markSucceeded(event, workerId);
            return FireEventState.SUCCEEDED;
        }

        if (retryPolicy.shouldRetry(event.attempt())) {
            Instant retryAt = clock.instant().plus(retryPolicy.delayAfter(event.attempt()));
            log.warn("[{}] Trigger execution failed, retrying at {} job={} attempt={} msg={}",
                    workspaceId, retryAt, event.id(), event.attempt(), outcome.error());
            dispatchQueue.scheduleRetry(event, workerId, retryAt, outcome.error());
            return FireEventState.RETRY_SCHEDULED;
        }

        log.warn("[{}] Trigger execution failed permanently job={} attempts={} msg={}",
                workspaceId, event.id(), event.attempt() + 1, outcome.error());
        dispatchQueue.markPermanentlyFailed(event, workerId, outcome.error());
        return FireEventState.PERMANENTLY_FAILED;
    }

    private ExecutionRecord toRecord(FireEvent event, InvocationOutcome outcome) {
        Trigger trigger = event.trigger();
        return new ExecutionRecord(
                clock.instant(),
                event.workspaceId(),
                event.id(),
                event.jobName(),
                trigger.url(),
                trigger.method(),
                outcome.delivered() ? ExecutionStatus.SUCCESS : ExecutionStatus.FAILED,
                outcome.durationMs(),
                outcome.httpStatus(),
                outcome.error(),
                event.attempt()
        );
    }
}
