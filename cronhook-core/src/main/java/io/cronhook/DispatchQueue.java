package io.cronhook;

import io.cronhook.core.FireEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * At-least-once work queue of fire events shared by all worker processes.
 *
 * <p>A claimed event is leased to one worker. If the lease expires before the worker reports an outcome
 * the event becomes claimable again. Outcome reports are ignored when the caller no longer holds the lease.
 */
public interface DispatchQueue {

    /**
     * Enqueue a new event. Enqueueing an id that is already present is a no-op.
     *
     * @return true if the event was inserted
     */
    boolean enqueue(FireEvent event);

    /**
     * Lease at most {@code max} events whose run time has arrived, oldest first.
     */
    List<FireEvent> claimDue(int max, Duration lease, String workerId);

    void markSucceeded(FireEvent event, String workerId);

    /**
     * Put the event back with its attempt counter incremented, claimable from {@code runAt}.
     */
    void scheduleRetry(FireEvent event, String workerId, Instant runAt, String error);

    void markPermanentlyFailed(FireEvent event, String workerId, String error);
}
