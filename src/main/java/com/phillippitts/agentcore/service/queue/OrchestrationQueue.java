package com.phillippitts.agentcore.service.queue;

import com.phillippitts.agentcore.domain.RequestInput;
import com.phillippitts.agentcore.domain.RequestSnapshot;

import java.util.Optional;

/**
 * FIFO of agent requests served by a single worker, so at most one request runs at a time.
 */
public interface OrchestrationQueue {

    /**
     * Enqueues a request. Never waits for the running request.
     *
     * @throws com.phillippitts.agentcore.exception.QueueFullException when the waiting-request cap is reached
     * @throws IllegalStateException when the queue is stopped
     */
    RequestTicket submit(RequestInput input);

    /**
     * Cancels a request. A queued request becomes CANCELLED at once and never runs; a running
     * request is flagged and stops at its next turn boundary.
     *
     * @return false if the request had already finished
     * @throws com.phillippitts.agentcore.exception.RequestNotFoundException for unknown or evicted ids
     */
    boolean cancel(String requestId);

    /**
     * @throws com.phillippitts.agentcore.exception.RequestNotFoundException for unknown or evicted ids
     */
    RequestSnapshot snapshot(String requestId);

    /**
     * Subscribes to one request. Events already emitted are replayed first, so a subscriber may
     * see an event twice when it races a live transition.
     *
     * @throws com.phillippitts.agentcore.exception.RequestNotFoundException for unknown or evicted ids
     */
    Subscription subscribe(String requestId, ProgressSubscriber subscriber);

    /** Subscribes to events of every request from now on. */
    Subscription subscribeAll(ProgressSubscriber subscriber);

    Optional<String> runningRequestId();

    /** Number of requests waiting to run. */
    int depth();

    void start();

    /** Stops the worker; requests still waiting are cancelled. */
    void stop();
}
