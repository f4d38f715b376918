package com.phillippitts.agentcore.service.queue;

import com.phillippitts.agentcore.domain.RequestSnapshot;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Returned by {@link OrchestrationQueue#submit}.
 *
 * @param requestId id of the queued request
 * @param completion completes with the terminal snapshot once the terminal event was published
 */
public record RequestTicket(String requestId, CompletableFuture<RequestSnapshot> completion) {

    public RequestTicket {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(completion, "completion");
    }
}
