package com.phillippitts.agentcore.domain;

import java.time.Instant;
import java.util.List;

/**
 * Immutable, persistence-ready view of a request record at one point in time.
 *
 * @param id request id
 * @param input request input
 * @param status status at snapshot time
 * @param trace turns appended so far
 * @param result final answer when {@code SUCCEEDED}; otherwise {@code null}
 * @param failureReason reason when {@code FAILED} or {@code CANCELLED}; otherwise {@code null}
 * @param submittedAt when the request was accepted
 * @param startedAt when the worker started it; {@code null} if it never ran
 * @param finishedAt when it reached a terminal status; {@code null} while active
 */
public record RequestSnapshot(
        String id,
        RequestInput input,
        RequestStatus status,
        List<Turn> trace,
        String result,
        String failureReason,
        Instant submittedAt,
        Instant startedAt,
        Instant finishedAt
) {
    public RequestSnapshot {
        trace = trace == null ? List.of() : List.copyOf(trace);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
