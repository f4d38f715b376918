package com.phillippitts.agentcore.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Progress notification for one request. Sequence numbers are per request and start at 1.
 *
 * <p>PII note: {@code message} carries the final answer or failure reason for terminal events;
 * listeners should not log it at INFO.
 *
 * @param requestId request id
 * @param sequence per-request sequence number
 * @param type event kind
 * @param status request status at the time of the event
 * @param turn the appended turn for {@code TURN} events; otherwise {@code null}
 * @param message answer, reason, or short note; may be {@code null}
 * @param at when the event was produced
 */
public record ProgressEvent(
        String requestId,
        long sequence,
        ProgressEventType type,
        RequestStatus status,
        Turn turn,
        String message,
        Instant at
) {
    public ProgressEvent {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(status, "status");
        if (at == null) {
            at = Instant.now();
        }
    }

    public boolean isTerminal() {
        return type.isTerminal();
    }
}
