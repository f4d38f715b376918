package com.phillippitts.agentcore.service.backend.event;

import java.time.Instant;

/**
 * Published when a provider finishes readiness preparation successfully.
 */
public record BackendReadyEvent(String family, String backendId, long durationMs, Instant at) {
    public BackendReadyEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
