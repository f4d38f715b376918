package com.phillippitts.agentcore.service.backend.event;

import com.phillippitts.agentcore.domain.BackendReadiness;

import java.time.Instant;

/**
 * Published when a health probe moves a provider between READY and DEGRADED.
 */
public record BackendHealthChangedEvent(
        String family,
        String backendId,
        BackendReadiness from,
        BackendReadiness to,
        String reason,
        Instant at
) {
    public BackendHealthChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
