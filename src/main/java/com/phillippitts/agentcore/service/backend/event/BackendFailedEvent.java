package com.phillippitts.agentcore.service.backend.event;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a provider fails readiness preparation or a call against it fails.
 *
 * <p>PII note: restrict {@code context} to technical diagnostics, never user text.
 */
public record BackendFailedEvent(
        String family,
        String backendId,
        String message,
        Throwable cause,
        Map<String, String> context,
        Instant at
) {
    public BackendFailedEvent {
        context = context == null ? Map.of() : Map.copyOf(context);
        if (at == null) {
            at = Instant.now();
        }
    }
}
