package com.phillippitts.agentcore.service.backend.event;

import java.time.Instant;

/**
 * Published when a registry's selection pointer moves.
 *
 * @param previousId previously selected id; {@code null} on first selection
 */
public record BackendSelectedEvent(String family, String previousId, String backendId, Instant at) {
    public BackendSelectedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
