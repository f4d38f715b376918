package com.phillippitts.agentcore.domain;

import java.time.Instant;

/**
 * Snapshot of one registered provider as reported by {@code BackendRegistry#health()}.
 *
 * @param id provider id
 * @param displayName human-readable name
 * @param readiness current readiness
 * @param selected whether this provider is the registry's current selection
 * @param lastProbe last health probe result; {@code null} if never probed
 * @param probedAt when {@code lastProbe} was taken; {@code null} if never probed
 * @param failureReason reason of the last initialization failure; {@code null} unless FAILED
 */
public record BackendStatus(
        String id,
        String displayName,
        BackendReadiness readiness,
        boolean selected,
        HealthProbe lastProbe,
        Instant probedAt,
        String failureReason
) {
}
