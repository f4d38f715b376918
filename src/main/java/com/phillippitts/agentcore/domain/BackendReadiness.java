package com.phillippitts.agentcore.domain;

/**
 * Readiness of a backend provider inside its registry.
 *
 * <pre>
 * UNREGISTERED → INITIALIZING → READY ⇄ DEGRADED
 *                            ↘ FAILED → (reinitialize) INITIALIZING
 * </pre>
 */
public enum BackendReadiness {
    UNREGISTERED,
    INITIALIZING,
    READY,
    DEGRADED,
    FAILED;

    /** Whether a provider in this state may be selected and used. */
    public boolean isUsable() {
        return this == READY || this == DEGRADED;
    }
}
