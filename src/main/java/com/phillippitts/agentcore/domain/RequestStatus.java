package com.phillippitts.agentcore.domain;

/**
 * Lifecycle status of an orchestration request.
 *
 * <pre>
 * QUEUED  → RUNNING → SUCCEEDED | FAILED | CANCELLED
 * QUEUED  → CANCELLED
 * </pre>
 */
public enum RequestStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    /**
     * Whether moving from this status to {@code next} respects the forward-only lifecycle.
     */
    public boolean canTransitionTo(RequestStatus next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case QUEUED -> next == RUNNING || next == CANCELLED;
            case RUNNING -> next.isTerminal();
            case SUCCEEDED, FAILED, CANCELLED -> false;
        };
    }
}
